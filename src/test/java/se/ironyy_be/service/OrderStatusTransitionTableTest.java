package se.ironyy_be.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import se.ironyy_be.pojo.enums.OrderStatus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderStatusTransitionTableTest {

    @Test
    void happyPathIsOneStepAtATime() {
        assertThat(OrderWorkflowService.allowedTransitionsFrom(OrderStatus.DRAFT))
                .containsExactlyInAnyOrder(OrderStatus.CONFIRMED, OrderStatus.PENDING, OrderStatus.CANCELLED);
        assertThat(OrderWorkflowService.allowedTransitionsFrom(OrderStatus.PENDING))
                .containsExactlyInAnyOrder(OrderStatus.CONFIRMED, OrderStatus.CANCELLED);
        assertThat(OrderWorkflowService.allowedTransitionsFrom(OrderStatus.CONFIRMED))
                .containsExactlyInAnyOrder(OrderStatus.SCHEDULED_FOR_PICKUP, OrderStatus.CANCELLED);
        assertThat(OrderWorkflowService.allowedTransitionsFrom(OrderStatus.SCHEDULED_FOR_PICKUP))
                .containsExactlyInAnyOrder(OrderStatus.OUT_FOR_PICKUP, OrderStatus.CANCELLED);
        assertThat(OrderWorkflowService.allowedTransitionsFrom(OrderStatus.OUT_FOR_PICKUP))
                .containsExactlyInAnyOrder(OrderStatus.PICKED_UP, OrderStatus.CANCELLED);
        assertThat(OrderWorkflowService.allowedTransitionsFrom(OrderStatus.PICKED_UP))
                .containsExactlyInAnyOrder(OrderStatus.PROCESSING, OrderStatus.CANCELLED);
        assertThat(OrderWorkflowService.allowedTransitionsFrom(OrderStatus.PROCESSING))
                .containsExactlyInAnyOrder(OrderStatus.READY, OrderStatus.CANCELLED);
        assertThat(OrderWorkflowService.allowedTransitionsFrom(OrderStatus.READY))
                .containsExactlyInAnyOrder(OrderStatus.OUT_FOR_DELIVERY, OrderStatus.CANCELLED);
        assertThat(OrderWorkflowService.allowedTransitionsFrom(OrderStatus.OUT_FOR_DELIVERY))
                .containsExactlyInAnyOrder(OrderStatus.COMPLETED, OrderStatus.CANCELLED);
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"COMPLETED", "CANCELLED", "REFUNDED", "FAILED"})
    void terminalStatusesHaveNoWayOut(OrderStatus terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        assertThat(OrderWorkflowService.allowedTransitionsFrom(terminal)).isEmpty();
    }

    @Test
    void everyStatusHasAnEntry() {
        for (OrderStatus status : OrderStatus.values()) {
            assertThat(OrderWorkflowService.allowedTransitionsFrom(status)).isNotNull();
            assertThat(OrderWorkflowService.isAllowed(status, status)).as("%s -> itself", status).isFalse();
        }
    }

    @Test
    void tableIsReadOnly() {
        assertThatThrownBy(() -> OrderWorkflowService.allowedTransitionsFrom(OrderStatus.DRAFT).add(OrderStatus.COMPLETED))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void hasReachedFollowsLifecycleOrderAndExcludesDeadEnds() {
        assertThat(OrderStatus.PROCESSING.hasReached(OrderStatus.CONFIRMED)).isTrue();
        assertThat(OrderStatus.COMPLETED.hasReached(OrderStatus.SCHEDULED_FOR_PICKUP)).isTrue();
        assertThat(OrderStatus.PENDING.hasReached(OrderStatus.CONFIRMED)).isFalse();
        assertThat(OrderStatus.CANCELLED.hasReached(OrderStatus.CONFIRMED)).isFalse();
        assertThat(OrderStatus.FAILED.hasReached(OrderStatus.DRAFT)).isFalse();
    }
}

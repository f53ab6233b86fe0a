package se.ironyy_be.service;

import org.springframework.stereotype.Component;
import se.ironyy_be.pojo.Order;
import se.ironyy_be.pojo.User;
import se.ironyy_be.pojo.enums.OrderStatus;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether an actor may request a status for an order. Reads the order and the actor,
 * never changes either.
 */
@Component
public class OrderTransitionPolicy {

    private static final Set<OrderStatus> CUSTOMER_CANCELLABLE =
            EnumSet.of(OrderStatus.DRAFT, OrderStatus.PENDING, OrderStatus.CONFIRMED);
    private static final Set<OrderStatus> CUSTOMER_CONFIRMABLE =
            EnumSet.of(OrderStatus.DRAFT, OrderStatus.PENDING);
    private static final Set<OrderStatus> PRESS_TARGETS =
            EnumSet.of(OrderStatus.SCHEDULED_FOR_PICKUP, OrderStatus.PROCESSING, OrderStatus.READY);
    private static final Set<OrderStatus> DELIVERY_TARGETS =
            EnumSet.of(OrderStatus.OUT_FOR_PICKUP, OrderStatus.PICKED_UP, OrderStatus.OUT_FOR_DELIVERY, OrderStatus.COMPLETED);

    public boolean mayTransition(User actor, Order order, OrderStatus requested) {
        if (actor == null || order == null || requested == null) {
            return false;
        }
        if (actor.hasAdminRights()) {
            return true;
        }

        return switch (actor.getRole()) {
            case CUSTOMER -> customerMay(actor, order, requested);
            case PRESS -> PRESS_TARGETS.contains(requested)
                    && (order.getAssignedStaff() == null || sameUser(order.getAssignedStaff(), actor));
            case DELIVERY -> DELIVERY_TARGETS.contains(requested)
                    && (sameUser(order.getDeliveryPerson(), actor)
                    || (order.getDeliveryPerson() == null && requested == OrderStatus.OUT_FOR_PICKUP));
            default -> false;
        };
    }

    private boolean customerMay(User actor, Order order, OrderStatus requested) {
        if (!sameUser(order.getCustomer(), actor)) {
            return false;
        }
        if (requested == OrderStatus.CANCELLED) {
            return CUSTOMER_CANCELLABLE.contains(order.getStatus());
        }
        if (requested == OrderStatus.CONFIRMED) {
            return CUSTOMER_CONFIRMABLE.contains(order.getStatus());
        }
        return false;
    }

    static boolean sameUser(User a, User b) {
        return a != null && b != null && a.getUserId() != null && Objects.equals(a.getUserId(), b.getUserId());
    }
}

package se.ironyy_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import se.ironyy_be.pojo.Order;
import se.ironyy_be.pojo.OrderStatusUpdate;
import se.ironyy_be.pojo.User;
import se.ironyy_be.pojo.enums.OrderStatus;
import se.ironyy_be.repository.OrderStatusUpdateRepository;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class OrderAuditService {

    private final OrderStatusUpdateRepository statusUpdateRepository;

    /**
     * Appends the audit row for an accepted transition. Must join the transaction that
     * changes the order so both commit or neither does.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OrderStatusUpdate record(Order order, OrderStatus fromStatus, OrderStatus toStatus, User actor, String notes) {
        OrderStatusUpdate update = OrderStatusUpdate.builder()
                .order(order)
                .fromStatus(fromStatus)
                .toStatus(toStatus)
                .changedBy(actor)
                .notes(notes)
                .build();

        OrderStatusUpdate saved = statusUpdateRepository.saveAndFlush(update);
        log.debug("Audit record {} written for order {}: {} -> {}", saved.getId(), order.getOrderId(), fromStatus, toStatus);
        return saved;
    }

    /**
     * Full trail for an order, newest first.
     */
    public List<OrderStatusUpdate> getHistory(Long orderId) {
        return statusUpdateRepository.findByOrderOrderIdOrderByTimestampDescIdDesc(orderId);
    }

    public Optional<OrderStatusUpdate> getLatest(Long orderId) {
        return statusUpdateRepository.findFirstByOrderOrderIdOrderByTimestampDescIdDesc(orderId);
    }
}

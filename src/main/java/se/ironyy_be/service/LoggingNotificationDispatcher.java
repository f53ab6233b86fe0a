package se.ironyy_be.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import se.ironyy_be.pojo.Order;
import se.ironyy_be.pojo.User;
import se.ironyy_be.pojo.enums.OrderStatus;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Works out who should hear about a transition and logs it. Delivery over email or SMS
 * plugs in behind {@link NotificationDispatcher}.
 */
@Component
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    private static final Set<OrderStatus> CUSTOMER_FACING = EnumSet.of(
            OrderStatus.CONFIRMED, OrderStatus.PROCESSING, OrderStatus.READY,
            OrderStatus.OUT_FOR_DELIVERY, OrderStatus.COMPLETED, OrderStatus.CANCELLED);

    @Override
    public void notify(Order order, OrderStatus fromStatus, OrderStatus toStatus) {
        List<String> recipients = recipientsFor(order, toStatus);
        if (recipients.isEmpty()) {
            log.debug("No recipients for order {} moving {} -> {}", order.getOrderNumber(), fromStatus, toStatus);
            return;
        }
        log.info("Notify {} that order {} moved {} -> {}", recipients, order.getOrderNumber(), fromStatus, toStatus);
    }

    List<String> recipientsFor(Order order, OrderStatus toStatus) {
        List<String> recipients = new ArrayList<>();
        if (CUSTOMER_FACING.contains(toStatus)) {
            addIfPresent(recipients, order.getCustomer());
        }
        if (toStatus == OrderStatus.SCHEDULED_FOR_PICKUP) {
            addIfPresent(recipients, order.getAssignedStaff());
        }
        if (toStatus == OrderStatus.READY) {
            addIfPresent(recipients, order.getDeliveryPerson());
        }
        return recipients;
    }

    private void addIfPresent(List<String> recipients, User user) {
        if (user != null && user.getEmail() != null) {
            recipients.add(user.getEmail());
        }
    }
}

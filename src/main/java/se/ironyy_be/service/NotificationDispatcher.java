package se.ironyy_be.service;

import se.ironyy_be.pojo.Order;
import se.ironyy_be.pojo.enums.OrderStatus;

/**
 * Told about every committed transition. Best effort: the caller logs and ignores failures.
 */
public interface NotificationDispatcher {

    void notify(Order order, OrderStatus fromStatus, OrderStatus toStatus);
}

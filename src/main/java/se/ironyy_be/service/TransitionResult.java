package se.ironyy_be.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import se.ironyy_be.pojo.Order;
import se.ironyy_be.pojo.OrderStatusUpdate;

/**
 * The order after an accepted transition, with the audit record written for it.
 */
@Getter
@AllArgsConstructor
public class TransitionResult {
    private final Order order;
    private final OrderStatusUpdate update;
}

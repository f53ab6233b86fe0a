package se.ironyy_be.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;
import se.ironyy_be.pojo.enums.OrderStatus;

/**
 * The requested status cannot be reached from the order's current status ("not possible").
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidTransitionException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final OrderStatus fromStatus;
    private final OrderStatus toStatus;

    public InvalidTransitionException(OrderStatus fromStatus, OrderStatus toStatus) {
        this(fromStatus, toStatus, String.format("Cannot move order from %s to %s", fromStatus, toStatus));
    }

    public InvalidTransitionException(OrderStatus fromStatus, OrderStatus toStatus, String message) {
        super(message);
        this.fromStatus = fromStatus;
        this.toStatus = toStatus;
    }

    public OrderStatus getFromStatus() {
        return fromStatus;
    }

    public OrderStatus getToStatus() {
        return toStatus;
    }
}

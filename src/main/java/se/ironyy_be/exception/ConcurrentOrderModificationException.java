package se.ironyy_be.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The order changed between read and write. Transient: the caller may reload and try again.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class ConcurrentOrderModificationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final Long orderId;

    public ConcurrentOrderModificationException(Long orderId, String message) {
        super(message);
        this.orderId = orderId;
    }

    public ConcurrentOrderModificationException(Long orderId, String message, Throwable cause) {
        super(message, cause);
        this.orderId = orderId;
    }

    public Long getOrderId() {
        return orderId;
    }
}

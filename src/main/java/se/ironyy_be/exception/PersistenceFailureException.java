package se.ironyy_be.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class PersistenceFailureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}

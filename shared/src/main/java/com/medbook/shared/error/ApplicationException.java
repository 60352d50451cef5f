package com.medbook.shared.error;

import org.springframework.http.HttpStatus;

/**
 * Base of the exceptions a request handler may raise on purpose.
 * Each subtype is rendered by GlobalExceptionHandler with its own status and its message.
 */
public abstract class ApplicationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected ApplicationException(String message) {
        super(message);
    }

    protected ApplicationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract HttpStatus getStatus();
}

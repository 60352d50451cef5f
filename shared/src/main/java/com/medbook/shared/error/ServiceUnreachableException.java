package com.medbook.shared.error;

import org.springframework.http.HttpStatus;

/** A downstream HTTP dependency failed or its circuit breaker is open. */
public class ServiceUnreachableException extends ApplicationException {

    private static final long serialVersionUID = 1L;

    public ServiceUnreachableException(String message) {
        super(message);
    }

    public ServiceUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.SERVICE_UNAVAILABLE;
    }
}

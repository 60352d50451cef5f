package com.medbook.shared.error;

import org.springframework.http.HttpStatus;

/** The caller does not own the referenced resource. */
public class ForbiddenResourceException extends ApplicationException {

    private static final long serialVersionUID = 1L;

    public ForbiddenResourceException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.FORBIDDEN;
    }
}

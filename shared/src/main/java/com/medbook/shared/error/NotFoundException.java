package com.medbook.shared.error;

import org.springframework.http.HttpStatus;

/** The requested resource does not exist, or is not visible to the caller. */
public class NotFoundException extends ApplicationException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.NOT_FOUND;
    }
}

package com.medbook.shared.error;

import org.springframework.http.HttpStatus;

public class BadRequestException extends ApplicationException {

    private static final long serialVersionUID = 1L;

    public BadRequestException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }
}

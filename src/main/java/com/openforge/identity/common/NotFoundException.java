package com.openforge.identity.common;

import org.springframework.http.HttpStatus;

public class NotFoundException extends IdentityException {

    public NotFoundException(String message) {
        super("NOT_FOUND", message);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.NOT_FOUND;
    }
}

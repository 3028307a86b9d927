package com.openforge.identity.common;

import org.springframework.http.HttpStatus;

/** A uniqueness invariant would be violated. */
public class ConflictException extends IdentityException {

    public static final String USERNAME_TAKEN = "USERNAME_TAKEN";
    public static final String EMAIL_TAKEN    = "EMAIL_TAKEN";

    public ConflictException(String reason, String message) {
        super(reason, message);
    }

    public static ConflictException usernameTaken() {
        return new ConflictException(USERNAME_TAKEN, "Username already taken");
    }

    public static ConflictException emailTaken() {
        return new ConflictException(EMAIL_TAKEN, "Email already registered");
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.CONFLICT;
    }
}

package com.openforge.identity.common;

import org.springframework.http.HttpStatus;

/** Malformed or out-of-policy input. Always raised before any write. */
public class ValidationException extends IdentityException {

    public static final String USERNAME_TOO_SHORT = "USERNAME_TOO_SHORT";
    public static final String INVALID_EMAIL      = "INVALID_EMAIL";
    public static final String PASSWORD_TOO_SHORT = "PASSWORD_TOO_SHORT";
    public static final String INVALID_PURPOSE    = "INVALID_PURPOSE";
    public static final String UNKNOWN_SETTING    = "UNKNOWN_SETTING";
    public static final String MISSING_FIELD      = "MISSING_FIELD";
    public static final String INVALID_ROLE       = "INVALID_ROLE";

    public ValidationException(String reason, String message) {
        super(reason, message);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.BAD_REQUEST;
    }
}

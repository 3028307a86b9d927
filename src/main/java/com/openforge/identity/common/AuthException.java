package com.openforge.identity.common;

import org.springframework.http.HttpStatus;

/**
 * Authentication failures. Deliberately low-information: an unknown email and a
 * wrong password produce the same {@link #INVALID_CREDENTIALS}.
 */
public class AuthException extends IdentityException {

    public static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";
    public static final String ACCOUNT_DISABLED    = "ACCOUNT_DISABLED";
    public static final String INVALID_TOKEN       = "INVALID_TOKEN";
    public static final String ACCOUNT_NOT_FOUND   = "ACCOUNT_NOT_FOUND";
    public static final String WRONG_PASSWORD      = "WRONG_PASSWORD";

    private final HttpStatus status;

    private AuthException(String reason, String message, HttpStatus status) {
        super(reason, message);
        this.status = status;
    }

    public static AuthException invalidCredentials() {
        return new AuthException(INVALID_CREDENTIALS, "Invalid email or password", HttpStatus.UNAUTHORIZED);
    }

    public static AuthException accountDisabled() {
        return new AuthException(ACCOUNT_DISABLED, "Account is disabled", HttpStatus.FORBIDDEN);
    }

    public static AuthException invalidToken() {
        return new AuthException(INVALID_TOKEN, "Invalid or expired token", HttpStatus.UNAUTHORIZED);
    }

    public static AuthException accountNotFound() {
        return new AuthException(ACCOUNT_NOT_FOUND, "Account not found", HttpStatus.UNAUTHORIZED);
    }

    /** Change-password with a wrong current password; the caller is already authenticated. */
    public static AuthException wrongPassword() {
        return new AuthException(WRONG_PASSWORD, "Current password is incorrect", HttpStatus.BAD_REQUEST);
    }

    @Override
    public HttpStatus status() {
        return status;
    }
}

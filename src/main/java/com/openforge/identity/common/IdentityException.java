package com.openforge.identity.common;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Root of every expected failure this service reports to a caller.
 *
 * Each subclass carries a fixed {@code reason} code and the HTTP status it maps to.
 * Messages are written for end users; no internal detail goes in them.
 */
public abstract class IdentityException extends RuntimeException {

    private final String reason;

    protected IdentityException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected IdentityException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }

    public abstract HttpStatus status();

    /** Extra response fields (e.g. retry_after_seconds). Empty by default. */
    public Map<String, Object> details() {
        return Map.of();
    }
}

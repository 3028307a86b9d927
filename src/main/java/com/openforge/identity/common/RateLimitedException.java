package com.openforge.identity.common;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class RateLimitedException extends IdentityException {

    private final long retryAfterSeconds;

    public RateLimitedException(long retryAfterSeconds) {
        super("RATE_LIMITED", "Too many requests, retry in %d seconds".formatted(retryAfterSeconds));
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long retryAfterSeconds() {
        return retryAfterSeconds;
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.TOO_MANY_REQUESTS;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("retry_after_seconds", retryAfterSeconds);
    }
}

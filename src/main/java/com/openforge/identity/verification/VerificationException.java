package com.openforge.identity.verification;

import com.openforge.identity.common.IdentityException;
import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * A submitted code was not accepted.
 *
 * "Never requested" and "already consumed" both surface as {@link Reason#NOT_FOUND};
 * callers cannot tell them apart.
 */
public class VerificationException extends IdentityException {

    public enum Reason {
        NOT_FOUND,
        EXPIRED,
        TOO_MANY_ATTEMPTS,
        MISMATCH
    }

    private final Reason kind;
    private final int    attemptsRemaining;

    private VerificationException(Reason kind, String message, int attemptsRemaining) {
        super(kind.name(), message);
        this.kind              = kind;
        this.attemptsRemaining = attemptsRemaining;
    }

    public static VerificationException notFound() {
        return new VerificationException(Reason.NOT_FOUND, "Verification code not found or expired", 0);
    }

    public static VerificationException expired() {
        return new VerificationException(Reason.EXPIRED, "Verification code expired, please request a new one", 0);
    }

    public static VerificationException tooManyAttempts() {
        return new VerificationException(Reason.TOO_MANY_ATTEMPTS,
                "Too many attempts, please request a new code", 0);
    }

    public static VerificationException mismatch(int attemptsRemaining) {
        return new VerificationException(Reason.MISMATCH,
                "Incorrect verification code, %d attempts remaining".formatted(attemptsRemaining),
                attemptsRemaining);
    }

    public Reason kind() {
        return kind;
    }

    public int attemptsRemaining() {
        return attemptsRemaining;
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.BAD_REQUEST;
    }

    @Override
    public Map<String, Object> details() {
        return kind == Reason.MISMATCH
                ? Map.of("attempts_remaining", attemptsRemaining)
                : Map.of();
    }
}

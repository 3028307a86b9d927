package com.openforge.identity.verification;

/** Outcome of the send cooldown check. {@code retryAfterSeconds} is 0 when allowed. */
public record IssueDecision(boolean allowed, long retryAfterSeconds) {

    public static IssueDecision allow() {
        return new IssueDecision(true, 0);
    }

    public static IssueDecision retryAfter(long seconds) {
        return new IssueDecision(false, seconds);
    }
}

package com.openforge.identity.domain;

import java.util.Arrays;
import java.util.Optional;

/** What a verification code may be used for. Codes never satisfy another purpose. */
public enum VerificationPurpose {
    REGISTER("register"),
    RESET_PASSWORD("reset_password");

    private final String tag;

    VerificationPurpose(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<VerificationPurpose> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        String t = tag.trim();
        return Arrays.stream(values()).filter(p -> p.tag.equals(t)).findFirst();
    }
}

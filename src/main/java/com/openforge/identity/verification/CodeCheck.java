package com.openforge.identity.verification;

/** Non-consuming pre-check result; {@code reason} is null when valid. */
public record CodeCheck(boolean valid, VerificationException.Reason reason) {

    public static CodeCheck ok() {
        return new CodeCheck(true, null);
    }

    public static CodeCheck rejected(VerificationException.Reason reason) {
        return new CodeCheck(false, reason);
    }
}

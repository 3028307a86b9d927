package com.openforge.identity.crypto;

/**
 * A stored secret could not be decrypted: wrong key, or corrupted ciphertext.
 *
 * Never reaches an HTTP response. Callers treat it as "no usable secret".
 */
public class InvalidSecretException extends RuntimeException {

    public InvalidSecretException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.openforge.identity.crypto;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-GCM cipher for small secrets stored at rest (user API keys, tokens).
 *
 * Token layout: Base64( iv[12] || ciphertext || tag[16] ).
 * The GCM tag authenticates the payload, so a token from another key or a
 * tampered token fails with {@link InvalidSecretException} instead of
 * decrypting to garbage.
 *
 * One instance per process, built by {@link CipherConfig}. Immutable after construction.
 */
@Slf4j
public final class SecretCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int    IV_BYTES       = 12;
    private static final int    TAG_BITS       = 128;
    private static final int    GENERATED_KEY_BYTES = 32;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final SecretKey key;
    private final boolean   ephemeral;

    private SecretCipher(byte[] rawKey, boolean ephemeral) {
        if (rawKey.length != 16 && rawKey.length != 24 && rawKey.length != 32) {
            throw new IllegalArgumentException(
                    "Invalid encryption key length %d bytes; expected 16, 24 or 32".formatted(rawKey.length));
        }
        this.key       = new SecretKeySpec(rawKey, "AES");
        this.ephemeral = ephemeral;
    }

    /** Build from an operator-supplied Base64 key. Fails fast on a malformed key. */
    public static SecretCipher fromBase64Key(String keyBase64) {
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(keyBase64.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid encryption key format: expected Base64", e);
        }
        return new SecretCipher(raw, false);
    }

    /**
     * Build with a key that lives only as long as this process.
     * Anything encrypted by an earlier process becomes undecryptable.
     */
    public static SecretCipher ephemeral() {
        byte[] raw = new byte[GENERATED_KEY_BYTES];
        RANDOM.nextBytes(raw);
        return new SecretCipher(raw, true);
    }

    /** A fresh Base64 key suitable for {@code app.crypto.secret-key}. */
    public static String generateKey() {
        byte[] raw = new byte[GENERATED_KEY_BYTES];
        RANDOM.nextBytes(raw);
        return Base64.getEncoder().encodeToString(raw);
    }

    public boolean isEphemeral() {
        return ephemeral;
    }

    /**
     * @return the cipher token, or {@code null} for a null or empty input;
     *         callers store the absence, never an encrypted empty string
     */
    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) return null;

        byte[] iv = new byte[IV_BYTES];
        RANDOM.nextBytes(iv);
        try {
            Cipher c = Cipher.getInstance(TRANSFORMATION);
            c.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] ct = c.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] out = new byte[iv.length + ct.length];
            System.arraycopy(iv, 0, out, 0, iv.length);
            System.arraycopy(ct, 0, out, iv.length, ct.length);
            return Base64.getEncoder().encodeToString(out);
        } catch (GeneralSecurityException e) {
            // JCE always ships AES/GCM; reaching this means a broken runtime, not bad input
            throw new IllegalStateException("CIPHER_ENCRYPT_FAILED", e);
        }
    }

    /**
     * @return the plaintext, or {@code null} for a null or empty token
     * @throws InvalidSecretException when the token was produced under another key or is corrupted
     */
    public String decrypt(String token) {
        if (token == null || token.isEmpty()) return null;

        byte[] all;
        try {
            all = Base64.getDecoder().decode(token);
        } catch (IllegalArgumentException e) {
            throw new InvalidSecretException("Secret is not valid Base64", e);
        }
        if (all.length <= IV_BYTES) {
            throw new InvalidSecretException("Secret is truncated", null);
        }

        try {
            Cipher c = Cipher.getInstance(TRANSFORMATION);
            c.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, all, 0, IV_BYTES));
            byte[] pt = c.doFinal(all, IV_BYTES, all.length - IV_BYTES);
            return new String(pt, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            log.debug("[Cipher] Decryption rejected: {}", e.getClass().getSimpleName());
            throw new InvalidSecretException("Failed to decrypt: invalid encryption key or corrupted data", e);
        }
    }
}

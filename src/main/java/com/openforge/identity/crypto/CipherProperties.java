package com.openforge.identity.crypto;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * app.crypto.*
 *
 * app:
 *   crypto:
 *     secret-key: ${ENCRYPTION_KEY:}   # Base64 AES key, 32 bytes recommended
 *
 * Leave empty only for local development: a key is then generated per process.
 */
@ConfigurationProperties(prefix = "app.crypto")
public record CipherProperties(String secretKey) {

    public boolean hasKey() {
        return secretKey != null && !secretKey.isBlank();
    }
}

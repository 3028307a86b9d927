package com.openforge.identity.crypto;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the single {@link SecretCipher} for the process.
 *
 * Missing key → a per-process key is generated and a loud warning is logged:
 * secrets saved by a previous run will no longer decrypt and every user
 * silently falls back to system defaults until they re-enter their keys.
 */
@Slf4j
@Configuration
public class CipherConfig {

    @Bean
    public SecretCipher secretCipher(CipherProperties props) {
        if (props.hasKey()) {
            SecretCipher cipher = SecretCipher.fromBase64Key(props.secretKey());
            log.info("[Cipher] Initialised from configured key");
            return cipher;
        }

        log.warn("""

                ************************************************************
                [Cipher] app.crypto.secret-key (ENCRYPTION_KEY) is NOT set.
                A temporary key was generated for this process only.
                User secrets stored by any previous process will NOT decrypt,
                and secrets stored now will be lost on restart.
                Generate a key with SecretCipher.generateKey() and set
                ENCRYPTION_KEY before running in production.
                ************************************************************""");
        return SecretCipher.ephemeral();
    }
}

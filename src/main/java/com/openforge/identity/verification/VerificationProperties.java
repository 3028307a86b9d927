package com.openforge.identity.verification;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * app.verification.*
 *
 * app:
 *   verification:
 *     cooldown: 60s        # minimum gap between two sends for one (email, purpose)
 *     ttl: 5m              # code lifetime
 *     max-attempts: 5      # wrong guesses before the code is dead
 */
@ConfigurationProperties(prefix = "app.verification")
public record VerificationProperties(
        @DefaultValue("60s") Duration cooldown,
        @DefaultValue("5m")  Duration ttl,
        @DefaultValue("5")   int maxAttempts
) {

    public static VerificationProperties defaults() {
        return new VerificationProperties(Duration.ofSeconds(60), Duration.ofMinutes(5), 5);
    }
}

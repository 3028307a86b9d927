package com.openforge.identity.oauth;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * app.oauth.*
 *
 * A provider is enabled only when both its client id and secret are set.
 */
@ConfigurationProperties(prefix = "app.oauth")
public record OAuthProperties(
        @DefaultValue("http://localhost:8080") String backendUrl,
        @DefaultValue("http://localhost:3000") String frontendUrl,
        @DefaultValue Provider google,
        @DefaultValue Provider github
) {

    public record Provider(String clientId, String clientSecret) {

        public boolean enabled() {
            return clientId != null && !clientId.isBlank()
                    && clientSecret != null && !clientSecret.isBlank();
        }
    }
}

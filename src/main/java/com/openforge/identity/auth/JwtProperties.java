package com.openforge.identity.auth;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * app.jwt.*
 *
 * The secret must be at least 32 bytes (HS256).
 */
@ConfigurationProperties(prefix = "app.jwt")
public record JwtProperties(
        String secret,
        @DefaultValue("15m") Duration accessExpiration,
        @DefaultValue("7d")  Duration refreshExpiration,
        @DefaultValue("30d") Duration rememberMeRefreshExpiration,
        @DefaultValue("10m") Duration stateExpiration
) {}

package com.openforge.identity.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Core infrastructure beans:
 *  - Clock                → every expiry / cooldown / audit timestamp reads this one clock
 *  - Java HttpClient      → the only HTTP engine, used for OAuth provider calls
 *  - Jackson ObjectMapper → snake_case wire format, ISO-8601 dates, tolerant deserialization
 *  - PasswordEncoder      → BCrypt, salted per hash
 */
@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Shared HttpClient for OAuth token exchange and profile lookups.
     * Per-request timeouts are set at the call site.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper:
     *  - snake_case property names (access_token, remember_me, retry_after_seconds …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (OAuth providers add fields freely)
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Password encoder used for registration, login, change and reset.
     * Never reversible; every hash carries its own salt.
     */
    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}

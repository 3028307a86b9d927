package com.openforge.identity.oauth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Raw HttpClient + Jackson plumbing shared by the provider clients. No SDK.
 */
@Slf4j
public abstract class AbstractOAuthClient implements OAuthProviderClient {

    private static final Duration TIMEOUT = Duration.ofSeconds(15);

    protected final HttpClient             httpClient;
    protected final ObjectMapper           objectMapper;
    protected final OAuthProperties.Provider config;

    protected AbstractOAuthClient(HttpClient httpClient, ObjectMapper objectMapper,
                                  OAuthProperties.Provider config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config == null ? new OAuthProperties.Provider(null, null) : config;
    }

    @Override
    public boolean isEnabled() {
        return config.enabled();
    }

    // ── HTTP helpers ─────────────────────────────────────────────────────────

    protected JsonNode postForm(String url, Map<String, String> form) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .timeout(TIMEOUT)
                .POST(HttpRequest.BodyPublishers.ofString(formEncode(form)))
                .build();
        log.debug("[OAuth] → POST {}", url);
        return send(request);
    }

    protected JsonNode getJson(String url, String accessToken) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Authorization", "Bearer " + accessToken)
                .header("Accept", "application/json")
                .timeout(TIMEOUT)
                .GET()
                .build();
        log.debug("[OAuth] → GET {}", url);
        return send(request);
    }

    protected static String formEncode(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    protected static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private JsonNode send(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new OAuthException("Network error calling " + name(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OAuthException("Interrupted calling " + name(), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new OAuthException("%s returned HTTP %d".formatted(name(), status));
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new OAuthException("Unreadable response from " + name(), e);
        }
    }

    // ── Exception ────────────────────────────────────────────────────────────

    public static class OAuthException extends RuntimeException {
        public OAuthException(String message) { super(message); }
        public OAuthException(String message, Throwable cause) { super(message, cause); }
    }
}

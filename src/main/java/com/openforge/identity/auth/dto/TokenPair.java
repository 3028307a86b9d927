package com.openforge.identity.auth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/** {@code refreshToken} is null on a refresh response. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenPair(
        String accessToken,
        String refreshToken,
        String tokenType,
        long   expiresIn
) {
    public static TokenPair of(String access, String refresh, long expiresIn) {
        return new TokenPair(access, refresh, "Bearer", expiresIn);
    }
}

package com.openforge.identity.oauth;

/** What a provider tells us about the person who just signed in. */
public record OAuthProfile(
        String provider,
        String externalId,
        String email,
        String displayName,
        String avatarUrl
) {}

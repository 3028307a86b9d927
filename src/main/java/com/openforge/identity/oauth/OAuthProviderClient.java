package com.openforge.identity.oauth;

/**
 * One OAuth2 authorization-code provider.
 */
public interface OAuthProviderClient {

    /** Path segment and stored provider tag: google | github. */
    String name();

    boolean isEnabled();

    String authorizationUrl(String state, String redirectUri);

    /**
     * Exchanges the authorization code and reads the user's profile.
     *
     * @throws AbstractOAuthClient.OAuthException on any provider or network failure
     */
    OAuthProfile fetchProfile(String code, String redirectUri);
}

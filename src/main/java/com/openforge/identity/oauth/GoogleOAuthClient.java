package com.openforge.identity.oauth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.Map;

/** Google OpenID Connect, authorization-code flow. */
@Component
public class GoogleOAuthClient extends AbstractOAuthClient {

    static final String AUTHORIZE_URL = "https://accounts.google.com/o/oauth2/v2/auth";
    static final String TOKEN_URL     = "https://oauth2.googleapis.com/token";
    static final String USERINFO_URL  = "https://openidconnect.googleapis.com/v1/userinfo";

    public GoogleOAuthClient(HttpClient httpClient, ObjectMapper objectMapper, OAuthProperties props) {
        super(httpClient, objectMapper, props.google());
    }

    @Override
    public String name() {
        return "google";
    }

    @Override
    public String authorizationUrl(String state, String redirectUri) {
        Map<String, String> q = new LinkedHashMap<>();
        q.put("client_id", config.clientId());
        q.put("redirect_uri", redirectUri);
        q.put("response_type", "code");
        q.put("scope", "openid email profile");
        q.put("state", state);
        return AUTHORIZE_URL + "?" + formEncode(q);
    }

    @Override
    public OAuthProfile fetchProfile(String code, String redirectUri) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("code", code);
        form.put("client_id", config.clientId());
        form.put("client_secret", config.clientSecret());
        form.put("redirect_uri", redirectUri);
        form.put("grant_type", "authorization_code");

        String accessToken = text(postForm(TOKEN_URL, form), "access_token");
        if (accessToken == null) throw new OAuthException("google returned no access token");

        JsonNode user = getJson(USERINFO_URL, accessToken);
        String email  = text(user, "email");
        String name   = text(user, "name");
        return new OAuthProfile(name(), text(user, "sub"), email,
                name != null ? name : localPart(email), text(user, "picture"));
    }

    private static String localPart(String email) {
        return email == null ? null : email.substring(0, Math.max(0, email.indexOf('@')));
    }
}

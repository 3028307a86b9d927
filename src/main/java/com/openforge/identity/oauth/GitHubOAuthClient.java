package com.openforge.identity.oauth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GitHub OAuth app. The profile email is often hidden; in that case the primary
 * verified address from /user/emails is used.
 */
@Component
public class GitHubOAuthClient extends AbstractOAuthClient {

    static final String AUTHORIZE_URL = "https://github.com/login/oauth/authorize";
    static final String TOKEN_URL     = "https://github.com/login/oauth/access_token";
    static final String USER_URL      = "https://api.github.com/user";
    static final String EMAILS_URL    = "https://api.github.com/user/emails";

    public GitHubOAuthClient(HttpClient httpClient, ObjectMapper objectMapper, OAuthProperties props) {
        super(httpClient, objectMapper, props.github());
    }

    @Override
    public String name() {
        return "github";
    }

    @Override
    public String authorizationUrl(String state, String redirectUri) {
        Map<String, String> q = new LinkedHashMap<>();
        q.put("client_id", config.clientId());
        q.put("redirect_uri", redirectUri);
        q.put("scope", "user:email");
        q.put("state", state);
        return AUTHORIZE_URL + "?" + formEncode(q);
    }

    @Override
    public OAuthProfile fetchProfile(String code, String redirectUri) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", config.clientId());
        form.put("client_secret", config.clientSecret());
        form.put("code", code);
        form.put("redirect_uri", redirectUri);

        String accessToken = text(postForm(TOKEN_URL, form), "access_token");
        if (accessToken == null) throw new OAuthException("github returned no access token");

        JsonNode user = getJson(USER_URL, accessToken);
        String email  = text(user, "email");
        if (email == null || email.isBlank()) {
            email = primaryVerifiedEmail(getJson(EMAILS_URL, accessToken));
        }
        return new OAuthProfile(name(), text(user, "id"), email,
                text(user, "login"), text(user, "avatar_url"));
    }

    static String primaryVerifiedEmail(JsonNode emails) {
        if (emails == null || !emails.isArray()) return null;
        for (JsonNode e : emails) {
            if (e.path("primary").asBoolean(false) && e.path("verified").asBoolean(false)) {
                return text(e, "email");
            }
        }
        return null;
    }
}

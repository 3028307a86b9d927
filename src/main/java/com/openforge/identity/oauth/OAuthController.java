package com.openforge.identity.oauth;

import com.openforge.identity.auth.JwtUtil;
import com.openforge.identity.auth.TokenService;
import com.openforge.identity.auth.dto.TokenPair;
import com.openforge.identity.common.NotFoundException;
import com.openforge.identity.domain.Account;
import io.jsonwebtoken.Claims;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Browser-facing OAuth sign-in.
 *
 *   GET /api/auth/{provider}           → 302 to the provider
 *   GET /api/auth/{provider}/callback  → 302 to the frontend with tokens, or to /login?error=
 */
@Slf4j
@RestController
@RequestMapping("/api/auth")
public class OAuthController {

    private final List<OAuthProviderClient> providers;
    private final OAuthIdentityResolver     resolver;
    private final TokenService              tokenService;
    private final JwtUtil                   jwtUtil;
    private final OAuthProperties           props;

    public OAuthController(List<OAuthProviderClient> clients,
                           OAuthIdentityResolver resolver,
                           TokenService tokenService,
                           JwtUtil jwtUtil,
                           OAuthProperties props) {
        this.providers    = clients;
        this.resolver     = resolver;
        this.tokenService = tokenService;
        this.jwtUtil      = jwtUtil;
        this.props        = props;
    }

    @GetMapping("/{provider:google|github}")
    public ResponseEntity<Void> authorize(@PathVariable String provider) {
        OAuthProviderClient client = enabledClient(provider);
        String url = client.authorizationUrl(jwtUtil.generateState(provider), redirectUri(provider));
        return redirect(url);
    }

    @GetMapping("/{provider:google|github}/callback")
    public ResponseEntity<Void> callback(@PathVariable String provider,
                                         @RequestParam(required = false) String code,
                                         @RequestParam(required = false) String state,
                                         @RequestParam(required = false) String error) {
        OAuthProviderClient client = enabledClient(provider);

        if (error != null || code == null || state == null) {
            log.warn("[OAuth] {} callback without code: error={}", provider, error);
            return loginError("Authorization cancelled");
        }

        try {
            Claims claims = jwtUtil.parse(state, JwtUtil.TYPE_STATE);
            if (!provider.equals(claims.get("provider", String.class))) {
                return loginError("Invalid state");
            }

            OAuthProfile profile = client.fetchProfile(code, redirectUri(provider));
            if (profile.email() == null || profile.email().isBlank()) {
                return loginError("Email not available");
            }

            Account account = resolver.resolve(profile.provider(), profile.externalId(),
                    profile.email(), profile.displayName(), profile.avatarUrl());
            if (!account.isActive()) {
                return loginError("Account is disabled");
            }

            TokenPair tokens = tokenService.issueTokens(account, true);
            log.info("[OAuth] {} sign-in for account id={}", provider, account.getId());
            return redirect(props.frontendUrl() + "/auth/callback?access_token=" + encode(tokens.accessToken())
                    + "&refresh_token=" + encode(tokens.refreshToken()));
        } catch (RuntimeException e) {
            log.error("[OAuth] {} callback failed: {}", provider, e.getMessage(), e);
            return loginError("OAuth failed");
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private OAuthProviderClient enabledClient(String provider) {
        OAuthProviderClient client = providers.stream()
                .filter(c -> provider.equals(c.name()))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Unknown OAuth provider: " + provider));
        if (!client.isEnabled()) throw new OAuthNotConfiguredException(provider);
        return client;
    }

    private String redirectUri(String provider) {
        return props.backendUrl() + "/api/auth/" + provider + "/callback";
    }

    private ResponseEntity<Void> loginError(String message) {
        return redirect(props.frontendUrl() + "/login?error=" + encode(message));
    }

    private static ResponseEntity<Void> redirect(String url) {
        HttpHeaders headers = new HttpHeaders();
        headers.setLocation(URI.create(url));
        return new ResponseEntity<>(headers, HttpStatus.FOUND);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}

package com.openforge.identity.auth;

import com.openforge.identity.common.AuthException;
import com.openforge.identity.domain.Account;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Signs and parses the three HS256 token kinds, told apart by the {@code type} claim.
 */
@Slf4j
@Component
public class JwtUtil {

    public static final String TYPE_ACCESS  = "access";
    public static final String TYPE_REFRESH = "refresh";
    public static final String TYPE_STATE   = "oauth_state";

    static final String CLAIM_TYPE     = "type";
    static final String CLAIM_USERNAME = "username";
    static final String CLAIM_ROLE     = "role";
    static final String CLAIM_PROVIDER = "provider";

    private final SecretKey     key;
    private final JwtProperties props;
    private final Clock         clock;

    public JwtUtil(JwtProperties props, Clock clock) {
        if (props.secret() == null || props.secret().getBytes(StandardCharsets.UTF_8).length < 32) {
            throw new IllegalStateException("app.jwt.secret must be at least 32 bytes");
        }
        this.key   = Keys.hmacShaKeyFor(props.secret().getBytes(StandardCharsets.UTF_8));
        this.props = props;
        this.clock = clock;
    }

    /** sub = account id, plus username and role. */
    public String generateAccess(Account account) {
        return Jwts.builder()
                .subject(String.valueOf(account.getId()))
                .claim(CLAIM_TYPE, TYPE_ACCESS)
                .claim(CLAIM_USERNAME, account.getUsername())
                .claim(CLAIM_ROLE, account.getRole().wireName())
                .issuedAt(Date.from(now()))
                .expiration(Date.from(now().plus(props.accessExpiration())))
                .signWith(key)
                .compact();
    }

    public String generateRefresh(Long accountId, boolean rememberMe) {
        Duration ttl = rememberMe ? props.rememberMeRefreshExpiration() : props.refreshExpiration();
        return Jwts.builder()
                .subject(String.valueOf(accountId))
                .claim(CLAIM_TYPE, TYPE_REFRESH)
                .issuedAt(Date.from(now()))
                .expiration(Date.from(now().plus(ttl)))
                .signWith(key)
                .compact();
    }

    /** Short-lived OAuth {@code state}, bound to one provider. */
    public String generateState(String provider) {
        return Jwts.builder()
                .subject(provider)
                .claim(CLAIM_TYPE, TYPE_STATE)
                .claim(CLAIM_PROVIDER, provider)
                .issuedAt(Date.from(now()))
                .expiration(Date.from(now().plus(props.stateExpiration())))
                .signWith(key)
                .compact();
    }

    /**
     * Verifies signature and expiry and checks the {@code type} claim.
     *
     * @throws AuthException INVALID_TOKEN on any failure
     */
    public Claims parse(String token, String expectedType) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(now()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("[JWT] Invalid token: {}", e.getMessage());
            throw AuthException.invalidToken();
        }
        if (!expectedType.equals(claims.get(CLAIM_TYPE, String.class))) {
            log.debug("[JWT] Wrong token type, expected {}", expectedType);
            throw AuthException.invalidToken();
        }
        return claims;
    }

    /** Account id from a valid token of the given type. */
    public Long accountId(String token, String expectedType) {
        try {
            return Long.valueOf(parse(token, expectedType).getSubject());
        } catch (NumberFormatException e) {
            throw AuthException.invalidToken();
        }
    }

    public long accessExpiresInSeconds() {
        return props.accessExpiration().toSeconds();
    }

    private Instant now() {
        return clock.instant();
    }
}

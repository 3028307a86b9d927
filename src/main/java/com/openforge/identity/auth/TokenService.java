package com.openforge.identity.auth;

import com.openforge.identity.auth.dto.TokenPair;
import com.openforge.identity.common.AuthException;
import com.openforge.identity.domain.Account;
import com.openforge.identity.repository.AccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Mints token pairs and exchanges refresh tokens for new access tokens.
 *
 * Nothing is stored server-side; a token is valid until it expires.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenService {

    private final JwtUtil           jwtUtil;
    private final AccountRepository accounts;

    public TokenPair issueTokens(Account account, boolean rememberMe) {
        return TokenPair.of(
                jwtUtil.generateAccess(account),
                jwtUtil.generateRefresh(account.getId(), rememberMe),
                jwtUtil.accessExpiresInSeconds());
    }

    /**
     * Returns a pair carrying only a new access token.
     *
     * @throws AuthException INVALID_TOKEN for anything but a live refresh token,
     *                       ACCOUNT_NOT_FOUND or ACCOUNT_DISABLED after reload
     */
    @Transactional(readOnly = true)
    public TokenPair refresh(String refreshToken) {
        Long accountId = jwtUtil.accountId(refreshToken, JwtUtil.TYPE_REFRESH);
        Account account = accounts.findById(accountId)
                .orElseThrow(AuthException::accountNotFound);
        if (!account.isActive()) {
            log.info("[Auth] Refresh refused for disabled account id={}", accountId);
            throw AuthException.accountDisabled();
        }
        return TokenPair.of(jwtUtil.generateAccess(account), null, jwtUtil.accessExpiresInSeconds());
    }
}

package com.openforge.identity.oauth;

import com.openforge.identity.auth.AuthService;
import com.openforge.identity.common.ValidationException;
import com.openforge.identity.domain.Account;
import com.openforge.identity.domain.AccountSettings;
import com.openforge.identity.repository.AccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Maps a provider identity onto a local account.
 *
 * Lookup order:
 *   1. (provider, external id) already linked
 *   2. same email: link this provider onto that account
 *   3. neither: create a password-less account
 *
 * An account holds one provider link; signing in with a second provider by the
 * same email re-links it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OAuthIdentityResolver {

    /** Leaves room for a "_NNN" suffix inside the 64-char column. */
    static final int MAX_BASE_LENGTH = 56;

    static final String FALLBACK_USERNAME = "user";

    private final AccountRepository accounts;

    @Transactional
    public Account resolve(String provider, String externalId, String email,
                           String displayName, String avatarUrl) {
        String normalized = Account.normalizeEmail(email);
        if (normalized == null || !normalized.contains("@")) {
            throw new ValidationException(ValidationException.INVALID_EMAIL, "Provider did not supply an email");
        }

        // 1. Known identity
        Optional<Account> linked = accounts.findByOauthProviderAndOauthId(provider, externalId);
        if (linked.isPresent()) {
            Account account = linked.get();
            if (notBlank(avatarUrl) && !avatarUrl.equals(account.getAvatarUrl())) {
                account.setAvatarUrl(avatarUrl);
            }
            return account;
        }

        // 2. Existing account with the same email
        Optional<Account> byEmail = accounts.findByEmail(normalized);
        if (byEmail.isPresent()) {
            Account account = byEmail.get();
            account.setOauthProvider(provider);
            account.setOauthId(externalId);
            if (!notBlank(account.getAvatarUrl()) && notBlank(avatarUrl)) {
                account.setAvatarUrl(avatarUrl);
            }
            log.info("[OAuth] Linked {} identity to account id={}", provider, account.getId());
            return account;
        }

        // 3. New account
        Account account = new Account();
        account.setUsername(uniqueUsername(baseUsername(displayName, normalized)));
        account.setEmail(normalized);
        account.setAvatarUrl(notBlank(avatarUrl) ? avatarUrl : null);
        account.setOauthProvider(provider);
        account.setOauthId(externalId);
        account.attachSettings(new AccountSettings());

        Account saved = accounts.save(account);
        log.info("[OAuth] Created account id={} username={} via {}", saved.getId(), saved.getUsername(), provider);
        return saved;
    }

    // ── Username ─────────────────────────────────────────────────────────────

    static String baseUsername(String displayName, String email) {
        String base = notBlank(displayName)
                ? displayName.trim().replace(' ', '_').toLowerCase()
                : email.substring(0, email.indexOf('@'));
        if (base.isEmpty()) {
            return FALLBACK_USERNAME;
        }
        if (base.length() < AuthService.MIN_USERNAME_LENGTH) {
            return base + "_" + FALLBACK_USERNAME;
        }
        return base.length() > MAX_BASE_LENGTH ? base.substring(0, MAX_BASE_LENGTH) : base;
    }

    /** base, base_1, base_2, ... until free. */
    private String uniqueUsername(String base) {
        String candidate = base;
        int suffix = 1;
        while (accounts.existsByUsername(candidate)) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}

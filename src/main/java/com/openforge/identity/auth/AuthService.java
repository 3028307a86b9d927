package com.openforge.identity.auth;

import com.openforge.identity.common.AuthException;
import com.openforge.identity.common.ConflictException;
import com.openforge.identity.common.NotFoundException;
import com.openforge.identity.common.ValidationException;
import com.openforge.identity.domain.Account;
import com.openforge.identity.domain.AccountSettings;
import com.openforge.identity.domain.VerificationPurpose;
import com.openforge.identity.repository.AccountRepository;
import com.openforge.identity.verification.VerificationCodeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Password accounts: registration, login, password changes and profile edits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    public static final int MIN_USERNAME_LENGTH = 3;
    static final int MIN_PASSWORD_LENGTH = 6;

    private final AccountRepository       accountRepository;
    private final PasswordEncoder         passwordEncoder;
    private final VerificationCodeService verificationCodes;
    private final Clock                   clock;

    // ── Registration ─────────────────────────────────────────────────────────

    /**
     * Creates the account and its empty settings row in one transaction.
     * Every check runs before the first write.
     */
    @Transactional
    public Account register(String username, String email, String password) {
        String name       = checkNewAccount(username, email, password);
        String normalized = Account.normalizeEmail(email);

        Account account = new Account();
        account.setUsername(name);
        account.setEmail(normalized);
        account.setPasswordHash(passwordEncoder.encode(password));
        account.attachSettings(new AccountSettings());

        Account saved = accountRepository.save(account);
        log.info("[Auth] New account registered: id={}, username={}", saved.getId(), saved.getUsername());
        return saved;
    }

    /**
     * Registration gated by an emailed code. Input and uniqueness are checked
     * first so a rejected request never burns the code.
     */
    @Transactional
    public Account registerWithCode(String username, String email, String password, String code) {
        if (code == null || code.isBlank()) {
            throw new ValidationException(ValidationException.MISSING_FIELD, "Verification code is required");
        }
        checkNewAccount(username, email, password);
        verificationCodes.verify(Account.normalizeEmail(email), VerificationPurpose.REGISTER, code);
        return register(username, email, password);
    }

    // ── Login ────────────────────────────────────────────────────────────────

    /**
     * Unknown email, password-less account and wrong password are indistinguishable.
     * The disabled flag is only revealed once the password is right.
     */
    @Transactional
    public Account login(String email, String password) {
        Account account = accountRepository.findByEmail(Account.normalizeEmail(email))
                .orElseThrow(AuthException::invalidCredentials);

        if (!account.hasPassword() || password == null
                || !passwordEncoder.matches(password, account.getPasswordHash())) {
            throw AuthException.invalidCredentials();
        }
        if (!account.isActive()) {
            throw AuthException.accountDisabled();
        }

        account.setLastLoginTime(LocalDateTime.now(clock));
        log.info("[Auth] Login id={}", account.getId());
        return account;
    }

    // ── Passwords ────────────────────────────────────────────────────────────

    @Transactional
    public void changePassword(Long accountId, String oldPassword, String newPassword) {
        Account account = load(accountId);
        if (!account.hasPassword() || oldPassword == null
                || !passwordEncoder.matches(oldPassword, account.getPasswordHash())) {
            throw AuthException.wrongPassword();
        }
        requirePassword(newPassword);
        account.setPasswordHash(passwordEncoder.encode(newPassword));
        log.info("[Auth] Password changed id={}", accountId);
    }

    /**
     * Consumes a reset_password code, then sets the new hash. The code is spent
     * even if the account vanished in between.
     */
    @Transactional
    public void resetPassword(String email, String code, String newPassword) {
        requirePassword(newPassword);
        String normalized = Account.normalizeEmail(email);
        verificationCodes.verify(normalized, VerificationPurpose.RESET_PASSWORD, code);

        Account account = accountRepository.findByEmail(normalized)
                .orElseThrow(() -> new NotFoundException("Account not found"));
        account.setPasswordHash(passwordEncoder.encode(newPassword));
        log.info("[Auth] Password reset id={}", account.getId());
    }

    // ── Profile ──────────────────────────────────────────────────────────────

    /** Null arguments leave the field untouched; a blank avatar clears it. */
    @Transactional
    public Account updateProfile(Long accountId, String username, String avatarUrl) {
        Account account = load(accountId);

        if (username != null) {
            String name = username.trim();
            requireUsername(name);
            if (!name.equals(account.getUsername())) {
                if (accountRepository.existsByUsername(name)) throw ConflictException.usernameTaken();
                account.setUsername(name);
            }
        }
        if (avatarUrl != null) {
            account.setAvatarUrl(avatarUrl.isBlank() ? null : avatarUrl.trim());
        }
        return account;
    }

    @Transactional(readOnly = true)
    public Account load(Long accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(AuthException::accountNotFound);
    }

    // ── Validation ───────────────────────────────────────────────────────────

    /** @return the trimmed username */
    private String checkNewAccount(String username, String email, String password) {
        String name = username == null ? "" : username.trim();
        requireUsername(name);
        String normalized = Account.normalizeEmail(email);
        if (normalized == null || !normalized.contains("@")) {
            throw new ValidationException(ValidationException.INVALID_EMAIL, "Invalid email address");
        }
        requirePassword(password);

        if (accountRepository.existsByUsername(name))     throw ConflictException.usernameTaken();
        if (accountRepository.existsByEmail(normalized))  throw ConflictException.emailTaken();
        return name;
    }

    private static void requireUsername(String name) {
        if (name.length() < MIN_USERNAME_LENGTH) {
            throw new ValidationException(ValidationException.USERNAME_TOO_SHORT,
                    "Username must be at least %d characters".formatted(MIN_USERNAME_LENGTH));
        }
    }

    private static void requirePassword(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new ValidationException(ValidationException.PASSWORD_TOO_SHORT,
                    "Password must be at least %d characters".formatted(MIN_PASSWORD_LENGTH));
        }
    }
}

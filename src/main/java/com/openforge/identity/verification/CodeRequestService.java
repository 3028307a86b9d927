package com.openforge.identity.verification;

import com.openforge.identity.common.ConflictException;
import com.openforge.identity.common.RateLimitedException;
import com.openforge.identity.common.ValidationException;
import com.openforge.identity.domain.Account;
import com.openforge.identity.domain.VerificationCode;
import com.openforge.identity.domain.VerificationPurpose;
import com.openforge.identity.mail.MailException;
import com.openforge.identity.mail.Mailer;
import com.openforge.identity.mail.VerificationMailComposer;
import com.openforge.identity.mail.VerificationMailComposer.ComposedMail;
import com.openforge.identity.repository.AccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Handles "send me a code": account checks, cooldown, issue, then mail.
 *
 * Not transactional itself. The code row is committed by {@code issue} before
 * the mail goes out, so a failed send still starts the cooldown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CodeRequestService {

    private final VerificationCodeService  codes;
    private final AccountRepository        accounts;
    private final Mailer                   mailer;
    private final VerificationMailComposer composer;

    /**
     * @return seconds until the issued code expires
     * @throws ValidationException   malformed email
     * @throws MailException         mail not configured (503) or send failed (500)
     * @throws ConflictException     register for an email that already has an account
     * @throws RateLimitedException  still inside the cooldown window
     */
    public long requestCode(String email, VerificationPurpose purpose) {
        String normalized = Account.normalizeEmail(email);
        if (normalized == null || !normalized.contains("@")) {
            throw new ValidationException(ValidationException.INVALID_EMAIL, "Invalid email address");
        }
        if (!mailer.isConfigured()) {
            throw MailException.unavailable();
        }

        long ttlSeconds = codes.ttl().toSeconds();
        boolean exists  = accounts.existsByEmail(normalized);

        if (purpose == VerificationPurpose.REGISTER && exists) {
            throw ConflictException.emailTaken();
        }
        if (purpose == VerificationPurpose.RESET_PASSWORD && !exists) {
            // same answer as a real send so accounts cannot be enumerated
            log.info("[Verify] Reset code requested for unknown email, nothing sent");
            return ttlSeconds;
        }

        IssueDecision decision = codes.canIssue(normalized, purpose);
        if (!decision.allowed()) {
            throw new RateLimitedException(decision.retryAfterSeconds());
        }

        VerificationCode code = codes.issue(normalized, purpose);
        ComposedMail mail = composer.compose(purpose, code.getCode(), codes.ttl().toMinutes());
        mailer.send(normalized, mail.subject(), mail.html(), mail.text());
        return ttlSeconds;
    }
}

package com.openforge.identity.verification;

import com.openforge.identity.domain.VerificationCode;
import com.openforge.identity.domain.VerificationPurpose;
import com.openforge.identity.repository.VerificationCodeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Issues, rate-limits, expires and consumes 6-digit email codes per (email, purpose).
 *
 * Lifecycle of one code: ACTIVE → CONSUMED | EXPIRED | SUPERSEDED.
 * Codes are compared as strings (leading zeros count).
 */
@Slf4j
@Service
public class VerificationCodeService {

    static final int CODE_LENGTH = 6;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final VerificationCodeRepository codes;
    private final VerificationProperties     props;
    private final Clock                      clock;

    public VerificationCodeService(VerificationCodeRepository codes,
                                   VerificationProperties props,
                                   Clock clock) {
        this.codes = codes;
        this.props = props;
        this.clock = clock;
    }

    // ── Cooldown ─────────────────────────────────────────────────────────────

    /**
     * Looks at the newest code for the pair, used or not. Younger than the
     * cooldown → not allowed, with the whole seconds left (never 0 while blocked).
     */
    @Transactional(readOnly = true)
    public IssueDecision canIssue(String email, VerificationPurpose purpose) {
        Optional<VerificationCode> last = codes.findFirstByEmailAndPurposeOrderByCreateTimeDescIdDesc(
                normalize(email), purpose.tag());
        if (last.isEmpty()) return IssueDecision.allow();

        Duration age = Duration.between(last.get().getCreateTime(), now());
        if (age.compareTo(props.cooldown()) < 0) {
            Duration left = props.cooldown().minus(age);
            long seconds  = Math.max(1, (left.toMillis() + 999) / 1000);
            return IssueDecision.retryAfter(seconds);
        }
        return IssueDecision.allow();
    }

    // ── Issue ────────────────────────────────────────────────────────────────

    /**
     * Supersedes every unused code of the pair, then inserts a fresh one, in one
     * transaction. The supersede UPDATE locks the (email, purpose, used) index
     * range, so two concurrent issues for one pair serialize.
     */
    @Transactional
    public VerificationCode issue(String email, VerificationPurpose purpose) {
        String normalized  = normalize(email);
        LocalDateTime now  = now();

        int superseded = codes.supersedeUnused(normalized, purpose.tag(), now);

        VerificationCode code = new VerificationCode();
        code.setEmail(normalized);
        code.setPurpose(purpose.tag());
        code.setCode(generateCode());
        code.setExpiresAt(now.plus(props.ttl()));
        code.setAttempts(0);
        code.setUsed(false);
        VerificationCode saved = codes.save(code);

        log.info("[Verify] Issued {} code id={} (superseded {})", purpose.tag(), saved.getId(), superseded);
        return saved;
    }

    // ── Verify (consuming) ───────────────────────────────────────────────────

    /**
     * Consumes the latest unused code of the pair if {@code submitted} matches.
     *
     * Runs in its own transaction and commits even when it throws, so the
     * attempt increment is durable before the caller sees the result. The row
     * is held FOR UPDATE for the whole check, which serializes racing callers:
     * at most one of them can ever succeed.
     *
     * @throws VerificationException NOT_FOUND | EXPIRED | TOO_MANY_ATTEMPTS | MISMATCH
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW, noRollbackFor = VerificationException.class)
    public void verify(String email, VerificationPurpose purpose, String submitted) {
        VerificationCode code = lockLatestUnused(normalize(email), purpose)
                .orElseThrow(VerificationException::notFound);

        if (code.isUsed()) {
            // consumed by the caller we waited on
            throw VerificationException.notFound();
        }
        if (code.isExpiredAt(now())) {
            throw VerificationException.expired();
        }
        if (code.getAttempts() >= props.maxAttempts()) {
            throw VerificationException.tooManyAttempts();
        }

        // count first: a correct guess after the last allowed miss is still rejected above
        code.setAttempts(code.getAttempts() + 1);
        codes.saveAndFlush(code);

        if (!code.getCode().equals(submitted == null ? null : submitted.trim())) {
            int remaining = Math.max(0, props.maxAttempts() - code.getAttempts());
            log.info("[Verify] Mismatch on code id={} attempts={}", code.getId(), code.getAttempts());
            throw VerificationException.mismatch(remaining);
        }

        code.setUsed(true);
        codes.saveAndFlush(code);
        log.info("[Verify] Consumed {} code id={}", purpose.tag(), code.getId());
    }

    // ── Check (non-consuming) ────────────────────────────────────────────────

    /**
     * Form pre-check: tells whether {@code submitted} would currently verify,
     * without consuming the code. A wrong guess still counts as an attempt.
     */
    @Transactional
    public CodeCheck check(String email, VerificationPurpose purpose, String submitted) {
        Optional<VerificationCode> found = lockLatestUnused(normalize(email), purpose);
        if (found.isEmpty()) return CodeCheck.rejected(VerificationException.Reason.NOT_FOUND);

        VerificationCode code = found.get();
        if (code.isExpiredAt(now())) return CodeCheck.rejected(VerificationException.Reason.EXPIRED);
        if (code.getAttempts() >= props.maxAttempts()) {
            return CodeCheck.rejected(VerificationException.Reason.TOO_MANY_ATTEMPTS);
        }
        if (!code.getCode().equals(submitted == null ? null : submitted.trim())) {
            code.setAttempts(code.getAttempts() + 1);
            codes.save(code);
            return CodeCheck.rejected(VerificationException.Reason.MISMATCH);
        }
        return CodeCheck.ok();
    }

    public Duration ttl() {
        return props.ttl();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private Optional<VerificationCode> lockLatestUnused(String email, VerificationPurpose purpose) {
        return codes.lockUnused(email, purpose.tag(), PageRequest.of(0, 1)).stream().findFirst();
    }

    static String generateCode() {
        StringBuilder sb = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            sb.append((char) ('0' + RANDOM.nextInt(10)));
        }
        return sb.toString();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static String normalize(String email) {
        return email == null ? "" : email.trim().toLowerCase();
    }
}

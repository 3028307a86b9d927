package com.openforge.identity.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * One emailed 6-digit code.
 *
 * Keyed by email rather than account id: registration codes are requested
 * before the account exists. At most one row per (email, purpose) is unused.
 */
@Getter
@Setter
@Entity
@Table(name = "verification_codes", indexes = {
        @Index(name = "idx_verification_email_purpose_used", columnList = "email, purpose, used")
})
public class VerificationCode extends BaseEntity {

    @Column(nullable = false, length = 255)
    private String email;

    /** Exactly six ASCII digits; leading zeros are significant. */
    @Column(nullable = false, length = 6)
    private String code;

    /** register | reset_password */
    @Column(nullable = false, length = 20)
    private String purpose;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(nullable = false)
    private boolean used = false;

    @Column(nullable = false)
    private int attempts = 0;

    public boolean isExpiredAt(LocalDateTime now) {
        return now.isAfter(expiresAt);
    }
}

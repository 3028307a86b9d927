package com.openforge.identity.domain;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A registered user. Password-less when created through OAuth.
 *
 * All audit fields (id, create_time, update_time, version) come from BaseEntity.
 * Email is always stored trimmed and lower-cased, so the plain unique index
 * enforces case-insensitive uniqueness.
 */
@Getter
@Setter
@Entity
@Table(name = "users", uniqueConstraints = {
        @UniqueConstraint(name = "uk_users_oauth_identity", columnNames = {"oauth_provider", "oauth_id"})
})
public class Account extends BaseEntity {

    @Column(nullable = false, length = 64, unique = true)
    private String username;

    @Column(nullable = false, length = 128, unique = true)
    private String email;

    /** Null for accounts that only ever signed in through OAuth. */
    @Column(name = "password_hash", length = 255)
    private String passwordHash;

    @Column(name = "avatar_url", length = 500)
    private String avatarUrl;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Role role = Role.USER;

    /** google | github */
    @Column(name = "oauth_provider", length = 20)
    private String oauthProvider;

    @Column(name = "oauth_id", length = 100)
    private String oauthId;

    @Column(name = "last_login_time")
    private LocalDateTime lastLoginTime;

    @OneToOne(mappedBy = "account", cascade = CascadeType.ALL, orphanRemoval = true)
    private AccountSettings settings;

    public boolean hasPassword() {
        return passwordHash != null && !passwordHash.isBlank();
    }

    /** Keeps both sides of the one-to-one in step. */
    public void attachSettings(AccountSettings settings) {
        settings.setAccount(this);
        this.settings = settings;
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase();
    }
}

package com.openforge.identity.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Lob;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

/**
 * Per-account overrides of system-wide settings.
 *
 * Secret columns only ever hold SecretCipher output. A null column means
 * "no override" and the system default applies.
 */
@Getter
@Setter
@Entity
@Table(name = "user_settings")
public class AccountSettings extends BaseEntity {

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "account_id", nullable = false, unique = true)
    private Account account;

    @Lob
    @Column(name = "google_api_key_encrypted")
    private String googleApiKeyEncrypted;

    @Column(name = "google_api_base", length = 500)
    private String googleApiBase;

    @Lob
    @Column(name = "mineru_token_encrypted")
    private String mineruTokenEncrypted;

    @Column(name = "mineru_api_base", length = 500)
    private String mineruApiBase;

    @Column(name = "image_caption_model", length = 100)
    private String imageCaptionModel;

    @Column(name = "max_description_workers")
    private Integer maxDescriptionWorkers;

    @Column(name = "max_image_workers")
    private Integer maxImageWorkers;
}

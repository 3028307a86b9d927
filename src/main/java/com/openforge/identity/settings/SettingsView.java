package com.openforge.identity.settings;

import com.openforge.identity.domain.AccountSettings;

import java.time.LocalDateTime;

/** Stored overrides as the owner sees them; secrets only as has_* flags. */
public record SettingsView(
        Long          id,
        String        googleApiBase,
        String        mineruApiBase,
        String        imageCaptionModel,
        Integer       maxDescriptionWorkers,
        Integer       maxImageWorkers,
        boolean       hasGoogleApiKey,
        boolean       hasMineruToken,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    public static SettingsView of(AccountSettings s) {
        return new SettingsView(
                s.getId(),
                s.getGoogleApiBase(),
                s.getMineruApiBase(),
                s.getImageCaptionModel(),
                s.getMaxDescriptionWorkers(),
                s.getMaxImageWorkers(),
                notEmpty(s.getGoogleApiKeyEncrypted()),
                notEmpty(s.getMineruTokenEncrypted()),
                s.getCreateTime(),
                s.getUpdateTime());
    }

    private static boolean notEmpty(String v) {
        return v != null && !v.isEmpty();
    }
}

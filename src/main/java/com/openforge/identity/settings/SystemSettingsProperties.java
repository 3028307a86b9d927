package com.openforge.identity.settings;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * System-wide defaults behind every per-account override.
 *
 * app:
 *   settings:
 *     defaults:
 *       google-api-key: ${GOOGLE_API_KEY:}
 *       google-api-base: https://generativelanguage.googleapis.com
 *       ...
 */
@ConfigurationProperties(prefix = "app.settings.defaults")
public record SystemSettingsProperties(
        @DefaultValue("")                                          String googleApiKey,
        @DefaultValue("https://generativelanguage.googleapis.com") String googleApiBase,
        @DefaultValue("")                                          String mineruToken,
        @DefaultValue("https://mineru.net")                        String mineruApiBase,
        @DefaultValue("gemini-2.5-flash")                          String imageCaptionModel,
        @DefaultValue("5")                                         int    maxDescriptionWorkers,
        @DefaultValue("8")                                         int    maxImageWorkers
) {

    Object valueOf(SettingKey key) {
        return switch (key) {
            case GOOGLE_API_KEY          -> googleApiKey;
            case GOOGLE_API_BASE         -> googleApiBase;
            case MINERU_TOKEN            -> mineruToken;
            case MINERU_API_BASE         -> mineruApiBase;
            case IMAGE_CAPTION_MODEL     -> imageCaptionModel;
            case MAX_DESCRIPTION_WORKERS -> maxDescriptionWorkers;
            case MAX_IMAGE_WORKERS       -> maxImageWorkers;
        };
    }
}

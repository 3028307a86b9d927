package com.openforge.identity.settings;

import com.openforge.identity.crypto.InvalidSecretException;
import com.openforge.identity.crypto.SecretCipher;
import com.openforge.identity.domain.AccountSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves what each setting actually is for a given account.
 *
 * Resolution order per key:
 *   1. The account's own non-empty override (secrets decrypted)
 *   2. The system default from app.settings.defaults
 *
 * A secret that no longer decrypts (rotated key, corrupt row) counts as absent.
 * Settings are always passed in; a null settings row means "no overrides".
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EffectiveConfigResolver {

    private final SecretCipher             cipher;
    private final SystemSettingsProperties defaults;

    // ── Typed getters ────────────────────────────────────────────────────────

    public String googleApiKey(AccountSettings settings) {
        return (String) resolve(SettingKey.GOOGLE_API_KEY, settings);
    }

    public String googleApiBase(AccountSettings settings) {
        return (String) resolve(SettingKey.GOOGLE_API_BASE, settings);
    }

    public String mineruToken(AccountSettings settings) {
        return (String) resolve(SettingKey.MINERU_TOKEN, settings);
    }

    public String mineruApiBase(AccountSettings settings) {
        return (String) resolve(SettingKey.MINERU_API_BASE, settings);
    }

    public String imageCaptionModel(AccountSettings settings) {
        return (String) resolve(SettingKey.IMAGE_CAPTION_MODEL, settings);
    }

    public int maxDescriptionWorkers(AccountSettings settings) {
        return (Integer) resolve(SettingKey.MAX_DESCRIPTION_WORKERS, settings);
    }

    public int maxImageWorkers(AccountSettings settings) {
        return (Integer) resolve(SettingKey.MAX_IMAGE_WORKERS, settings);
    }

    // ── Whole view ───────────────────────────────────────────────────────────

    /** Every key in declaration order. Decrypted secrets never leave this method. */
    public Map<String, EffectiveSetting> allEffective(AccountSettings settings) {
        Map<String, EffectiveSetting> out = new LinkedHashMap<>();
        for (SettingKey key : SettingKey.values()) {
            Optional<Object> user = userValue(key, settings);
            Object effective      = user.orElseGet(() -> defaults.valueOf(key));
            if (key.isSecret()) {
                boolean isSet = effective != null && !((String) effective).isEmpty();
                out.put(key.key(), EffectiveSetting.secret(isSet, user.isPresent()));
            } else {
                out.put(key.key(), EffectiveSetting.plain(effective, user.isPresent()));
            }
        }
        return out;
    }

    public Object resolve(SettingKey key, AccountSettings settings) {
        return userValue(key, settings).orElseGet(() -> defaults.valueOf(key));
    }

    // ── Private ──────────────────────────────────────────────────────────────

    private Optional<Object> userValue(SettingKey key, AccountSettings s) {
        if (s == null) return Optional.empty();
        return switch (key) {
            case GOOGLE_API_KEY          -> decrypted(key, s.getGoogleApiKeyEncrypted(), s);
            case MINERU_TOKEN            -> decrypted(key, s.getMineruTokenEncrypted(), s);
            case GOOGLE_API_BASE         -> text(s.getGoogleApiBase());
            case MINERU_API_BASE         -> text(s.getMineruApiBase());
            case IMAGE_CAPTION_MODEL     -> text(s.getImageCaptionModel());
            case MAX_DESCRIPTION_WORKERS -> workers(s.getMaxDescriptionWorkers());
            case MAX_IMAGE_WORKERS       -> workers(s.getMaxImageWorkers());
        };
    }

    private Optional<Object> decrypted(SettingKey key, String stored, AccountSettings s) {
        if (stored == null || stored.isEmpty()) return Optional.empty();
        try {
            String plain = cipher.decrypt(stored);
            return plain == null || plain.isEmpty() ? Optional.empty() : Optional.of(plain);
        } catch (InvalidSecretException e) {
            log.warn("[Settings] Stored {} for settings id={} does not decrypt, using system default: {}",
                    key.key(), s.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<Object> text(String value) {
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private static Optional<Object> workers(Integer value) {
        return SettingKey.inWorkerRange(value) ? Optional.of(value) : Optional.empty();
    }
}

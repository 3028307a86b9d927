package com.openforge.identity.settings;

import com.openforge.identity.common.AuthException;
import com.openforge.identity.common.ValidationException;
import com.openforge.identity.crypto.SecretCipher;
import com.openforge.identity.domain.Account;
import com.openforge.identity.domain.AccountSettings;
import com.openforge.identity.repository.AccountRepository;
import com.openforge.identity.repository.AccountSettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Reads and writes an account's settings row.
 *
 * Secrets are encrypted on the way in and never decrypted here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountSettingsService {

    private final AccountSettingsRepository settingsRepo;
    private final AccountRepository         accountRepo;
    private final SecretCipher              cipher;

    /** Creates an empty row for accounts that predate settings. */
    @Transactional
    public AccountSettings getOrCreate(Long accountId) {
        return settingsRepo.findByAccountId(accountId).orElseGet(() -> {
            Account account = accountRepo.findById(accountId)
                    .orElseThrow(AuthException::accountNotFound);
            AccountSettings settings = new AccountSettings();
            account.attachSettings(settings);
            log.info("[Settings] Created settings row for account id={}", accountId);
            return settingsRepo.save(settings);
        });
    }

    /**
     * Applies a partial update keyed by wire name. Absent keys are untouched.
     *
     * Secrets: empty or null clears, anything else is encrypted.
     * Worker counts: anything but an integer in [1, 20] is stored as unset.
     * Unknown keys are ignored.
     */
    @Transactional
    public AccountSettings update(Long accountId, Map<String, Object> changes) {
        AccountSettings s = getOrCreate(accountId);
        changes.forEach((name, raw) -> SettingKey.fromKey(name).ifPresentOrElse(
                key -> apply(s, key, raw),
                () -> log.debug("[Settings] Ignoring unknown key '{}'", name)));
        log.info("[Settings] Updated {} for account id={}", changes.keySet(), accountId);
        return s;
    }

    /**
     * Clears exactly one override so the system default applies again.
     *
     * @throws ValidationException UNKNOWN_SETTING
     */
    @Transactional
    public AccountSettings reset(Long accountId, String name) {
        SettingKey key = SettingKey.fromKey(name).orElseThrow(() ->
                new ValidationException(ValidationException.UNKNOWN_SETTING, "Unknown setting key: " + name));
        AccountSettings s = getOrCreate(accountId);
        apply(s, key, null);
        log.info("[Settings] Reset {} for account id={}", key.key(), accountId);
        return s;
    }

    // ── Private ──────────────────────────────────────────────────────────────

    private void apply(AccountSettings s, SettingKey key, Object raw) {
        switch (key) {
            case GOOGLE_API_KEY          -> s.setGoogleApiKeyEncrypted(encrypt(raw));
            case MINERU_TOKEN            -> s.setMineruTokenEncrypted(encrypt(raw));
            case GOOGLE_API_BASE         -> s.setGoogleApiBase(text(raw));
            case MINERU_API_BASE         -> s.setMineruApiBase(text(raw));
            case IMAGE_CAPTION_MODEL     -> s.setImageCaptionModel(text(raw));
            case MAX_DESCRIPTION_WORKERS -> s.setMaxDescriptionWorkers(workers(raw));
            case MAX_IMAGE_WORKERS       -> s.setMaxImageWorkers(workers(raw));
        }
    }

    private String encrypt(Object raw) {
        String plain = text(raw);
        return plain == null ? null : cipher.encrypt(plain);
    }

    private static String text(Object raw) {
        if (raw == null) return null;
        String v = raw.toString();
        return v.isEmpty() ? null : v;
    }

    /** JSON integers only; 5.0 or "5" count as unset. */
    private static Integer workers(Object raw) {
        if (raw instanceof Integer i && SettingKey.inWorkerRange(i)) return i;
        return null;
    }
}

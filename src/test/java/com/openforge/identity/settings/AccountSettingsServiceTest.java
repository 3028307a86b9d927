package com.openforge.identity.settings;

import com.openforge.identity.account.AccountAdminService;
import com.openforge.identity.common.IdentityException;
import com.openforge.identity.common.ValidationException;
import com.openforge.identity.crypto.SecretCipher;
import com.openforge.identity.domain.Account;
import com.openforge.identity.domain.AccountSettings;
import com.openforge.identity.repository.AccountSettingsRepository;
import com.openforge.identity.testsupport.BaseSpringTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccountSettingsServiceTest extends BaseSpringTest {

    @Autowired AccountSettingsService    settingsService;
    @Autowired AccountSettingsRepository settingsRepository;
    @Autowired EffectiveConfigResolver   resolver;
    @Autowired AccountAdminService       adminService;
    @Autowired SecretCipher              cipher;

    private Long accountId;

    @BeforeEach
    void createAccount() {
        Account account = new Account();
        account.setUsername("alice");
        account.setEmail("alice@example.com");
        accountId = accountRepository.save(account).getId();
    }

    @Test
    void settings_row_is_created_on_first_read() {
        assertThat(settingsRepository.findByAccountId(accountId)).isEmpty();

        AccountSettings first  = settingsService.getOrCreate(accountId);
        AccountSettings second = settingsService.getOrCreate(accountId);

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(settingsRepository.count()).isEqualTo(1);
    }

    @Test
    void new_entities_are_persisted_rather_than_merged() {
        Account bob = new Account();
        bob.setUsername("bob");
        bob.setEmail("bob@example.com");
        assertThat(bob.getVersion()).isNull();

        Account saved = accountRepository.save(bob);

        assertThat(saved).isSameAs(bob);
        assertThat(saved.getVersion()).isZero();
    }

    @Test
    void first_update_on_account_without_settings_row_creates_exactly_one() {
        Map<String, Object> patch = new HashMap<>();
        patch.put("max_image_workers", 4);

        settingsService.update(accountId, patch);

        assertThat(settingsRepository.count()).isEqualTo(1);
        assertThat(settingsRepository.findByAccountId(accountId).orElseThrow().getMaxImageWorkers()).isEqualTo(4);
    }

    @Test
    void secrets_are_stored_encrypted_and_cleared_by_empty_string() {
        settingsService.update(accountId, Map.of("google_api_key", "my-key"));

        AccountSettings stored = settingsRepository.findByAccountId(accountId).orElseThrow();
        assertThat(stored.getGoogleApiKeyEncrypted()).isNotEqualTo("my-key");
        assertThat(cipher.decrypt(stored.getGoogleApiKeyEncrypted())).isEqualTo("my-key");
        assertThat(resolver.googleApiKey(stored)).isEqualTo("my-key");

        settingsService.update(accountId, Map.of("google_api_key", ""));

        stored = settingsRepository.findByAccountId(accountId).orElseThrow();
        assertThat(stored.getGoogleApiKeyEncrypted()).isNull();
        assertThat(resolver.googleApiKey(stored)).isEqualTo("system-google-key");
    }

    @Test
    void partial_update_leaves_other_keys_alone_and_ignores_unknown_ones() {
        settingsService.update(accountId, Map.of("image_caption_model", "caption-x", "mineru_api_base", "https://m"));

        settingsService.update(accountId, Map.of("mineru_api_base", "https://m2", "no_such_key", "x"));

        AccountSettings stored = settingsRepository.findByAccountId(accountId).orElseThrow();
        assertThat(stored.getImageCaptionModel()).isEqualTo("caption-x");
        assertThat(stored.getMineruApiBase()).isEqualTo("https://m2");
    }

    @Test
    void worker_overrides_outside_range_are_stored_unset() {
        Map<String, Object> changes = new HashMap<>();
        changes.put("max_description_workers", 25);
        changes.put("max_image_workers", "7");
        settingsService.update(accountId, changes);

        AccountSettings stored = settingsRepository.findByAccountId(accountId).orElseThrow();
        assertThat(stored.getMaxDescriptionWorkers()).isNull();
        assertThat(stored.getMaxImageWorkers()).isNull();
    }

    @Test
    void reset_restores_system_default_for_one_key_only() {
        settingsService.update(accountId, Map.of("max_image_workers", 3, "max_description_workers", 4));
        AccountSettings before = settingsRepository.findByAccountId(accountId).orElseThrow();
        assertThat(resolver.allEffective(before).get("max_image_workers"))
                .isEqualTo(new EffectiveSetting(3, null, "user"));

        AccountSettings after = settingsService.reset(accountId, "max_image_workers");

        assertThat(after.getMaxImageWorkers()).isNull();
        assertThat(after.getMaxDescriptionWorkers()).isEqualTo(4);
        assertThat(resolver.allEffective(after).get("max_image_workers"))
                .isEqualTo(new EffectiveSetting(8, null, "system"));
    }

    @Test
    void reset_of_unknown_key_is_rejected() {
        assertThatThrownBy(() -> settingsService.reset(accountId, "favourite_colour"))
                .isInstanceOfSatisfying(IdentityException.class,
                        e -> assertThat(e.reason()).isEqualTo(ValidationException.UNKNOWN_SETTING));
    }

    @Test
    void deleting_the_account_removes_its_settings() {
        settingsService.update(accountId, Map.of("google_api_key", "my-key"));
        assertThat(settingsRepository.count()).isEqualTo(1);

        adminService.delete(accountId);

        assertThat(accountRepository.findById(accountId)).isEmpty();
        assertThat(settingsRepository.count()).isZero();
    }
}

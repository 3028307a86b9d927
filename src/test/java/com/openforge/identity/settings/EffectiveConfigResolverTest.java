package com.openforge.identity.settings;

import com.openforge.identity.crypto.SecretCipher;
import com.openforge.identity.domain.AccountSettings;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EffectiveConfigResolverTest {

    private static final SystemSettingsProperties DEFAULTS = new SystemSettingsProperties(
            "sys-google", "https://google.example", "", "https://mineru.example", "caption-v1", 5, 8);

    private final SecretCipher            cipher   = SecretCipher.ephemeral();
    private final EffectiveConfigResolver resolver = new EffectiveConfigResolver(cipher, DEFAULTS);

    @Test
    void no_settings_row_means_system_defaults_everywhere() {
        Map<String, EffectiveSetting> all = resolver.allEffective(null);

        assertThat(all.keySet()).containsExactly(
                "google_api_key", "google_api_base", "mineru_token", "mineru_api_base",
                "image_caption_model", "max_description_workers", "max_image_workers");
        assertThat(all.values()).allSatisfy(s -> assertThat(s.source()).isEqualTo("system"));
        assertThat(resolver.googleApiKey(null)).isEqualTo("sys-google");
        assertThat(resolver.maxImageWorkers(null)).isEqualTo(8);
    }

    @Test
    void user_overrides_win_and_are_reported_as_user() {
        AccountSettings s = new AccountSettings();
        s.setGoogleApiKeyEncrypted(cipher.encrypt("my-google"));
        s.setImageCaptionModel("caption-v2");
        s.setMaxDescriptionWorkers(12);

        assertThat(resolver.googleApiKey(s)).isEqualTo("my-google");
        assertThat(resolver.imageCaptionModel(s)).isEqualTo("caption-v2");
        assertThat(resolver.maxDescriptionWorkers(s)).isEqualTo(12);
        assertThat(resolver.googleApiBase(s)).isEqualTo("https://google.example");

        Map<String, EffectiveSetting> all = resolver.allEffective(s);
        assertThat(all.get("google_api_key")).isEqualTo(new EffectiveSetting(null, true, "user"));
        assertThat(all.get("image_caption_model")).isEqualTo(new EffectiveSetting("caption-v2", null, "user"));
        assertThat(all.get("max_description_workers").value()).isEqualTo(12);
        assertThat(all.get("google_api_base").source()).isEqualTo("system");
    }

    @Test
    void secrets_never_expose_their_value() {
        AccountSettings s = new AccountSettings();
        s.setMineruTokenEncrypted(cipher.encrypt("tok-123"));

        EffectiveSetting mineru = resolver.allEffective(s).get("mineru_token");
        assertThat(mineru.value()).isNull();
        assertThat(mineru.isSet()).isTrue();
    }

    @Test
    void empty_system_secret_is_reported_unset() {
        EffectiveSetting mineru = resolver.allEffective(new AccountSettings()).get("mineru_token");

        assertThat(mineru).isEqualTo(new EffectiveSetting(null, false, "system"));
        assertThat(resolver.mineruToken(null)).isEmpty();
    }

    @Test
    void secret_from_another_key_falls_back_to_system_default() {
        AccountSettings s = new AccountSettings();
        s.setGoogleApiKeyEncrypted(SecretCipher.ephemeral().encrypt("stale"));

        assertThat(resolver.googleApiKey(s)).isEqualTo("sys-google");
        assertThat(resolver.allEffective(s).get("google_api_key"))
                .isEqualTo(new EffectiveSetting(null, true, "system"));
    }

    @Test
    void corrupt_secret_falls_back_to_system_default() {
        AccountSettings s = new AccountSettings();
        s.setGoogleApiKeyEncrypted("not base64 at all!");

        assertThat(resolver.googleApiKey(s)).isEqualTo("sys-google");
        assertThat(resolver.allEffective(s).get("google_api_key").source()).isEqualTo("system");
    }

    @Test
    void empty_text_override_is_absent() {
        AccountSettings s = new AccountSettings();
        s.setGoogleApiBase("");

        assertThat(resolver.allEffective(s).get("google_api_base"))
                .isEqualTo(new EffectiveSetting("https://google.example", null, "system"));
    }

    @Test
    void worker_counts_outside_one_to_twenty_are_ignored() {
        AccountSettings s = new AccountSettings();

        s.setMaxImageWorkers(0);
        assertThat(resolver.maxImageWorkers(s)).isEqualTo(8);
        s.setMaxImageWorkers(21);
        assertThat(resolver.maxImageWorkers(s)).isEqualTo(8);
        s.setMaxImageWorkers(1);
        assertThat(resolver.maxImageWorkers(s)).isEqualTo(1);
        s.setMaxImageWorkers(20);
        assertThat(resolver.maxImageWorkers(s)).isEqualTo(20);
    }
}

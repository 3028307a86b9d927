package com.openforge.identity.settings;

import java.util.Arrays;
import java.util.Optional;

/** Logical per-account settings, by wire key. */
public enum SettingKey {

    GOOGLE_API_KEY("google_api_key", Kind.SECRET),
    GOOGLE_API_BASE("google_api_base", Kind.TEXT),
    MINERU_TOKEN("mineru_token", Kind.SECRET),
    MINERU_API_BASE("mineru_api_base", Kind.TEXT),
    IMAGE_CAPTION_MODEL("image_caption_model", Kind.TEXT),
    MAX_DESCRIPTION_WORKERS("max_description_workers", Kind.WORKERS),
    MAX_IMAGE_WORKERS("max_image_workers", Kind.WORKERS);

    public enum Kind { SECRET, TEXT, WORKERS }

    /** Inclusive bounds for worker-count overrides. */
    public static final int MIN_WORKERS = 1;
    public static final int MAX_WORKERS = 20;

    private final String key;
    private final Kind   kind;

    SettingKey(String key, Kind kind) {
        this.key  = key;
        this.kind = kind;
    }

    public String key() {
        return key;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isSecret() {
        return kind == Kind.SECRET;
    }

    public static Optional<SettingKey> fromKey(String key) {
        return Arrays.stream(values()).filter(k -> k.key.equals(key)).findFirst();
    }

    public static boolean inWorkerRange(Integer value) {
        return value != null && value >= MIN_WORKERS && value <= MAX_WORKERS;
    }
}

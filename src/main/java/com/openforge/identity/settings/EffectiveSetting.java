package com.openforge.identity.settings;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One resolved setting with its provenance. Secrets carry only {@code isSet},
 * plain settings only {@code value}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EffectiveSetting(Object value, @JsonProperty("is_set") Boolean isSet, String source) {

    public static final String SOURCE_USER   = "user";
    public static final String SOURCE_SYSTEM = "system";

    static EffectiveSetting plain(Object value, boolean fromUser) {
        return new EffectiveSetting(value, null, fromUser ? SOURCE_USER : SOURCE_SYSTEM);
    }

    static EffectiveSetting secret(boolean isSet, boolean fromUser) {
        return new EffectiveSetting(null, isSet, fromUser ? SOURCE_USER : SOURCE_SYSTEM);
    }
}

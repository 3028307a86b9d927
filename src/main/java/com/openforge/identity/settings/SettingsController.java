package com.openforge.identity.settings;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.identity.auth.AuthenticatedAccount;
import com.openforge.identity.common.ValidationException;
import com.openforge.identity.domain.AccountSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * The caller's settings overrides and what they resolve to.
 *
 * Base path: /api/user/settings
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/user/settings")
public class SettingsController {

    private final AccountSettingsService  settingsService;
    private final EffectiveConfigResolver resolver;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SettingsResponse(
            String                        message,
            SettingsView                  settings,
            Map<String, EffectiveSetting> effectiveConfig
    ) {}

    @GetMapping
    public SettingsResponse get(@AuthenticationPrincipal AuthenticatedAccount me) {
        return respond(null, settingsService.getOrCreate(me.id()));
    }

    @PutMapping
    public SettingsResponse update(@AuthenticationPrincipal AuthenticatedAccount me,
                                   @RequestBody(required = false) Map<String, Object> body) {
        if (body == null || body.isEmpty()) {
            throw new ValidationException(ValidationException.MISSING_FIELD, "Request body is required");
        }
        return respond("Settings updated", settingsService.update(me.id(), body));
    }

    @DeleteMapping("/{key}")
    public SettingsResponse reset(@AuthenticationPrincipal AuthenticatedAccount me,
                                  @PathVariable String key) {
        return respond("Setting '%s' reset to system default".formatted(key),
                settingsService.reset(me.id(), key));
    }

    private SettingsResponse respond(String message, AccountSettings s) {
        return new SettingsResponse(message, SettingsView.of(s), resolver.allEffective(s));
    }
}

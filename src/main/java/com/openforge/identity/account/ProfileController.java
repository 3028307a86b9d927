package com.openforge.identity.account;

import com.openforge.identity.auth.AuthService;
import com.openforge.identity.auth.AuthenticatedAccount;
import com.openforge.identity.auth.dto.ChangePasswordRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * The caller's own profile.
 *
 * Base path: /api/user
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/user")
public class ProfileController {

    private final AuthService authService;

    // ── DTOs ─────────────────────────────────────────────────────────────────

    /** Absent fields are left as they are. */
    public record ProfileUpdate(
            @Size(max = 64)  String username,
            @Size(max = 500) String avatarUrl
    ) {}

    public record ProfileResponse(String message, AccountView user) {}

    // ── Endpoints ────────────────────────────────────────────────────────────

    @GetMapping("/profile")
    public Map<String, AccountView> profile(@AuthenticationPrincipal AuthenticatedAccount me) {
        return Map.of("user", AccountView.selfView(authService.load(me.id())));
    }

    @PutMapping("/profile")
    public ProfileResponse update(@AuthenticationPrincipal AuthenticatedAccount me,
                                  @Valid @RequestBody ProfileUpdate req) {
        var updated = authService.updateProfile(me.id(), req.username(), req.avatarUrl());
        return new ProfileResponse("Profile updated", AccountView.selfView(updated));
    }

    @PutMapping("/password")
    public Map<String, String> changePassword(@AuthenticationPrincipal AuthenticatedAccount me,
                                              @Valid @RequestBody ChangePasswordRequest req) {
        authService.changePassword(me.id(), req.oldPassword(), req.newPassword());
        return Map.of("message", "Password changed");
    }
}

package com.openforge.identity.auth;

import com.openforge.identity.account.AccountView;
import com.openforge.identity.auth.dto.AuthResponse;
import com.openforge.identity.auth.dto.LoginRequest;
import com.openforge.identity.auth.dto.RefreshRequest;
import com.openforge.identity.auth.dto.RegisterRequest;
import com.openforge.identity.auth.dto.ResetPasswordRequest;
import com.openforge.identity.auth.dto.SendCodeRequest;
import com.openforge.identity.auth.dto.TokenPair;
import com.openforge.identity.auth.dto.VerifyCodeRequest;
import com.openforge.identity.common.ValidationException;
import com.openforge.identity.domain.Account;
import com.openforge.identity.domain.VerificationPurpose;
import com.openforge.identity.verification.CodeCheck;
import com.openforge.identity.verification.CodeRequestService;
import com.openforge.identity.verification.VerificationCodeService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base path: /api/auth
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService             authService;
    private final TokenService            tokenService;
    private final CodeRequestService      codeRequests;
    private final VerificationCodeService verificationCodes;

    // ── Account ──────────────────────────────────────────────────────────────

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public AuthResponse register(@Valid @RequestBody RegisterRequest req) {
        Account account = authService.registerWithCode(
                req.username(), req.email(), req.password(), req.verificationCode());
        return new AuthResponse("Registration successful", AccountView.selfView(account),
                tokenService.issueTokens(account, false));
    }

    @PostMapping("/login")
    public AuthResponse login(@Valid @RequestBody LoginRequest req) {
        Account account = authService.login(req.email(), req.password());
        return new AuthResponse("Login successful", AccountView.selfView(account),
                tokenService.issueTokens(account, req.rememberMe()));
    }

    @PostMapping("/refresh")
    public TokenPair refresh(@Valid @RequestBody RefreshRequest req) {
        return tokenService.refresh(req.refreshToken());
    }

    /** Tokens are stateless; the client drops them. */
    @PostMapping("/logout")
    public Map<String, String> logout(@AuthenticationPrincipal AuthenticatedAccount me) {
        log.info("[Auth] Logout id={}", me.id());
        return Map.of("message", "Logout successful");
    }

    @GetMapping("/me")
    public Map<String, AccountView> me(@AuthenticationPrincipal AuthenticatedAccount me) {
        return Map.of("user", AccountView.selfView(authService.load(me.id())));
    }

    // ── Verification codes ───────────────────────────────────────────────────

    @PostMapping("/send-code")
    public Map<String, Object> sendCode(@Valid @RequestBody SendCodeRequest req) {
        long expiresIn = codeRequests.requestCode(req.email(), purpose(req.codeType()));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Verification code sent, please check your inbox");
        body.put("expires_in", expiresIn);
        return body;
    }

    /** Form pre-check; does not consume the code. */
    @PostMapping("/verify-code")
    public CodeCheck verifyCode(@Valid @RequestBody VerifyCodeRequest req) {
        return verificationCodes.check(req.email(), purpose(req.codeType()), req.code());
    }

    @PostMapping("/reset-password")
    public Map<String, String> resetPassword(@Valid @RequestBody ResetPasswordRequest req) {
        authService.resetPassword(req.email(), req.verificationCode(), req.newPassword());
        return Map.of("message", "Password reset, please sign in with your new password");
    }

    private static VerificationPurpose purpose(String tag) {
        return VerificationPurpose.fromTag(tag).orElseThrow(() ->
                new ValidationException(ValidationException.INVALID_PURPOSE, "Invalid code type: " + tag));
    }
}

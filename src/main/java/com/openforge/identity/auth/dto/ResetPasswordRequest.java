package com.openforge.identity.auth.dto;

import jakarta.validation.constraints.NotBlank;

public record ResetPasswordRequest(
        @NotBlank String email,
        @NotBlank String verificationCode,
        @NotBlank String newPassword
) {
}

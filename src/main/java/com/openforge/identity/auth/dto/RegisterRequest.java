package com.openforge.identity.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Length and format rules are enforced by AuthService so that they surface with
 * their own reason codes; only presence is checked here.
 */
public record RegisterRequest(
        @NotBlank @Size(max = 64)  String username,
        @NotBlank @Size(max = 128) String email,
        @NotBlank @Size(max = 72)  String password,
        String verificationCode
) {
}

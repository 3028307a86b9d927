package com.openforge.identity.auth.dto;

import jakarta.validation.constraints.NotBlank;

public record VerifyCodeRequest(
        @NotBlank String email,
        @NotBlank String code,
        @NotBlank String codeType
) {
}

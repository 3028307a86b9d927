package com.openforge.identity.auth.dto;

import jakarta.validation.constraints.NotBlank;

/** {@code codeType} is a purpose tag: register | reset_password. */
public record SendCodeRequest(
        @NotBlank String email,
        @NotBlank String codeType
) {
}

package com.openforge.identity.auth.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.openforge.identity.account.AccountView;

/**
 * Register and login response: the caller's own view plus a token pair at top level.
 */
public record AuthResponse(
        String message,
        AccountView user,
        @JsonUnwrapped TokenPair tokens
) {
}

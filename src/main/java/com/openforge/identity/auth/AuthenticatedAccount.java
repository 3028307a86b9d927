package com.openforge.identity.auth;

import com.openforge.identity.domain.Role;

/** Principal placed in the SecurityContext by {@link JwtAuthFilter}. */
public record AuthenticatedAccount(Long id, String username, Role role) {

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}

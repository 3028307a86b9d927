package com.openforge.identity.account;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.openforge.identity.domain.Account;

import java.time.LocalDateTime;

/**
 * Outward projections of an {@link Account}. Neither carries the password hash
 * or anything from the settings row.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccountView(
        Long          id,
        String        username,
        String        email,
        String        avatarUrl,
        String        role,
        String        oauthProvider,
        @JsonProperty("is_active") Boolean isActive,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    /** What other users may see. */
    public static AccountView publicView(Account a) {
        return new AccountView(a.getId(), a.getUsername(), null, a.getAvatarUrl(),
                a.getRole().wireName(), a.getOauthProvider(), null, a.getCreateTime(), null);
    }

    /** What the account owner (or an admin) sees. */
    public static AccountView selfView(Account a) {
        return new AccountView(a.getId(), a.getUsername(), a.getEmail(), a.getAvatarUrl(),
                a.getRole().wireName(), a.getOauthProvider(), a.isActive(), a.getCreateTime(), a.getUpdateTime());
    }
}

package com.openforge.identity.repository;

import com.openforge.identity.domain.Account;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AccountRepository extends JpaRepository<Account, Long> {

    boolean existsByUsername(String username);

    /** Callers pass an already-normalized email; stored emails are lower-case. */
    boolean existsByEmail(String email);

    Optional<Account> findByEmail(String email);

    Optional<Account> findByUsername(String username);

    Optional<Account> findByOauthProviderAndOauthId(String oauthProvider, String oauthId);
}

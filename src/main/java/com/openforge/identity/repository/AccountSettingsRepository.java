package com.openforge.identity.repository;

import com.openforge.identity.domain.AccountSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AccountSettingsRepository extends JpaRepository<AccountSettings, Long> {

    Optional<AccountSettings> findByAccountId(Long accountId);
}

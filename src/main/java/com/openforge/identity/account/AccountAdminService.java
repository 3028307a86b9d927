package com.openforge.identity.account;

import com.openforge.identity.common.NotFoundException;
import com.openforge.identity.domain.Account;
import com.openforge.identity.domain.Role;
import com.openforge.identity.repository.AccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Admin-only account mutations. Deleting an account removes its settings row too.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountAdminService {

    private final AccountRepository accounts;

    @Transactional
    public Account setActive(Long id, boolean active) {
        Account account = find(id);
        account.setActive(active);
        log.info("[Admin] Account id={} active={}", id, active);
        return account;
    }

    @Transactional
    public Account setRole(Long id, Role role) {
        Account account = find(id);
        account.setRole(role);
        log.info("[Admin] Account id={} role={}", id, role.wireName());
        return account;
    }

    @Transactional
    public void delete(Long id) {
        accounts.delete(find(id));
        log.info("[Admin] Account id={} deleted", id);
    }

    private Account find(Long id) {
        return accounts.findById(id).orElseThrow(() -> new NotFoundException("Account not found"));
    }
}

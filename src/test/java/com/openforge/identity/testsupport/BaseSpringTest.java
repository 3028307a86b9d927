package com.openforge.identity.testsupport;

import com.openforge.identity.repository.AccountRepository;
import com.openforge.identity.repository.VerificationCodeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

/**
 * Full context on H2 under the test profile.
 *
 * Not transactional: several flows commit in their own transaction, so every
 * test starts from empty tables and a reset clock instead.
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class BaseSpringTest {

    @Autowired protected MutableClock               clock;
    @Autowired protected AccountRepository          accountRepository;
    @Autowired protected VerificationCodeRepository codeRepository;

    @BeforeEach
    void resetState() {
        clock.reset();
        codeRepository.deleteAll();
        accountRepository.deleteAll();
    }
}

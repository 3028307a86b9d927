package com.openforge.identity.repository;

import com.openforge.identity.domain.VerificationCode;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface VerificationCodeRepository extends JpaRepository<VerificationCode, Long> {

    /** Latest code for the pair regardless of used state; drives the send cooldown. */
    Optional<VerificationCode> findFirstByEmailAndPurposeOrderByCreateTimeDescIdDesc(String email, String purpose);

    /**
     * Latest unused code, locked FOR UPDATE until the caller's transaction ends.
     * Concurrent verifications of the same code queue here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
           select c from VerificationCode c
            where c.email = :email
              and c.purpose = :purpose
              and c.used = false
            order by c.createTime desc, c.id desc
           """)
    List<VerificationCode> lockUnused(@Param("email") String email,
                                      @Param("purpose") String purpose,
                                      Pageable page);

    /**
     * Supersede: mark every unused code of the pair as used before a new one is inserted.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
           update VerificationCode c
              set c.used = true,
                  c.updateTime = :now
            where c.email = :email
              and c.purpose = :purpose
              and c.used = false
           """)
    int supersedeUnused(@Param("email") String email,
                        @Param("purpose") String purpose,
                        @Param("now") LocalDateTime now);
}

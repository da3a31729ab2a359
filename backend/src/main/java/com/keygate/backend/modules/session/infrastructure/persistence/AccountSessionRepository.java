package com.keygate.backend.modules.session.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.keygate.backend.modules.session.domain.RevocationReason;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccountSessionRepository extends JpaRepository<AccountSessionEntity, UUID> {

    @Query("""
            select s
              from AccountSessionEntity s
             where s.accountId = :accountId
               and s.revokedAt is null
               and s.refreshExpiresAt > :now
             order by s.createdAt asc, s.id asc
            """)
    List<AccountSessionEntity> findLiveByAccountId(@Param("accountId") long accountId,
                                                   @Param("now") OffsetDateTime now);

    @Query("select s from AccountSessionEntity s where s.token = :token and s.revokedAt is null")
    Optional<AccountSessionEntity> findActiveByToken(@Param("token") String token);

    @Query("select s from AccountSessionEntity s where s.refreshToken = :refreshToken and s.revokedAt is null")
    Optional<AccountSessionEntity> findActiveByRefreshToken(@Param("refreshToken") String refreshToken);

    @Modifying
    @Query("""
            update AccountSessionEntity s
               set s.revokedAt = :revokedAt,
                   s.revokedReason = :reason,
                   s.updatedAt = :revokedAt
             where s.token = :token
               and s.revokedAt is null
            """)
    int revokeByToken(@Param("token") String token,
                      @Param("revokedAt") OffsetDateTime revokedAt,
                      @Param("reason") RevocationReason reason);

    @Modifying
    @Query("""
            delete from AccountSessionEntity s
             where s.refreshExpiresAt < :cutoff
                or (s.revokedAt is not null and s.revokedAt < :cutoff)
            """)
    int deleteExpiredBefore(@Param("cutoff") OffsetDateTime cutoff);
}

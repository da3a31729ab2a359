package com.keygate.backend.modules.account.infrastructure.persistence;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccountRepository extends JpaRepository<AccountEntity, Long> {

    @Query("select a from AccountEntity a where lower(a.email) = lower(:email)")
    Optional<AccountEntity> findByEmailIgnoreCase(@Param("email") String email);

    @Query("""
            select case when count(a) > 0 then true else false end
              from AccountEntity a
             where a.id = :accountId
               and a.role = com.keygate.backend.modules.account.domain.AccountRole.ADMIN
            """)
    boolean existsAdmin(@Param("accountId") long accountId);
}

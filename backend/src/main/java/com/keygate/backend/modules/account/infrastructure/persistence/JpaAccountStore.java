package com.keygate.backend.modules.account.infrastructure.persistence;

import java.util.Optional;

import com.keygate.backend.global.common.CallContext;
import com.keygate.backend.modules.account.domain.Account;
import com.keygate.backend.modules.account.domain.AccountStatus;
import com.keygate.backend.modules.account.domain.NewAccount;
import com.keygate.backend.modules.auth.application.port.AccountProvider;
import com.keygate.backend.modules.auth.application.port.AccountSaver;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Account store on PostgreSQL. Email uniqueness is enforced case-insensitively by the
 * {@code ux_account_email_lower} index; a duplicate surfaces as a
 * {@code DataIntegrityViolationException} from the flush.
 */
@Component
public class JpaAccountStore implements AccountSaver, AccountProvider {

    private final AccountRepository accountRepository;

    public JpaAccountStore(AccountRepository accountRepository) {
        this.accountRepository = accountRepository;
    }

    @Override
    @Transactional
    public long saveAccount(CallContext ctx, NewAccount account) {
        ctx.throwIfCancelled("AccountStore.saveAccount");
        AccountEntity entity = new AccountEntity();
        entity.setEmail(account.email().trim());
        entity.setPassHash(account.passHash());
        entity.setRole(account.role());
        entity.setStatus(account.status());
        entity.setAppId(account.appId());
        return accountRepository.saveAndFlush(entity).getId();
    }

    @Override
    @Transactional
    public boolean updatePassword(CallContext ctx, long accountId, byte[] newPassHash) {
        ctx.throwIfCancelled("AccountStore.updatePassword");
        return accountRepository.findById(accountId)
                .map(entity -> {
                    entity.setPassHash(newPassHash);
                    return true;
                })
                .orElse(false);
    }

    @Override
    @Transactional
    public boolean updateStatus(CallContext ctx, long accountId, AccountStatus status) {
        ctx.throwIfCancelled("AccountStore.updateStatus");
        return accountRepository.findById(accountId)
                .map(entity -> {
                    entity.setStatus(status);
                    return true;
                })
                .orElse(false);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> accountByEmail(CallContext ctx, String email) {
        ctx.throwIfCancelled("AccountStore.accountByEmail");
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return accountRepository.findByEmailIgnoreCase(email.trim()).map(AccountEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> accountById(CallContext ctx, long accountId) {
        ctx.throwIfCancelled("AccountStore.accountById");
        return accountRepository.findById(accountId).map(AccountEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isAdmin(CallContext ctx, long accountId) {
        ctx.throwIfCancelled("AccountStore.isAdmin");
        return accountRepository.existsAdmin(accountId);
    }
}

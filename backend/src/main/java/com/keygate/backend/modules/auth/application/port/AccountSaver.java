package com.keygate.backend.modules.auth.application.port;

import com.keygate.backend.global.common.CallContext;
import com.keygate.backend.modules.account.domain.AccountStatus;
import com.keygate.backend.modules.account.domain.NewAccount;

/**
 * Write side of the account store. Failures surface as Spring {@code DataAccessException}s;
 * a duplicate email is a {@code DataIntegrityViolationException}.
 */
public interface AccountSaver {

    /**
     * @return id assigned by the store
     */
    long saveAccount(CallContext ctx, NewAccount account);

    /**
     * @return {@code false} when no account has the given id
     */
    boolean updatePassword(CallContext ctx, long accountId, byte[] newPassHash);

    /**
     * @return {@code false} when no account has the given id
     */
    boolean updateStatus(CallContext ctx, long accountId, AccountStatus status);
}

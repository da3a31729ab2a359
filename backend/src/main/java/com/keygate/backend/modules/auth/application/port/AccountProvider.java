package com.keygate.backend.modules.auth.application.port;

import java.util.Optional;

import com.keygate.backend.global.common.CallContext;
import com.keygate.backend.modules.account.domain.Account;

public interface AccountProvider {

    /**
     * Case-insensitive lookup.
     */
    Optional<Account> accountByEmail(CallContext ctx, String email);

    Optional<Account> accountById(CallContext ctx, long accountId);

    /**
     * @return {@code false} for a missing account as well as for a non-admin one
     */
    boolean isAdmin(CallContext ctx, long accountId);
}

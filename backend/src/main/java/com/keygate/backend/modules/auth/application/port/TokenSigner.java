package com.keygate.backend.modules.auth.application.port;

import java.time.Duration;

import com.keygate.backend.modules.account.domain.Account;
import com.keygate.backend.modules.app.domain.App;

public interface TokenSigner {

    /**
     * Produces a self-contained access token for {@code account} scoped to {@code app},
     * expiring {@code ttl} after issuance.
     *
     * @throws TokenGenerationException if signing fails
     */
    SignedAccessToken sign(Account account, App app, Duration ttl);
}

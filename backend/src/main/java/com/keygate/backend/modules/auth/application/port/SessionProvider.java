package com.keygate.backend.modules.auth.application.port;

import java.util.List;
import java.util.Optional;

import com.keygate.backend.global.common.CallContext;
import com.keygate.backend.modules.session.domain.Session;

/**
 * Read side of the session store. Revoked sessions are never returned.
 */
public interface SessionProvider {

    /**
     * Live sessions of an account: not revoked and still refreshable at call time,
     * oldest first. This store-side filter is the single definition of the account's
     * active session list; logout revokes exactly this list.
     */
    List<Session> sessions(CallContext ctx, long accountId);

    Optional<Session> session(CallContext ctx, String token);

    Optional<Session> sessionByRefreshToken(CallContext ctx, String refreshToken);
}

package com.keygate.backend.modules.auth.application.port;

import java.time.Instant;

import com.keygate.backend.global.common.CallContext;
import com.keygate.backend.modules.session.domain.NewSession;
import com.keygate.backend.modules.session.domain.RevocationReason;

public interface SessionSaver {

    /**
     * @return session id assigned by the store
     */
    String saveSession(CallContext ctx, NewSession session);

    /**
     * Idempotent: revoking an unknown or already revoked token is not an error.
     */
    void revokeSession(CallContext ctx, String token, RevocationReason reason);

    /**
     * Hard-deletes sessions whose refresh window closed before {@code cutoff} and sessions
     * revoked before {@code cutoff}.
     *
     * @return number of deleted rows
     */
    int deleteExpiredBefore(Instant cutoff);
}

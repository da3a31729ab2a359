package com.keygate.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import com.keygate.backend.global.common.CallCancelledException;
import com.keygate.backend.global.common.CallContext;
import com.keygate.backend.global.common.logging.LogMasking;
import com.keygate.backend.modules.account.domain.Account;
import com.keygate.backend.modules.account.domain.AccountRole;
import com.keygate.backend.modules.account.domain.AccountStatus;
import com.keygate.backend.modules.account.domain.NewAccount;
import com.keygate.backend.modules.app.domain.App;
import com.keygate.backend.modules.auth.application.port.AccountProvider;
import com.keygate.backend.modules.auth.application.port.AccountSaver;
import com.keygate.backend.modules.auth.application.port.AppProvider;
import com.keygate.backend.modules.auth.application.port.CredentialHasher;
import com.keygate.backend.modules.auth.application.port.CredentialHashingException;
import com.keygate.backend.modules.auth.application.port.RefreshTokenGenerator;
import com.keygate.backend.modules.auth.application.port.SessionProvider;
import com.keygate.backend.modules.auth.application.port.SessionSaver;
import com.keygate.backend.modules.auth.application.port.SignedAccessToken;
import com.keygate.backend.modules.auth.application.port.TokenGenerationException;
import com.keygate.backend.modules.auth.application.port.TokenSigner;
import com.keygate.backend.modules.session.domain.NewSession;
import com.keygate.backend.modules.session.domain.RevocationReason;
import com.keygate.backend.modules.session.domain.Session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Credential and session lifecycle engine.
 * <p>
 * Holds no state besides the configured TTLs, which apply to the sessions of every app.
 * Every operation re-reads accounts, apps and sessions from their stores and issues each
 * write as its own store call; there is no transaction spanning an operation, so a failure
 * part-way through leaves earlier writes committed. The {@link CallContext} is checked before every collaborator call and handed
 * to every store call.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final AccountSaver accountSaver;
    private final AccountProvider accountProvider;
    private final AppProvider appProvider;
    private final SessionSaver sessionSaver;
    private final SessionProvider sessionProvider;
    private final CredentialHasher credentialHasher;
    private final TokenSigner tokenSigner;
    private final RefreshTokenGenerator refreshTokenGenerator;
    private final Clock clock;
    private final Duration tokenTtl;
    private final Duration refreshTokenTtl;

    public AuthService(
            AccountSaver accountSaver,
            AccountProvider accountProvider,
            AppProvider appProvider,
            SessionSaver sessionSaver,
            SessionProvider sessionProvider,
            CredentialHasher credentialHasher,
            TokenSigner tokenSigner,
            RefreshTokenGenerator refreshTokenGenerator,
            Clock clock,
            @Value("${keygate.auth.token-ttl:PT1H}") Duration tokenTtl,
            @Value("${keygate.auth.refresh-token-ttl:PT24H}") Duration refreshTokenTtl
    ) {
        this.accountSaver = accountSaver;
        this.accountProvider = accountProvider;
        this.appProvider = appProvider;
        this.sessionSaver = sessionSaver;
        this.sessionProvider = sessionProvider;
        this.credentialHasher = credentialHasher;
        this.tokenSigner = tokenSigner;
        this.refreshTokenGenerator = refreshTokenGenerator;
        this.clock = clock;
        this.tokenTtl = tokenTtl;
        this.refreshTokenTtl = refreshTokenTtl;
    }

    /**
     * Registers a new ACTIVE account. Does not open a session; callers wanting tokens log in afterwards.
     *
     * @return id assigned by the account store
     */
    public long registerNewAccount(CallContext ctx, String email, String password, AccountRole role, long appId) {
        final String op = "Auth.RegisterNewAccount";
        log.info("registering account op={} email={} appId={}", op, LogMasking.maskEmail(email), appId);

        checkpoint(ctx, op);
        byte[] passHash = hashPassword(op, password);

        NewAccount account = new NewAccount(email, passHash, role, AccountStatus.ACTIVE, appId);
        long accountId = callStore(ctx, op, "save account", () -> accountSaver.saveAccount(ctx, account));

        log.info("account registered op={} accountId={}", op, accountId);
        return accountId;
    }

    /**
     * Checks credentials and opens a new session for {@code appId}.
     * <p>
     * An unknown email and a wrong password both fail with {@link AuthErrorKind#INVALID_CREDENTIALS};
     * only the log tells them apart.
     */
    public TokenPair login(CallContext ctx, String email, String password, String userAgent, String ipAddress, long appId) {
        final String op = "Auth.Login";
        String maskedEmail = LogMasking.maskEmail(email);
        log.info("attempting to login op={} email={} appId={}", op, maskedEmail, appId);

        Optional<Account> found = callStore(ctx, op, "get account", () -> accountProvider.accountByEmail(ctx, email));
        if (found.isEmpty()) {
            log.warn("account not found op={} email={}", op, maskedEmail);
            throw new AuthException(AuthErrorKind.INVALID_CREDENTIALS, op);
        }
        Account account = found.get();

        checkpoint(ctx, op);
        if (!verifyPassword(op, account.passHash(), password)) {
            log.info("invalid password op={} accountId={}", op, account.id());
            throw new AuthException(AuthErrorKind.INVALID_CREDENTIALS, op);
        }

        App app = callStore(ctx, op, "get app", () -> appProvider.app(ctx, appId))
                .orElseThrow(() -> {
                    log.warn("app not found op={} appId={}", op, appId);
                    return new AuthException(AuthErrorKind.APP_NOT_FOUND, op);
                });

        log.info("account logged in op={} accountId={}", op, account.id());
        return openSession(ctx, op, account, app, userAgent, ipAddress);
    }

    /**
     * Revokes every live session of the account, one at a time and oldest first.
     * <p>
     * Stops at the first failed revocation and rethrows it: sessions revoked before the failure
     * stay revoked, the remaining ones stay live. Callers may simply retry, revocation is idempotent.
     */
    public void logout(CallContext ctx, long accountId) {
        final String op = "Auth.Logout";
        log.info("logging out account op={} accountId={}", op, accountId);

        List<Session> sessions = callStore(ctx, op, "get sessions", () -> sessionProvider.sessions(ctx, accountId));

        int revoked = 0;
        for (Session session : sessions) {
            callStore(ctx, op, "revoke session " + session.id(),
                    () -> sessionSaver.revokeSession(ctx, session.token(), RevocationReason.LOGOUT));
            revoked++;
        }

        log.info("account logged out op={} accountId={} revokedSessions={}", op, accountId, revoked);
    }

    /**
     * Verify and update are two separate store calls; a concurrent change between them is not
     * detected and the last write wins.
     */
    public void changePassword(CallContext ctx, long accountId, String oldPassword, String newPassword) {
        final String op = "Auth.ChangePassword";
        log.info("attempting to change password op={} accountId={}", op, accountId);

        Account account = callStore(ctx, op, "get account", () -> accountProvider.accountById(ctx, accountId))
                .orElseThrow(() -> new AuthException(AuthErrorKind.ACCOUNT_NOT_FOUND, op));

        checkpoint(ctx, op);
        if (!verifyPassword(op, account.passHash(), oldPassword)) {
            log.info("invalid old password op={} accountId={}", op, accountId);
            throw new AuthException(AuthErrorKind.INVALID_CREDENTIALS, op);
        }

        checkpoint(ctx, op);
        byte[] newPassHash = hashPassword(op, newPassword);

        boolean updated = callStore(ctx, op, "update password",
                () -> accountSaver.updatePassword(ctx, accountId, newPassHash));
        if (!updated) {
            throw new AuthException(AuthErrorKind.ACCOUNT_NOT_FOUND, op);
        }

        log.info("password changed op={} accountId={}", op, accountId);
    }

    /**
     * Any status value is accepted; no transition rules are enforced.
     */
    public AccountStatus changeStatus(CallContext ctx, long accountId, AccountStatus status) {
        final String op = "Auth.ChangeStatus";
        log.info("attempting to change account status op={} accountId={} newStatus={}", op, accountId, status);

        boolean updated = callStore(ctx, op, "change status", () -> accountSaver.updateStatus(ctx, accountId, status));
        if (!updated) {
            throw new AuthException(AuthErrorKind.ACCOUNT_NOT_FOUND, op);
        }

        log.info("status changed op={} accountId={} newStatus={}", op, accountId, status);
        return status;
    }

    public boolean isAdmin(CallContext ctx, long accountId) {
        final String op = "Auth.IsAdmin";
        return callStore(ctx, op, "check admin", () -> accountProvider.isAdmin(ctx, accountId));
    }

    /**
     * Resolves the account behind an access token.
     *
     * @return id of the account owning the live session of {@code accessToken}
     */
    public long authenticate(CallContext ctx, String accessToken) {
        return resolveCaller(ctx, "Auth.Authenticate", accessToken);
    }

    /**
     * Resolves the caller behind an access token and requires the admin flag on its account.
     *
     * @return id of the admin account
     */
    public long requireAdmin(CallContext ctx, String accessToken) {
        final String op = "Auth.RequireAdmin";
        long callerId = resolveCaller(ctx, op, accessToken);

        boolean admin = callStore(ctx, op, "check admin", () -> accountProvider.isAdmin(ctx, callerId));
        if (!admin) {
            log.warn("admin required op={} accountId={}", op, callerId);
            throw new AuthException(AuthErrorKind.PERMISSION_DENIED, op);
        }
        return callerId;
    }

    /**
     * Lets the caller act on {@code accountId} when it is that account or an admin.
     *
     * @return id of the calling account
     */
    public long requireAccountAccess(CallContext ctx, String accessToken, long accountId) {
        final String op = "Auth.RequireAccountAccess";
        long callerId = resolveCaller(ctx, op, accessToken);
        if (callerId == accountId) {
            return callerId;
        }

        boolean admin = callStore(ctx, op, "check admin", () -> accountProvider.isAdmin(ctx, callerId));
        if (!admin) {
            log.warn("access to foreign account denied op={} callerId={} accountId={}", op, callerId, accountId);
            throw new AuthException(AuthErrorKind.PERMISSION_DENIED, op);
        }
        return callerId;
    }

    /**
     * Live sessions as filtered by the session store: not revoked and still refreshable.
     * <p>
     * A listed session may already be past its access-token expiry ({@link Session#isActive}
     * is false) while its refresh token still works. Such sessions are listed so that logout
     * revokes every credential that can still mint new tokens.
     */
    public List<Session> getActiveAccountSessions(CallContext ctx, long accountId) {
        final String op = "Auth.GetActiveAccountSessions";
        log.info("retrieving active sessions op={} accountId={}", op, accountId);

        List<Session> sessions = callStore(ctx, op, "retrieve sessions", () -> sessionProvider.sessions(ctx, accountId));

        log.info("sessions retrieved op={} accountId={} count={}", op, accountId, sessions.size());
        return sessions;
    }

    /**
     * Exchanges a refresh token for a new token pair. Refresh is additive: a new session is
     * stored and the one holding {@code refreshToken} stays usable until it expires or is revoked.
     */
    public RefreshedSession refreshAccountSession(CallContext ctx, long accountId, String refreshToken, String userAgent, String ipAddress) {
        final String op = "Auth.RefreshAccountSession";
        log.info("attempting to refresh session op={} accountId={}", op, accountId);

        Account account = callStore(ctx, op, "get account", () -> accountProvider.accountById(ctx, accountId))
                .orElseThrow(() -> {
                    log.warn("invalid account id op={} accountId={}", op, accountId);
                    return new AuthException(AuthErrorKind.ACCOUNT_NOT_FOUND, op);
                });

        App app = callStore(ctx, op, "get app", () -> appProvider.app(ctx, account.appId()))
                .orElseThrow(() -> {
                    log.warn("invalid app id op={} appId={}", op, account.appId());
                    return new AuthException(AuthErrorKind.APP_NOT_FOUND, op);
                });

        Session session = callStore(ctx, op, "get session", () -> sessionProvider.sessionByRefreshToken(ctx, refreshToken))
                .filter(candidate -> candidate.accountId() == accountId)
                .orElseThrow(() -> {
                    log.warn("invalid refresh token op={} accountId={}", op, accountId);
                    return new AuthException(AuthErrorKind.SESSION_NOT_FOUND, op);
                });

        if (!session.isRefreshable(clock.instant())) {
            log.info("refresh token expired op={} sessionId={}", op, session.id());
            throw new AuthException(AuthErrorKind.REFRESH_TOKEN_EXPIRED, op);
        }

        TokenPair tokens = openSession(ctx, op, account, app, userAgent, ipAddress);
        return new RefreshedSession(tokens.accessToken(), tokens.refreshToken(), tokens.refreshExpiresAt().getEpochSecond());
    }

    /**
     * An unknown or revoked token is an error, not an invalid result; an expired one is
     * reported as {@code valid = false} with its expiry.
     */
    public SessionValidity validateAccountSession(CallContext ctx, String token) {
        final String op = "Auth.ValidateAccountSession";
        log.debug("validating session op={}", op);

        Session session = callStore(ctx, op, "get session", () -> sessionProvider.session(ctx, token))
                .orElseThrow(() -> {
                    log.info("invalid token op={}", op);
                    return new AuthException(AuthErrorKind.SESSION_NOT_FOUND, op);
                });

        long expiresAt = session.expiresAt().getEpochSecond();
        if (!session.isActive(clock.instant())) {
            log.info("session expired op={} sessionId={}", op, session.id());
            return new SessionValidity(false, expiresAt);
        }
        return new SessionValidity(true, expiresAt);
    }

    public void revokeAccountSession(CallContext ctx, String token) {
        final String op = "Auth.RevokeAccountSession";
        log.info("revoking session op={}", op);

        callStore(ctx, op, "revoke session", () -> sessionSaver.revokeSession(ctx, token, RevocationReason.REVOKED));

        log.info("session revoked op={}", op);
    }

    private TokenPair openSession(CallContext ctx, String op, Account account, App app, String userAgent, String ipAddress) {
        checkpoint(ctx, op);
        SignedAccessToken accessToken;
        String refreshToken;
        try {
            accessToken = tokenSigner.sign(account, app, tokenTtl);
            refreshToken = refreshTokenGenerator.generate();
        } catch (TokenGenerationException ex) {
            log.error("failed to generate tokens op={} accountId={} appId={}", op, account.id(), app.id(), ex);
            throw new AuthException(AuthErrorKind.TOKEN_GENERATION_FAILURE, op, ex);
        }

        Instant refreshExpiresAt = accessToken.issuedAt().plus(refreshTokenTtl);
        NewSession session = new NewSession(
                account.id(),
                userAgent,
                ipAddress,
                accessToken.token(),
                refreshToken,
                accessToken.expiresAt(),
                refreshExpiresAt
        );
        String sessionId = callStore(ctx, op, "save session", () -> sessionSaver.saveSession(ctx, session));

        log.info("session created op={} accountId={} sessionId={}", op, account.id(), sessionId);
        return new TokenPair(accessToken.token(), refreshToken, accessToken.expiresAt(), refreshExpiresAt);
    }

    private long resolveCaller(CallContext ctx, String op, String accessToken) {
        Session session = callStore(ctx, op, "get session", () -> sessionProvider.session(ctx, accessToken))
                .orElseThrow(() -> new AuthException(AuthErrorKind.SESSION_NOT_FOUND, op));
        if (!session.isActive(clock.instant())) {
            throw new AuthException(AuthErrorKind.SESSION_EXPIRED, op);
        }
        return session.accountId();
    }

    private byte[] hashPassword(String op, String password) {
        try {
            return credentialHasher.hash(password);
        } catch (CredentialHashingException ex) {
            log.error("failed to generate password hash op={}", op, ex);
            throw new AuthException(AuthErrorKind.HASHING_FAILURE, op, ex);
        }
    }

    private boolean verifyPassword(String op, byte[] passHash, String password) {
        try {
            return credentialHasher.verify(passHash, password);
        } catch (CredentialHashingException ex) {
            log.error("failed to verify password hash op={}", op, ex);
            throw new AuthException(AuthErrorKind.HASHING_FAILURE, op, ex);
        }
    }

    private void checkpoint(CallContext ctx, String op) {
        try {
            ctx.throwIfCancelled(op);
        } catch (CallCancelledException ex) {
            log.info("operation cancelled op={}", op);
            throw new AuthException(AuthErrorKind.CANCELLED, op, ex);
        }
    }

    private <T> T callStore(CallContext ctx, String op, String action, Supplier<T> call) {
        checkpoint(ctx, op);
        try {
            return call.get();
        } catch (CallCancelledException ex) {
            log.info("operation cancelled op={} action={}", op, action);
            throw new AuthException(AuthErrorKind.CANCELLED, op, ex);
        } catch (DataAccessException ex) {
            log.error("failed to {} op={}", action, op, ex);
            throw new AuthException(AuthErrorKind.PERSISTENCE_FAILURE, op, ex);
        }
    }

    private void callStore(CallContext ctx, String op, String action, Runnable call) {
        callStore(ctx, op, action, () -> {
            call.run();
            return null;
        });
    }
}

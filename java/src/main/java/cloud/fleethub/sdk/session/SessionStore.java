package cloud.fleethub.sdk.session;

import cloud.fleethub.sdk.FleetHubException;
import cloud.fleethub.sdk.auth.Token;
import cloud.fleethub.sdk.auth.TokenProvider;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Holds the single active {@link Session} for one client.
 *
 * <p>
 * The store is an explicit object owned by whoever builds the client, so several independent stores can coexist
 * (tests typically create one per case). Readers see the current session through a volatile reference to an
 * immutable record and never observe a half-applied refresh. Every mutation (connect, refresh, workspace switch,
 * disconnect) runs under one lock, which also makes refresh single-flight: a caller that waited for a refresh
 * already performed by another thread gets that result instead of issuing its own.
 * </p>
 */
public final class SessionStore {

    private static final Logger LOGGER = Logger.getLogger(SessionStore.class.getName());

    private final TokenProvider tokenProvider;
    private final Duration leeway;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile Session current;

    public SessionStore(TokenProvider tokenProvider, Duration leeway) {
        this(tokenProvider, leeway, Clock.systemUTC());
    }

    public SessionStore(TokenProvider tokenProvider, Duration leeway, Clock clock) {
        this.tokenProvider = Objects.requireNonNull(tokenProvider, "tokenProvider");
        this.leeway = leeway == null || leeway.isNegative() ? Duration.ZERO : leeway;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Establishes a session, replacing any existing one.
     *
     * @param workspaceId workspace to bind the token to, or {@code null} for the account default.
     * @throws FleetHubException when the identity service refuses to issue a token.
     */
    public Session connect(String workspaceId) throws FleetHubException {
        lock.lock();
        try {
            Session session = issue(workspaceId, false, false);
            current = session;
            LOGGER.info(() -> String.format(Locale.ROOT,
                "[fleethub-sdk] connected (workspace %s, account %s)", session.workspaceId(), session.accountId()));
            return session;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the current session, which may be stale.
     *
     * @throws NoSessionException when no connect has occurred or the store was disconnected.
     */
    public Session resolveSession() throws NoSessionException {
        Session session = current;
        if (session == null) {
            throw new NoSessionException();
        }
        return session;
    }

    public Optional<Session> current() {
        return Optional.ofNullable(current);
    }

    public boolean isStale(Session session) {
        return session.isStale(clock.instant(), leeway);
    }

    /**
     * Replaces {@code observed} with a freshly issued session.
     *
     * <p>
     * When another caller already replaced {@code observed} with a session that is still fresh, that session is
     * returned without contacting the identity service.
     * </p>
     *
     * @param observed the session the caller found stale or had rejected.
     * @throws NoSessionException when the store was disconnected in the meantime.
     * @throws FleetHubException when the identity service refuses to issue a token.
     */
    public Session refreshSession(Session observed) throws FleetHubException {
        Objects.requireNonNull(observed, "observed");
        lock.lock();
        try {
            Session latest = current;
            if (latest == null) {
                throw new NoSessionException();
            }
            if (latest != observed && !isStale(latest)) {
                return latest;
            }
            Session refreshed = issue(latest.workspaceId(), true, false);
            current = refreshed;
            LOGGER.info(() -> String.format(Locale.ROOT,
                "[fleethub-sdk] session refreshed (workspace %s, expires %s)",
                refreshed.workspaceId(), refreshed.expiry()));
            return refreshed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-issues the session for another workspace.
     *
     * @throws NoSessionException when no session is active.
     * @throws FleetHubException when the new token cannot be issued or is not bound to {@code workspaceId}.
     */
    public Session switchWorkspace(String workspaceId) throws FleetHubException {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new IllegalArgumentException("workspaceId is required");
        }
        lock.lock();
        try {
            if (current == null) {
                throw new NoSessionException();
            }
            Session switched = issue(workspaceId.trim(), true, true);
            current = switched;
            LOGGER.info(() -> String.format(Locale.ROOT,
                "[fleethub-sdk] switched to workspace %s (%s)", switched.workspaceId(), switched.workspaceName()));
            return switched;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the session and any credentials the token provider cached for it. Idempotent.
     */
    public void disconnect() {
        lock.lock();
        try {
            boolean hadSession = current != null;
            current = null;
            tokenProvider.invalidate();
            if (hadSession) {
                LOGGER.info("[fleethub-sdk] disconnected");
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param requireBinding when set, the token must carry a workspace claim equal to {@code workspaceId}.
     */
    private Session issue(String workspaceId, boolean force, boolean requireBinding) throws FleetHubException {
        Token token = force ? tokenProvider.forceRefresh(workspaceId) : tokenProvider.token(workspaceId);
        if (token == null || token.getAccessToken() == null || token.getAccessToken().isBlank()) {
            throw new FleetHubException("identity service returned an empty token");
        }
        if (requireBinding && token.getWorkspaceId() == null) {
            throw new FleetHubException("token is not bound to any workspace, expected " + workspaceId);
        }
        if (workspaceId != null && token.getWorkspaceId() != null && !workspaceId.equals(token.getWorkspaceId())) {
            throw new FleetHubException("token is bound to workspace " + token.getWorkspaceId()
                + ", expected " + workspaceId);
        }
        return Session.from(token, workspaceId);
    }
}

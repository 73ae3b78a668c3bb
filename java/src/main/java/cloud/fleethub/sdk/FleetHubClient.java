package cloud.fleethub.sdk;

import cloud.fleethub.sdk.auth.ClientCredentialsManager;
import cloud.fleethub.sdk.auth.TokenProvider;
import cloud.fleethub.sdk.outcome.Diagnostic;
import cloud.fleethub.sdk.outcome.DiagnosticContext;
import cloud.fleethub.sdk.outcome.ErrorClassifier;
import cloud.fleethub.sdk.outcome.Outcome;
import cloud.fleethub.sdk.paging.CursorPageReader;
import cloud.fleethub.sdk.paging.PaginationAggregator;
import cloud.fleethub.sdk.request.HttpMethod;
import cloud.fleethub.sdk.request.RequestDescriptor;
import cloud.fleethub.sdk.retry.RetryEngine;
import cloud.fleethub.sdk.retry.Sleeper;
import cloud.fleethub.sdk.session.Session;
import cloud.fleethub.sdk.session.SessionStore;
import cloud.fleethub.sdk.transport.HttpClientTransport;
import cloud.fleethub.sdk.transport.Transport;

import java.util.Objects;
import java.util.Optional;

/**
 * <p>
 * Primary entry point for calling the FleetHub management API. The client is thread-safe: create one instance per
 * set of credentials, {@link #connect()} once, and route every workspace, user, device, server-fleet, firmware or
 * settings call through {@link #execute(RequestDescriptor)} or the verb shortcuts.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Owns one {@link SessionStore}; stale sessions are refreshed before use and a 401/403 triggers one refresh
 *       followed by one retry of the rejected request.</li>
 *   <li>Retries transient failures (network errors, 5xx, rate limiting) with bounded exponential backoff.</li>
 *   <li>Aggregates collection pages, following cursors until the service reports the end.</li>
 *   <li>Never throws for API failures: every call returns exactly one {@link Outcome}. The detail of the latest
 *       failure is also available from {@link #lastFailure()}.</li>
 * </ul>
 */
public final class FleetHubClient implements AutoCloseable {

    private final Config config;
    private final SessionStore sessions;
    private final DiagnosticContext diagnostics = new DiagnosticContext();
    private final RequestExecutor executor;

    /**
     * Constructs a client that authenticates with OAuth client credentials and talks HTTP through the configured
     * {@link java.net.http.HttpClient}.
     */
    public FleetHubClient(Config config) {
        this(config, null, null);
    }

    /**
     * Constructs a client with a custom token source and/or transport; {@code null} selects the default. The
     * client id and secret are only required when the default token source is used.
     */
    public FleetHubClient(Config config, TokenProvider tokenProvider, Transport transport) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();

        TokenProvider provider = tokenProvider != null ? tokenProvider : new ClientCredentialsManager(
            this.config.requireClientCredentials().getHttpClient(),
            this.config.getTokenUrl(),
            this.config.getClientId(),
            this.config.getClientSecret(),
            this.config.getScope(),
            this.config.getTokenLeeway(),
            this.config.getHttpTimeout()
        );
        Transport resolvedTransport = transport != null ? transport : new HttpClientTransport(this.config.getHttpClient());

        ErrorClassifier classifier = new ErrorClassifier();
        this.sessions = new SessionStore(provider, this.config.getTokenLeeway());
        RetryEngine retryEngine = new RetryEngine(
            resolvedTransport,
            classifier,
            this.config.getRetryPolicy(),
            this.config.getHttpTimeout(),
            Sleeper.cancellable(),
            diagnostics
        );
        PaginationAggregator aggregator = new PaginationAggregator(
            new CursorPageReader(), this.config.getPageSize(), this.config.getMaxPages());
        this.executor = new RequestExecutor(
            this.config.getBaseUrl(), sessions, retryEngine, aggregator, classifier, diagnostics);
    }

    /**
     * Connects to the workspace selected in {@link Config}, or the account default when none is configured.
     *
     * @throws FleetHubException when the identity service refuses the credentials.
     */
    public Session connect() throws FleetHubException {
        return sessions.connect(config.getWorkspaceId());
    }

    public Session connect(String workspaceId) throws FleetHubException {
        return sessions.connect(workspaceId);
    }

    public Session switchWorkspace(String workspaceId) throws FleetHubException {
        return sessions.switchWorkspace(workspaceId);
    }

    public void disconnect() {
        sessions.disconnect();
    }

    public Optional<Session> session() {
        return sessions.current();
    }

    public Outcome execute(RequestDescriptor descriptor) {
        return executor.execute(descriptor);
    }

    public Outcome execute(RequestDescriptor descriptor, CancellationToken cancellation) {
        return executor.execute(descriptor, cancellation);
    }

    public Outcome get(String path) {
        return execute(RequestDescriptor.get(path).build());
    }

    /**
     * Fetches every page of a collection, up to the configured page ceiling.
     */
    public Outcome list(String path) {
        return execute(RequestDescriptor.get(path).collection(true).build());
    }

    public Outcome post(String path, Object body) {
        return execute(RequestDescriptor.builder().method(HttpMethod.POST).uri(path).body(body).build());
    }

    public Outcome put(String path, Object body) {
        return execute(RequestDescriptor.builder().method(HttpMethod.PUT).uri(path).body(body).build());
    }

    public Outcome patch(String path, Object body) {
        return execute(RequestDescriptor.builder().method(HttpMethod.PATCH).uri(path).body(body).build());
    }

    public Outcome delete(String path) {
        return execute(RequestDescriptor.builder().method(HttpMethod.DELETE).uri(path).build());
    }

    /**
     * @return detail of the most recent failed attempt of the latest call, empty when it had none.
     */
    public Optional<Diagnostic> lastFailure() {
        return diagnostics.lastFailure();
    }

    /**
     * Disconnects. The underlying {@link java.net.http.HttpClient} is managed by the caller and left open.
     */
    @Override
    public void close() {
        disconnect();
    }
}

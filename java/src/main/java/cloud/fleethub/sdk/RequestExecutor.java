package cloud.fleethub.sdk;

import cloud.fleethub.sdk.dryrun.DryRunRenderer;
import cloud.fleethub.sdk.outcome.Diagnostic;
import cloud.fleethub.sdk.outcome.DiagnosticContext;
import cloud.fleethub.sdk.outcome.Disposition;
import cloud.fleethub.sdk.outcome.ErrorClassifier;
import cloud.fleethub.sdk.outcome.Outcome;
import cloud.fleethub.sdk.paging.PaginationAggregator;
import cloud.fleethub.sdk.request.RequestDescriptor;
import cloud.fleethub.sdk.request.RequestValidationException;
import cloud.fleethub.sdk.retry.AttemptResult;
import cloud.fleethub.sdk.retry.RetryEngine;
import cloud.fleethub.sdk.retry.RetryState;
import cloud.fleethub.sdk.session.NoSessionException;
import cloud.fleethub.sdk.session.Session;
import cloud.fleethub.sdk.session.SessionStore;
import cloud.fleethub.sdk.transport.PreparedRequest;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Turns a {@link RequestDescriptor} into exactly one {@link Outcome}.
 *
 * <h2>Order of operations</h2>
 * <ol>
 *   <li>Validate the descriptor; a malformed one fails with {@link Outcome.Failed.Reason#VALIDATION}.</li>
 *   <li>Unless the session check is skipped, resolve the session and refresh it once if it is stale. No session or
 *       a failed refresh ends the call with an {@link Outcome.Authentication} outcome.</li>
 *   <li>For dry runs, render the request (the first page request for collections) and return without any
 *       network call.</li>
 *   <li>Send through the {@link RetryEngine}, aggregating pages for collection requests.</li>
 *   <li>On 401/403, refresh the session once and repeat the rejected request once. A second rejection is final.</li>
 *   <li>Classify the terminal result.</li>
 * </ol>
 *
 * <p>
 * The executor never throws for an orchestration failure. The richest failure detail of the call is also left in
 * the {@link DiagnosticContext}.
 * </p>
 */
public final class RequestExecutor {

    private static final Logger LOGGER = Logger.getLogger(RequestExecutor.class.getName());

    private final String baseUrl;
    private final SessionStore sessions;
    private final RetryEngine retryEngine;
    private final PaginationAggregator aggregator;
    private final ErrorClassifier classifier;
    private final DryRunRenderer renderer;
    private final DiagnosticContext diagnostics;

    public RequestExecutor(
        String baseUrl,
        SessionStore sessions,
        RetryEngine retryEngine,
        PaginationAggregator aggregator,
        ErrorClassifier classifier,
        DiagnosticContext diagnostics
    ) {
        this.baseUrl = baseUrl;
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.retryEngine = Objects.requireNonNull(retryEngine, "retryEngine");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.renderer = new DryRunRenderer(baseUrl);
    }

    public Outcome execute(RequestDescriptor descriptor) {
        return execute(descriptor, CancellationToken.create());
    }

    public Outcome execute(RequestDescriptor descriptor, CancellationToken cancellation) {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(cancellation, "cancellation");
        diagnostics.clear();
        Outcome outcome = run(descriptor, cancellation);
        if (outcome.category() != Outcome.Category.COMPLETE && outcome.category() != Outcome.Category.DRY_RUN) {
            outcome.diagnostic().ifPresent(diagnostics::record);
        }
        return outcome;
    }

    private Outcome run(RequestDescriptor descriptor, CancellationToken cancellation) {
        try {
            descriptor.validate();
        } catch (RequestValidationException ex) {
            return invalid(ex);
        }

        Call call = new Call();
        if (!descriptor.isSkipSessionCheck()) {
            try {
                call.session = sessions.resolveSession();
            } catch (NoSessionException ex) {
                return new Outcome.Authentication(Outcome.Authentication.Reason.NO_SESSION, Diagnostic.of(ex.getMessage()));
            }
            if (sessions.isStale(call.session)) {
                LOGGER.info("[fleethub-sdk] session is stale; refreshing before request");
                try {
                    call.session = sessions.refreshSession(call.session);
                } catch (FleetHubException ex) {
                    return refreshFailed(ex);
                }
            }
        }

        if (descriptor.isDryRun()) {
            RequestDescriptor shown = descriptor.isCollection() ? aggregator.firstPage(descriptor) : descriptor;
            try {
                return new Outcome.DryRun(renderer.render(shown, call.session));
            } catch (RequestValidationException ex) {
                return invalid(ex);
            }
        }

        if (descriptor.isCollection()) {
            return aggregator.fetchAll(descriptor, cancellation, page -> send(page, call, cancellation));
        }
        return send(descriptor, call, cancellation);
    }

    private Outcome send(RequestDescriptor descriptor, Call call, CancellationToken cancellation) {
        while (true) {
            PreparedRequest prepared;
            try {
                prepared = PreparedRequest.of(descriptor.getMethod(), descriptor.resolve(baseUrl), descriptor.getBody(),
                    call.session == null ? null : call.session.accessToken());
            } catch (RequestValidationException ex) {
                return invalid(ex);
            }

            AttemptResult result = retryEngine.attempt(prepared, cancellation);
            if (result.state() == RetryState.CANCELLED) {
                String reason = cancellation.isCancelled() ? cancellation.reason() : "interrupted";
                return new Outcome.Cancelled(reason, 0, List.of());
            }
            if (result.disposition() != Disposition.AUTHENTICATION) {
                return classifier.classify(result.last());
            }

            Diagnostic rejected = classifier.diagnose(result.last());
            if (call.session == null || call.authRetried) {
                LOGGER.warning(() -> String.format(Locale.ROOT,
                    "[fleethub-sdk] %s rejected with status %d: %s",
                    descriptor, rejected.statusCode(), rejected.message()));
                return new Outcome.Authentication(Outcome.Authentication.Reason.REJECTED, rejected);
            }

            if (cancellation.isCancelled()) {
                return new Outcome.Cancelled(cancellation.reason(), 0, List.of());
            }
            call.authRetried = true;
            LOGGER.info(() -> String.format(Locale.ROOT,
                "[fleethub-sdk] %s rejected with status %d; refreshing session and retrying once",
                descriptor, rejected.statusCode()));
            try {
                call.session = sessions.refreshSession(call.session);
            } catch (FleetHubException ex) {
                return refreshFailed(ex);
            }
        }
    }

    private Outcome refreshFailed(FleetHubException ex) {
        if (ex instanceof NoSessionException) {
            return new Outcome.Authentication(Outcome.Authentication.Reason.NO_SESSION, Diagnostic.of(ex.getMessage()));
        }
        Diagnostic detail;
        if (ex instanceof FleetHubApiException) {
            FleetHubApiException api = (FleetHubApiException) ex;
            detail = new Diagnostic(api.getMessage(), api.getCode(), api.getStatusCode());
        } else {
            detail = Diagnostic.of("session refresh failed: " + ex.getMessage());
        }
        LOGGER.warning(() -> "[fleethub-sdk] session refresh failed: " + ex.getMessage());
        return new Outcome.Authentication(Outcome.Authentication.Reason.REFRESH_FAILED, detail);
    }

    private static Outcome invalid(RequestValidationException ex) {
        return new Outcome.Failed(Outcome.Failed.Reason.VALIDATION, Diagnostic.of(ex.getMessage()));
    }

    /**
     * Session state of one call; page fetches share it so the single authentication retry covers the whole call.
     */
    private static final class Call {
        private Session session;
        private boolean authRetried;
    }
}

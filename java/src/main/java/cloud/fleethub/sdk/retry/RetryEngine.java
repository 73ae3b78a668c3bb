package cloud.fleethub.sdk.retry;

import cloud.fleethub.sdk.CancellationToken;
import cloud.fleethub.sdk.outcome.DiagnosticContext;
import cloud.fleethub.sdk.outcome.Disposition;
import cloud.fleethub.sdk.outcome.ErrorClassifier;
import cloud.fleethub.sdk.transport.PreparedRequest;
import cloud.fleethub.sdk.transport.RawResult;
import cloud.fleethub.sdk.transport.Transport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Runs one request through the {@link RetryState} machine: transient failures are retried with backoff up to
 * {@link RetryPolicy#maxAttempts()} transport calls; authentication and business failures stop immediately and
 * are handed back to the caller.
 */
public final class RetryEngine {

    private static final Logger LOGGER = Logger.getLogger(RetryEngine.class.getName());

    private final Transport transport;
    private final ErrorClassifier classifier;
    private final RetryPolicy policy;
    private final Duration attemptTimeout;
    private final Sleeper sleeper;
    private final DiagnosticContext diagnostics;

    public RetryEngine(
        Transport transport,
        ErrorClassifier classifier,
        RetryPolicy policy,
        Duration attemptTimeout,
        Sleeper sleeper,
        DiagnosticContext diagnostics
    ) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.attemptTimeout = Objects.requireNonNull(attemptTimeout, "attemptTimeout");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public AttemptResult attempt(PreparedRequest request, CancellationToken cancellation) {
        RetryState state = RetryState.IDLE;
        RawResult last = null;
        Disposition disposition = null;
        int attempts = 0;
        Duration previousDelay = Duration.ZERO;
        List<Duration> delays = new ArrayList<>();

        while (!state.isTerminal()) {
            switch (state) {
                case IDLE:
                    state = cancellation.isCancelled() ? RetryState.CANCELLED : RetryState.ATTEMPTING;
                    break;

                case ATTEMPTING:
                    attempts++;
                    int attempt = attempts;
                    LOGGER.fine(() -> String.format(Locale.ROOT,
                        "[fleethub-sdk] %s attempt %d/%d", request, attempt, policy.maxAttempts()));
                    try {
                        last = transport.send(request, attemptTimeout);
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                        state = RetryState.CANCELLED;
                        break;
                    }
                    disposition = classifier.disposition(last);
                    if (disposition != Disposition.SUCCESS) {
                        diagnostics.record(classifier.diagnose(last));
                    }
                    // a failure that arrives after cancellation is reported as the cancellation
                    state = disposition != Disposition.SUCCESS && cancellation.isCancelled()
                        ? RetryState.CANCELLED
                        : next(disposition, attempts);
                    break;

                case BACKOFF_WAIT:
                    Duration delay = policy.honour(policy.delayBeforeRetry(attempts), retryAfter(last));
                    if (delay.compareTo(previousDelay) < 0) {
                        delay = previousDelay;
                    }
                    previousDelay = delay;
                    delays.add(delay);
                    Duration wait = delay;
                    RawResult failed = last;
                    LOGGER.warning(() -> String.format(Locale.ROOT,
                        "[fleethub-sdk] %s transient failure (%s); retrying in %d ms",
                        request, describe(failed), wait.toMillis()));
                    try {
                        boolean cancelled = sleeper.sleep(delay, cancellation);
                        state = cancelled || cancellation.isCancelled() ? RetryState.CANCELLED : RetryState.ATTEMPTING;
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                        state = RetryState.CANCELLED;
                    }
                    break;

                default:
                    throw new IllegalStateException("unexpected state " + state);
            }
        }

        if (state == RetryState.EXHAUSTED) {
            int made = attempts;
            RawResult failed = last;
            LOGGER.warning(() -> String.format(Locale.ROOT,
                "[fleethub-sdk] %s giving up after %d attempts (%s)", request, made, describe(failed)));
        }
        return new AttemptResult(state, last, disposition, attempts, delays);
    }

    private RetryState next(Disposition disposition, int attempts) {
        switch (disposition) {
            case SUCCESS:
                return RetryState.SUCCEEDED;
            case TRANSIENT:
                return attempts >= policy.maxAttempts() ? RetryState.EXHAUSTED : RetryState.BACKOFF_WAIT;
            default:
                return RetryState.TERMINAL_FAILURE;
        }
    }

    private static Duration retryAfter(RawResult raw) {
        if (raw == null) {
            return null;
        }
        Optional<String> header = raw.header("Retry-After");
        if (header.isEmpty()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(header.get().trim());
            return seconds > 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException ex) {
            // HTTP-date form is not honoured
            return null;
        }
    }

    private static String describe(RawResult raw) {
        if (raw == null) {
            return "no response";
        }
        if (raw.isTransportFailure()) {
            return raw.transportError().getClass().getSimpleName();
        }
        return "HTTP " + raw.statusCode();
    }
}

package cloud.fleethub.sdk.retry;

import cloud.fleethub.sdk.outcome.Disposition;
import cloud.fleethub.sdk.transport.RawResult;

import java.time.Duration;
import java.util.List;

/**
 * Where the retry state machine stopped.
 *
 * @param last        the final transport result, {@code null} when cancelled before the first attempt.
 * @param disposition disposition of {@code last}, {@code null} when there is none.
 * @param attempts    transport calls made.
 * @param delays      backoff delays waited (or started) between attempts, in order.
 */
public record AttemptResult(
    RetryState state,
    RawResult last,
    Disposition disposition,
    int attempts,
    List<Duration> delays
) {

    public AttemptResult {
        delays = List.copyOf(delays);
    }
}

package cloud.fleethub.sdk.retry;

import cloud.fleethub.sdk.CancellationToken;

import java.time.Duration;

/**
 * Waits out a backoff delay.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * @return {@code true} when the wait ended because {@code cancellation} fired.
     */
    boolean sleep(Duration delay, CancellationToken cancellation) throws InterruptedException;

    /**
     * Real-time sleeper that wakes early on cancellation.
     */
    static Sleeper cancellable() {
        return (delay, cancellation) -> cancellation.await(delay);
    }
}

package cloud.fleethub.sdk;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal for one call. Once cancelled, the executor issues no further attempts or
 * page requests and the call resolves to a {@code Cancelled} outcome. Backoff waits wake up immediately.
 */
public final class CancellationToken {

    private final CountDownLatch signal = new CountDownLatch(1);
    private volatile String reason;

    /**
     * @return a fresh token that is cancelled only if someone calls {@link #cancel()} on it.
     */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancel("cancelled by caller");
    }

    public void cancel(String reason) {
        if (this.reason == null) {
            this.reason = reason == null || reason.isBlank() ? "cancelled by caller" : reason;
        }
        signal.countDown();
    }

    public boolean isCancelled() {
        return signal.getCount() == 0;
    }

    public String reason() {
        return reason == null ? "cancelled by caller" : reason;
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return {@code true} when the token was cancelled before the timeout elapsed.
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return isCancelled();
        }
        return signal.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}

package cloud.fleethub.sdk.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Bounded exponential backoff.
 *
 * <p>
 * The n-th retry waits a random point in {@code [nominal(n), nominal(n+1))} where
 * {@code nominal(n) = min(maxDelay, baseDelay * 2^(n-1))}. Drawing the jitter inside that window keeps the delay
 * sequence monotonically non-decreasing and never above {@code maxDelay}.
 * </p>
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 4;
    public static final int MAX_ALLOWED_ATTEMPTS = 10;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(500);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(8);

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final DoubleSupplier jitter;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        this(maxAttempts, baseDelay, maxDelay, () -> ThreadLocalRandom.current().nextDouble());
    }

    private RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, DoubleSupplier jitter) {
        if (maxAttempts < 1 || maxAttempts > MAX_ALLOWED_ATTEMPTS) {
            throw new IllegalArgumentException("maxAttempts must be between 1 and " + MAX_ALLOWED_ATTEMPTS);
        }
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays cannot be negative");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than baseDelay");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = Objects.requireNonNull(jitter, "jitter");
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY);
    }

    /**
     * @return a copy drawing jitter from {@code jitter} (values in {@code [0, 1)}); {@code () -> 0} disables it.
     */
    public RetryPolicy withJitter(DoubleSupplier jitter) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, jitter);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    /**
     * @param retry 1 for the wait before the second attempt, 2 before the third, and so on.
     */
    public Duration delayBeforeRetry(int retry) {
        if (retry < 1) {
            throw new IllegalArgumentException("retry must be >= 1");
        }
        long lower = nominalMillis(retry);
        long upper = nominalMillis(retry + 1);
        double fraction = Math.min(Math.max(jitter.getAsDouble(), 0.0d), 1.0d);
        long millis = lower + (long) Math.floor((upper - lower) * fraction);
        return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
    }

    /**
     * Applies a server-provided {@code Retry-After} hint, never exceeding {@link #maxDelay()}.
     */
    public Duration honour(Duration computed, Duration retryAfter) {
        if (retryAfter == null || retryAfter.compareTo(computed) <= 0) {
            return computed;
        }
        return retryAfter.compareTo(maxDelay) > 0 ? maxDelay : retryAfter;
    }

    private long nominalMillis(int retry) {
        long cap = maxDelay.toMillis();
        long value = baseDelay.toMillis();
        for (int i = 1; i < retry && value < cap; i++) {
            value = value * 2;
        }
        return Math.min(value, cap);
    }

    @Override
    public String toString() {
        return "RetryPolicy[maxAttempts=" + maxAttempts + ", baseDelay=" + baseDelay + ", maxDelay=" + maxDelay + "]";
    }
}

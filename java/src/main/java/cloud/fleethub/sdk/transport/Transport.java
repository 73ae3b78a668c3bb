package cloud.fleethub.sdk.transport;

import java.time.Duration;

/**
 * Sends one {@link PreparedRequest}. Implementations do not retry and do not interpret status codes.
 */
@FunctionalInterface
public interface Transport {

    /**
     * Performs a single attempt. Network failures (including the attempt exceeding {@code timeout}) are
     * reported as {@link RawResult#transportFailure(java.io.IOException)} rather than thrown.
     *
     * @throws InterruptedException when the calling thread is interrupted while waiting for the response.
     */
    RawResult send(PreparedRequest request, Duration timeout) throws InterruptedException;
}

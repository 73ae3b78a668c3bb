package cloud.fleethub.sdk.retry;

/**
 * States of one logical attempt.
 *
 * <pre>
 * IDLE -> ATTEMPTING -> SUCCEEDED
 *                    -> TERMINAL_FAILURE
 *                    -> BACKOFF_WAIT -> ATTEMPTING
 *                    -> EXHAUSTED
 * any non-terminal state -> CANCELLED
 * </pre>
 */
public enum RetryState {
    IDLE(false),
    ATTEMPTING(false),
    BACKOFF_WAIT(false),
    SUCCEEDED(true),
    TERMINAL_FAILURE(true),
    EXHAUSTED(true),
    CANCELLED(true);

    private final boolean terminal;

    RetryState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}

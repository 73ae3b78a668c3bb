package cloud.fleethub.sdk.outcome;

/**
 * How the retry engine should treat one raw attempt.
 */
public enum Disposition {
    /** 2xx; may still carry an application-level error or per-item failures. */
    SUCCESS,
    /** Network failure, 5xx or rate limiting: worth retrying unchanged. */
    TRANSIENT,
    /** 401/403: only a session refresh can help. */
    AUTHENTICATION,
    /** Evaluated and rejected by the service; retrying would not change the answer. */
    TERMINAL
}

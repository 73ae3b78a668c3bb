package cloud.fleethub.sdk.session;

import cloud.fleethub.sdk.FleetHubException;

/**
 * Raised when a session is required but {@code connect} has not been called, or the session was disconnected.
 */
public final class NoSessionException extends FleetHubException {

    private static final long serialVersionUID = 1L;

    public NoSessionException() {
        super("no active session: connect before issuing requests");
    }
}

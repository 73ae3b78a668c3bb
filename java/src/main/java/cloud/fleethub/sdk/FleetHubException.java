package cloud.fleethub.sdk;

/**
 * Base exception thrown by the FleetHub Java SDK.
 */
public class FleetHubException extends Exception {

    private static final long serialVersionUID = 1L;

    public FleetHubException(String message) {
        super(message);
    }

    public FleetHubException(String message, Throwable cause) {
        super(message, cause);
    }
}

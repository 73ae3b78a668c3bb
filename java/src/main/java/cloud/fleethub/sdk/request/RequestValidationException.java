package cloud.fleethub.sdk.request;

import cloud.fleethub.sdk.FleetHubException;

/**
 * Raised when a {@link RequestDescriptor} is not well-formed enough to be sent or rendered.
 */
public final class RequestValidationException extends FleetHubException {

    private static final long serialVersionUID = 1L;

    public RequestValidationException(String message) {
        super(message);
    }

    public RequestValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package cloud.fleethub.sdk;

/**
 * Exception representing an error returned by the FleetHub management API. When the backend rejects a request
 * the SDK hydrates this type so callers can inspect both the HTTP status and the structured error code.
 */
public final class FleetHubApiException extends FleetHubException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;

    public FleetHubApiException(int statusCode, String code, String message) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode, code) : message);
        this.statusCode = statusCode;
        this.code = code;
    }

    /**
     * @return HTTP status code returned by the API, or {@code 0} when the failure never reached the service.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return API-specific error code (nullable when the response body did not include one).
     */
    public String getCode() {
        return code;
    }

    private static String defaultMessage(int status, String code) {
        if (code == null || code.isBlank()) {
            return "FleetHub request failed with status " + status;
        }
        return "FleetHub request failed with status " + status + " (" + code + ")";
    }
}

package cloud.fleethub.sdk.outcome;

import cloud.fleethub.sdk.FleetHubApiException;

/**
 * Structured failure detail: the most actionable message available, the API error code when one was sent, and
 * the HTTP status ({@code 0} when no response was received).
 */
public record Diagnostic(String message, String code, int statusCode) {

    public static Diagnostic of(String message) {
        return new Diagnostic(message, null, 0);
    }

    public FleetHubApiException toException() {
        return new FleetHubApiException(statusCode, code, message);
    }
}

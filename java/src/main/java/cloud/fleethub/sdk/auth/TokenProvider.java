package cloud.fleethub.sdk.auth;

import cloud.fleethub.sdk.FleetHubException;

/**
 * Contract for obtaining access tokens bound to a workspace.
 */
public interface TokenProvider {

    /**
     * Returns a token for {@code workspaceId} ({@code null} for the account default), reusing a cached one while
     * it is still fresh.
     */
    Token token(String workspaceId) throws FleetHubException;

    default void invalidate() {
        // default no-op
    }

    default Token forceRefresh(String workspaceId) throws FleetHubException {
        invalidate();
        return token(workspaceId);
    }
}

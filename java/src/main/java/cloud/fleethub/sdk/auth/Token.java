package cloud.fleethub.sdk.auth;

import java.time.Instant;

/**
 * Represents an issued access token and the workspace claims bound to it.
 */
public final class Token {
    private final String accessToken;
    private final String workspaceId;
    private final String workspaceName;
    private final String accountId;
    private final Instant expiry;

    public Token(String accessToken, String workspaceId, String workspaceName, String accountId, Instant expiry) {
        this.accessToken = accessToken;
        this.workspaceId = workspaceId;
        this.workspaceName = workspaceName;
        this.accountId = accountId;
        this.expiry = expiry;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getWorkspaceName() {
        return workspaceName;
    }

    public String getAccountId() {
        return accountId;
    }

    public Instant getExpiry() {
        return expiry;
    }
}

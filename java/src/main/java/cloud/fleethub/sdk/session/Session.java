package cloud.fleethub.sdk.session;

import cloud.fleethub.sdk.auth.Token;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One authenticated context: the bearer token, when it expires, and the workspace it is bound to.
 * Instances are immutable; a refresh or workspace switch produces a new {@code Session}.
 */
public record Session(
    String accessToken,
    Instant expiry,
    String workspaceId,
    String workspaceName,
    String accountId
) {

    public Session {
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(expiry, "expiry");
    }

    static Session from(Token token, String requestedWorkspaceId) {
        String workspace = token.getWorkspaceId() == null ? requestedWorkspaceId : token.getWorkspaceId();
        return new Session(token.getAccessToken(), token.getExpiry(), workspace, token.getWorkspaceName(),
            token.getAccountId());
    }

    /**
     * @return {@code true} when the token expires within {@code leeway} of {@code now}.
     */
    public boolean isStale(Instant now, Duration leeway) {
        return !now.isBefore(expiry.minus(leeway));
    }

    @Override
    public String toString() {
        return "Session[workspaceId=" + workspaceId
            + ", workspaceName=" + workspaceName
            + ", accountId=" + accountId
            + ", expiry=" + expiry + "]";
    }
}

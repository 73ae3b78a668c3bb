package cloud.fleethub.sdk.auth;

import cloud.fleethub.sdk.FleetHubException;
import cloud.fleethub.sdk.internal.ApiErrorDecoder;
import cloud.fleethub.sdk.internal.Json;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * TokenProvider implementation performing OAuth client credentials flows against the FleetHub identity service.
 */
public final class ClientCredentialsManager implements TokenProvider {

    private static final Logger LOGGER = Logger.getLogger(ClientCredentialsManager.class.getName());
    private static final Duration DEFAULT_LEEWAY = Duration.ofSeconds(30);
    private static final int DEFAULT_EXPIRES_IN = 60;

    private final HttpClient httpClient;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final String scope;
    private final Duration leeway;
    private final Duration requestTimeout;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile Token cached;

    public ClientCredentialsManager(
        HttpClient httpClient,
        String tokenUrl,
        String clientId,
        String clientSecret,
        String scope,
        Duration leeway,
        Duration requestTimeout
    ) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.tokenUrl = Objects.requireNonNull(tokenUrl, "tokenUrl");
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.clientSecret = Objects.requireNonNull(clientSecret, "clientSecret");
        this.scope = scope;
        this.leeway = leeway == null || leeway.isZero() || leeway.isNegative() ? DEFAULT_LEEWAY : leeway;
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? Duration.ofSeconds(30) : requestTimeout;
    }

    @Override
    public Token token(String workspaceId) throws FleetHubException {
        Token current = cached;
        if (usable(current, workspaceId)) {
            return current;
        }

        lock.lock();
        try {
            current = cached;
            if (usable(current, workspaceId)) {
                return current;
            }

            Token fresh = fetchToken(workspaceId);
            cached = fresh;
            return fresh;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void invalidate() {
        cached = null;
    }

    @Override
    public Token forceRefresh(String workspaceId) throws FleetHubException {
        lock.lock();
        try {
            Token fresh = fetchToken(workspaceId);
            cached = fresh;
            return fresh;
        } finally {
            lock.unlock();
        }
    }

    private boolean usable(Token token, String workspaceId) {
        if (token == null) {
            return false;
        }
        if (workspaceId != null && !workspaceId.equals(token.getWorkspaceId())) {
            return false;
        }
        Instant refreshAt = token.getExpiry().minus(leeway);
        return Instant.now().isBefore(refreshAt);
    }

    private Token fetchToken(String workspaceId) throws FleetHubException {
        LOGGER.fine(() -> "[fleethub-sdk] requesting access token"
            + (workspaceId == null ? "" : " for workspace " + workspaceId));
        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(tokenRequest(workspaceId), HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new FleetHubException("request token interrupted", ex);
        } catch (IOException ex) {
            throw new FleetHubException("request token: " + ex.getMessage(), ex);
        }

        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() >= 400) {
                throw ApiErrorDecoder.decode(response.statusCode(), bodyStream);
            }

            JsonNode node = Json.mapper().readTree(bodyStream);
            String accessToken = node.path("access_token").asText();
            if (accessToken == null || accessToken.isBlank()) {
                throw new FleetHubException("token response missing access_token");
            }

            int expiresIn = node.path("expires_in").isInt() ? node.path("expires_in").asInt() : DEFAULT_EXPIRES_IN;
            if (expiresIn <= 0) {
                expiresIn = DEFAULT_EXPIRES_IN;
            }
            Instant expiry = Instant.now().plusSeconds(expiresIn);

            DecodedClaims claims = DecodedClaims.decode(accessToken);
            String boundWorkspace = claims.workspaceId();
            if (boundWorkspace == null) {
                boundWorkspace = Json.text(node, "workspace_id");
            }
            return new Token(accessToken, boundWorkspace, claims.workspaceName(), claims.accountId(), expiry);
        } catch (IOException ex) {
            throw new FleetHubException("decode token response: " + ex.getMessage(), ex);
        }
    }

    private HttpRequest tokenRequest(String workspaceId) {
        StringBuilder form = new StringBuilder("grant_type=client_credentials");
        if (scope != null && !scope.isBlank()) {
            form.append("&scope=").append(URLEncoder.encode(scope, StandardCharsets.UTF_8));
        }
        if (workspaceId != null && !workspaceId.isBlank()) {
            form.append("&workspace_id=").append(URLEncoder.encode(workspaceId.trim(), StandardCharsets.UTF_8));
        }

        String credentials = Base64.getEncoder()
            .encodeToString((clientId + ":" + clientSecret).getBytes(StandardCharsets.UTF_8));

        return HttpRequest.newBuilder()
            .uri(URI.create(tokenUrl))
            .POST(HttpRequest.BodyPublishers.ofString(form.toString()))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .header("Authorization", "Basic " + credentials)
            .timeout(requestTimeout)
            .build();
    }
}

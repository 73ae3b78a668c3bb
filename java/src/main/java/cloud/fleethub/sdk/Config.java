package cloud.fleethub.sdk;

import cloud.fleethub.sdk.paging.PaginationAggregator;
import cloud.fleethub.sdk.retry.RetryPolicy;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link FleetHubClient} instances.
 */
public final class Config {

    public static final String DEFAULT_BASE_URL = "https://api.fleethub.cloud";
    public static final String DEFAULT_TOKEN_URL = "https://auth.fleethub.cloud/oauth2/token";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_TOKEN_LEEWAY = Duration.ofSeconds(30);

    private final String baseUrl;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final String scope;
    private final String workspaceId;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final Duration tokenLeeway;
    private final RetryPolicy retryPolicy;
    private final int pageSize;
    private final int maxPages;

    private Config(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.tokenUrl = builder.tokenUrl;
        this.clientId = builder.clientId;
        this.clientSecret = builder.clientSecret;
        this.scope = builder.scope;
        this.workspaceId = builder.workspaceId;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.tokenLeeway = builder.tokenLeeway;
        this.retryPolicy = builder.retryPolicy;
        this.pageSize = builder.pageSize;
        this.maxPages = builder.maxPages;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        String resolvedBaseUrl = sanitizeUrl(Optional.ofNullable(baseUrl).orElse(DEFAULT_BASE_URL));
        String resolvedTokenUrl = sanitizeUrl(Optional.ofNullable(tokenUrl).orElse(DEFAULT_TOKEN_URL));

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        Duration resolvedLeeway = Optional.ofNullable(tokenLeeway).orElse(DEFAULT_TOKEN_LEEWAY);
        if (resolvedLeeway.isNegative() || resolvedLeeway.isZero()) {
            resolvedLeeway = DEFAULT_TOKEN_LEEWAY;
        }

        int resolvedPageSize = pageSize <= 0 ? PaginationAggregator.DEFAULT_PAGE_SIZE : pageSize;
        if (resolvedPageSize > PaginationAggregator.MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("PageSize cannot exceed " + PaginationAggregator.MAX_PAGE_SIZE);
        }
        int resolvedMaxPages = maxPages <= 0 ? PaginationAggregator.DEFAULT_MAX_PAGES : maxPages;

        String resolvedWorkspace = Optional.ofNullable(workspaceId)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(null);

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .baseUrl(resolvedBaseUrl)
            .tokenUrl(resolvedTokenUrl)
            .clientId(clientId)
            .clientSecret(clientSecret)
            .scope(scope)
            .workspaceId(resolvedWorkspace)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .tokenLeeway(resolvedLeeway)
            .retryPolicy(Optional.ofNullable(retryPolicy).orElseGet(RetryPolicy::defaults))
            .pageSize(resolvedPageSize)
            .maxPages(resolvedMaxPages)
            .buildInternal();
    }

    /**
     * Checks the credentials needed by the built-in client credentials flow. A client built with its own
     * {@link cloud.fleethub.sdk.auth.TokenProvider} does not need them.
     *
     * @throws IllegalArgumentException when the client id or secret is missing.
     */
    public Config requireClientCredentials() {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("ClientID is required");
        }
        if (clientSecret == null || clientSecret.isBlank()) {
            throw new IllegalArgumentException("ClientSecret is required");
        }
        return this;
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public String getScope() {
        return scope;
    }

    /**
     * @return workspace selected on connect, or {@code null} for the account default.
     */
    public String getWorkspaceId() {
        return workspaceId;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    /**
     * @return upper bound for a single network attempt.
     */
    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public Duration getTokenLeeway() {
        return tokenLeeway;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public int getPageSize() {
        return pageSize;
    }

    public int getMaxPages() {
        return maxPages;
    }

    public static final class Builder {
        private String baseUrl;
        private String tokenUrl;
        private String clientId;
        private String clientSecret;
        private String scope;
        private String workspaceId;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private Duration tokenLeeway;
        private RetryPolicy retryPolicy;
        private int pageSize;
        private int maxPages;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder tokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder clientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder workspaceId(String workspaceId) {
            this.workspaceId = workspaceId;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder tokenLeeway(Duration tokenLeeway) {
            this.tokenLeeway = tokenLeeway;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public Builder maxPages(int maxPages) {
            this.maxPages = maxPages;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}

package cloud.fleethub.sdk.request;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Describes one logical call against the management API.
 *
 * <p>
 * Descriptors are immutable. Pagination derives a new descriptor per page through {@link #withQuery(String, String)}
 * rather than mutating the original. {@link #validate()} is not invoked by the builder so that a malformed
 * descriptor can still be handed to the executor and come back as a validation outcome.
 * </p>
 */
public final class RequestDescriptor {

    private final HttpMethod method;
    private final String uri;
    private final Map<String, String> query;
    private final Object body;
    private final boolean dryRun;
    private final boolean skipPaginationLimit;
    private final boolean skipSessionCheck;
    private final boolean collection;

    private RequestDescriptor(Builder builder) {
        this.method = builder.method;
        this.uri = builder.uri;
        this.query = Collections.unmodifiableMap(new LinkedHashMap<>(builder.query));
        this.body = builder.body;
        this.dryRun = builder.dryRun;
        this.skipPaginationLimit = builder.skipPaginationLimit;
        this.skipSessionCheck = builder.skipSessionCheck;
        this.collection = builder.collection;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder get(String uri) {
        return builder().method(HttpMethod.GET).uri(uri);
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
            .method(method)
            .uri(uri)
            .body(body)
            .dryRun(dryRun)
            .skipPaginationLimit(skipPaginationLimit)
            .skipSessionCheck(skipSessionCheck)
            .collection(collection);
        builder.query.putAll(query);
        return builder;
    }

    /**
     * @return a copy with {@code name} set to {@code value}, replacing an existing value.
     */
    public RequestDescriptor withQuery(String name, String value) {
        return toBuilder().query(name, value).build();
    }

    public HttpMethod getMethod() {
        return method;
    }

    public String getUri() {
        return uri;
    }

    public Map<String, String> getQuery() {
        return query;
    }

    public Object getBody() {
        return body;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public boolean isSkipPaginationLimit() {
        return skipPaginationLimit;
    }

    public boolean isSkipSessionCheck() {
        return skipSessionCheck;
    }

    public boolean isCollection() {
        return collection;
    }

    /**
     * Checks the descriptor invariants: method and URI present, body present exactly when the method calls for
     * one, and collection semantics only on GET.
     *
     * @throws RequestValidationException describing the first violated rule.
     */
    public void validate() throws RequestValidationException {
        if (method == null) {
            throw new RequestValidationException("method is required");
        }
        if (uri == null || uri.isBlank()) {
            throw new RequestValidationException("uri is required");
        }
        try {
            URI parsed = new URI(uri.trim());
            if (parsed.isAbsolute()) {
                String scheme = parsed.getScheme().toLowerCase(Locale.ROOT);
                if (!scheme.equals("http") && !scheme.equals("https")) {
                    throw new RequestValidationException("unsupported uri scheme " + parsed.getScheme());
                }
                if (parsed.getHost() == null) {
                    throw new RequestValidationException("uri must include a host: " + uri);
                }
            }
        } catch (URISyntaxException ex) {
            throw new RequestValidationException("invalid uri: " + uri, ex);
        }
        if (body == null && method.requiresBody()) {
            throw new RequestValidationException(method + " requires a request body");
        }
        if (body != null && !method.permitsBody()) {
            throw new RequestValidationException(method + " must not carry a request body");
        }
        if (collection && method != HttpMethod.GET) {
            throw new RequestValidationException("collection requests must use GET");
        }
        for (String name : query.keySet()) {
            if (name == null || name.isBlank()) {
                throw new RequestValidationException("query parameter names must be non-empty");
            }
        }
    }

    /**
     * Resolves the target against {@code baseUrl} (relative targets only) and appends the query parameters.
     */
    public URI resolve(String baseUrl) throws RequestValidationException {
        String target = uri.trim();
        String resolved;
        if (URI.create(target).isAbsolute()) {
            resolved = target;
        } else {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new RequestValidationException("relative uri " + target + " needs a base url");
            }
            resolved = baseUrl + (target.startsWith("/") ? target : "/" + target);
        }

        if (!query.isEmpty()) {
            StringBuilder sb = new StringBuilder(resolved);
            sb.append(resolved.contains("?") ? '&' : '?');
            boolean first = true;
            for (Map.Entry<String, String> entry : query.entrySet()) {
                if (!first) {
                    sb.append('&');
                }
                first = false;
                sb.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8));
                if (entry.getValue() != null) {
                    sb.append('=').append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
                }
            }
            resolved = sb.toString();
        }

        try {
            return new URI(resolved);
        } catch (URISyntaxException ex) {
            throw new RequestValidationException("invalid uri: " + resolved, ex);
        }
    }

    @Override
    public String toString() {
        return method + " " + uri + (query.isEmpty() ? "" : " " + query);
    }

    public static final class Builder {
        private HttpMethod method;
        private String uri;
        private final Map<String, String> query = new LinkedHashMap<>();
        private Object body;
        private boolean dryRun;
        private boolean skipPaginationLimit;
        private boolean skipSessionCheck;
        private boolean collection;

        public Builder method(HttpMethod method) {
            this.method = method;
            return this;
        }

        public Builder uri(String uri) {
            this.uri = uri;
            return this;
        }

        public Builder query(String name, String value) {
            this.query.put(name, value);
            return this;
        }

        /**
         * Request body; serialised to JSON with the SDK's shared mapper. A {@code String} or {@code byte[]} is
         * sent verbatim.
         */
        public Builder body(Object body) {
            this.body = body;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder skipPaginationLimit(boolean skipPaginationLimit) {
            this.skipPaginationLimit = skipPaginationLimit;
            return this;
        }

        public Builder skipSessionCheck(boolean skipSessionCheck) {
            this.skipSessionCheck = skipSessionCheck;
            return this;
        }

        /**
         * Marks the target as a collection resource whose pages should be aggregated.
         */
        public Builder collection(boolean collection) {
            this.collection = collection;
            return this;
        }

        public RequestDescriptor build() {
            return new RequestDescriptor(this);
        }
    }
}

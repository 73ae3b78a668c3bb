package cloud.fleethub.sdk.transport;

import cloud.fleethub.sdk.internal.Json;
import cloud.fleethub.sdk.request.HttpMethod;
import cloud.fleethub.sdk.request.RequestValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A fully resolved request, ready to hand to a {@link Transport}: absolute URI, final headers (including the
 * Authorization header when a session applies) and the serialised body.
 */
public final class PreparedRequest {

    public static final String AUTHORIZATION = "Authorization";

    private final HttpMethod method;
    private final URI uri;
    private final Map<String, String> headers;
    private final byte[] body;

    private PreparedRequest(HttpMethod method, URI uri, Map<String, String> headers, byte[] body) {
        this.method = method;
        this.uri = uri;
        this.headers = Collections.unmodifiableMap(headers);
        this.body = body;
    }

    /**
     * @param bearerToken access token for the Authorization header, or {@code null} to send none.
     * @throws RequestValidationException when the body cannot be serialised to JSON.
     */
    public static PreparedRequest of(HttpMethod method, URI uri, Object payload, String bearerToken)
        throws RequestValidationException {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "application/json");
        byte[] body = null;
        if (payload != null) {
            body = serialise(payload);
            headers.put("Content-Type", "application/json");
        }
        if (bearerToken != null && !bearerToken.isBlank()) {
            headers.put(AUTHORIZATION, "Bearer " + bearerToken);
        }
        return new PreparedRequest(method, uri, headers, body);
    }

    private static byte[] serialise(Object payload) throws RequestValidationException {
        if (payload instanceof byte[]) {
            return ((byte[]) payload).clone();
        }
        if (payload instanceof String) {
            return ((String) payload).getBytes(StandardCharsets.UTF_8);
        }
        try {
            return Json.mapper().writeValueAsBytes(payload);
        } catch (JsonProcessingException ex) {
            throw new RequestValidationException("request body is not serialisable: " + ex.getOriginalMessage(), ex);
        }
    }

    public HttpMethod method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public byte[] body() {
        return body == null ? null : body.clone();
    }

    public boolean hasBody() {
        return body != null;
    }

    public boolean hasAuthorization() {
        return headers.containsKey(AUTHORIZATION);
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }
}

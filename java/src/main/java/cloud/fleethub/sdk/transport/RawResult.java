package cloud.fleethub.sdk.transport;

import cloud.fleethub.sdk.internal.Json;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * What came back from one transport attempt: either an HTTP response (any status) or the I/O failure that
 * prevented one.
 */
public final class RawResult {

    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final byte[] body;
    private final IOException transportError;

    private RawResult(int statusCode, Map<String, List<String>> headers, byte[] body, IOException transportError) {
        this.statusCode = statusCode;
        this.headers = headers;
        this.body = body;
        this.transportError = transportError;
    }

    public static RawResult response(int statusCode, Map<String, List<String>> headers, byte[] body) {
        Map<String, List<String>> normalised = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> {
                if (name != null && values != null) {
                    normalised.put(name, List.copyOf(values));
                }
            });
        }
        return new RawResult(statusCode, Collections.unmodifiableMap(normalised),
            body == null ? new byte[0] : body, null);
    }

    public static RawResult response(int statusCode, String body) {
        return response(statusCode, Map.of(), body == null ? null : body.getBytes(StandardCharsets.UTF_8));
    }

    public static RawResult transportFailure(IOException error) {
        return new RawResult(0, Map.of(), new byte[0], Objects.requireNonNull(error, "error"));
    }

    public boolean isTransportFailure() {
        return transportError != null;
    }

    /**
     * @return HTTP status, or {@code 0} for a transport failure.
     */
    public int statusCode() {
        return statusCode;
    }

    public IOException transportError() {
        return transportError;
    }

    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(0));
    }

    public byte[] body() {
        return body.clone();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * @return the body parsed as JSON, or {@code null} when it is empty or not JSON.
     */
    public JsonNode json() {
        if (body.length == 0) {
            return null;
        }
        try {
            return Json.mapper().readTree(body);
        } catch (IOException ex) {
            return null;
        }
    }

    @Override
    public String toString() {
        if (transportError != null) {
            return "RawResult[transport failure: " + transportError.getClass().getSimpleName() + "]";
        }
        return String.format(Locale.ROOT, "RawResult[status=%d, %d bytes]", statusCode, body.length);
    }
}

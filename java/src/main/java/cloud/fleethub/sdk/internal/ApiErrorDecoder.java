package cloud.fleethub.sdk.internal;

import cloud.fleethub.sdk.FleetHubApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Utility for decoding error payloads from FleetHub services.
 *
 * <p>Recognised shapes, in order of preference: {@code {"code","message"}}, {@code {"error":{"code","message"}}},
 * {@code {"error":"...","error_description":"..."}} (OAuth) and {@code {"detail":"..."}}.</p>
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static FleetHubApiException decode(int statusCode, InputStream bodyStream) throws IOException {
        if (bodyStream == null) {
            return new FleetHubApiException(statusCode, null, null);
        }
        return decode(statusCode, bodyStream.readAllBytes());
    }

    public static FleetHubApiException decode(int statusCode, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return new FleetHubApiException(statusCode, null, null);
        }

        try {
            JsonNode node = MAPPER.readTree(bytes);
            return new FleetHubApiException(statusCode, code(node), message(node));
        } catch (IOException ex) {
            String fallback = new String(bytes, StandardCharsets.UTF_8).trim();
            return new FleetHubApiException(statusCode, null, fallback.isEmpty() ? null : fallback);
        }
    }

    /**
     * Extracts the machine-readable error code from a decoded body, or {@code null}.
     */
    public static String code(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String code = Json.text(node, "code");
        if (code != null) {
            return code;
        }
        JsonNode error = node.path("error");
        if (error.isObject()) {
            return Json.text(error, "code");
        }
        // OAuth style: "error" is the code, "error_description" the message
        return Json.text(node, "error");
    }

    /**
     * Extracts the most descriptive human-readable message from a decoded body, or {@code null}.
     */
    public static String message(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String message = Json.text(node, "message");
        if (message != null) {
            return message;
        }
        JsonNode error = node.path("error");
        if (error.isObject()) {
            message = Json.text(error, "message");
            if (message != null) {
                return message;
            }
        }
        message = Json.text(node, "error_description");
        if (message != null) {
            return message;
        }
        return Json.text(node, "detail");
    }
}

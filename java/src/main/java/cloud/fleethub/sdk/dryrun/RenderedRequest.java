package cloud.fleethub.sdk.dryrun;

import cloud.fleethub.sdk.request.HttpMethod;

import java.net.URI;
import java.util.Map;

/**
 * Display form of a request that was not sent. Header values are safe to print: credentials are masked.
 *
 * @param body        pretty-printed JSON body, or {@code null} when the request has none.
 * @param workspaceId workspace the request would run against, {@code null} without a session.
 */
public record RenderedRequest(
    HttpMethod method,
    URI uri,
    Map<String, String> headers,
    String body,
    String workspaceId
) {

    public RenderedRequest {
        headers = Map.copyOf(headers);
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(method).append(' ').append(uri).append('\n');
        headers.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(entry -> sb.append(entry.getKey()).append(": ").append(entry.getValue()).append('\n'));
        if (workspaceId != null) {
            sb.append("# workspace ").append(workspaceId).append('\n');
        }
        if (body != null) {
            sb.append('\n').append(body).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return describe();
    }
}

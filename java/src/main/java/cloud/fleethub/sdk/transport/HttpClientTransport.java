package cloud.fleethub.sdk.transport;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link Transport} backed by the JDK {@link HttpClient}.
 */
public final class HttpClientTransport implements Transport {

    private static final Logger LOGGER = Logger.getLogger(HttpClientTransport.class.getName());

    private final HttpClient client;

    public HttpClientTransport(HttpClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public RawResult send(PreparedRequest request, Duration timeout) throws InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(request.uri())
            .timeout(timeout);

        if (request.hasBody()) {
            builder.method(request.method().name(), HttpRequest.BodyPublishers.ofByteArray(request.body()));
        } else {
            builder.method(request.method().name(), HttpRequest.BodyPublishers.noBody());
        }
        request.headers().forEach(builder::header);

        try {
            HttpResponse<byte[]> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
            LOGGER.fine(() -> String.format(Locale.ROOT,
                "[fleethub-sdk] %s %s -> %d", request.method(), request.uri(), response.statusCode()));
            return RawResult.response(response.statusCode(), response.headers().map(), response.body());
        } catch (IOException ex) {
            LOGGER.fine(() -> String.format(Locale.ROOT,
                "[fleethub-sdk] %s %s failed: %s", request.method(), request.uri(), ex));
            return RawResult.transportFailure(ex);
        }
    }
}

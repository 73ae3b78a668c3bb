package cloud.fleethub.sdk.dryrun;

import cloud.fleethub.sdk.internal.Json;
import cloud.fleethub.sdk.request.RequestDescriptor;
import cloud.fleethub.sdk.request.RequestValidationException;
import cloud.fleethub.sdk.session.Session;
import cloud.fleethub.sdk.transport.PreparedRequest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Builds the exact request the executor would send and turns it into a {@link RenderedRequest} without touching
 * the network. The Authorization header is masked.
 */
public final class DryRunRenderer {

    private static final Logger LOGGER = Logger.getLogger(DryRunRenderer.class.getName());

    public static final String MASKED_BEARER = "Bearer ********";

    private final String baseUrl;

    public DryRunRenderer(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    /**
     * @param session resolved session, or {@code null} when the descriptor skips the session check.
     * @throws RequestValidationException when the request cannot be resolved or its body serialised.
     */
    public RenderedRequest render(RequestDescriptor descriptor, Session session) throws RequestValidationException {
        PreparedRequest prepared = PreparedRequest.of(
            descriptor.getMethod(),
            descriptor.resolve(baseUrl),
            descriptor.getBody(),
            session == null ? null : session.accessToken());
        RenderedRequest rendered = render(prepared, session);
        LOGGER.info(() -> String.format(Locale.ROOT, "[fleethub-sdk] dry run: %s %s (not sent)",
            rendered.method(), rendered.uri()));
        return rendered;
    }

    RenderedRequest render(PreparedRequest prepared, Session session) {
        Map<String, String> headers = new LinkedHashMap<>(prepared.headers());
        headers.computeIfPresent(PreparedRequest.AUTHORIZATION, (name, value) -> MASKED_BEARER);

        String body = prepared.hasBody() ? prettyBody(prepared.body()) : null;
        return new RenderedRequest(prepared.method(), prepared.uri(), headers, body,
            session == null ? null : session.workspaceId());
    }

    private static String prettyBody(byte[] bytes) {
        try {
            return Json.pretty(Json.mapper().readTree(bytes));
        } catch (IOException ex) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }
}

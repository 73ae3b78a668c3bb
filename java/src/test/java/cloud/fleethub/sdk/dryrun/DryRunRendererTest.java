package cloud.fleethub.sdk.dryrun;

import cloud.fleethub.sdk.request.HttpMethod;
import cloud.fleethub.sdk.request.RequestDescriptor;
import cloud.fleethub.sdk.session.Session;
import cloud.fleethub.sdk.transport.PreparedRequest;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DryRunRendererTest {

    private final DryRunRenderer renderer = new DryRunRenderer("https://api.test");
    private final Session session = new Session("secret-token-value", Instant.parse("2030-01-01T00:00:00Z"),
        "ws-edge", "Edge", "acct-1");

    @Test
    void rendersExactRequestWithMaskedCredentials() throws Exception {
        RequestDescriptor descriptor = RequestDescriptor.builder()
            .method(HttpMethod.PATCH)
            .uri("/v1/servers/srv-1")
            .query("force", "true")
            .body(Map.of("state", "maintenance"))
            .dryRun(true)
            .build();

        RenderedRequest rendered = renderer.render(descriptor, session);

        assertEquals(HttpMethod.PATCH, rendered.method());
        assertEquals("https://api.test/v1/servers/srv-1?force=true", rendered.uri().toString());
        assertEquals(DryRunRenderer.MASKED_BEARER, rendered.headers().get(PreparedRequest.AUTHORIZATION));
        assertEquals("application/json", rendered.headers().get("Content-Type"));
        assertEquals("ws-edge", rendered.workspaceId());
        assertTrue(rendered.body().contains("\"state\" : \"maintenance\""));

        String described = rendered.describe();
        assertFalse(described.contains("secret-token-value"));
        assertTrue(described.startsWith("PATCH https://api.test/v1/servers/srv-1?force=true\n"));
        assertTrue(described.contains("# workspace ws-edge"));
        assertEquals(described, rendered.toString());
    }

    @Test
    void rendersAnonymousRequestWithoutBody() throws Exception {
        RenderedRequest rendered = renderer.render(RequestDescriptor.get("/v1/health").build(), null);

        assertNull(rendered.body());
        assertNull(rendered.workspaceId());
        assertFalse(rendered.headers().containsKey(PreparedRequest.AUTHORIZATION));
        assertEquals("GET https://api.test/v1/health\nAccept: application/json\n", rendered.describe());
    }

    @Test
    void verbatimBodyIsKeptWhenNotJson() throws Exception {
        RenderedRequest rendered = renderer.render(RequestDescriptor.builder()
            .method(HttpMethod.PUT)
            .uri("/v1/firmware/notes")
            .body("plain release notes")
            .build(), session);

        assertEquals("plain release notes", rendered.body());
    }
}

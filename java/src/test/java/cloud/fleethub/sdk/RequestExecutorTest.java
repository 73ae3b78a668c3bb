package cloud.fleethub.sdk;

import cloud.fleethub.sdk.dryrun.DryRunRenderer;
import cloud.fleethub.sdk.dryrun.RenderedRequest;
import cloud.fleethub.sdk.outcome.Diagnostic;
import cloud.fleethub.sdk.outcome.DiagnosticContext;
import cloud.fleethub.sdk.outcome.ErrorClassifier;
import cloud.fleethub.sdk.outcome.Outcome;
import cloud.fleethub.sdk.paging.CursorPageReader;
import cloud.fleethub.sdk.paging.PaginationAggregator;
import cloud.fleethub.sdk.request.HttpMethod;
import cloud.fleethub.sdk.request.RequestDescriptor;
import cloud.fleethub.sdk.retry.RetryEngine;
import cloud.fleethub.sdk.retry.RetryPolicy;
import cloud.fleethub.sdk.session.SessionStore;
import cloud.fleethub.sdk.transport.PreparedRequest;
import cloud.fleethub.sdk.transport.RawResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class RequestExecutorTest {

    private static final String BASE_URL = "https://api.test";

    private MutableClock clock;
    private FakeTokenProvider tokens;
    private SessionStore sessions;
    private ScriptedTransport transport;
    private DiagnosticContext diagnostics;
    private RequestExecutor executor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        tokens = new FakeTokenProvider(clock, Duration.ofMinutes(10));
        sessions = new SessionStore(tokens, Duration.ofSeconds(30), clock);
        transport = new ScriptedTransport();
        diagnostics = new DiagnosticContext();
        ErrorClassifier classifier = new ErrorClassifier();
        RetryEngine engine = new RetryEngine(transport, classifier, RetryPolicy.defaults(), Duration.ofSeconds(5),
            (delay, cancellation) -> cancellation.isCancelled(), diagnostics);
        PaginationAggregator aggregator = new PaginationAggregator(new CursorPageReader(), 2, 10);
        executor = new RequestExecutor(BASE_URL, sessions, engine, aggregator, classifier, diagnostics);
    }

    @Test
    void dryRunSendsNothingAndMasksToken() throws Exception {
        sessions.connect("ws-prod");
        RequestDescriptor create = RequestDescriptor.builder()
            .method(HttpMethod.POST)
            .uri("/v1/workspaces/ws-prod/users")
            .body(Map.of("email", "ops@example.com"))
            .dryRun(true)
            .build();

        Outcome outcome = executor.execute(create);

        RenderedRequest rendered = assertInstanceOf(Outcome.DryRun.class, outcome).request();
        assertEquals(0, transport.calls());
        assertEquals(HttpMethod.POST, rendered.method());
        assertEquals("https://api.test/v1/workspaces/ws-prod/users", rendered.uri().toString());
        assertEquals(DryRunRenderer.MASKED_BEARER, rendered.headers().get(PreparedRequest.AUTHORIZATION));
        assertEquals("ws-prod", rendered.workspaceId());
        assertTrue(rendered.body().contains("ops@example.com"));
        assertFalse(rendered.describe().contains(tokens.tokenValue(1)));
        assertTrue(diagnostics.lastFailure().isEmpty());
    }

    @Test
    void dryRunOfCollectionShowsFirstPageRequest() throws Exception {
        sessions.connect("ws-prod");

        Outcome outcome = executor.execute(RequestDescriptor.get("/v1/devices").collection(true).dryRun(true).build());

        RenderedRequest rendered = ((Outcome.DryRun) outcome).request();
        assertEquals("https://api.test/v1/devices?limit=2", rendered.uri().toString());
        assertEquals(0, transport.calls());
    }

    @Test
    void validationRunsBeforeDryRun() throws Exception {
        sessions.connect(null);
        RequestDescriptor missingBody = RequestDescriptor.builder()
            .method(HttpMethod.PUT)
            .uri("/v1/devices/dev-1")
            .dryRun(true)
            .build();

        Outcome outcome = executor.execute(missingBody);

        Outcome.Failed failed = assertInstanceOf(Outcome.Failed.class, outcome);
        assertEquals(Outcome.Failed.Reason.VALIDATION, failed.reason());
        assertEquals(0, transport.calls());
        assertEquals(failed.detail(), diagnostics.lastFailure().orElseThrow());
    }

    @Test
    void noSessionIsReportedWithoutSending() {
        Outcome outcome = executor.execute(RequestDescriptor.get("/v1/devices").build());

        Outcome.Authentication auth = assertInstanceOf(Outcome.Authentication.class, outcome);
        assertEquals(Outcome.Authentication.Reason.NO_SESSION, auth.reason());
        assertEquals(0, transport.calls());
    }

    @Test
    void secondRejectionIsFinal() throws Exception {
        sessions.connect("ws-1");
        transport.always(RawResult.response(401, "{\"code\":\"TOKEN_INVALID\",\"message\":\"token rejected\"}"));

        Outcome outcome = executor.execute(RequestDescriptor.get("/v1/devices/dev-1").build());

        Outcome.Authentication auth = assertInstanceOf(Outcome.Authentication.class, outcome);
        assertEquals(Outcome.Authentication.Reason.REJECTED, auth.reason());
        assertEquals("token rejected", auth.detail().message());
        assertEquals(2, transport.calls());
        assertEquals(1, tokens.refreshes());
        assertEquals("Bearer token-1", transport.request(0).headers().get(PreparedRequest.AUTHORIZATION));
        assertEquals("Bearer token-2", transport.request(1).headers().get(PreparedRequest.AUTHORIZATION));
    }

    @Test
    void rejectionRecoversAfterRefresh() throws Exception {
        sessions.connect("ws-1");
        transport.then(RawResult.response(401, ""))
            .then(RawResult.response(200, "{\"id\":\"dev-1\",\"state\":\"online\"}"));

        Outcome outcome = executor.execute(RequestDescriptor.get("/v1/devices/dev-1").build());

        Outcome.Complete complete = assertInstanceOf(Outcome.Complete.class, outcome);
        assertEquals("online", complete.payload().path("state").asText());
        assertEquals(2, transport.calls());
        assertEquals("token-2", sessions.resolveSession().accessToken());
    }

    @Test
    void rejectionAfterCancellationDoesNotRefresh() throws Exception {
        sessions.connect("ws-1");
        CancellationToken cancellation = CancellationToken.create();
        transport.then(request -> {
            cancellation.cancel("operator stop");
            return RawResult.response(401, "");
        });

        Outcome outcome = executor.execute(RequestDescriptor.get("/v1/devices/dev-1").build(), cancellation);

        Outcome.Cancelled cancelled = assertInstanceOf(Outcome.Cancelled.class, outcome);
        assertEquals("operator stop", cancelled.message());
        assertEquals(0, tokens.refreshes());
        assertEquals(1, transport.calls());
    }

    @Test
    void staleSessionIsRefreshedBeforeSending() throws Exception {
        sessions.connect("ws-1");
        clock.advance(Duration.ofMinutes(9).plusSeconds(45));

        Outcome outcome = executor.execute(RequestDescriptor.get("/v1/devices").build());

        assertEquals(Outcome.Category.COMPLETE, outcome.category());
        assertEquals(1, tokens.refreshes());
        assertEquals(1, transport.calls());
        assertEquals("Bearer token-2", transport.request(0).headers().get(PreparedRequest.AUTHORIZATION));
    }

    @Test
    void failedRefreshIsAnAuthenticationOutcome() throws Exception {
        sessions.connect("ws-1");
        clock.advance(Duration.ofMinutes(10));
        tokens.failRefresh(true);

        Outcome outcome = executor.execute(RequestDescriptor.get("/v1/devices").build());

        Outcome.Authentication auth = assertInstanceOf(Outcome.Authentication.class, outcome);
        assertEquals(Outcome.Authentication.Reason.REFRESH_FAILED, auth.reason());
        assertEquals(new Diagnostic("client credentials revoked", "INVALID_CLIENT", 401), auth.detail());
        assertEquals(0, transport.calls());
    }

    @Test
    void skippedSessionCheckSendsAnonymously() {
        transport.then(RawResult.response(200, "{\"status\":\"ok\"}"));

        Outcome outcome = executor.execute(RequestDescriptor.get("/v1/health").skipSessionCheck(true).build());

        assertEquals(Outcome.Category.COMPLETE, outcome.category());
        assertFalse(transport.request(0).hasAuthorization());
    }

    @Test
    void diagnosticContextHoldsLastFailure() throws Exception {
        sessions.connect("ws-1");
        transport.then(RawResult.response(404, "{\"code\":\"NOT_FOUND\",\"message\":\"device dev-9 not found\"}"));

        Outcome outcome = executor.execute(RequestDescriptor.get("/v1/devices/dev-9").build());

        assertEquals(Outcome.Failed.Reason.BUSINESS, ((Outcome.Failed) outcome).reason());
        assertEquals("device dev-9 not found", diagnostics.lastFailure().orElseThrow().message());

        executor.execute(RequestDescriptor.get("/v1/devices/dev-1").build());
        assertTrue(diagnostics.lastFailure().isEmpty());
    }

    @Test
    void recoveredAttemptLeavesItsDiagnostic() throws Exception {
        sessions.connect("ws-1");
        transport.then(RawResult.response(503, "{\"message\":\"node draining\"}"))
            .then(RawResult.response(200, "{}"));

        Outcome outcome = executor.execute(RequestDescriptor.get("/v1/devices").build());

        assertEquals(Outcome.Category.COMPLETE, outcome.category());
        assertEquals("node draining", diagnostics.lastFailure().orElseThrow().message());
    }

    @Test
    void transientFailureRetriesOnlyThatPage() throws Exception {
        sessions.connect("ws-1");
        AtomicBoolean failedOnce = new AtomicBoolean();
        transport.always(request -> {
            String cursor = ScriptedTransport.queryParam(request.uri(), "cursor");
            if ("c4".equals(cursor) && failedOnce.compareAndSet(false, true)) {
                return RawResult.response(503, "");
            }
            return devicePage(request, 10);
        });

        Outcome outcome = executor.execute(RequestDescriptor.get("/v1/devices").collection(true).build());

        Outcome.Complete complete = assertInstanceOf(Outcome.Complete.class, outcome);
        assertEquals(10, complete.items().size());
        assertEquals(5, complete.pageCount());
        assertEquals(6, transport.calls());
        List<String> cursors = new ArrayList<>();
        transport.requests().forEach(r -> cursors.add(ScriptedTransport.queryParam(r.uri(), "cursor")));
        assertEquals(Arrays.asList(null, "c2", "c4", "c4", "c6", "c8"), cursors);
        for (int i = 0; i < 10; i++) {
            assertEquals("dev-" + i, complete.items().get(i).path("id").asText());
        }
    }

    @Test
    void cancellationStopsPagination() throws Exception {
        sessions.connect("ws-1");
        CancellationToken cancellation = CancellationToken.create();
        transport.always(request -> {
            RawResult page = devicePage(request, 10);
            if (transport.calls() == 2) {
                cancellation.cancel("shutdown");
            }
            return page;
        });

        Outcome outcome = executor.execute(RequestDescriptor.get("/v1/devices").collection(true).build(), cancellation);

        Outcome.Cancelled cancelled = assertInstanceOf(Outcome.Cancelled.class, outcome);
        assertEquals("shutdown", cancelled.message());
        assertEquals(2, cancelled.pagesFetched());
        assertEquals(4, cancelled.partialItems().size());
        assertEquals(2, transport.calls());
    }

    @Test
    void multiStatusBecomesPartialSuccess() throws Exception {
        sessions.connect("ws-1");
        transport.then(RawResult.response(207, "{\"results\":["
            + "{\"id\":\"dev-1\",\"status\":200},"
            + "{\"id\":\"dev-2\",\"status\":422,\"code\":\"FIRMWARE_INCOMPATIBLE\",\"message\":\"unsupported model\"}]}"));
        RequestDescriptor rollout = RequestDescriptor.builder()
            .method(HttpMethod.POST)
            .uri("/v1/firmware/rollouts")
            .body(Map.of("devices", List.of("dev-1", "dev-2"), "version", "4.2.0"))
            .build();

        Outcome outcome = executor.execute(rollout);

        Outcome.PartialSuccess partial = assertInstanceOf(Outcome.PartialSuccess.class, outcome);
        assertEquals(1, partial.succeeded().size());
        assertEquals("dev-2", partial.failed().get(0).id());
        assertEquals("FIRMWARE_INCOMPATIBLE", diagnostics.lastFailure().orElseThrow().code());
        String sent = new String(transport.request(0).body(), StandardCharsets.UTF_8);
        assertTrue(sent.contains("4.2.0"));
    }

    @Test
    void concurrentRejectionsShareOneRefresh() throws Exception {
        sessions.connect("ws-1");
        transport.always(request -> "Bearer token-1".equals(request.headers().get(PreparedRequest.AUTHORIZATION))
            ? RawResult.response(401, "")
            : RawResult.response(200, "{}"));

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Outcome>> calls = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                calls.add(() -> executor.execute(RequestDescriptor.get("/v1/devices").build()));
            }
            for (Future<Outcome> result : pool.invokeAll(calls, 10, TimeUnit.SECONDS)) {
                assertEquals(Outcome.Category.COMPLETE, result.get().category());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, tokens.refreshes());
    }

    private static RawResult devicePage(PreparedRequest request, int total) {
        String cursor = ScriptedTransport.queryParam(request.uri(), "cursor");
        int limit = Integer.parseInt(ScriptedTransport.queryParam(request.uri(), "limit"));
        int offset = cursor == null ? 0 : Integer.parseInt(cursor.substring(1));
        int end = Math.min(total, offset + limit);
        StringBuilder body = new StringBuilder("{\"data\":[");
        for (int i = offset; i < end; i++) {
            body.append(i > offset ? "," : "").append("{\"id\":\"dev-").append(i).append("\"}");
        }
        body.append(']');
        if (end < total) {
            body.append(",\"next_cursor\":\"c").append(end).append('"');
        }
        return RawResult.response(200, body.append('}').toString());
    }
}

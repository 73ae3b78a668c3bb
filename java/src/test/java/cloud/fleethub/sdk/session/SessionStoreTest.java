package cloud.fleethub.sdk.session;

import cloud.fleethub.sdk.FakeTokenProvider;
import cloud.fleethub.sdk.FleetHubException;
import cloud.fleethub.sdk.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionStoreTest {

    private MutableClock clock;
    private FakeTokenProvider tokens;
    private SessionStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        tokens = new FakeTokenProvider(clock, Duration.ofHours(1));
        store = new SessionStore(tokens, Duration.ofSeconds(30), clock);
    }

    @Test
    void resolveFailsBeforeConnect() {
        assertThrows(NoSessionException.class, store::resolveSession);
        assertTrue(store.current().isEmpty());
    }

    @Test
    void connectBindsWorkspace() throws Exception {
        Session session = store.connect("ws-7");

        assertEquals("ws-7", session.workspaceId());
        assertEquals("Workspace ws-7", session.workspaceName());
        assertEquals("acct-1", session.accountId());
        assertSame(session, store.resolveSession());
        assertFalse(store.isStale(session));
        assertFalse(session.toString().contains(session.accessToken()));
    }

    @Test
    void sessionBecomesStaleWithinLeeway() throws Exception {
        Session session = store.connect(null);

        clock.advance(Duration.ofMinutes(59).plusSeconds(31));
        assertTrue(store.isStale(session));
        assertSame(session, store.resolveSession());
    }

    @Test
    void switchWorkspaceReplacesSession() throws Exception {
        Session first = store.connect("ws-1");
        Session switched = store.switchWorkspace("ws-2");

        assertEquals("ws-2", switched.workspaceId());
        assertNotEquals(first.accessToken(), switched.accessToken());
        assertSame(switched, store.resolveSession());
    }

    @Test
    void switchWorkspaceRequiresSession() {
        assertThrows(NoSessionException.class, () -> store.switchWorkspace("ws-2"));
    }

    @Test
    void switchWorkspaceRejectsTokenBoundElsewhere() throws Exception {
        Session original = store.connect("ws-1");
        tokens.bindTo("ws-other");

        FleetHubException ex = assertThrows(FleetHubException.class, () -> store.switchWorkspace("ws-2"));
        assertTrue(ex.getMessage().contains("ws-other"));
        assertSame(original, store.resolveSession());
    }

    @Test
    void switchRejectsTokenWithoutWorkspaceClaim() throws Exception {
        Session original = store.connect("ws-1");
        tokens.unbound();

        FleetHubException ex = assertThrows(FleetHubException.class, () -> store.switchWorkspace("ws-other"));
        assertTrue(ex.getMessage().contains("ws-other"));
        assertSame(original, store.resolveSession());
        assertEquals("ws-1", store.resolveSession().workspaceId());
    }

    @Test
    void disconnectClearsSessionAndCachedCredentials() throws Exception {
        store.connect("ws-1");
        store.disconnect();

        assertThrows(NoSessionException.class, store::resolveSession);
        assertEquals(1, tokens.invalidations());
        assertThrows(NoSessionException.class, () -> store.refreshSession(
            new Session("stale", clock.instant(), "ws-1", null, null)));
    }

    @Test
    void refreshReturnsNewerSessionWithoutReissuing() throws Exception {
        Session original = store.connect("ws-1");
        clock.advance(Duration.ofHours(2));

        Session refreshed = store.refreshSession(original);
        Session again = store.refreshSession(original);

        assertSame(refreshed, again);
        assertEquals(1, tokens.refreshes());
        assertFalse(store.isStale(refreshed));
    }

    @Test
    void failedRefreshKeepsPreviousSession() throws Exception {
        Session original = store.connect("ws-1");
        clock.advance(Duration.ofHours(2));
        tokens.failRefresh(true);

        assertThrows(FleetHubException.class, () -> store.refreshSession(original));
        assertSame(original, store.resolveSession());
    }

    @Test
    void concurrentRefreshesAreSingleFlight() throws Exception {
        Session original = store.connect("ws-1");
        clock.advance(Duration.ofHours(2));

        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        tokens.blockRefresh(entered, release);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Session> first = pool.submit(() -> store.refreshSession(original));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            Future<Session> second = pool.submit(() -> store.refreshSession(original));

            release.countDown();
            Session a = first.get(5, TimeUnit.SECONDS);
            Session b = second.get(5, TimeUnit.SECONDS);

            assertEquals(1, tokens.refreshes());
            assertEquals(a.accessToken(), b.accessToken());
            assertNotEquals(original.accessToken(), a.accessToken());
        } finally {
            pool.shutdownNow();
        }
    }
}

package xrl.java.limiter;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import xrl.core.clock.ManualClock;
import xrl.core.clock.SystemClock;
import xrl.core.config.GroupConfig;
import xrl.core.config.GroupConfigs;
import xrl.core.config.LimiterConfiguration;
import xrl.core.config.LimiterSettings;
import xrl.core.model.RateLimitGroup;
import xrl.java.async.HealthStatus;
import xrl.java.endpoint.PrefixEndpointGroupResolver;
import xrl.java.engine.Admission;
import xrl.java.engine.RateLimitListener;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the facade with its real background tasks.
 */
class UnifiedRateLimiterTest {

    private static final long MS = 1_000_000L;

    private UnifiedRateLimiter limiter;

    @AfterEach
    void tearDown() {
        if (limiter != null) {
            limiter.close();
        }
    }

    private static LimiterConfiguration configuration(LimiterSettings settings, RateLimitGroup group, GroupConfig config) {
        Map<RateLimitGroup, GroupConfig> groups = new EnumMap<>(GroupConfigs.defaults());
        groups.put(group, config);
        return new LimiterConfiguration(settings, groups);
    }

    @Test
    void testAcquireGrantsAndCommitShowsInStatus() {
        limiter = UnifiedRateLimiter.builder().build();

        try (Admission admission = limiter.acquire(RateLimitGroup.PUBLIC_READ, "/v1/ticker").join()) {
            assertTrue(admission.isGranted());
            admission.commit();
        }

        LimiterStatus status = limiter.getStatus();
        assertTrue(status.running());
        GroupStatus publicRead = status.group(RateLimitGroup.PUBLIC_READ);
        assertEquals(10.0, publicRead.baseRps(), 1e-9);
        assertEquals(1.0, publicRead.currentRatio(), 1e-9);
        assertEquals(1, publicRead.burstWindowOccupancy());
        assertTrue(publicRead.tatPrimaryNanos() > 0);
        assertTrue(publicRead.tatSecondaryNanos().isEmpty());
        assertTrue(status.group(RateLimitGroup.WEBSOCKET).tatSecondaryNanos().isPresent());
        assertEquals(0, status.activeTimeouts());
    }

    @Test
    void testSequentialCallsArePacedAtEmissionInterval() throws Exception {
        // burst 1 at 20/s: one call per 50ms
        limiter = UnifiedRateLimiter.builder()
            .configuration(configuration(LimiterSettings.defaults(), RateLimitGroup.PRIVATE_ORDER,
                GroupConfig.singleLimit(20.0, 1)))
            .clock(SystemClock.instance())
            .build();

        int calls = 6;
        long first = 0L;
        long last = 0L;
        for (int i = 0; i < calls; i++) {
            Admission admission = limiter.acquire(RateLimitGroup.PRIVATE_ORDER, "/v1/orders").get(2, TimeUnit.SECONDS);
            assertTrue(admission.isGranted());
            last = System.nanoTime();
            if (i == 0) {
                first = last;
            }
            admission.commit();
        }

        long tolerance = 5 * MS;
        assertTrue(last - first >= (calls - 1) * 50 * MS - tolerance, "elapsed " + (last - first));
    }

    @Test
    void testBurstIsFreeThenNextCallerWaits() throws Exception {
        ManualClock clock = new ManualClock(0L);
        limiter = UnifiedRateLimiter.builder()
            .configuration(configuration(LimiterSettings.defaults(), RateLimitGroup.PRIVATE_ORDER,
                GroupConfig.singleLimit(4.0, 4)))
            .clock(clock)
            .build();

        for (int i = 0; i < 4; i++) {
            CompletableFuture<Admission> future = limiter.acquire(RateLimitGroup.PRIVATE_ORDER, "/v1/orders");
            assertTrue(future.isDone(), "burst call " + i + " should not wait");
            future.join().commit();
        }

        CompletableFuture<Admission> fifth = limiter.acquire(RateLimitGroup.PRIVATE_ORDER, "/v1/orders");
        Thread.sleep(50);
        assertFalse(fifth.isDone());
        assertEquals(1, limiter.getStatus().group(RateLimitGroup.PRIVATE_ORDER).queueDepth());

        clock.advance(Duration.ofSeconds(1));
        Admission admission = fifth.get(2, TimeUnit.SECONDS);
        assertTrue(admission.isGranted());
        assertTrue(admission.waitedNanos() > 0);
    }

    @Test
    void testNotify429ReducesRatioAndHonorsRetryAfter() throws Exception {
        ManualClock clock = new ManualClock(0L);
        limiter = UnifiedRateLimiter.builder().clock(clock).build();
        limiter.start();

        limiter.notify429(RateLimitGroup.PUBLIC_READ, "/v1/ticker", Duration.ofSeconds(2));

        GroupStatus status = limiter.getStatus().group(RateLimitGroup.PUBLIC_READ);
        assertEquals(0.8, status.currentRatio(), 1e-9);
        assertEquals(1L, status.violationCount());
        assertEquals(8.0, status.effectiveRps(), 1e-9);

        CompletableFuture<Admission> held = limiter.acquire(RateLimitGroup.PUBLIC_READ, "/v1/ticker");
        Thread.sleep(50);
        assertFalse(held.isDone());

        clock.advance(Duration.ofSeconds(2));
        Admission admission = held.get(2, TimeUnit.SECONDS);
        assertTrue(admission.isGranted());
        assertEquals(2_000 * MS, admission.waitedNanos());
    }

    @Test
    void testListenerSeesViolationsAndStatusCountsRequests() {
        List<String> events = new CopyOnWriteArrayList<>();
        limiter = UnifiedRateLimiter.builder()
            .clock(new ManualClock(0L))
            .callbackExecutor(Runnable::run)
            .listener(new RateLimitListener() {
                @Override
                public void on429Detected(RateLimitGroup group, String endpointTag, Duration retryAfter) {
                    events.add("429 " + endpointTag);
                }

                @Override
                public void onRateReduced(RateLimitGroup group, double oldRatio, double newRatio) {
                    events.add("reduced " + group.tag());
                }
            })
            .build();

        limiter.acquire(RateLimitGroup.PRIVATE_DEFAULT, "/v1/accounts").join().commit();
        limiter.acquire(RateLimitGroup.PRIVATE_DEFAULT, "/v1/accounts").join().commit();
        limiter.notify429(RateLimitGroup.PRIVATE_DEFAULT, "/v1/accounts", null);

        assertEquals(List.of("429 /v1/accounts", "reduced private_default"), events);
        GroupStatus status = limiter.getStatus().group(RateLimitGroup.PRIVATE_DEFAULT);
        assertEquals(2L, status.totalRequests());
        assertEquals(0, status.maxConcurrentWaiters());
    }

    @Test
    void testWaiterTimesOutSoftly() throws Exception {
        ManualClock clock = new ManualClock(0L);
        LimiterSettings settings = LimiterSettings.defaults().withWaiterTimeout(Duration.ofMillis(200));
        limiter = UnifiedRateLimiter.builder()
            .configuration(configuration(settings, RateLimitGroup.PRIVATE_ORDER, GroupConfig.singleLimit(1.0, 1)))
            .clock(clock)
            .build();

        limiter.acquire(RateLimitGroup.PRIVATE_ORDER, "/v1/orders").join().commit();

        long start = System.nanoTime();
        Admission admission = limiter.acquire(RateLimitGroup.PRIVATE_ORDER, "/v1/orders").get(2, TimeUnit.SECONDS);
        long elapsed = System.nanoTime() - start;

        assertEquals(Admission.Outcome.TIMED_OUT, admission.outcome());
        assertTrue(elapsed <= 200 * MS + 1_000 * MS, "suspended for " + elapsed);
        GroupStatus status = limiter.getStatus().group(RateLimitGroup.PRIVATE_ORDER);
        assertEquals(1L, status.waitStats().timeouts());
        assertEquals(0, status.queueDepth());
    }

    @Test
    void testCloseCancelsQueuedCallers() throws Exception {
        ManualClock clock = new ManualClock(0L);
        limiter = UnifiedRateLimiter.builder()
            .configuration(configuration(LimiterSettings.defaults(), RateLimitGroup.PRIVATE_ORDER,
                GroupConfig.singleLimit(1.0, 1)))
            .clock(clock)
            .build();
        limiter.acquire(RateLimitGroup.PRIVATE_ORDER, "/v1/orders").join().commit();
        CompletableFuture<Admission> queued = limiter.acquire(RateLimitGroup.PRIVATE_ORDER, "/v1/orders");

        limiter.close();

        assertEquals(Admission.Outcome.CANCELLED, queued.get(2, TimeUnit.SECONDS).outcome());
        assertTrue(limiter.isClosed());
        assertFalse(limiter.getStatus().running());
        assertThrows(IllegalStateException.class,
            () -> limiter.acquire(RateLimitGroup.PRIVATE_ORDER, "/v1/orders"));
    }

    @Test
    void testAcquireByEndpoint() {
        limiter = UnifiedRateLimiter.builder()
            .endpointResolver(PrefixEndpointGroupResolver.builder()
                .exact("POST", "/v1/orders", RateLimitGroup.PRIVATE_ORDER)
                .prefix("/v1/", RateLimitGroup.PRIVATE_DEFAULT)
                .build())
            .build();

        Admission admission = limiter.acquire("/v1/orders", "post").join();
        assertEquals(RateLimitGroup.PRIVATE_ORDER, admission.group());
        assertEquals("/v1/orders", admission.endpointTag());
        admission.abort();

        assertEquals(RateLimitGroup.PRIVATE_DEFAULT, limiter.acquire("/v1/accounts", "GET").join().group());
    }

    @Test
    void testAcquireByEndpointWithoutResolverIsRejected() {
        limiter = UnifiedRateLimiter.builder().build();
        assertThrows(IllegalStateException.class, () -> limiter.acquire("/v1/orders", "POST"));
        assertThrows(IllegalArgumentException.class, () -> limiter.acquire((RateLimitGroup) null, "tag"));
    }

    @Test
    void testHealthAfterStart() {
        limiter = UnifiedRateLimiter.builder().build();
        limiter.start();
        limiter.start();

        assertEquals(RateLimitGroup.values().length, limiter.health().size());
        limiter.health().values().forEach(health -> assertEquals(HealthStatus.HEALTHY, health.status()));
    }
}

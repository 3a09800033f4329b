package xrl.java.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xrl.core.clock.ManualClock;
import xrl.core.config.ConfigurationException;
import xrl.core.config.GroupConfig;
import xrl.core.config.GroupConfigs;
import xrl.core.model.AdmissionDecision;
import xrl.core.model.RateLimitGroup;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GroupRegistry and Admission settlement.
 *
 * <p>Tests cover:
 * <ul>
 *   <li>Reserve / commit / abort through the registry</li>
 *   <li>Group isolation</li>
 *   <li>Violations, Retry-After and recovery</li>
 *   <li>Listener events</li>
 *   <li>Validation</li>
 * </ul>
 */
class GroupRegistryTest {

    private static final long MS = 1_000_000L;

    private ManualClock clock;
    private GroupRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(0L);
        Map<RateLimitGroup, GroupConfig> configs = new EnumMap<>(GroupConfigs.defaults());
        configs.put(RateLimitGroup.PRIVATE_ORDER, GroupConfig.singleLimit(2.0, 2));
        registry = new GroupRegistry(clock, configs);
    }

    @Test
    void testGrantsUpToBurst_thenDenies() {
        for (int i = 0; i < 2; i++) {
            AdmissionDecision decision = registry.tryAdmit(RateLimitGroup.PRIVATE_ORDER);
            assertTrue(decision.granted());
            registry.commit(decision.reservation());
        }

        AdmissionDecision third = registry.tryAdmit(RateLimitGroup.PRIVATE_ORDER);
        assertFalse(third.granted());
        assertTrue(third.waitNanos() > 0);
        assertEquals(2, registry.snapshot(RateLimitGroup.PRIVATE_ORDER).burstWindowOccupancy());
    }

    @Test
    void testGroupsAreIsolated() {
        registry.tryAdmit(RateLimitGroup.PRIVATE_ORDER);
        registry.tryAdmit(RateLimitGroup.PRIVATE_ORDER);
        assertFalse(registry.tryAdmit(RateLimitGroup.PRIVATE_ORDER).granted());

        assertTrue(registry.tryAdmit(RateLimitGroup.PUBLIC_READ).granted());
    }

    @Test
    void testAbortReleasesSlot() {
        AdmissionDecision first = registry.tryAdmit(RateLimitGroup.PRIVATE_ORDER);
        AdmissionDecision second = registry.tryAdmit(RateLimitGroup.PRIVATE_ORDER);
        registry.abort(first.reservation());

        assertTrue(registry.tryAdmit(RateLimitGroup.PRIVATE_ORDER).granted());
        assertEquals(2, registry.snapshot(RateLimitGroup.PRIVATE_ORDER).pendingReservations());
        registry.commit(second.reservation());
        assertEquals(1, registry.snapshot(RateLimitGroup.PRIVATE_ORDER).burstWindowOccupancy());
    }

    @Test
    void testViolationReducesRatioAndRecoveryRestoresIt() {
        assertTrue(registry.recordViolation(RateLimitGroup.PUBLIC_READ, "/v1/ticker", null));
        GroupSnapshot snapshot = registry.snapshot(RateLimitGroup.PUBLIC_READ);
        assertEquals(0.8, snapshot.currentRatio(), 1e-9);
        assertEquals(8.0, snapshot.effectiveRps(), 1e-9);
        assertEquals(1L, snapshot.violationCount());

        assertFalse(registry.recover(RateLimitGroup.PUBLIC_READ));
        clock.advance(GroupConfig.DEFAULT_RECOVERY_DELAY);
        assertTrue(registry.recover(RateLimitGroup.PUBLIC_READ));
        assertEquals(0.85, registry.snapshot(RateLimitGroup.PUBLIC_READ).currentRatio(), 1e-9);
    }

    @Test
    void testListenerReceivesThrottleEvents() {
        List<String> events = new ArrayList<>();
        RateLimitListener listener = new RateLimitListener() {
            @Override
            public void on429Detected(RateLimitGroup group, String endpointTag, Duration retryAfter) {
                events.add("429 " + group.tag() + " " + endpointTag + " " + retryAfter);
            }

            @Override
            public void onRateReduced(RateLimitGroup group, double oldRatio, double newRatio) {
                events.add(String.format(Locale.ROOT, "reduced %s %.2f %.2f", group.tag(), oldRatio, newRatio));
            }

            @Override
            public void onRateRecovered(RateLimitGroup group, double oldRatio, double newRatio) {
                events.add(String.format(Locale.ROOT, "recovered %s %.2f %.2f", group.tag(), oldRatio, newRatio));
            }
        };
        registry = new GroupRegistry(clock, GroupConfigs.defaults(), listener, Runnable::run);

        registry.recordViolation(RateLimitGroup.PUBLIC_READ, "/v1/ticker", Duration.ofSeconds(2));
        clock.advance(GroupConfig.DEFAULT_RECOVERY_DELAY);
        registry.recover(RateLimitGroup.PUBLIC_READ);

        assertEquals(List.of(
            "429 public_read /v1/ticker PT2S",
            "reduced public_read 1.00 0.80",
            "recovered public_read 0.80 0.85"
        ), events);
    }

    @Test
    void testNoReductionEventForFixedRateGroup() {
        List<String> events = new ArrayList<>();
        RateLimitListener listener = new RateLimitListener() {
            @Override
            public void on429Detected(RateLimitGroup group, String endpointTag, Duration retryAfter) {
                events.add("429");
            }

            @Override
            public void onRateReduced(RateLimitGroup group, double oldRatio, double newRatio) {
                events.add("reduced");
            }
        };
        registry = new GroupRegistry(clock, GroupConfigs.defaults(), listener, Runnable::run);

        assertFalse(registry.recordViolation(RateLimitGroup.WEBSOCKET, "subscribe", null));
        assertEquals(List.of("429"), events);
    }

    @Test
    void testFailingListenerDoesNotBreakViolationHandling() {
        RateLimitListener listener = new RateLimitListener() {
            @Override
            public void onRateReduced(RateLimitGroup group, double oldRatio, double newRatio) {
                throw new IllegalStateException("listener boom");
            }
        };
        registry = new GroupRegistry(clock, GroupConfigs.defaults(), listener, Runnable::run);

        assertTrue(registry.recordViolation(RateLimitGroup.PUBLIC_READ, "/v1/ticker", null));
        assertEquals(0.8, registry.snapshot(RateLimitGroup.PUBLIC_READ).currentRatio(), 1e-9);
    }

    @Test
    void testRetryAfterHoldsGroup() {
        registry.recordViolation(RateLimitGroup.PUBLIC_READ, "/v1/ticker", Duration.ofSeconds(3));

        AdmissionDecision held = registry.tryAdmit(RateLimitGroup.PUBLIC_READ);
        assertFalse(held.granted());
        assertEquals(3_000 * MS, held.waitNanos());
        assertTrue(registry.snapshot(RateLimitGroup.PUBLIC_READ).tatPrimaryNanos() >= 3_000 * MS);

        clock.advance(Duration.ofSeconds(3));
        assertTrue(registry.tryAdmit(RateLimitGroup.PUBLIC_READ).granted());
    }

    @Test
    void testPreventiveDelayAfterViolation() {
        assertEquals(0L, registry.preventiveDelayNanos(RateLimitGroup.PUBLIC_READ));
        registry.recordViolation(RateLimitGroup.PUBLIC_READ, "/v1/ticker", null);
        assertEquals(100 * MS, registry.preventiveDelayNanos(RateLimitGroup.PUBLIC_READ));
    }

    @Test
    void testWebsocketSnapshotHasSecondaryLeg() {
        AdmissionDecision decision = registry.tryAdmit(RateLimitGroup.WEBSOCKET);
        registry.commit(decision.reservation());

        GroupSnapshot snapshot = registry.snapshot(RateLimitGroup.WEBSOCKET);
        assertTrue(snapshot.dualLimit());
        assertTrue(snapshot.tatSecondaryNanos() > 0);
        assertEquals(1, snapshot.secondaryWindowOccupancy());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> registry.tryAdmit(null));
        assertThrows(IllegalArgumentException.class, () -> new GroupRegistry(null, GroupConfigs.defaults()));
        assertThrows(IllegalArgumentException.class,
            () -> new GroupRegistry(clock, GroupConfigs.defaults(), null, Runnable::run));

        Map<RateLimitGroup, GroupConfig> partial = new EnumMap<>(GroupConfigs.defaults());
        partial.remove(RateLimitGroup.WEBSOCKET);
        assertThrows(ConfigurationException.class, () -> new GroupRegistry(clock, partial));
    }

    @Test
    void testAdmissionSettlesExactlyOnce() {
        AdmissionDecision decision = registry.tryAdmit(RateLimitGroup.PRIVATE_ORDER);
        Admission admission = Admission.granted(registry, decision.reservation(), "/v1/orders", 0L, false);

        assertTrue(admission.isGranted());
        assertFalse(admission.isSettled());
        admission.commit();
        assertTrue(admission.isSettled());
        assertThrows(IllegalStateException.class, admission::commit);

        // abort after commit is a no-op
        admission.abort();
        assertEquals(1, registry.snapshot(RateLimitGroup.PRIVATE_ORDER).burstWindowOccupancy());
        assertEquals(0, registry.snapshot(RateLimitGroup.PRIVATE_ORDER).pendingReservations());
    }

    @Test
    void testCloseAbortsUnsettledAdmission() {
        AdmissionDecision decision = registry.tryAdmit(RateLimitGroup.PRIVATE_ORDER);
        try (Admission admission = Admission.granted(registry, decision.reservation(), "/v1/orders", 0L, false)) {
            assertEquals(1, registry.snapshot(RateLimitGroup.PRIVATE_ORDER).pendingReservations());
            assertEquals(Admission.Outcome.GRANTED, admission.outcome());
        }
        assertEquals(0, registry.snapshot(RateLimitGroup.PRIVATE_ORDER).pendingReservations());
        assertEquals(0, registry.snapshot(RateLimitGroup.PRIVATE_ORDER).burstWindowOccupancy());
    }

    @Test
    void testTimedOutAdmissionCannotCommit() {
        Admission timedOut = Admission.timedOut(RateLimitGroup.PUBLIC_READ, "/v1/ticker", 5 * MS);

        assertFalse(timedOut.isGranted());
        assertTrue(timedOut.isSettled());
        assertThrows(IllegalStateException.class, timedOut::commit);
        timedOut.close();
    }
}

package xrl.core.throttle;

import org.junit.jupiter.api.Test;
import xrl.core.config.GroupConfig;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class AdaptiveThrottleTest {

    private static final long SECOND = 1_000_000_000L;

    @Test
    void singleViolationReducesRatio() {
        AdaptiveThrottle throttle = new AdaptiveThrottle(GroupConfig.singleLimit(10.0, 10));

        assertTrue(throttle.recordViolation(0L));
        assertEquals(0.8, throttle.currentRatio(), 1e-9);
        assertTrue(throttle.reduced());
        assertEquals(1L, throttle.violationCount());
    }

    @Test
    void ratioNeverDropsBelowMinRatio() {
        AdaptiveThrottle throttle = new AdaptiveThrottle(GroupConfig.singleLimit(10.0, 10));

        for (int i = 0; i < 20; i++) {
            throttle.recordViolation(i * SECOND);
            assertTrue(throttle.currentRatio() >= GroupConfig.DEFAULT_MIN_RATIO);
        }
        assertEquals(GroupConfig.DEFAULT_MIN_RATIO, throttle.currentRatio(), 1e-9);
        assertEquals(20L, throttle.violationCount());
    }

    @Test
    void thresholdCountsOnlyViolationsInsideErrorWindow() {
        GroupConfig config = GroupConfig.builder(10.0, 10)
            .errorThreshold(3, Duration.ofSeconds(10))
            .build();
        AdaptiveThrottle throttle = new AdaptiveThrottle(config);

        assertFalse(throttle.recordViolation(0L));
        assertFalse(throttle.recordViolation(5 * SECOND));
        // first violation is now outside the 10s window
        assertFalse(throttle.recordViolation(12 * SECOND));
        assertEquals(2, throttle.recentViolations(12 * SECOND));
        assertEquals(1.0, throttle.currentRatio(), 1e-9);

        assertTrue(throttle.recordViolation(13 * SECOND));
        assertEquals(0.8, throttle.currentRatio(), 1e-9);
    }

    @Test
    void disabledAdjustmentOnlyCounts() {
        AdaptiveThrottle throttle = new AdaptiveThrottle(GroupConfig.builder(5.0, 5).dynamicAdjustment(false).build());

        assertFalse(throttle.recordViolation(0L));
        assertEquals(1.0, throttle.currentRatio(), 1e-9);
        assertEquals(1L, throttle.violationCount());
    }

    @Test
    void recoversStepwiseAfterRecoveryDelay() {
        GroupConfig config = GroupConfig.builder(10.0, 10)
            .recovery(Duration.ofSeconds(60), 0.1)
            .build();
        AdaptiveThrottle throttle = new AdaptiveThrottle(config);
        throttle.recordViolation(0L);
        throttle.recordViolation(0L);
        assertEquals(0.64, throttle.currentRatio(), 1e-9);

        assertFalse(throttle.recover(59 * SECOND));
        assertEquals(0.64, throttle.currentRatio(), 1e-9);

        assertTrue(throttle.recover(60 * SECOND));
        assertEquals(0.74, throttle.currentRatio(), 1e-9);
        assertTrue(throttle.recovered());
        assertEquals(60 * SECOND, throttle.lastRecoveryNanos());

        for (int i = 0; i < 10; i++) {
            throttle.recover((61 + i) * SECOND);
        }
        assertEquals(1.0, throttle.currentRatio(), 1e-9);
        assertFalse(throttle.recover(100 * SECOND));
    }

    @Test
    void newViolationRestartsRecoveryDelay() {
        GroupConfig config = GroupConfig.builder(10.0, 10)
            .recovery(Duration.ofSeconds(60), 0.05)
            .build();
        AdaptiveThrottle throttle = new AdaptiveThrottle(config);
        throttle.recordViolation(0L);
        throttle.recordViolation(50 * SECOND);

        assertFalse(throttle.recover(60 * SECOND));
        assertTrue(throttle.recover(110 * SECOND));
        assertEquals(50 * SECOND, throttle.lastReductionNanos());
    }

    @Test
    void preventiveDelayDecaysOverWindow() {
        AdaptiveThrottle throttle = new AdaptiveThrottle(GroupConfig.singleLimit(10.0, 10));
        assertEquals(0L, throttle.preventiveDelayNanos(0L));

        throttle.recordViolation(0L);
        // one recent violation: min(500ms, 1 x 100ms), full weight right after it
        assertEquals(100_000_000L, throttle.preventiveDelayNanos(0L));
        assertEquals(50_000_000L, throttle.preventiveDelayNanos(15 * SECOND));
        assertEquals(0L, throttle.preventiveDelayNanos(30 * SECOND));
        assertEquals(0L, throttle.preventiveDelayNanos(45 * SECOND));
    }

    @Test
    void preventiveDelayIsCapped() {
        AdaptiveThrottle throttle = new AdaptiveThrottle(GroupConfig.singleLimit(10.0, 10));
        for (int i = 0; i < 8; i++) {
            throttle.recordViolation(0L);
        }
        assertEquals(500_000_000L, throttle.preventiveDelayNanos(0L));
    }

    @Test
    void preventiveThrottlingCanBeDisabled() {
        AdaptiveThrottle throttle = new AdaptiveThrottle(
            GroupConfig.builder(10.0, 10).preventiveThrottling(false).build());
        throttle.recordViolation(0L);
        assertEquals(0L, throttle.preventiveDelayNanos(0L));
    }

    @Test
    void historyDropsViolationsOlderThanOneHour() {
        ViolationHistory history = new ViolationHistory();
        history.record(0L);
        history.record(ViolationHistory.RETENTION_NANOS + 1);

        assertEquals(1, history.retained());
        assertEquals(2L, history.total());
        assertEquals(ViolationHistory.RETENTION_NANOS + 1, history.latestNanos());
    }
}

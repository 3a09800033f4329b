package xrl.java.engine;

import xrl.core.model.RateLimitGroup;

import java.time.Duration;

/**
 * Receives throttle events of the limiter.
 *
 * <p>Callbacks run on the limiter's callback executor, after the group's lock is
 * released. An exception thrown by a callback is logged and otherwise ignored.
 */
public interface RateLimitListener {

    /** Listener that ignores every event. */
    RateLimitListener NO_OP = new RateLimitListener() {
    };

    /**
     * A provider 429 was reported for {@code group}.
     *
     * @param retryAfter provider's Retry-After, or null if absent
     */
    default void on429Detected(RateLimitGroup group, String endpointTag, Duration retryAfter) {
    }

    /**
     * The group's rate ratio was reduced after repeated violations.
     */
    default void onRateReduced(RateLimitGroup group, double oldRatio, double newRatio) {
    }

    /**
     * The group's rate ratio was stepped back up by the recovery loop.
     */
    default void onRateRecovered(RateLimitGroup group, double oldRatio, double newRatio) {
    }
}

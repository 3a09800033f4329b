package xrl.java.engine;

import xrl.core.algorithms.hybrid.HybridGcraLimiter;
import xrl.core.config.GroupConfig;
import xrl.core.model.RateLimitGroup;
import xrl.core.throttle.AdaptiveThrottle;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-group state bundled with the lock that guards it.
 *
 * Holds:
 * - the immutable group config
 * - the admission core (GCRA + burst windows)
 * - the adaptive throttle (ratio, violation history)
 * - a ReentrantLock shared with the group's waiter queue
 *
 * Thread-safety:
 * - The lock must be held for any access to the limiter or the throttle
 * - Contention is per group; groups never share a lock
 */
public final class GroupEntry {

    private final RateLimitGroup group;
    private final GroupConfig config;
    private final AdaptiveThrottle throttle;
    private final HybridGcraLimiter limiter;
    private final ReentrantLock lock;

    GroupEntry(RateLimitGroup group, GroupConfig config) {
        if (group == null) {
            throw new IllegalArgumentException("group cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.group = group;
        this.config = config;
        this.throttle = new AdaptiveThrottle(config);
        this.limiter = new HybridGcraLimiter(group, config, throttle);
        this.lock = new ReentrantLock(); // Non-fair for better throughput
    }

    public RateLimitGroup group() {
        return group;
    }

    public GroupConfig config() {
        return config;
    }

    /**
     * Returns the admission core.
     * MUST be called while holding the lock.
     */
    public HybridGcraLimiter limiter() {
        return limiter;
    }

    /**
     * Returns the adaptive throttle.
     * MUST be called while holding the lock.
     */
    public AdaptiveThrottle throttle() {
        return throttle;
    }

    public ReentrantLock lock() {
        return lock;
    }
}

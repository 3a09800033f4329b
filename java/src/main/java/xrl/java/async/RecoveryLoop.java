package xrl.java.async;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xrl.core.model.RateLimitGroup;
import xrl.java.engine.GroupRegistry;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically steps reduced group rates back toward their base rate.
 */
public final class RecoveryLoop {

    private static final Logger log = LoggerFactory.getLogger(RecoveryLoop.class);

    private final GroupRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private ScheduledFuture<?> future;

    public RecoveryLoop(GroupRegistry registry, ScheduledExecutorService scheduler, Duration interval) {
        if (registry == null) throw new IllegalArgumentException("registry cannot be null");
        if (scheduler == null) throw new IllegalArgumentException("scheduler cannot be null");
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.registry = registry;
        this.scheduler = scheduler;
        this.interval = interval;
    }

    public synchronized void start() {
        if (future == null) {
            long nanos = interval.toNanos();
            future = scheduler.scheduleWithFixedDelay(this::runOnce, nanos, nanos, TimeUnit.NANOSECONDS);
        }
    }

    public synchronized void stop() {
        if (future != null) {
            future.cancel(false);
        }
    }

    /**
     * One pass over every group.
     *
     * @return number of groups whose ratio was stepped up
     */
    public int runOnce() {
        int recovered = 0;
        for (RateLimitGroup group : RateLimitGroup.values()) {
            try {
                if (registry.recover(group)) {
                    recovered++;
                }
            } catch (RuntimeException e) {
                log.error("recovery.failed group={}", group.tag(), e);
            }
        }
        return recovered;
    }
}

package xrl.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xrl.core.clock.Clock;
import xrl.core.config.ConfigurationException;
import xrl.core.config.GroupConfig;
import xrl.core.config.GroupConfigs;
import xrl.core.model.AdmissionDecision;
import xrl.core.model.RateLimitGroup;
import xrl.core.model.Reservation;
import xrl.core.throttle.AdaptiveThrottle;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe owner of every group's admission and throttle state.
 *
 * Features:
 * - One {@link GroupEntry} per group, created up front from a complete config map
 * - ReentrantLock per group: contention on one group never blocks another
 * - {@link #tryAdmit} is the atomic read-decide-reserve step of the admission core
 * - Clock injection enables deterministic testing
 * - Throttle events go to a {@link RateLimitListener} on the listener executor, outside the lock
 *
 * All other readers get {@link GroupSnapshot} copies for diagnostics.
 */
public final class GroupRegistry {

    private static final Logger log = LoggerFactory.getLogger(GroupRegistry.class);

    private final Clock clock;
    private final Map<RateLimitGroup, GroupEntry> entries;
    private final RateLimitListener listener;
    private final Executor listenerExecutor;

    /**
     * Creates a registry without a listener.
     *
     * @param clock Clock instance for time control (injected for testability)
     * @param configs one config per {@link RateLimitGroup}
     * @throws ConfigurationException if a group has no config
     */
    public GroupRegistry(Clock clock, Map<RateLimitGroup, GroupConfig> configs) {
        this(clock, configs, RateLimitListener.NO_OP, Runnable::run);
    }

    /**
     * Creates a registry.
     *
     * @param listener receives throttle events
     * @param listenerExecutor runs the listener callbacks
     * @throws ConfigurationException if a group has no config
     */
    public GroupRegistry(Clock clock, Map<RateLimitGroup, GroupConfig> configs,
                         RateLimitListener listener, Executor listenerExecutor) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (listenerExecutor == null) {
            throw new IllegalArgumentException("listenerExecutor cannot be null");
        }
        Map<RateLimitGroup, GroupConfig> complete = GroupConfigs.requireComplete(configs);

        this.clock = clock;
        this.listener = listener;
        this.listenerExecutor = listenerExecutor;
        EnumMap<RateLimitGroup, GroupEntry> map = new EnumMap<>(RateLimitGroup.class);
        complete.forEach((group, config) -> map.put(group, new GroupEntry(group, config)));
        this.entries = Collections.unmodifiableMap(map);

        complete.forEach((group, config) -> log.debug(
            "group.configured group={} rps={} burst={} rpm={} rpmBurst={}",
            group.tag(), config.baseRps(), config.burstCapacity(),
            config.requestsPerMinute(), config.rpmBurstCapacity()));
    }

    /**
     * Attempts to admit one call now.
     *
     * This method:
     * 1. Acquires the group's lock
     * 2. Runs the admission core (GCRA legs + burst windows)
     * 3. On grant, reserves the slot before releasing the lock
     *
     * @return GRANT with a reservation, or DENY with the wait before the next useful check
     */
    public AdmissionDecision tryAdmit(RateLimitGroup group) {
        GroupEntry entry = entry(group);
        ReentrantLock lock = entry.lock();
        lock.lock();
        try {
            return entry.limiter().tryAdmit(clock.nowNanos());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Grants regardless of the core's decision (fail-open release).
     */
    public Reservation forceAdmit(RateLimitGroup group) {
        GroupEntry entry = entry(group);
        ReentrantLock lock = entry.lock();
        lock.lock();
        try {
            return entry.limiter().forceAdmit(clock.nowNanos());
        } finally {
            lock.unlock();
        }
    }

    public void commit(Reservation reservation) {
        GroupEntry entry = entry(reservation.group());
        ReentrantLock lock = entry.lock();
        lock.lock();
        try {
            entry.limiter().commit(reservation, clock.nowNanos());
        } finally {
            lock.unlock();
        }
    }

    public void abort(Reservation reservation) {
        GroupEntry entry = entry(reservation.group());
        ReentrantLock lock = entry.lock();
        lock.lock();
        try {
            entry.limiter().abort(reservation);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a provider-reported violation.
     *
     * @param endpointTag label of the rejected call, passed to the listener
     * @param retryAfter provider's Retry-After, or null
     * @return true if the group's rate was reduced
     */
    public boolean recordViolation(RateLimitGroup group, String endpointTag, Duration retryAfter) {
        GroupEntry entry = entry(group);
        ReentrantLock lock = entry.lock();
        double before;
        double after;
        boolean reduced;
        lock.lock();
        try {
            long now = clock.nowNanos();
            AdaptiveThrottle throttle = entry.throttle();
            before = throttle.currentRatio();
            reduced = throttle.recordViolation(now);
            after = throttle.currentRatio();
            if (retryAfter != null && !retryAfter.isNegative() && !retryAfter.isZero()) {
                entry.limiter().holdUntil(now + retryAfter.toNanos());
            }
        } finally {
            lock.unlock();
        }
        notifyListener("on429Detected", group, () -> listener.on429Detected(group, endpointTag, retryAfter));
        if (reduced) {
            log.warn("rate.reduced group={} ratio={} -> {}", group.tag(), format(before), format(after));
            notifyListener("onRateReduced", group, () -> listener.onRateReduced(group, before, after));
        }
        return reduced;
    }

    /**
     * One recovery pass for a group.
     *
     * @return true if the ratio was stepped up
     */
    public boolean recover(RateLimitGroup group) {
        GroupEntry entry = entry(group);
        ReentrantLock lock = entry.lock();
        double before;
        double after;
        boolean recovered;
        lock.lock();
        try {
            AdaptiveThrottle throttle = entry.throttle();
            before = throttle.currentRatio();
            recovered = throttle.recover(clock.nowNanos());
            after = throttle.currentRatio();
        } finally {
            lock.unlock();
        }
        if (recovered) {
            log.info("rate.recovered group={} ratio={} -> {}", group.tag(), format(before), format(after));
            notifyListener("onRateRecovered", group, () -> listener.onRateRecovered(group, before, after));
        }
        return recovered;
    }

    public long preventiveDelayNanos(RateLimitGroup group) {
        GroupEntry entry = entry(group);
        ReentrantLock lock = entry.lock();
        lock.lock();
        try {
            return entry.throttle().preventiveDelayNanos(clock.nowNanos());
        } finally {
            lock.unlock();
        }
    }

    public GroupSnapshot snapshot(RateLimitGroup group) {
        GroupEntry entry = entry(group);
        ReentrantLock lock = entry.lock();
        lock.lock();
        try {
            return new GroupSnapshot(
                group,
                entry.config().baseRps(),
                entry.throttle().currentRatio(),
                entry.limiter().tatPrimaryNanos(),
                entry.limiter().dualLimit(),
                entry.limiter().tatSecondaryNanos(),
                entry.limiter().primaryOccupancy(),
                entry.limiter().secondaryOccupancy(),
                entry.limiter().pendingReservations(),
                entry.throttle().violationCount()
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws IllegalArgumentException if group is null
     */
    public GroupEntry entry(RateLimitGroup group) {
        if (group == null) {
            throw new IllegalArgumentException("group cannot be null");
        }
        GroupEntry entry = entries.get(group);
        if (entry == null) {
            // unreachable with a complete config map
            throw new ConfigurationException("no configuration for group: " + group.tag());
        }
        return entry;
    }

    public GroupConfig config(RateLimitGroup group) {
        return entry(group).config();
    }

    public Clock clock() {
        return clock;
    }

    private void notifyListener(String event, RateLimitGroup group, Runnable callback) {
        listenerExecutor.execute(() -> {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.error("listener.failed event={} group={}", event, group.tag(), e);
            }
        });
    }

    private static String format(double ratio) {
        return String.format("%.1f%%", ratio * 100);
    }
}

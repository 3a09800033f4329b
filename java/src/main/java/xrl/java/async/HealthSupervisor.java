package xrl.java.async;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xrl.core.clock.Clock;
import xrl.core.config.LimiterSettings;
import xrl.core.model.RateLimitGroup;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Owns the per-group notifier tasks and replaces the unhealthy ones.
 *
 * <p>Assessment per check:
 * <ul>
 *   <li>FAILED: the notifier terminated itself</li>
 *   <li>DEGRADED: consecutive errors at or above half the tolerated maximum</li>
 *   <li>HEALTHY: otherwise</li>
 * </ul>
 * A FAILED or DEGRADED notifier is restarted at most once per restart cooldown:
 * the old task is cancelled, every caller queued on the group is released
 * fail-open, and a fresh task is spawned.
 */
public final class HealthSupervisor {

    private static final Logger log = LoggerFactory.getLogger(HealthSupervisor.class);

    private final AdmissionQueue queue;
    private final ScheduledExecutorService scheduler;
    private final LimiterSettings settings;
    private final Clock clock;
    private final Function<RateLimitGroup, NotifierTask.Tick> ticks;
    private final Map<RateLimitGroup, Slot> slots = new EnumMap<>(RateLimitGroup.class);

    private ScheduledFuture<?> checks;

    /**
     * @param ticks tick of each group's notifier
     */
    public HealthSupervisor(
        AdmissionQueue queue,
        ScheduledExecutorService scheduler,
        LimiterSettings settings,
        Clock clock,
        Function<RateLimitGroup, NotifierTask.Tick> ticks
    ) {
        if (queue == null) throw new IllegalArgumentException("queue cannot be null");
        if (scheduler == null) throw new IllegalArgumentException("scheduler cannot be null");
        if (settings == null) throw new IllegalArgumentException("settings cannot be null");
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (ticks == null) throw new IllegalArgumentException("ticks cannot be null");
        this.queue = queue;
        this.scheduler = scheduler;
        this.settings = settings;
        this.clock = clock;
        this.ticks = ticks;
    }

    /**
     * Spawns one notifier per group and schedules the periodic health check.
     */
    public synchronized void start() {
        if (checks != null) {
            return;
        }
        for (RateLimitGroup group : RateLimitGroup.values()) {
            Slot slot = new Slot();
            slot.task = spawn(group);
            slots.put(group, slot);
        }
        long interval = settings.healthCheckInterval().toNanos();
        checks = scheduler.scheduleAtFixedRate(this::checkAll, interval, interval, TimeUnit.NANOSECONDS);
        log.info("supervisor.started groups={} checkIntervalMs={}",
            slots.size(), TimeUnit.NANOSECONDS.toMillis(interval));
    }

    public synchronized void stop() {
        if (checks != null) {
            checks.cancel(false);
        }
        slots.values().forEach(slot -> slot.task.cancel());
    }

    /**
     * Runs one health check over every group. Never throws.
     */
    public void checkAll() {
        for (RateLimitGroup group : RateLimitGroup.values()) {
            try {
                check(group);
            } catch (RuntimeException e) {
                log.error("supervisor.check_failed group={}", group.tag(), e);
            }
        }
    }

    /**
     * Assesses one group's notifier and restarts it if needed.
     *
     * @return status after the check
     * @throws IllegalStateException if the supervisor was not started
     */
    public synchronized HealthStatus check(RateLimitGroup group) {
        Slot slot = slot(group);
        HealthStatus assessed = assess(slot.task);
        slot.status = assessed;
        if (assessed == HealthStatus.HEALTHY) {
            return assessed;
        }
        long now = clock.nowNanos();
        if (slot.restartCount > 0 && now - slot.lastRestartNanos < settings.restartCooldown().toNanos()) {
            log.debug("notifier.restart_deferred group={} status={}", group.tag(), assessed);
            return assessed;
        }
        restart(group, slot, assessed, now);
        return slot.status;
    }

    public synchronized NotifierHealth health(RateLimitGroup group) {
        Slot slot = slots.get(group);
        if (slot == null) {
            return new NotifierHealth(HealthStatus.HEALTHY, 0, 0L, 0);
        }
        return new NotifierHealth(slot.status, slot.task.consecutiveErrors(), slot.lastRestartNanos, slot.restartCount);
    }

    public synchronized Map<RateLimitGroup, NotifierHealth> healthAll() {
        Map<RateLimitGroup, NotifierHealth> result = new EnumMap<>(RateLimitGroup.class);
        for (RateLimitGroup group : RateLimitGroup.values()) {
            result.put(group, health(group));
        }
        return result;
    }

    synchronized NotifierTask task(RateLimitGroup group) {
        return slot(group).task;
    }

    private HealthStatus assess(NotifierTask task) {
        if (task.isTerminated()) {
            return HealthStatus.FAILED;
        }
        int half = Math.max(1, settings.maxConsecutiveErrors() / 2);
        if (task.consecutiveErrors() >= half) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.HEALTHY;
    }

    private void restart(RateLimitGroup group, Slot slot, HealthStatus cause, long now) {
        slot.status = HealthStatus.RESTARTING;
        slot.task.cancel();
        int released = queue.releaseAll(group);
        slot.task = spawn(group);
        slot.lastRestartNanos = now;
        slot.restartCount++;
        log.warn("notifier.restarted group={} cause={} released={} restartCount={}",
            group.tag(), cause, released, slot.restartCount);
    }

    private NotifierTask spawn(RateLimitGroup group) {
        return new NotifierTask(group, ticks.apply(group), scheduler, settings).start();
    }

    private Slot slot(RateLimitGroup group) {
        if (group == null) throw new IllegalArgumentException("group cannot be null");
        Slot slot = slots.get(group);
        if (slot == null) {
            throw new IllegalStateException("supervisor not started");
        }
        return slot;
    }

    private static final class Slot {
        NotifierTask task;
        HealthStatus status = HealthStatus.HEALTHY;
        long lastRestartNanos;
        int restartCount;
    }
}

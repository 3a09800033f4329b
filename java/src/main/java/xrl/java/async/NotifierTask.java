package xrl.java.async;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xrl.core.config.LimiterSettings;
import xrl.core.model.RateLimitGroup;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Self-rescheduling tick loop of one group wrapped in a recovery shell.
 *
 * <p>A successful tick resets the error count and schedules the next tick after
 * the notifier period. A failed tick schedules a retry after
 * {@code min(backoffMax, backoffBase * 2^errors) + random(0, jitter)}; after
 * {@code maxConsecutiveErrors} failures in a row the task terminates itself and
 * waits for the health supervisor to replace it.
 */
public final class NotifierTask implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(NotifierTask.class);

    /**
     * Work done on every tick.
     */
    @FunctionalInterface
    public interface Tick {
        void run() throws Exception;
    }

    private final RateLimitGroup group;
    private final Tick tick;
    private final ScheduledExecutorService scheduler;
    private final long tickNanos;
    private final int maxConsecutiveErrors;
    private final long backoffBaseNanos;
    private final long backoffMaxNanos;
    private final long backoffJitterNanos;

    private final AtomicInteger consecutiveErrors = new AtomicInteger();
    private volatile boolean terminated;
    private volatile boolean cancelled;
    private ScheduledFuture<?> next;

    public NotifierTask(RateLimitGroup group, Tick tick, ScheduledExecutorService scheduler, LimiterSettings settings) {
        if (group == null) throw new IllegalArgumentException("group cannot be null");
        if (tick == null) throw new IllegalArgumentException("tick cannot be null");
        if (scheduler == null) throw new IllegalArgumentException("scheduler cannot be null");
        if (settings == null) throw new IllegalArgumentException("settings cannot be null");
        this.group = group;
        this.tick = tick;
        this.scheduler = scheduler;
        this.tickNanos = settings.notifierTick().toNanos();
        this.maxConsecutiveErrors = settings.maxConsecutiveErrors();
        this.backoffBaseNanos = settings.backoffBase().toNanos();
        this.backoffMaxNanos = settings.backoffMax().toNanos();
        this.backoffJitterNanos = settings.backoffJitter().toNanos();
    }

    /**
     * Schedules the first tick.
     */
    public NotifierTask start() {
        schedule(0L);
        return this;
    }

    @Override
    public void run() {
        if (cancelled || terminated) {
            return;
        }
        try {
            tick.run();
            consecutiveErrors.set(0);
            schedule(tickNanos);
        } catch (Exception e) {
            int errors = consecutiveErrors.incrementAndGet();
            if (errors >= maxConsecutiveErrors) {
                terminated = true;
                log.error("notifier.terminated group={} consecutiveErrors={}", group.tag(), errors, e);
                return;
            }
            long backoff = backoffNanos(errors);
            log.warn("notifier.tick_failed group={} consecutiveErrors={} retryInMs={} error={}",
                group.tag(), errors, TimeUnit.NANOSECONDS.toMillis(backoff), e.toString());
            schedule(backoff);
        } catch (Error e) {
            terminated = true;
            throw e;
        }
    }

    /**
     * Stops the loop. A tick already running finishes but does not reschedule.
     */
    public synchronized void cancel() {
        cancelled = true;
        if (next != null) {
            next.cancel(false);
            next = null;
        }
    }

    public boolean isAlive() {
        return !terminated && !cancelled;
    }

    public boolean isTerminated() {
        return terminated;
    }

    public int consecutiveErrors() {
        return consecutiveErrors.get();
    }

    public RateLimitGroup group() {
        return group;
    }

    long backoffNanos(int errors) {
        long exponential = backoffBaseNanos << Math.min(errors, 30);
        if (exponential <= 0 || exponential > backoffMaxNanos) {
            exponential = backoffMaxNanos;
        }
        long jitter = backoffJitterNanos > 0 ? ThreadLocalRandom.current().nextLong(backoffJitterNanos + 1) : 0L;
        return exponential + jitter;
    }

    private synchronized void schedule(long delayNanos) {
        if (cancelled) {
            return;
        }
        try {
            next = scheduler.schedule(this, delayNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            // scheduler is shutting down
            terminated = true;
            log.debug("notifier.stopped group={} reason=scheduler_shutdown", group.tag());
        }
    }
}

package xrl.java.async;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Arms one timeout task per suspended waiter and tracks the armed ones.
 *
 * <p>The timeout is measured from the waiter's arrival and is not reset when the
 * waiter is re-armed after a denied re-check. {@link #disarm} is idempotent and is
 * the guard's half of the queue's single cleanup path.
 */
final class TimeoutGuard {

    private final ScheduledExecutorService scheduler;
    private final long timeoutNanos;
    private final Map<Long, ScheduledFuture<?>> active = new ConcurrentHashMap<>();

    TimeoutGuard(ScheduledExecutorService scheduler, long timeoutNanos) {
        if (scheduler == null) throw new IllegalArgumentException("scheduler cannot be null");
        if (timeoutNanos <= 0) throw new IllegalArgumentException("timeoutNanos must be > 0");
        this.scheduler = scheduler;
        this.timeoutNanos = timeoutNanos;
    }

    /**
     * Schedules {@code onTimeout} for {@code waiter}.
     *
     * @param elapsedNanos time the waiter already spent since arrival
     */
    void arm(Waiter waiter, long elapsedNanos, Consumer<Waiter> onTimeout) {
        long delay = Math.max(0L, timeoutNanos - elapsedNanos);
        ScheduledFuture<?> task = scheduler.schedule(() -> onTimeout.accept(waiter), delay, TimeUnit.NANOSECONDS);
        active.put(waiter.sequence, task);
    }

    /**
     * Cancels the waiter's timeout task if still pending.
     *
     * @return true if this call removed an armed timeout
     */
    boolean disarm(Waiter waiter) {
        ScheduledFuture<?> task = active.remove(waiter.sequence);
        if (task == null) {
            return false;
        }
        task.cancel(false);
        return true;
    }

    int activeCount() {
        return active.size();
    }
}

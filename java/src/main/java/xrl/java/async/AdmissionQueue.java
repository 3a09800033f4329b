package xrl.java.async;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xrl.core.model.AdmissionDecision;
import xrl.core.model.RateLimitGroup;
import xrl.core.model.Reservation;
import xrl.java.engine.Admission;
import xrl.java.engine.GroupEntry;
import xrl.java.engine.GroupRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Non-blocking admission: callers get a future, denied callers are parked in a
 * per-group ordered queue and re-checked by that group's notifier tick.
 *
 * <p>Lifecycle of a queued caller:
 * <pre>
 * WAITING --(readyAt elapsed, tick)--> READY --(grant)--> COMPLETED
 *    ^                                   |
 *    +-------------(deny, re-arm)--------+
 * WAITING/READY --(timeout | caller cancel | shutdown)--> CANCELLED
 * WAITING --(fail-open release)--> COMPLETED (forced)
 * </pre>
 *
 * <p>Every state transition of a group's waiters happens under that group's lock.
 * Futures are completed on the callback executor, never on the caller of the
 * transition, so user continuations never run on scheduler threads or under a lock.
 */
public final class AdmissionQueue {

    private static final Logger log = LoggerFactory.getLogger(AdmissionQueue.class);

    /** Preventive delays shorter than this are not worth a queue round trip. */
    static final long MIN_PREVENTIVE_DELAY_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

    private final GroupRegistry registry;
    private final Executor callbackExecutor;
    private final TimeoutGuard timeouts;
    private final Map<RateLimitGroup, TreeSet<Waiter>> queues = new EnumMap<>(RateLimitGroup.class);
    private final Map<RateLimitGroup, WaitStats> stats = new EnumMap<>(RateLimitGroup.class);
    private final AtomicLong sequence = new AtomicLong();
    private volatile boolean closed;

    public AdmissionQueue(
        GroupRegistry registry,
        ScheduledExecutorService scheduler,
        Executor callbackExecutor,
        long waiterTimeoutNanos
    ) {
        if (registry == null) throw new IllegalArgumentException("registry cannot be null");
        if (callbackExecutor == null) throw new IllegalArgumentException("callbackExecutor cannot be null");
        this.registry = registry;
        this.callbackExecutor = callbackExecutor;
        this.timeouts = new TimeoutGuard(scheduler, waiterTimeoutNanos);
        for (RateLimitGroup group : RateLimitGroup.values()) {
            queues.put(group, new TreeSet<>(Waiter.ORDER));
            stats.put(group, new WaitStats());
        }
    }

    /**
     * Requests admission for one call.
     *
     * <p>Queued callers whose readyAt already elapsed are re-checked first, so a new
     * caller never takes a slot ahead of them. Completes immediately on a grant.
     * Otherwise the caller is queued and the future completes with GRANTED once the
     * group's notifier admits it, or with TIMED_OUT after the waiter timeout.
     * Cancelling the returned future withdraws the caller from the queue; a
     * reservation granted concurrently is released.
     *
     * @throws IllegalStateException if the queue was closed by {@link #cancelAll}, or the
     *         caller must be queued but the scheduler was shut down
     */
    public CompletableFuture<Admission> acquire(RateLimitGroup group, String endpointTag) {
        GroupEntry entry = registry.entry(group);
        TreeSet<Waiter> queue = queues.get(group);
        CompletableFuture<Admission> result = new CompletableFuture<>();
        List<Dispatch> dispatches = new ArrayList<>();
        ReentrantLock lock = entry.lock();
        Admission immediate = null;
        Waiter waiter = null;
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("admission queue is closed");
            }
            long now = registry.clock().nowNanos();
            stats.get(group).recordRequest();
            admitDue(group, queue, now, dispatches);
            long preventive = entry.throttle().preventiveDelayNanos(now);
            if (preventive >= MIN_PREVENTIVE_DELAY_NANOS) {
                log.debug("preventive.delay group={} endpoint={} delayMs={}",
                    group.tag(), endpointTag, TimeUnit.NANOSECONDS.toMillis(preventive));
                waiter = enqueue(group, endpointTag, now, now + preventive, result);
            } else {
                AdmissionDecision decision = registry.tryAdmit(group);
                if (decision.granted()) {
                    immediate = Admission.granted(registry, decision.reservation(), endpointTag, 0L, false);
                } else {
                    waiter = enqueue(group, endpointTag, now, now + decision.waitNanos(), result);
                }
            }
        } finally {
            lock.unlock();
            // earlier waiters admitted above are delivered even if this caller failed
            dispatch(dispatches);
        }

        if (immediate != null) {
            // not counted in WaitStats: the caller never waited
            result.complete(immediate);
            return result;
        }
        Waiter queued = waiter;
        result.whenComplete((admission, error) -> {
            if (result.isCancelled()) {
                withdraw(queued);
            }
        });
        return result;
    }

    /**
     * One notifier tick: re-checks every waiter whose readyAt elapsed, in queue order.
     *
     * @return number of callers admitted by this tick
     */
    public int tick(RateLimitGroup group) {
        GroupEntry entry = registry.entry(group);
        TreeSet<Waiter> queue = queues.get(group);
        List<Dispatch> dispatches = new ArrayList<>();
        ReentrantLock lock = entry.lock();
        lock.lock();
        try {
            admitDue(group, queue, registry.clock().nowNanos(), dispatches);
        } finally {
            lock.unlock();
        }
        dispatch(dispatches);
        return dispatches.size();
    }

    /**
     * Fail-open release: grants every queued caller of the group regardless of the core.
     *
     * @return number of callers released
     */
    public int releaseAll(RateLimitGroup group) {
        GroupEntry entry = registry.entry(group);
        TreeSet<Waiter> queue = queues.get(group);
        List<Dispatch> dispatches = new ArrayList<>();
        ReentrantLock lock = entry.lock();
        lock.lock();
        try {
            long now = registry.clock().nowNanos();
            for (Waiter waiter : new ArrayList<>(queue)) {
                retire(waiter, WaiterState.COMPLETED);
                Reservation reservation = registry.forceAdmit(group);
                long waited = waiter.waitedNanos(now);
                stats.get(group).recordForced(waited);
                dispatches.add(new Dispatch(waiter,
                    Admission.granted(registry, reservation, waiter.endpointTag, waited, true)));
            }
        } finally {
            lock.unlock();
        }
        if (!dispatches.isEmpty()) {
            log.warn("queue.released_fail_open group={} waiters={}", group.tag(), dispatches.size());
        }
        dispatch(dispatches);
        return dispatches.size();
    }

    /**
     * Closes the queue and completes every queued caller of every group with CANCELLED.
     * Later acquires are rejected.
     *
     * @return number of callers cancelled
     */
    public int cancelAll() {
        // set before taking any group lock: an acquire either queued already or sees it
        closed = true;
        int total = 0;
        for (RateLimitGroup group : RateLimitGroup.values()) {
            GroupEntry entry = registry.entry(group);
            TreeSet<Waiter> queue = queues.get(group);
            List<Dispatch> dispatches = new ArrayList<>();
            ReentrantLock lock = entry.lock();
            lock.lock();
            try {
                long now = registry.clock().nowNanos();
                for (Waiter waiter : new ArrayList<>(queue)) {
                    retire(waiter, WaiterState.CANCELLED);
                    long waited = waiter.waitedNanos(now);
                    stats.get(group).recordCancelled(waited);
                    dispatches.add(new Dispatch(waiter, Admission.cancelled(group, waiter.endpointTag, waited)));
                }
            } finally {
                lock.unlock();
            }
            dispatch(dispatches);
            total += dispatches.size();
        }
        return total;
    }

    public int depth(RateLimitGroup group) {
        GroupEntry entry = registry.entry(group);
        entry.lock().lock();
        try {
            return queues.get(group).size();
        } finally {
            entry.lock().unlock();
        }
    }

    public WaitStats.Snapshot waitStats(RateLimitGroup group) {
        if (group == null) throw new IllegalArgumentException("group cannot be null");
        return stats.get(group).snapshot();
    }

    /**
     * Number of queued callers with an armed timeout, across all groups.
     */
    public int activeTimeouts() {
        return timeouts.activeCount();
    }

    /**
     * Grants due waiters in queue order until the core denies one, which is re-armed.
     * Caller holds the group's lock.
     */
    private void admitDue(RateLimitGroup group, TreeSet<Waiter> queue, long now, List<Dispatch> dispatches) {
        while (!queue.isEmpty() && queue.first().readyAtNanos <= now) {
            Waiter waiter = queue.pollFirst();
            waiter.state = WaiterState.READY;
            AdmissionDecision decision = registry.tryAdmit(group);
            if (decision.granted()) {
                retire(waiter, WaiterState.COMPLETED);
                long waited = waiter.waitedNanos(now);
                stats.get(group).recordGranted(waited);
                dispatches.add(new Dispatch(waiter,
                    Admission.granted(registry, decision.reservation(), waiter.endpointTag, waited, false)));
            } else {
                rearm(queue, waiter, now + decision.waitNanos());
                break;
            }
        }
    }

    private Waiter enqueue(RateLimitGroup group, String endpointTag, long now, long readyAt,
                           CompletableFuture<Admission> result) {
        Waiter waiter = new Waiter(sequence.incrementAndGet(), group, endpointTag, now, readyAt, result);
        // armed before it becomes visible in the queue: a rejected timeout leaves nothing behind
        try {
            timeouts.arm(waiter, 0L, this::expire);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("admission queue is shut down", e);
        }
        TreeSet<Waiter> queue = queues.get(group);
        queue.add(waiter);
        stats.get(group).recordQueued(queue.size());
        log.debug("waiter.queued group={} endpoint={} seq={} waitMs={}",
            group.tag(), endpointTag, waiter.sequence, TimeUnit.NANOSECONDS.toMillis(readyAt - now));
        return waiter;
    }

    /**
     * Re-arms a denied waiter and every other due waiter behind it with the same
     * readyAt, so arrival order among them is kept.
     */
    private void rearm(TreeSet<Waiter> queue, Waiter head, long readyAt) {
        List<Waiter> due = new ArrayList<>();
        due.add(head);
        while (!queue.isEmpty() && queue.first().readyAtNanos < readyAt) {
            due.add(queue.pollFirst());
        }
        for (Waiter waiter : due) {
            waiter.readyAtNanos = readyAt;
            waiter.state = WaiterState.WAITING;
            queue.add(waiter);
        }
    }

    private void expire(Waiter waiter) {
        GroupEntry entry = registry.entry(waiter.group);
        Dispatch dispatch = null;
        entry.lock().lock();
        try {
            if (retire(waiter, WaiterState.CANCELLED)) {
                long waited = waiter.waitedNanos(registry.clock().nowNanos());
                stats.get(waiter.group).recordTimeout(waited);
                dispatch = new Dispatch(waiter, Admission.timedOut(waiter.group, waiter.endpointTag, waited));
                log.warn("waiter.timeout group={} endpoint={} seq={} waitedMs={}",
                    waiter.group.tag(), waiter.endpointTag, waiter.sequence,
                    TimeUnit.NANOSECONDS.toMillis(waited));
            }
        } finally {
            entry.lock().unlock();
        }
        if (dispatch != null) {
            dispatch(List.of(dispatch));
        }
    }

    private void withdraw(Waiter waiter) {
        GroupEntry entry = registry.entry(waiter.group);
        entry.lock().lock();
        try {
            if (retire(waiter, WaiterState.CANCELLED)) {
                stats.get(waiter.group).recordCancelled(waiter.waitedNanos(registry.clock().nowNanos()));
                log.debug("waiter.cancelled group={} endpoint={} seq={}",
                    waiter.group.tag(), waiter.endpointTag, waiter.sequence);
            }
        } finally {
            entry.lock().unlock();
        }
    }

    /**
     * Single cleanup path: moves the waiter to a terminal state, removes it from the
     * queue and disarms its timeout. Caller holds the group's lock.
     *
     * @return false if the waiter was already retired
     */
    private boolean retire(Waiter waiter, WaiterState terminal) {
        if (waiter.state.terminal()) {
            return false;
        }
        if (waiter.state == WaiterState.WAITING) {
            queues.get(waiter.group).remove(waiter);
        }
        waiter.state = terminal;
        timeouts.disarm(waiter);
        return true;
    }

    private void dispatch(List<Dispatch> dispatches) {
        for (Dispatch dispatch : dispatches) {
            callbackExecutor.execute(() -> {
                if (!dispatch.waiter.result.complete(dispatch.admission)) {
                    // caller cancelled first
                    dispatch.admission.abort();
                }
            });
        }
    }

    private record Dispatch(Waiter waiter, Admission admission) {
    }
}

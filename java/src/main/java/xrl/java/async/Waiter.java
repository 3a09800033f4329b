package xrl.java.async;

import xrl.core.model.RateLimitGroup;
import xrl.java.engine.Admission;

import java.util.Comparator;
import java.util.concurrent.CompletableFuture;

/**
 * One caller suspended in a group's admission queue.
 *
 * All fields but the identity ones are mutated only under the group's lock.
 * {@code readyAtNanos} must not change while the waiter sits in the ordered queue.
 */
final class Waiter {

    /** Earliest readyAt first, then arrival order. */
    static final Comparator<Waiter> ORDER = Comparator
        .comparingLong((Waiter w) -> w.readyAtNanos)
        .thenComparingLong(w -> w.sequence);

    final long sequence;
    final RateLimitGroup group;
    final String endpointTag;
    final long arrivalNanos;
    final CompletableFuture<Admission> result;

    long readyAtNanos;
    WaiterState state = WaiterState.WAITING;

    Waiter(long sequence, RateLimitGroup group, String endpointTag, long arrivalNanos, long readyAtNanos,
           CompletableFuture<Admission> result) {
        this.sequence = sequence;
        this.group = group;
        this.endpointTag = endpointTag;
        this.arrivalNanos = arrivalNanos;
        this.readyAtNanos = readyAtNanos;
        this.result = result;
    }

    long waitedNanos(long nowNanos) {
        return Math.max(0L, nowNanos - arrivalNanos);
    }

    @Override
    public String toString() {
        return "Waiter{#" + sequence + ", group=" + group.tag() + ", endpoint=" + endpointTag
            + ", state=" + state + "}";
    }
}

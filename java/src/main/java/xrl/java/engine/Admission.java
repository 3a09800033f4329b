package xrl.java.engine;

import xrl.core.model.RateLimitGroup;
import xrl.core.model.Reservation;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outcome of one {@code acquire()}.
 *
 * <p>A granted admission holds a reservation that must be settled exactly once:
 * {@link #commit()} after the outbound call completed, {@link #abort()} if it never
 * reached the provider. {@link #close()} aborts an unsettled admission, so
 * try-with-resources is the safe way to use it:
 * <pre>
 * try (Admission admission = limiter.acquire(group, "/ticker").join()) {
 *     if (!admission.isGranted()) {
 *         // soft timeout: retry later
 *         return;
 *     }
 *     Response response = http.send(request);
 *     admission.commit();
 * }
 * </pre>
 *
 * <p>A timed-out admission is a soft, retryable failure; it never throws.
 */
public final class Admission implements AutoCloseable {

    public enum Outcome {
        GRANTED,
        /** Waited longer than the waiter timeout. Retryable. */
        TIMED_OUT,
        /** Limiter shut down while the caller was queued. */
        CANCELLED
    }

    private final Outcome outcome;
    private final RateLimitGroup group;
    private final String endpointTag;
    private final long waitedNanos;
    private final boolean forced;
    private final Reservation reservation;
    private final GroupRegistry registry;
    private final AtomicBoolean settled = new AtomicBoolean();

    private Admission(
        Outcome outcome,
        RateLimitGroup group,
        String endpointTag,
        long waitedNanos,
        boolean forced,
        Reservation reservation,
        GroupRegistry registry
    ) {
        this.outcome = outcome;
        this.group = group;
        this.endpointTag = endpointTag;
        this.waitedNanos = Math.max(0L, waitedNanos);
        this.forced = forced;
        this.reservation = reservation;
        this.registry = registry;
        if (outcome != Outcome.GRANTED) {
            settled.set(true);
        }
    }

    public static Admission granted(
        GroupRegistry registry,
        Reservation reservation,
        String endpointTag,
        long waitedNanos,
        boolean forced
    ) {
        if (registry == null) throw new IllegalArgumentException("registry cannot be null");
        if (reservation == null) throw new IllegalArgumentException("reservation cannot be null");
        return new Admission(Outcome.GRANTED, reservation.group(), endpointTag, waitedNanos, forced,
            reservation, registry);
    }

    public static Admission timedOut(RateLimitGroup group, String endpointTag, long waitedNanos) {
        return new Admission(Outcome.TIMED_OUT, group, endpointTag, waitedNanos, false, null, null);
    }

    public static Admission cancelled(RateLimitGroup group, String endpointTag, long waitedNanos) {
        return new Admission(Outcome.CANCELLED, group, endpointTag, waitedNanos, false, null, null);
    }

    /**
     * Records the call in the group's burst windows.
     *
     * @throws IllegalStateException if this admission was not granted or is already settled
     */
    public void commit() {
        if (outcome != Outcome.GRANTED) {
            throw new IllegalStateException("cannot commit a " + outcome + " admission");
        }
        if (!settled.compareAndSet(false, true)) {
            throw new IllegalStateException("admission already settled");
        }
        registry.commit(reservation);
    }

    /**
     * Releases the reserved slot. No-op if already settled or not granted.
     */
    public void abort() {
        if (settled.compareAndSet(false, true)) {
            registry.abort(reservation);
        }
    }

    @Override
    public void close() {
        abort();
    }

    public Outcome outcome() {
        return outcome;
    }

    public boolean isGranted() {
        return outcome == Outcome.GRANTED;
    }

    public boolean isSettled() {
        return settled.get();
    }

    public RateLimitGroup group() {
        return group;
    }

    public String endpointTag() {
        return endpointTag;
    }

    public long waitedNanos() {
        return waitedNanos;
    }

    /**
     * True if the caller was released fail-open after an internal failure rather than admitted by the core.
     */
    public boolean forced() {
        return forced;
    }

    public Reservation reservation() {
        return reservation;
    }

    @Override
    public String toString() {
        return "Admission{" + outcome + ", group=" + group.tag() + ", endpoint=" + endpointTag
            + ", waitedNanos=" + waitedNanos + (forced ? ", forced" : "") + "}";
    }
}

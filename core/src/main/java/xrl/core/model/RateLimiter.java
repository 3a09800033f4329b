package xrl.core.model;

/**
 * Per-group admission contract: no I/O, no threads.
 * Callers serialize access; implementations are not thread-safe.
 */
public interface RateLimiter {

    /**
     * Decides whether a call may proceed now. A grant reserves the slot.
     */
    AdmissionDecision tryAdmit(long nowNanos);

    /**
     * Records a reserved call as actually sent, stamped with its completion time.
     */
    void commit(Reservation reservation, long completedAtNanos);

    /**
     * Releases a reserved call that never reached the provider.
     */
    void abort(Reservation reservation);
}

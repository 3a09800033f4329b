package xrl.core.algorithms.gcra;

/**
 * GCRA (Generic Cell Rate Algorithm) state for one limiting leg:
 * a single theoretical arrival time (TAT) advanced by the emission interval per grant.
 *
 * Pros: O(1) state, exact steady-rate spacing, no refill bookkeeping.
 * Cons: no burst on its own; the burst window provides that.
 *
 * Thread-safety: none. The owning group's lock guards every call.
 */
public final class GcraCell {
    private static final long UNSET = Long.MIN_VALUE;

    private long tatNanos = UNSET;

    /**
     * Emission interval for a rate scaled by the adaptive ratio.
     *
     * @param ratePerSecond configured rate, > 0
     * @param ratio current ratio, > 0
     * @return nanoseconds between two conforming calls, at least 1
     */
    public static long emissionIntervalNanos(double ratePerSecond, double ratio) {
        if (!(ratePerSecond > 0)) throw new IllegalArgumentException("rate <= 0");
        if (!(ratio > 0)) throw new IllegalArgumentException("ratio <= 0");
        return Math.max(1L, Math.round(1_000_000_000d / (ratePerSecond * ratio)));
    }

    /**
     * Steady-rate wait: 0 once {@code now} reached the TAT.
     */
    public long waitNanos(long nowNanos) {
        if (tatNanos == UNSET || nowNanos >= tatNanos) {
            return 0L;
        }
        return tatNanos - nowNanos;
    }

    /**
     * Reserves one emission. The TAT never moves backwards.
     */
    public void reserve(long nowNanos, long emissionIntervalNanos) {
        if (emissionIntervalNanos <= 0) throw new IllegalArgumentException("interval <= 0");
        pushTo(nowNanos + emissionIntervalNanos);
    }

    /**
     * Moves the TAT forward to at least {@code earliestNanos}.
     */
    public void pushTo(long earliestNanos) {
        if (tatNanos == UNSET || earliestNanos > tatNanos) {
            tatNanos = earliestNanos;
        }
    }

    public boolean started() {
        return tatNanos != UNSET;
    }

    /**
     * @return the TAT, or 0 if nothing was ever reserved
     */
    public long tatNanos() {
        return tatNanos == UNSET ? 0L : tatNanos;
    }
}

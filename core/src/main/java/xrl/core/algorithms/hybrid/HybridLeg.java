package xrl.core.algorithms.hybrid;

import xrl.core.algorithms.burst_window.BurstWindow;
import xrl.core.algorithms.gcra.GcraCell;

/**
 * One limiting leg: a GCRA cell for steady spacing paired with a burst window.
 *
 * <p>A free window slot admits the call immediately. A full window yields
 * {@code max(steadyWait, windowWait)}, capped at half the observation interval so a
 * waiter re-checks instead of sleeping through state changes.
 *
 * <p>A provider Retry-After holds the whole leg, free slot or not, until it elapsed.
 *
 * <p>Both the emission interval and the observation interval scale with
 * {@code 1 / ratio}: a reduced ratio slows the whole leg.
 */
final class HybridLeg {
    private final double ratePerSecond;
    private final long baseIntervalNanos;
    private final GcraCell cell = new GcraCell();
    private final BurstWindow window;
    private long holdUntilNanos = Long.MIN_VALUE;

    HybridLeg(double ratePerSecond, int burstCapacity, long baseIntervalNanos) {
        if (!(ratePerSecond > 0)) throw new IllegalArgumentException("rate <= 0");
        if (baseIntervalNanos <= 0) throw new IllegalArgumentException("interval <= 0");
        this.ratePerSecond = ratePerSecond;
        this.baseIntervalNanos = baseIntervalNanos;
        this.window = new BurstWindow(burstCapacity);
    }

    long waitNanos(long nowNanos, double ratio) {
        if (nowNanos < holdUntilNanos) {
            return holdUntilNanos - nowNanos;
        }
        long interval = observationIntervalNanos(ratio);
        window.evictExpired(nowNanos, interval);
        if (window.hasFreeSlot()) {
            return 0L;
        }
        long steadyWait = cell.waitNanos(nowNanos);
        long windowWait = window.waitNanos(nowNanos, interval);
        long wait = Math.max(steadyWait, windowWait);
        return Math.min(wait, Math.max(1L, interval / 2));
    }

    void reserve(long nowNanos, double ratio) {
        cell.reserve(nowNanos, GcraCell.emissionIntervalNanos(ratePerSecond, ratio));
        window.reserve();
    }

    void commit(long completedAtNanos, long nowNanos, double ratio) {
        window.commit(completedAtNanos, nowNanos, observationIntervalNanos(ratio));
    }

    void abort() {
        window.abort();
    }

    void holdUntil(long earliestNanos) {
        holdUntilNanos = Math.max(holdUntilNanos, earliestNanos);
        cell.pushTo(earliestNanos);
    }

    long observationIntervalNanos(double ratio) {
        return Math.max(1L, Math.round(baseIntervalNanos / ratio));
    }

    long tatNanos() {
        return cell.tatNanos();
    }

    int occupancy() {
        return window.occupancy();
    }

    int pending() {
        return window.pending();
    }

    int capacity() {
        return window.capacity();
    }
}

package xrl.core.algorithms.hybrid;

import xrl.core.config.GroupConfig;
import xrl.core.model.AdmissionDecision;
import xrl.core.model.RateLimitGroup;
import xrl.core.model.RateLimiter;
import xrl.core.model.Reservation;
import xrl.core.throttle.AdaptiveThrottle;

/**
 * Admission core of one group: GCRA hybridized with a bounded burst window, and a
 * second independent leg for groups limited per second AND per minute.
 *
 * <p>Per check:
 * <ol>
 *   <li>each leg computes its wait (0 when its window has a free slot)</li>
 *   <li>group wait = max over legs; grant only if every leg grants</li>
 *   <li>a grant advances each leg's TAT and holds a pending window slot</li>
 * </ol>
 * The window timestamp is written by {@link #commit} once the call completed, so a
 * failed call releases its slot through {@link #abort} without consuming burst.
 *
 * <p>The adaptive ratio is read from the group's {@link AdaptiveThrottle}.
 *
 * Thread-safety: none. The group's lock must be held for every call.
 */
public final class HybridGcraLimiter implements RateLimiter {
    private final RateLimitGroup group;
    private final AdaptiveThrottle throttle;
    private final HybridLeg primary;
    private final HybridLeg secondary;

    public HybridGcraLimiter(RateLimitGroup group, GroupConfig config, AdaptiveThrottle throttle) {
        if (group == null) throw new IllegalArgumentException("group cannot be null");
        if (config == null) throw new IllegalArgumentException("config cannot be null");
        if (throttle == null) throw new IllegalArgumentException("throttle cannot be null");
        this.group = group;
        this.throttle = throttle;
        this.primary = new HybridLeg(config.baseRps(), config.burstCapacity(),
            config.observationInterval().toNanos());
        this.secondary = config.dualLimit()
            ? new HybridLeg(config.secondaryRps(), config.rpmBurstCapacity(), config.secondaryInterval().toNanos())
            : null;
    }

    @Override
    public AdmissionDecision tryAdmit(long nowNanos) {
        double ratio = throttle.currentRatio();
        long wait = primary.waitNanos(nowNanos, ratio);
        if (secondary != null) {
            wait = Math.max(wait, secondary.waitNanos(nowNanos, ratio));
        }
        if (wait > 0) {
            return AdmissionDecision.deny(wait);
        }
        return AdmissionDecision.grant(reserve(nowNanos, ratio));
    }

    /**
     * Grants unconditionally. Used when queued callers are released fail-open.
     */
    public Reservation forceAdmit(long nowNanos) {
        return reserve(nowNanos, throttle.currentRatio());
    }

    /**
     * Wait the next check would report, without reserving anything.
     */
    public long peekWaitNanos(long nowNanos) {
        double ratio = throttle.currentRatio();
        long wait = primary.waitNanos(nowNanos, ratio);
        if (secondary != null) {
            wait = Math.max(wait, secondary.waitNanos(nowNanos, ratio));
        }
        return wait;
    }

    @Override
    public void commit(Reservation reservation, long completedAtNanos) {
        checkOwner(reservation);
        double ratio = throttle.currentRatio();
        primary.commit(completedAtNanos, completedAtNanos, ratio);
        if (reservation.secondaryLeg() && secondary != null) {
            secondary.commit(completedAtNanos, completedAtNanos, ratio);
        }
    }

    @Override
    public void abort(Reservation reservation) {
        checkOwner(reservation);
        primary.abort();
        if (reservation.secondaryLeg() && secondary != null) {
            secondary.abort();
        }
    }

    /**
     * Honors a provider Retry-After: no leg grants before {@code earliestNanos}.
     */
    public void holdUntil(long earliestNanos) {
        primary.holdUntil(earliestNanos);
        if (secondary != null) {
            secondary.holdUntil(earliestNanos);
        }
    }

    public RateLimitGroup group() {
        return group;
    }

    public boolean dualLimit() {
        return secondary != null;
    }

    public long tatPrimaryNanos() {
        return primary.tatNanos();
    }

    public long tatSecondaryNanos() {
        return secondary == null ? 0L : secondary.tatNanos();
    }

    public int primaryOccupancy() {
        return primary.occupancy();
    }

    public int secondaryOccupancy() {
        return secondary == null ? 0 : secondary.occupancy();
    }

    public int pendingReservations() {
        return primary.pending();
    }

    public long primaryObservationIntervalNanos() {
        return primary.observationIntervalNanos(throttle.currentRatio());
    }

    private Reservation reserve(long nowNanos, double ratio) {
        primary.reserve(nowNanos, ratio);
        if (secondary != null) {
            secondary.reserve(nowNanos, ratio);
        }
        return new Reservation(group, nowNanos, secondary != null);
    }

    private void checkOwner(Reservation reservation) {
        if (reservation == null) throw new IllegalArgumentException("reservation cannot be null");
        if (reservation.group() != group) {
            throw new IllegalArgumentException("reservation belongs to " + reservation.group() + ", not " + group);
        }
    }
}

package xrl.java.engine;

import xrl.core.model.RateLimitGroup;

/**
 * Point-in-time copy of one group's admission and throttle state, taken under the group's lock.
 */
public record GroupSnapshot(
    RateLimitGroup group,
    double baseRps,
    double currentRatio,
    long tatPrimaryNanos,
    boolean dualLimit,
    long tatSecondaryNanos,
    int burstWindowOccupancy,
    int secondaryWindowOccupancy,
    int pendingReservations,
    long violationCount
) {
    public double effectiveRps() {
        return baseRps * currentRatio;
    }
}

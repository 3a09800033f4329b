package xrl.java.limiter;

import xrl.core.model.RateLimitGroup;
import xrl.java.async.NotifierHealth;
import xrl.java.async.WaitStats;

import java.util.OptionalLong;

/**
 * Diagnostic view of one group.
 *
 * @param tatSecondaryNanos present only for groups with a per-minute limit
 */
public record GroupStatus(
    RateLimitGroup group,
    double baseRps,
    double currentRatio,
    long tatPrimaryNanos,
    OptionalLong tatSecondaryNanos,
    int burstWindowOccupancy,
    int secondaryWindowOccupancy,
    long violationCount,
    int queueDepth,
    NotifierHealth notifierHealth,
    WaitStats.Snapshot waitStats
) {
    public double effectiveRps() {
        return baseRps * currentRatio;
    }

    /** Every acquire of the group, granted immediately or queued. */
    public long totalRequests() {
        return waitStats.totalRequests();
    }

    /** Deepest the group's queue has been. */
    public int maxConcurrentWaiters() {
        return waitStats.maxConcurrentWaiters();
    }
}

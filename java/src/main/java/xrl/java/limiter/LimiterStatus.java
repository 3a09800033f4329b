package xrl.java.limiter;

import xrl.core.model.RateLimitGroup;

import java.util.Map;

/**
 * Status of every group plus limiter-wide counters.
 *
 * @param activeTimeouts queued callers with an armed timeout, across all groups
 */
public record LimiterStatus(
    Map<RateLimitGroup, GroupStatus> groups,
    int activeTimeouts,
    boolean running
) {
    public LimiterStatus {
        groups = Map.copyOf(groups);
    }

    public GroupStatus group(RateLimitGroup group) {
        return groups.get(group);
    }
}

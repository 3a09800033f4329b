package xrl.core.config;

import xrl.core.model.RateLimitGroup;

import java.util.Map;

/**
 * Complete limiter configuration: runtime settings plus one {@link GroupConfig} per group.
 */
public record LimiterConfiguration(
    LimiterSettings settings,
    Map<RateLimitGroup, GroupConfig> groups
) {
    public LimiterConfiguration {
        if (settings == null) {
            throw new ConfigurationException("settings cannot be null");
        }
        groups = GroupConfigs.requireComplete(groups);
    }

    public static LimiterConfiguration defaults() {
        return new LimiterConfiguration(LimiterSettings.defaults(), GroupConfigs.defaults());
    }

    public GroupConfig group(RateLimitGroup group) {
        GroupConfig config = groups.get(group);
        if (config == null) {
            throw new ConfigurationException("missing configuration for group: " + group);
        }
        return config;
    }
}

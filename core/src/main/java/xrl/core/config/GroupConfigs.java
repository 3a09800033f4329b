package xrl.core.config;

import xrl.core.model.RateLimitGroup;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Published exchange limits per group.
 *
 * <ul>
 *   <li>PUBLIC_READ: 10 req/s</li>
 *   <li>PRIVATE_DEFAULT: 30 req/s</li>
 *   <li>PRIVATE_ORDER: 8 req/s</li>
 *   <li>PRIVATE_BULK_CANCEL: 1 request per 2 s</li>
 *   <li>WEBSOCKET: 5 req/s AND 100 req/min, fixed (no adaptive reduction)</li>
 * </ul>
 */
public final class GroupConfigs {

    private GroupConfigs() {
    }

    public static Map<RateLimitGroup, GroupConfig> defaults() {
        EnumMap<RateLimitGroup, GroupConfig> configs = new EnumMap<>(RateLimitGroup.class);
        configs.put(RateLimitGroup.PUBLIC_READ, GroupConfig.singleLimit(10.0, 10));
        configs.put(RateLimitGroup.PRIVATE_DEFAULT, GroupConfig.singleLimit(30.0, 30));
        configs.put(RateLimitGroup.PRIVATE_ORDER, GroupConfig.singleLimit(8.0, 8));
        configs.put(RateLimitGroup.PRIVATE_BULK_CANCEL, GroupConfig.builder(0.5, 1)
            .observationInterval(Duration.ofSeconds(2))
            .build());
        configs.put(RateLimitGroup.WEBSOCKET, GroupConfig.builder(5.0, 5)
            .requestsPerMinute(100, 20)
            .dynamicAdjustment(false)
            .build());
        return Collections.unmodifiableMap(configs);
    }

    /**
     * Checks that every group has a configuration and returns an immutable copy.
     *
     * @throws ConfigurationException if a group is missing
     */
    public static Map<RateLimitGroup, GroupConfig> requireComplete(Map<RateLimitGroup, GroupConfig> configs) {
        if (configs == null) {
            throw new ConfigurationException("group configs cannot be null");
        }
        EnumMap<RateLimitGroup, GroupConfig> copy = new EnumMap<>(RateLimitGroup.class);
        for (RateLimitGroup group : RateLimitGroup.values()) {
            GroupConfig config = configs.get(group);
            if (config == null) {
                throw new ConfigurationException("missing configuration for group: " + group.tag());
            }
            copy.put(group, config);
        }
        return Collections.unmodifiableMap(copy);
    }
}

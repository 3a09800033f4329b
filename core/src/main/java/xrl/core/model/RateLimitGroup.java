package xrl.core.model;

import java.util.Locale;

/**
 * Rate-limit categories of the exchange API.
 * Every outbound call belongs to exactly one group; groups never share budget.
 */
public enum RateLimitGroup {
    PUBLIC_READ,
    PRIVATE_DEFAULT,
    PRIVATE_ORDER,
    PRIVATE_BULK_CANCEL,
    /** Connection and subscription messages; limited per second and per minute. */
    WEBSOCKET;

    private final String tag = name().toLowerCase(Locale.ROOT);

    public String tag() {
        return tag;
    }

    public static RateLimitGroup fromTag(String tag) {
        if (tag == null) {
            throw new IllegalArgumentException("tag cannot be null");
        }
        for (RateLimitGroup group : values()) {
            if (group.tag.equalsIgnoreCase(tag) || group.name().equalsIgnoreCase(tag)) {
                return group;
            }
        }
        throw new IllegalArgumentException("unknown rate limit group: " + tag);
    }
}

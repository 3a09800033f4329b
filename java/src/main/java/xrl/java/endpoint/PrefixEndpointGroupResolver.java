package xrl.java.endpoint;

import xrl.core.config.ConfigurationException;
import xrl.core.model.RateLimitGroup;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Table-driven resolver.
 *
 * <p>Lookup order:
 * <ol>
 *   <li>exact path with the request's method</li>
 *   <li>exact path for any method</li>
 *   <li>longest registered path prefix</li>
 *   <li>default group, if one was set</li>
 * </ol>
 * Immutable once built; safe to share.
 */
public final class PrefixEndpointGroupResolver implements EndpointGroupResolver {

    private static final String ANY_METHOD = "*";

    private final Map<String, RateLimitGroup> exact;
    private final TreeMap<String, RateLimitGroup> prefixes;
    private final RateLimitGroup defaultGroup;

    private PrefixEndpointGroupResolver(Builder builder) {
        this.exact = Map.copyOf(builder.exact);
        this.prefixes = new TreeMap<>(builder.prefixes);
        this.defaultGroup = builder.defaultGroup;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public RateLimitGroup resolve(String path, String method) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("path cannot be null or empty");
        }
        String normalizedMethod = method == null ? ANY_METHOD : method.toUpperCase(Locale.ROOT);

        RateLimitGroup group = exact.get(key(normalizedMethod, path));
        if (group == null) {
            group = exact.get(key(ANY_METHOD, path));
        }
        if (group != null) {
            return group;
        }

        // floorKey walks down to the longest registered prefix
        String candidate = prefixes.floorKey(path);
        while (candidate != null) {
            if (path.startsWith(candidate)) {
                return prefixes.get(candidate);
            }
            candidate = prefixes.lowerKey(candidate);
        }

        if (defaultGroup != null) {
            return defaultGroup;
        }
        throw new ConfigurationException("no rate-limit group mapped for " + normalizedMethod + " " + path);
    }

    private static String key(String method, String path) {
        return method + " " + path;
    }

    public static final class Builder {
        private final Map<String, RateLimitGroup> exact = new HashMap<>();
        private final Map<String, RateLimitGroup> prefixes = new HashMap<>();
        private RateLimitGroup defaultGroup;

        private Builder() {
        }

        /**
         * Maps one path for one HTTP method.
         */
        public Builder exact(String method, String path, RateLimitGroup group) {
            requirePath(path);
            if (method == null || method.isBlank()) {
                throw new IllegalArgumentException("method cannot be null or blank");
            }
            exact.put(key(method.toUpperCase(Locale.ROOT), path), requireGroup(group));
            return this;
        }

        /**
         * Maps one path for every HTTP method.
         */
        public Builder exact(String path, RateLimitGroup group) {
            requirePath(path);
            exact.put(key(ANY_METHOD, path), requireGroup(group));
            return this;
        }

        public Builder prefix(String pathPrefix, RateLimitGroup group) {
            requirePath(pathPrefix);
            prefixes.put(pathPrefix, requireGroup(group));
            return this;
        }

        public Builder defaultGroup(RateLimitGroup group) {
            this.defaultGroup = requireGroup(group);
            return this;
        }

        public PrefixEndpointGroupResolver build() {
            return new PrefixEndpointGroupResolver(this);
        }

        private static void requirePath(String path) {
            if (path == null || path.isEmpty()) {
                throw new IllegalArgumentException("path cannot be null or empty");
            }
        }

        private static RateLimitGroup requireGroup(RateLimitGroup group) {
            if (group == null) {
                throw new IllegalArgumentException("group cannot be null");
            }
            return group;
        }
    }
}

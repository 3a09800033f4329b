package xrl.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import xrl.core.model.RateLimitGroup;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;

/**
 * JSON (de)serialization of limiter configuration.
 *
 * <p>A configuration file only needs to list what differs from the defaults:
 * <pre>
 * {
 *   "settings": { "waiterTimeout": "PT10S" },
 *   "groups": {
 *     "PUBLIC_READ": { "baseRps": 8.0, "burstCapacity": 8 },
 *     "websocket":   { "requestsPerMinute": 60 }
 *   }
 * }
 * </pre>
 * Each present object is merged field by field over the default value, then
 * validated by the record constructors. Durations use ISO-8601 ({@code PT0.5S}).
 */
public final class ConfigLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private ConfigLoader() {
    }

    public static LimiterConfiguration load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("cannot read limiter config: " + path, e);
        }
    }

    public static LimiterConfiguration load(InputStream in) {
        JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigurationException("malformed limiter config: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return LimiterConfiguration.defaults();
        }
        if (!root.isObject()) {
            throw new ConfigurationException("limiter config must be a JSON object");
        }

        LimiterSettings settings = merge(LimiterSettings.defaults(), root.get("settings"), LimiterSettings.class);

        Map<RateLimitGroup, GroupConfig> groups = new EnumMap<>(GroupConfigs.defaults());
        JsonNode groupsNode = root.get("groups");
        if (groupsNode != null && !groupsNode.isNull()) {
            if (!groupsNode.isObject()) {
                throw new ConfigurationException("\"groups\" must be a JSON object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = groupsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                RateLimitGroup group;
                try {
                    group = RateLimitGroup.fromTag(field.getKey());
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException(e.getMessage(), e);
                }
                groups.put(group, merge(groups.get(group), field.getValue(), GroupConfig.class));
            }
        }
        return new LimiterConfiguration(settings, groups);
    }

    public static String toJson(LimiterConfiguration configuration) {
        ObjectNode root = MAPPER.createObjectNode();
        root.set("settings", MAPPER.valueToTree(configuration.settings()));
        ObjectNode groups = root.putObject("groups");
        configuration.groups().forEach((group, config) -> groups.set(group.name(), MAPPER.valueToTree(config)));
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize limiter config", e);
        }
    }

    public static String toJson(GroupConfig config) {
        try {
            return MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize group config", e);
        }
    }

    public static GroupConfig groupConfigFromJson(String json) {
        try {
            return MAPPER.readValue(json, GroupConfig.class);
        } catch (JsonProcessingException e) {
            throw unwrap("group config", e);
        }
    }

    private static <T> T merge(T defaults, JsonNode overrides, Class<T> type) {
        if (overrides == null || overrides.isNull()) {
            return defaults;
        }
        if (!overrides.isObject()) {
            throw new ConfigurationException(type.getSimpleName() + " override must be a JSON object");
        }
        ObjectNode merged = MAPPER.valueToTree(defaults);
        if (overrides.has("baseRps") || overrides.has("burstCapacity")) {
            // derived from the rate unless set explicitly
            merged.remove("observationInterval");
        }
        merged.setAll((ObjectNode) overrides);
        try {
            return MAPPER.treeToValue(merged, type);
        } catch (JsonProcessingException e) {
            throw unwrap(type.getSimpleName(), e);
        }
    }

    private static ConfigurationException unwrap(String what, JsonProcessingException e) {
        Throwable cause = e.getCause();
        if (cause instanceof ConfigurationException) {
            return (ConfigurationException) cause;
        }
        return new ConfigurationException("invalid " + what + ": " + e.getOriginalMessage(), e);
    }
}

package xrl.java.endpoint;

import xrl.core.model.RateLimitGroup;

/**
 * Maps an outbound REST call to the rate-limit group it counts against.
 */
@FunctionalInterface
public interface EndpointGroupResolver {

    /**
     * @param path request path, e.g. {@code /v1/orders}
     * @param method HTTP method, case-insensitive
     * @throws xrl.core.config.ConfigurationException if the endpoint is not mapped
     */
    RateLimitGroup resolve(String path, String method);
}

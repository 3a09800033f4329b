package xrl.core.config;

/**
 * Invalid or incomplete limiter configuration.
 * Raised while the limiter is being built; never raised on the admission path.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

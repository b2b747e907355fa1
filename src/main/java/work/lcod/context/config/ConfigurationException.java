package work.lcod.context.config;

/**
 * Raised when configuration or request input cannot be read or parsed.
 */
public final class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

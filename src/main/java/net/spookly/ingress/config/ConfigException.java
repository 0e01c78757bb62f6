package net.spookly.ingress.config;

/**
 * Raised when the configuration cannot be read, parsed or validated.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.infrasentinel.core.config;

/**
 * Thrown when detection configuration is invalid or cannot be read.
 *
 * <p>
 * Configuration errors are fatal at startup and are never silently corrected.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}

package de.bsommerfeld.kurral.feed.core.config;

/**
 * Raised when config.toml cannot be read, parsed or created.
 */
public class ConfigLoadException extends RuntimeException {

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

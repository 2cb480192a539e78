package io.urlcrypt.standalone.config;

/**
 * Thrown when the proxy configuration cannot be loaded: missing file, invalid
 * YAML, an unknown binding shape or an unparseable value. The message is
 * written for startup error output.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.urlcrypt.core.error;

/** The protector cannot be constructed, typically because the configured master key is invalid. */
public final class ProtectorConfigException extends UrlCryptException {

    private static final long serialVersionUID = 1L;

    public ProtectorConfigException(String message) {
        super(message, Phase.STARTUP);
    }

    public ProtectorConfigException(String message, Throwable cause) {
        super(message, cause, Phase.STARTUP);
    }
}

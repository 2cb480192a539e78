package io.urlcrypt.core.error;

/**
 * Abstract base for all url-crypt exceptions. Never thrown directly; use one of the concrete
 * subclasses.
 */
public abstract class UrlCryptException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        STARTUP,
        REQUEST
    }

    private final Phase phase;

    protected UrlCryptException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected UrlCryptException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}

package io.urlcrypt.core.error;

/**
 * A target shape declaration is invalid: a recursive type, an unknown shape reference, or a
 * document that fails schema validation. Carries the offending source (file path, resource or
 * type name) when known.
 */
public final class ShapeDefinitionException extends UrlCryptException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public ShapeDefinitionException(String message, String source) {
        super(message, Phase.STARTUP);
        this.source = source;
    }

    public ShapeDefinitionException(String message, Throwable cause, String source) {
        super(message, cause, Phase.STARTUP);
        this.source = source;
    }

    /** The file path, resource or type that caused the error, or {@code null}. */
    public String source() {
        return source;
    }
}

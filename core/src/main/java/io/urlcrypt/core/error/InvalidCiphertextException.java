package io.urlcrypt.core.error;

/**
 * A token could not be decrypted: it is empty, malformed, truncated, tampered with, or was
 * produced under a different purpose.
 *
 * <p>Thrown per value by a {@code Protector}. The decryption strategies always recover from it
 * locally; it never aborts a request.
 */
public final class InvalidCiphertextException extends UrlCryptException {

    private static final long serialVersionUID = 1L;

    public InvalidCiphertextException(String message) {
        super(message, Phase.REQUEST);
    }

    public InvalidCiphertextException(String message, Throwable cause) {
        super(message, cause, Phase.REQUEST);
    }
}

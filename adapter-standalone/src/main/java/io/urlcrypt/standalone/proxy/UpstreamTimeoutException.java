package io.urlcrypt.standalone.proxy;

/**
 * The backend did not answer within the configured read timeout; rendered as
 * {@code 504 Gateway Timeout}.
 */
public class UpstreamTimeoutException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    public UpstreamTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}

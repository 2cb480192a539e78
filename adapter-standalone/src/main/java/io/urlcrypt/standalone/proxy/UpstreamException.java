package io.urlcrypt.standalone.proxy;

/**
 * Base exception for failures talking to the backend.
 *
 * <p>
 * {@link UpstreamConnectException} covers refused or unreachable connections,
 * {@link UpstreamTimeoutException} an exceeded read timeout.
 */
public abstract class UpstreamException extends Exception {

    private static final long serialVersionUID = 1L;

    protected UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}

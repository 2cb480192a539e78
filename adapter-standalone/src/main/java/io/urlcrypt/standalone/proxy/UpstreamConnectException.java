package io.urlcrypt.standalone.proxy;

/** The backend could not be reached; rendered as {@code 502 Bad Gateway}. */
public class UpstreamConnectException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    public UpstreamConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}

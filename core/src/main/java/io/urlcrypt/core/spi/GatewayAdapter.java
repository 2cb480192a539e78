package io.urlcrypt.core.spi;

import io.urlcrypt.core.model.RequestUrl;
import io.urlcrypt.core.model.UrlTransformResult;

/**
 * Bridges a host pipeline's native request type and the engine's {@link RequestUrl} view.
 *
 * <h3>Copy-on-wrap semantics</h3>
 *
 * <p>{@link #wrapRequest} returns an immutable snapshot of the native request's URL: the path with
 * its segments percent-decoded and the parsed query parameters. The engine never touches the
 * native object. {@link #applyChanges} writes the rewritten URL back; it is called only when the
 * transform completes.
 *
 * <p>Lifecycle (engine construction, key loading) is the adapter's responsibility. Implementations
 * MUST be thread-safe; one instance is shared by all request threads.
 *
 * @param <R> the host-native request type
 */
public interface GatewayAdapter<R> {

    /**
     * Snapshots the URL of a native request.
     *
     * @param nativeRequest the host-native request
     * @return path (decoded segments, single leading slash) and query parameters
     */
    RequestUrl wrapRequest(R nativeRequest);

    /**
     * Writes the transformed URL back to the native request.
     *
     * @param result       the transform result; {@code result.transformed()} holds the new URL
     * @param nativeTarget the native request to update
     */
    void applyChanges(UrlTransformResult result, R nativeTarget);
}

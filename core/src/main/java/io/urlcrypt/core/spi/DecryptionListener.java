package io.urlcrypt.core.spi;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Observability hooks for decryption outcomes. The core has no telemetry dependencies; adapters
 * bridge these events to their metrics or audit systems.
 *
 * <p>Events are immutable. Implementations MUST be thread-safe and non-blocking. Exceptions
 * thrown by listeners are caught and logged by the engine and never affect the request.
 */
public interface DecryptionListener {

    /** Listener that ignores every event. */
    DecryptionListener NOOP = new DecryptionListener() {};

    /**
     * Called at most once per request when schema-declared query fields failed to decrypt and were
     * not suppressed.
     */
    default void onQueryDecryptionWarning(QueryDecryptionWarningEvent event) {}

    /** Called after path decryption of every request, including requests with nothing decrypted. */
    default void onPathDecrypted(PathDecryptedEvent event) {}

    // --- Event records ---

    /**
     * @param keys        query keys that should have decrypted but did not, in encounter order
     * @param requestPath the (decrypted) request path the query belonged to, or {@code null}
     */
    record QueryDecryptionWarningEvent(Set<String> keys, String requestPath) {
        public QueryDecryptionWarningEvent {
            keys = Collections.unmodifiableSet(new LinkedHashSet<>(keys));
        }
    }

    /** Event emitted after the path strategy ran. */
    record PathDecryptedEvent(String originalPath, int decryptedSegments) {}
}

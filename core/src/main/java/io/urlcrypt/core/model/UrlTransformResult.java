package io.urlcrypt.core.model;

import java.util.Objects;

/**
 * Result of transforming one inbound URL: the original view, the rewritten view, and the per-part
 * results they were built from.
 */
public record UrlTransformResult(
        RequestUrl original, RequestUrl transformed, PathDecryptionResult path, QueryDecryptionResult query) {

    public UrlTransformResult {
        Objects.requireNonNull(original, "original must not be null");
        Objects.requireNonNull(transformed, "transformed must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(query, "query must not be null");
    }

    /** True if the path or any query value differs from the original. */
    public boolean isModified() {
        return !original.equals(transformed);
    }
}

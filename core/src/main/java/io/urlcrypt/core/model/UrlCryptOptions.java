package io.urlcrypt.core.model;

import java.util.Objects;

/**
 * Engine options. Use {@link #builder()}; every field has a default.
 *
 * @param pathPurpose                    protector purpose for path segment tokens
 * @param queryPurpose                   protector purpose for query value tokens
 * @param ignoreUnencryptedQueryWarnings suppress every reportable query failure globally
 * @param unboundQueryStrategy           query variant used post-routing when the route has no
 *                                       bound shape
 * @param showFullCryptographicException include the underlying crypto exception in DEBUG logs
 */
public record UrlCryptOptions(
        String pathPurpose,
        String queryPurpose,
        boolean ignoreUnencryptedQueryWarnings,
        QueryStrategyKind unboundQueryStrategy,
        boolean showFullCryptographicException) {

    public static final String DEFAULT_PATH_PURPOSE = "io.urlcrypt.core.engine.GreedyPathCryptography";
    public static final String DEFAULT_QUERY_PURPOSE = "io.urlcrypt.core.engine.QueryDecryptionStrategy";

    public UrlCryptOptions {
        Objects.requireNonNull(pathPurpose, "pathPurpose must not be null");
        Objects.requireNonNull(queryPurpose, "queryPurpose must not be null");
        Objects.requireNonNull(unboundQueryStrategy, "unboundQueryStrategy must not be null");
        if (pathPurpose.isBlank() || queryPurpose.isBlank()) {
            throw new IllegalArgumentException("protector purposes must not be blank");
        }
    }

    /** Options with every default applied. */
    public static UrlCryptOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link UrlCryptOptions}. */
    public static final class Builder {
        private String pathPurpose = DEFAULT_PATH_PURPOSE;
        private String queryPurpose = DEFAULT_QUERY_PURPOSE;
        private boolean ignoreUnencryptedQueryWarnings = false;
        private QueryStrategyKind unboundQueryStrategy = QueryStrategyKind.GREEDY;
        private boolean showFullCryptographicException = false;

        Builder() {}

        public Builder pathPurpose(String pathPurpose) {
            this.pathPurpose = pathPurpose;
            return this;
        }

        public Builder queryPurpose(String queryPurpose) {
            this.queryPurpose = queryPurpose;
            return this;
        }

        public Builder ignoreUnencryptedQueryWarnings(boolean ignoreUnencryptedQueryWarnings) {
            this.ignoreUnencryptedQueryWarnings = ignoreUnencryptedQueryWarnings;
            return this;
        }

        public Builder unboundQueryStrategy(QueryStrategyKind unboundQueryStrategy) {
            this.unboundQueryStrategy = unboundQueryStrategy;
            return this;
        }

        public Builder showFullCryptographicException(boolean showFullCryptographicException) {
            this.showFullCryptographicException = showFullCryptographicException;
            return this;
        }

        public UrlCryptOptions build() {
            return new UrlCryptOptions(
                    pathPurpose,
                    queryPurpose,
                    ignoreUnencryptedQueryWarnings,
                    unboundQueryStrategy,
                    showFullCryptographicException);
        }
    }
}

package io.urlcrypt.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Output of a query strategy.
 *
 * @param query          the transformed parameters, a fresh instance with exactly the input keys
 * @param keysWithErrors reportable failures, in encounter order; always empty for greedy
 * @param strategy       the variant that produced this result
 */
public record QueryDecryptionResult(QueryParameters query, Set<String> keysWithErrors, QueryStrategyKind strategy) {

    public QueryDecryptionResult {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        keysWithErrors = keysWithErrors == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(keysWithErrors));
    }

    public boolean hasWarnings() {
        return !keysWithErrors.isEmpty();
    }
}

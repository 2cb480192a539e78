package io.urlcrypt.core.engine;

import io.urlcrypt.core.model.QueryDecryptionResult;
import io.urlcrypt.core.model.QueryParameters;
import io.urlcrypt.core.model.QueryStrategyKind;
import io.urlcrypt.core.model.TargetShape;

/**
 * Query decryption variant. Implementations produce a fresh {@link QueryParameters} holding exactly
 * the input keys, with values positionally preserved, and never throw for a bad token.
 */
public interface QueryDecryptionStrategy {

    QueryStrategyKind kind();

    /**
     * @param query       the inbound parameters
     * @param shape       the bound target shape, or {@code null} when none is known
     * @param requestPath the request path for observability, or {@code null}
     */
    QueryDecryptionResult decrypt(QueryParameters query, TargetShape shape, String requestPath);
}

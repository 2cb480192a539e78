package io.urlcrypt.core.engine;

import io.urlcrypt.core.model.DecryptionOutcome;
import io.urlcrypt.core.model.QueryDecryptionResult;
import io.urlcrypt.core.model.QueryParameters;
import io.urlcrypt.core.model.QueryStrategyKind;
import io.urlcrypt.core.model.TargetShape;
import io.urlcrypt.core.protect.Protector;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Greedy query variant: every non-empty value of every key is tried; failures keep the original.
 * Nothing is reported. The only safe variant before routing, since it needs no binding.
 */
public final class GreedyQueryDecryption implements QueryDecryptionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(GreedyQueryDecryption.class);

    private final Protector protector;
    private final boolean showFullCryptographicException;

    public GreedyQueryDecryption(Protector protector) {
        this(protector, false);
    }

    public GreedyQueryDecryption(Protector protector, boolean showFullCryptographicException) {
        this.protector = Objects.requireNonNull(protector, "protector must not be null");
        this.showFullCryptographicException = showFullCryptographicException;
    }

    @Override
    public QueryStrategyKind kind() {
        return QueryStrategyKind.GREEDY;
    }

    @Override
    public QueryDecryptionResult decrypt(QueryParameters query, TargetShape shape, String requestPath) {
        QueryParameters.Builder output = query.toBuilder();
        int decrypted = 0;
        for (String name : query.names()) {
            List<String> values = query.all(name);
            for (int i = 0; i < values.size(); i++) {
                String value = values.get(i);
                if (value.isEmpty()) {
                    continue;
                }
                DecryptionOutcome outcome =
                        DecryptAttempt.attempt(protector, value, "query '" + name + "'", LOG, showFullCryptographicException);
                if (outcome.isDecrypted()) {
                    output.replace(name, i, outcome.value());
                    decrypted++;
                }
            }
        }
        LOG.debug("Greedy query decryption: {} value(s) decrypted across {} key(s)", decrypted, query.size());
        return new QueryDecryptionResult(output.build(), Set.of(), QueryStrategyKind.GREEDY);
    }
}

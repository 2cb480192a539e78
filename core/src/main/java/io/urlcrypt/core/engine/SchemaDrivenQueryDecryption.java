package io.urlcrypt.core.engine;

import io.urlcrypt.core.model.DecryptionOutcome;
import io.urlcrypt.core.model.FieldPolicy;
import io.urlcrypt.core.model.QueryDecryptionResult;
import io.urlcrypt.core.model.QueryParameters;
import io.urlcrypt.core.model.QueryStrategyKind;
import io.urlcrypt.core.model.TargetShape;
import io.urlcrypt.core.protect.Protector;
import io.urlcrypt.core.schema.SchemaWalker;
import io.urlcrypt.core.spi.DecryptionListener;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schema-driven query variant. Only keys produced by walking the bound {@link TargetShape} are
 * decrypted; failures are classified as ignorable or reportable and reportable ones are
 * aggregated into exactly one WARN log and one {@link DecryptionListener} event per request.
 *
 * <p>Matching rules:
 *
 * <ul>
 *   <li>A policy applies to the first value of its key; further repetitions are carried
 *       unchanged.
 *   <li>Keys are matched by leaf wire-name only. A name produced by several policies is tried
 *       once and the first policy in walk order decides whether a failure is ignorable.
 *   <li>Keys without a policy are never touched.
 * </ul>
 *
 * Without a shape the variant degrades to a pass-through copy.
 */
public final class SchemaDrivenQueryDecryption implements QueryDecryptionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaDrivenQueryDecryption.class);

    private final Protector protector;
    private final boolean ignoreUnencryptedWarnings;
    private final DecryptionListener listener;
    private final boolean showFullCryptographicException;

    public SchemaDrivenQueryDecryption(Protector protector, boolean ignoreUnencryptedWarnings) {
        this(protector, ignoreUnencryptedWarnings, DecryptionListener.NOOP, false);
    }

    public SchemaDrivenQueryDecryption(
            Protector protector,
            boolean ignoreUnencryptedWarnings,
            DecryptionListener listener,
            boolean showFullCryptographicException) {
        this.protector = Objects.requireNonNull(protector, "protector must not be null");
        this.ignoreUnencryptedWarnings = ignoreUnencryptedWarnings;
        this.listener = listener != null ? listener : DecryptionListener.NOOP;
        this.showFullCryptographicException = showFullCryptographicException;
    }

    @Override
    public QueryStrategyKind kind() {
        return QueryStrategyKind.SCHEMA_DRIVEN;
    }

    @Override
    public QueryDecryptionResult decrypt(QueryParameters query, TargetShape shape, String requestPath) {
        if (shape == null) {
            LOG.debug("MissingSchema: no target shape bound for {}; query passed through", requestPath);
            return new QueryDecryptionResult(query.toBuilder().build(), Set.of(), QueryStrategyKind.SCHEMA_DRIVEN);
        }

        QueryParameters.Builder output = query.toBuilder();
        Set<String> keysWithErrors = new LinkedHashSet<>();
        Set<String> attempted = new HashSet<>();

        for (FieldPolicy policy : SchemaWalker.walk(shape)) {
            String name = policy.name();
            if (!attempted.add(name)) {
                continue;
            }
            String value = query.first(name);
            if (value == null || value.isEmpty()) {
                continue;
            }
            DecryptionOutcome outcome = classify(
                    DecryptAttempt.attempt(protector, value, "query '" + name + "'", LOG, showFullCryptographicException),
                    policy);
            switch (outcome.kind()) {
                case DECRYPTED -> output.replace(name, 0, outcome.value());
                case FAILED_REPORTABLE -> keysWithErrors.add(name);
                default -> {
                    // ignorable failure: original value already in place
                }
            }
        }

        if (!keysWithErrors.isEmpty()) {
            LOG.warn(
                    "Errors occurred when attempting to decrypt one or more query parameters. "
                            + "This generally occurs because the parameter was not encrypted to begin with. "
                            + "Parameters: {}",
                    keysWithErrors);
            notifyWarning(keysWithErrors, requestPath);
        }
        return new QueryDecryptionResult(output.build(), keysWithErrors, QueryStrategyKind.SCHEMA_DRIVEN);
    }

    private DecryptionOutcome classify(DecryptionOutcome attempt, FieldPolicy policy) {
        if (attempt.isDecrypted()) {
            return attempt;
        }
        boolean ignore = ignoreUnencryptedWarnings || policy.ignoreFailureWarning();
        return ignore
                ? DecryptionOutcome.failedIgnorable(attempt.value())
                : DecryptionOutcome.failedReportable(attempt.value());
    }

    private void notifyWarning(Set<String> keys, String requestPath) {
        try {
            listener.onQueryDecryptionWarning(new DecryptionListener.QueryDecryptionWarningEvent(keys, requestPath));
        } catch (Exception e) {
            LOG.warn("DecryptionListener.onQueryDecryptionWarning failed", e);
        }
    }
}

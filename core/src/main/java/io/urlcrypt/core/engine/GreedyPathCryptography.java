package io.urlcrypt.core.engine;

import io.urlcrypt.core.model.DecryptionOutcome;
import io.urlcrypt.core.model.PathDecryptionResult;
import io.urlcrypt.core.model.PathSegments;
import io.urlcrypt.core.protect.Protector;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Greedy path strategy: every non-empty segment is tried, failures fall back to the original
 * segment. Empty segments, and segments that decrypt to a blank value, are dropped; the result
 * always has a single leading slash.
 *
 * <p>Immutable and thread-safe.
 */
public final class GreedyPathCryptography implements PathCryptography {

    private static final Logger LOG = LoggerFactory.getLogger(GreedyPathCryptography.class);

    private final Protector protector;
    private final boolean showFullCryptographicException;

    public GreedyPathCryptography(Protector protector) {
        this(protector, false);
    }

    public GreedyPathCryptography(Protector protector, boolean showFullCryptographicException) {
        this.protector = Objects.requireNonNull(protector, "protector must not be null");
        this.showFullCryptographicException = showFullCryptographicException;
    }

    @Override
    public PathDecryptionResult decrypt(String path) {
        List<String> segments = PathSegments.split(path);
        List<String> output = new ArrayList<>(segments.size());
        Set<Integer> decrypted = new LinkedHashSet<>();
        for (int i = 0; i < segments.size(); i++) {
            DecryptionOutcome outcome =
                    DecryptAttempt.attempt(protector, segments.get(i), "path segment " + i, LOG, showFullCryptographicException);
            if (outcome.isDecrypted()) {
                if (outcome.value().isBlank()) {
                    continue;
                }
                decrypted.add(output.size());
            }
            output.add(outcome.value());
        }
        LOG.debug(
                "Path decryption: {} of {} segment(s) decrypted, {} dropped",
                decrypted.size(),
                segments.size(),
                segments.size() - output.size());
        return new PathDecryptionResult(output, decrypted);
    }

    @Override
    public List<String> encrypt(List<String> segments, Set<Integer> positions) {
        List<String> output = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            output.add(positions.contains(i) ? protector.encrypt(segments.get(i)) : segments.get(i));
        }
        return output;
    }

    @Override
    public String encryptAll(String path) {
        List<String> output = new ArrayList<>();
        for (String segment : PathSegments.split(path)) {
            output.add(protector.encrypt(segment));
        }
        return PathSegments.join(output);
    }
}

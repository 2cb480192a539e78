package io.urlcrypt.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Output of the path strategy.
 *
 * <p>The segments are kept as a list because a decrypted plaintext may itself contain {@code '/'};
 * such a value stays one segment and is percent-encoded as {@code %2F} by {@link #encodedPath()}.
 *
 * @param segments          the rewritten, non-empty segments in order
 * @param decryptedSegments 0-based positions in {@code segments} that hold a decrypted plaintext
 */
public record PathDecryptionResult(List<String> segments, Set<Integer> decryptedSegments) {

    public PathDecryptionResult {
        segments = List.copyOf(Objects.requireNonNull(segments, "segments must not be null"));
        decryptedSegments =
                decryptedSegments == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(decryptedSegments));
        for (Integer position : decryptedSegments) {
            if (position < 0 || position >= segments.size()) {
                throw new IllegalArgumentException(
                        "decrypted position " + position + " outside " + segments.size() + " segment(s)");
            }
        }
    }

    /** Result for an already-split path, e.g. {@code "/orders/42"} with position 1 decrypted. */
    public PathDecryptionResult(String path, Set<Integer> decryptedSegments) {
        this(PathSegments.split(path), decryptedSegments);
    }

    public static PathDecryptionResult unchanged(String path) {
        return new PathDecryptionResult(path, Set.of());
    }

    /** The rewritten path in decoded form, with a single leading slash. */
    public String path() {
        return PathSegments.join(segments);
    }

    /** The rewritten path with every segment percent-encoded on its own. */
    public String encodedPath() {
        return PathSegments.encodeSegments(segments);
    }

    public boolean anyDecrypted() {
        return !decryptedSegments.isEmpty();
    }

    /** The plaintext values of the decrypted segments, in path order. */
    public List<String> decryptedValues() {
        List<String> values = new ArrayList<>(decryptedSegments.size());
        for (Integer position : decryptedSegments) {
            values.add(segments.get(position));
        }
        return values;
    }
}

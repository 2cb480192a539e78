package io.urlcrypt.core.engine;

import io.urlcrypt.core.model.PathDecryptionResult;
import io.urlcrypt.core.model.PathSegments;
import java.util.List;
import java.util.Set;

/** Decrypts and encrypts URL paths segment by segment. */
public interface PathCryptography {

    /**
     * Decrypts every non-empty segment independently. Segments that fail to decrypt pass through
     * unchanged; failures are never reported. A segment whose plaintext is blank is dropped, and a
     * plaintext containing {@code '/'} stays a single segment.
     *
     * @param path the path, segments already percent-decoded; {@code null} or empty gives {@code /}
     */
    PathDecryptionResult decrypt(String path);

    /**
     * Encrypts the segments at the given 0-based positions (counted over non-empty segments) and
     * leaves all others unchanged. Positions beyond the last segment are ignored.
     */
    default String encrypt(String path, Set<Integer> positions) {
        return PathSegments.join(encrypt(PathSegments.split(path), positions));
    }

    /** Segment-list form of {@link #encrypt(String, Set)}. */
    List<String> encrypt(List<String> segments, Set<Integer> positions);

    /** Encrypts every non-empty segment. */
    String encryptAll(String path);
}

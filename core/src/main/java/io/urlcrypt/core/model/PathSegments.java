package io.urlcrypt.core.model;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/** Splitting, joining and percent-coding of URL paths. */
public final class PathSegments {

    private PathSegments() {
        // utility class
    }

    /**
     * Splits a path on {@code '/'}. Empty segments (leading, trailing or doubled slashes) are
     * dropped.
     *
     * @return the non-empty segments in order; an empty list for a {@code null} or empty path
     */
    public static List<String> split(String path) {
        List<String> segments = new ArrayList<>();
        if (path == null || path.isEmpty()) {
            return segments;
        }
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return segments;
    }

    /** Joins segments with {@code '/'} behind a single leading slash. No segments gives {@code "/"}. */
    public static String join(List<String> segments) {
        if (segments.isEmpty()) {
            return "/";
        }
        return "/" + String.join("/", segments);
    }

    /**
     * Percent-decodes one raw path segment. Unlike form decoding, {@code '+'} is kept literally.
     * A segment with an invalid escape sequence is returned unchanged.
     */
    public static String decodeSegment(String rawSegment) {
        if (rawSegment.indexOf('%') < 0) {
            return rawSegment;
        }
        try {
            return URLDecoder.decode(rawSegment.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return rawSegment;
        }
    }

    /**
     * Percent-decodes every segment of a raw path. Empty segments are dropped as in {@link
     * #split(String)}.
     */
    public static String decodePath(String rawPath) {
        List<String> decoded = new ArrayList<>();
        for (String segment : split(rawPath)) {
            decoded.add(decodeSegment(segment));
        }
        return join(decoded);
    }

    /**
     * Percent-encodes a path per RFC 3986 §3.3, preserving {@code '/'} separators. Each segment
     * between slashes is encoded individually.
     */
    public static String encodePath(String path) {
        if (path == null || path.isEmpty()) {
            return path;
        }
        String[] segments = path.split("/", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                sb.append('/');
            }
            sb.append(encodeSegment(segments[i]));
        }
        return sb.toString();
    }

    /**
     * Encodes each segment on its own and joins them behind a single leading slash, so a {@code
     * '/'} inside a segment becomes {@code %2F}.
     */
    public static String encodeSegments(List<String> segments) {
        List<String> encoded = new ArrayList<>(segments.size());
        for (String segment : segments) {
            encoded.add(encodeSegment(segment));
        }
        return join(encoded);
    }

    /** Encodes a single segment. Unreserved characters (A-Z, a-z, 0-9, -, ., _, ~) pass as-is. */
    public static String encodeSegment(String segment) {
        if (segment.isEmpty()) {
            return segment;
        }
        // URLEncoder encodes spaces as '+', RFC 3986 requires '%20'
        return URLEncoder.encode(segment, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%7E", "~");
    }
}

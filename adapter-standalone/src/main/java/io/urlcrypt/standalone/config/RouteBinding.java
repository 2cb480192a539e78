package io.urlcrypt.standalone.config;

import io.urlcrypt.core.model.TargetShape;
import java.util.Locale;
import java.util.Objects;

/**
 * Binds a route (optional method plus path pattern) to the {@link TargetShape}
 * describing its query parameters.
 *
 * <p>
 * Patterns are matched against the decrypted path. {@code *} matches exactly
 * one segment and {@code **} matches any remaining tail.
 *
 * @param method      HTTP method, or {@code null} for any method
 * @param pathPattern path pattern, e.g. {@code /orders/*}
 * @param shape       the bound shape
 */
public record RouteBinding(String method, String pathPattern, TargetShape shape) {

    public RouteBinding {
        Objects.requireNonNull(pathPattern, "pathPattern must not be null");
        Objects.requireNonNull(shape, "shape must not be null");
        if (!pathPattern.startsWith("/")) {
            throw new IllegalArgumentException("pathPattern must start with '/': " + pathPattern);
        }
        if (method != null && method.isBlank()) {
            method = null;
        }
        if (method != null) {
            method = method.trim().toUpperCase(Locale.ROOT);
        }
    }

    /** Number of literal (non-wildcard) segments in the pattern. */
    public int specificityScore() {
        int score = 0;
        for (String segment : pathPattern.split("/")) {
            if (!segment.isEmpty() && !segment.equals("*") && !segment.equals("**")) {
                score++;
            }
        }
        return score;
    }

    /** 1 when the binding is restricted to a method, else 0. */
    public int constraintCount() {
        return method != null ? 1 : 0;
    }
}

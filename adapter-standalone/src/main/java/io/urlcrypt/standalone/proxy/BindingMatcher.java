package io.urlcrypt.standalone.proxy;

import io.urlcrypt.standalone.config.RouteBinding;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the {@link RouteBinding} for a decrypted request path.
 *
 * <p>
 * Most specific wins: the binding with the most literal path segments is
 * selected, ties broken in favour of bindings that restrict the method, then
 * by declaration order. Patterns support:
 * <ul>
 * <li>exact match: {@code /orders/search}</li>
 * <li>single-segment wildcard: {@code /orders/&#42;} matches
 * {@code /orders/42}</li>
 * <li>tail wildcard: {@code /orders/&#42;&#42;} matches {@code /orders},
 * {@code /orders/42/items}</li>
 * </ul>
 *
 * <p>
 * The list is read-only after construction, so one instance is shared by all
 * request threads.
 */
public final class BindingMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(BindingMatcher.class);

    private final List<RouteBinding> bindings;

    public BindingMatcher(List<RouteBinding> bindings) {
        this.bindings = List.copyOf(bindings);
    }

    /**
     * @param path   the decrypted request path
     * @param method the HTTP method, may be null
     * @return the best matching binding, or empty when none matches
     */
    public Optional<RouteBinding> findBestMatch(String path, String method) {
        List<RouteBinding> matches = findMatches(path, method);
        if (matches.isEmpty()) {
            LOG.debug("No binding for {} {}", method, path);
            return Optional.empty();
        }
        RouteBinding best = matches.get(0);
        LOG.debug(
                "Binding resolved: {} {} -> pattern='{}', shape='{}'",
                method,
                path,
                best.pathPattern(),
                best.shape().name());
        return Optional.of(best);
    }

    /** All matching bindings, most specific first. The sort is stable. */
    List<RouteBinding> findMatches(String path, String method) {
        List<RouteBinding> matches = new ArrayList<>();
        for (RouteBinding binding : bindings) {
            if (matches(binding, path, method)) {
                matches.add(binding);
            }
        }
        matches.sort(Comparator.comparingInt(RouteBinding::specificityScore)
                .thenComparingInt(RouteBinding::constraintCount)
                .reversed());
        return matches;
    }

    static boolean matches(RouteBinding binding, String path, String method) {
        if (binding.method() != null && method != null && !binding.method().equalsIgnoreCase(method)) {
            return false;
        }
        return pathMatches(binding.pathPattern(), path);
    }

    static boolean pathMatches(String pattern, String path) {
        if (pattern.equals(path)) {
            return true;
        }
        return matchSegments(splitPath(pattern), splitPath(path), 0, 0);
    }

    private static boolean matchSegments(String[] pattern, String[] path, int pi, int si) {
        if (pi == pattern.length) {
            return si == path.length;
        }

        // ** consumes zero or more segments
        if (pattern[pi].equals("**")) {
            for (int i = si; i <= path.length; i++) {
                if (matchSegments(pattern, path, pi + 1, i)) {
                    return true;
                }
            }
            return false;
        }

        if (si == path.length) {
            return false;
        }
        if (pattern[pi].equals("*") || pattern[pi].equals(path[si])) {
            return matchSegments(pattern, path, pi + 1, si + 1);
        }
        return false;
    }

    private static String[] splitPath(String path) {
        if (path == null || path.isEmpty() || path.equals("/")) {
            return new String[0];
        }
        return Arrays.stream(path.split("/"))
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
    }
}

package io.urlcrypt.core.model;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, multi-valued query parameter collection. Key insertion order and value order are
 * preserved exactly, so a transform that only replaces values keeps the query's shape.
 *
 * <p>Decryption strategies never mutate an instance; they derive a fresh copy via {@link
 * #toBuilder()}.
 */
public final class QueryParameters {

    private static final QueryParameters EMPTY = new QueryParameters(new LinkedHashMap<>());

    /** Internal storage: insertion-ordered keys, values are non-empty unmodifiable lists. */
    private final LinkedHashMap<String, List<String>> store;

    private QueryParameters(LinkedHashMap<String, List<String>> store) {
        this.store = store;
    }

    /**
     * First value for a parameter name.
     *
     * @return the first value, or {@code null} if the parameter is absent
     */
    public String first(String name) {
        List<String> values = store.get(name);
        return values != null && !values.isEmpty() ? values.get(0) : null;
    }

    /** All values for a parameter name, or an empty list if absent. */
    public List<String> all(String name) {
        List<String> values = store.get(name);
        return values != null ? values : List.of();
    }

    public boolean contains(String name) {
        return store.containsKey(name);
    }

    /** Parameter names in insertion order. */
    public Set<String> names() {
        return Collections.unmodifiableSet(store.keySet());
    }

    public int size() {
        return store.size();
    }

    public boolean isEmpty() {
        return store.isEmpty();
    }

    /** Unmodifiable name → values view, in insertion order. */
    public Map<String, List<String>> toMultiValueMap() {
        return Collections.unmodifiableMap(store);
    }

    /** Returns a builder pre-populated with a copy of this instance. */
    public Builder toBuilder() {
        Builder builder = new Builder();
        store.forEach((name, values) -> builder.store.put(name, new ArrayList<>(values)));
        return builder;
    }

    /**
     * Renders the parameters as a raw query string without the leading {@code '?'}. Keys and
     * values are percent-encoded per RFC 3986 §3.4; a parameter with an empty value is rendered
     * as its bare name.
     *
     * @return the query string, or an empty string when there are no parameters
     */
    public String toQueryString() {
        StringBuilder sb = new StringBuilder();
        store.forEach((name, values) -> {
            for (String value : values) {
                if (sb.length() > 0) {
                    sb.append('&');
                }
                sb.append(encodeComponent(name));
                if (!value.isEmpty()) {
                    sb.append('=').append(encodeComponent(value));
                }
            }
        });
        return sb.toString();
    }

    // ── Factory methods ──

    public static QueryParameters empty() {
        return EMPTY;
    }

    /**
     * Parses a raw query string (with or without leading {@code '?'}). Keys and values are
     * percent-decoded; a pair without {@code '='} yields an empty value; empty pairs are skipped.
     * A component with an invalid escape sequence is kept verbatim.
     */
    public static QueryParameters parse(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return EMPTY;
        }
        String query = rawQuery.charAt(0) == '?' ? rawQuery.substring(1) : rawQuery;
        Builder builder = new Builder();
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            if (eq >= 0) {
                builder.add(decodeComponent(pair.substring(0, eq)), decodeComponent(pair.substring(eq + 1)));
            } else {
                builder.add(decodeComponent(pair), "");
            }
        }
        return builder.build();
    }

    /** Creates parameters from a single-value map, keeping the map's iteration order. */
    public static QueryParameters of(Map<String, String> singleValue) {
        if (singleValue == null || singleValue.isEmpty()) {
            return EMPTY;
        }
        Builder builder = new Builder();
        singleValue.forEach(builder::add);
        return builder.build();
    }

    /** Creates parameters from a multi-value map, keeping the map's iteration order. */
    public static QueryParameters ofMulti(Map<String, List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        Builder builder = new Builder();
        multiValue.forEach((name, values) -> values.forEach(value -> builder.add(name, value)));
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ── Encoding helpers ──

    private static String decodeComponent(String component) {
        try {
            return URLDecoder.decode(component, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return component;
        }
    }

    private static String encodeComponent(String component) {
        if (component.isEmpty()) {
            return component;
        }
        // URLEncoder uses + for spaces, RFC 3986 prefers %20
        return URLEncoder.encode(component, StandardCharsets.UTF_8).replace("+", "%20");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryParameters that)) return false;
        return store.equals(that.store);
    }

    @Override
    public int hashCode() {
        return store.hashCode();
    }

    @Override
    public String toString() {
        return "QueryParameters" + store.keySet();
    }

    /** Mutable builder; {@link #build()} snapshots the current state. */
    public static final class Builder {

        private final LinkedHashMap<String, List<String>> store = new LinkedHashMap<>();

        private Builder() {}

        /** Appends a value, creating the parameter if it does not exist yet. */
        public Builder add(String name, String value) {
            store.computeIfAbsent(name, k -> new ArrayList<>()).add(value == null ? "" : value);
            return this;
        }

        /**
         * Replaces the value at {@code index} of an existing parameter. Position and all other
         * values are kept.
         */
        public Builder replace(String name, int index, String value) {
            List<String> values = store.get(name);
            if (values == null || index < 0 || index >= values.size()) {
                throw new IllegalArgumentException("no value at index " + index + " for parameter '" + name + "'");
            }
            values.set(index, value == null ? "" : value);
            return this;
        }

        public QueryParameters build() {
            if (store.isEmpty()) {
                return EMPTY;
            }
            LinkedHashMap<String, List<String>> copy = new LinkedHashMap<>();
            store.forEach((name, values) -> copy.put(name, List.copyOf(values)));
            return new QueryParameters(copy);
        }
    }
}

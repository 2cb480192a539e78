package io.urlcrypt.core.model;

/**
 * The URL view of an inbound request: a path (segments already percent-decoded) and its parsed
 * query. Immutable.
 */
public record RequestUrl(String path, QueryParameters query) {

    public RequestUrl {
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (query == null) {
            query = QueryParameters.empty();
        }
    }

    public static RequestUrl of(String path, String rawQuery) {
        return new RequestUrl(path, QueryParameters.parse(rawQuery));
    }

    public RequestUrl withPath(String newPath) {
        return new RequestUrl(newPath, query);
    }

    public RequestUrl withQuery(QueryParameters newQuery) {
        return new RequestUrl(path, newQuery);
    }

    /** Raw query string without leading {@code '?'}, or {@code null} when there is none. */
    public String queryString() {
        return query.isEmpty() ? null : query.toQueryString();
    }

    /** Percent-encoded path plus query, e.g. {@code /orders/42?lastName=Doe}. */
    public String toUriString() {
        String encoded = PathSegments.encodePath(path);
        return query.isEmpty() ? encoded : encoded + "?" + query.toQueryString();
    }
}

package io.urlcrypt.standalone.proxy;

import java.util.Map;

/**
 * Backend response as returned by {@link UpstreamClient#forward}. Header names
 * are lowercase, first value wins. The body is passed through as raw bytes.
 *
 * @param statusCode backend status code
 * @param headers    single-value header map
 * @param body       response body, empty for no-body responses
 */
public record UpstreamResponse(int statusCode, Map<String, String> headers, byte[] body) {

    public UpstreamResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }

    /** Header value by lowercase name, or {@code null}. */
    public String header(String lowerCaseName) {
        return headers.get(lowerCaseName);
    }
}

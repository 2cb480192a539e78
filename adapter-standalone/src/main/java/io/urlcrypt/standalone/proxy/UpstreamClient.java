package io.urlcrypt.standalone.proxy;

import io.urlcrypt.standalone.config.ProxyConfig;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards decrypted requests to the backend with the JDK {@link HttpClient}.
 *
 * <p>
 * Uses HTTP/1.1 and never follows redirects, so {@code Location} headers reach
 * the proxy untouched and can be re-encrypted there. Thread-safe.
 */
public final class UpstreamClient {

    private static final Logger LOG = LoggerFactory.getLogger(UpstreamClient.class);

    /** Hop-by-hop headers (RFC 7230 §6.1), stripped in both directions. */
    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection",
            "transfer-encoding",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "te",
            "trailer",
            "upgrade");

    /** Managed by the JDK HttpClient itself, which rejects them when set manually. */
    private static final Set<String> RESTRICTED_HEADERS =
            Set.of("host", "content-length", "expect", "date", "from", "via", "warning");

    private final HttpClient httpClient;
    private final String backendBaseUrl;
    private final Duration readTimeout;

    public UpstreamClient(ProxyConfig config) {
        this.backendBaseUrl = config.backendScheme() + "://" + config.backendHost() + ":" + config.backendPort();
        this.readTimeout = Duration.ofMillis(config.backendReadTimeoutMs());

        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(config.backendConnectTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();

        LOG.debug("UpstreamClient initialized: backend={}", backendBaseUrl);
    }

    /**
     * Forwards a request to the backend.
     *
     * @param method  HTTP method
     * @param target  already-encoded path plus optional query, e.g.
     *                {@code /orders/42?id=7}
     * @param body    request body, null or empty for bodyless requests
     * @param headers request headers (lowercase keys), may be null
     * @throws UpstreamConnectException if the backend is unreachable
     * @throws UpstreamTimeoutException if the backend exceeds the read timeout
     * @throws InterruptedException     if interrupted while waiting
     */
    public UpstreamResponse forward(String method, String target, byte[] body, Map<String, String> headers)
            throws UpstreamException, InterruptedException {

        URI targetUri = URI.create(backendBaseUrl + target);

        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .uri(targetUri)
                .timeout(readTimeout)
                .method(
                        method,
                        body != null && body.length > 0
                                ? HttpRequest.BodyPublishers.ofByteArray(body)
                                : HttpRequest.BodyPublishers.noBody());

        if (headers != null) {
            for (Map.Entry<String, String> entry : headers.entrySet()) {
                String name = entry.getKey();
                if (isRestrictedHeader(name) || isHopByHop(name.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                requestBuilder.header(name, entry.getValue());
            }
        }

        LOG.debug("Forwarding {} {}", method, targetUri);

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpConnectTimeoutException e) {
            throw new UpstreamConnectException("Connect timeout to " + targetUri, e);
        } catch (HttpTimeoutException e) {
            throw new UpstreamTimeoutException("Read timeout from " + targetUri, e);
        } catch (ConnectException e) {
            throw new UpstreamConnectException("Connection refused by " + targetUri, e);
        } catch (IOException e) {
            throw new UpstreamConnectException("Failed to connect to " + targetUri, e);
        }

        Map<String, String> responseHeaders = new LinkedHashMap<>();
        response.headers().map().forEach((name, values) -> {
            String lowerName = name.toLowerCase(Locale.ROOT);
            if (!values.isEmpty() && !isHopByHop(lowerName)) {
                responseHeaders.put(lowerName, values.get(0));
            }
        });

        LOG.debug("Backend responded: {} {} → {}", method, target, response.statusCode());

        return new UpstreamResponse(response.statusCode(), responseHeaders, response.body());
    }

    private static boolean isRestrictedHeader(String name) {
        return RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT));
    }

    private static boolean isHopByHop(String lowerCaseName) {
        return HOP_BY_HOP_HEADERS.contains(lowerCaseName);
    }
}

package io.urlcrypt.standalone.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.urlcrypt.core.engine.UrlTransformEngine;
import io.urlcrypt.core.model.PathDecryptionResult;
import io.urlcrypt.core.model.PathSegments;
import io.urlcrypt.core.model.QueryDecryptionResult;
import io.urlcrypt.core.model.RequestUrl;
import io.urlcrypt.core.model.RoutingPhase;
import io.urlcrypt.core.model.TargetShape;
import io.urlcrypt.core.model.UrlTransformResult;
import io.urlcrypt.standalone.adapter.StandaloneAdapter;
import io.urlcrypt.standalone.config.RouteBinding;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Decrypts the inbound URL and forwards the request to the backend.
 *
 * <p>
 * Per request:
 * <ol>
 * <li>Snapshot the URL (via {@link StandaloneAdapter})</li>
 * <li>Decrypt the path, before any routing decision</li>
 * <li>Resolve the {@link RouteBinding} on the decrypted path</li>
 * <li>Decrypt the query with the bound shape, or the unbound strategy</li>
 * <li>Forward the plaintext URL (via {@link UpstreamClient})</li>
 * <li>Copy the backend response, re-encrypting a relative {@code Location}
 * when enabled</li>
 * </ol>
 *
 * <p>
 * A value that fails to decrypt never fails the request. Only backend errors
 * produce a Problem Details response. Thread-safe: all state is local to
 * {@link #handle(Context)}.
 */
public final class ProxyHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(ProxyHandler.class);

    private static final String REQUEST_ID_HEADER = "x-request-id";
    static final String MDC_REQUEST_ID = "requestId";

    private final UrlTransformEngine engine;
    private final StandaloneAdapter adapter;
    private final BindingMatcher bindingMatcher;
    private final UpstreamClient upstreamClient;
    private final boolean forwardedHeadersEnabled;
    private final boolean reencryptLocation;

    /**
     * @param engine                  URL decryption engine
     * @param adapter                 Javalin-to-{@link RequestUrl} adapter
     * @param bindingMatcher          route binding resolver
     * @param upstreamClient          backend client
     * @param forwardedHeadersEnabled inject X-Forwarded-* headers
     * @param reencryptLocation       re-encrypt relative Location headers
     */
    public ProxyHandler(
            UrlTransformEngine engine,
            StandaloneAdapter adapter,
            BindingMatcher bindingMatcher,
            UpstreamClient upstreamClient,
            boolean forwardedHeadersEnabled,
            boolean reencryptLocation) {
        this.engine = engine;
        this.adapter = adapter;
        this.bindingMatcher = bindingMatcher;
        this.upstreamClient = upstreamClient;
        this.forwardedHeadersEnabled = forwardedHeadersEnabled;
        this.reencryptLocation = reencryptLocation;
    }

    @Override
    public void handle(Context ctx) throws Exception {
        String requestId = ctx.header("X-Request-ID");
        if (requestId == null || requestId.isEmpty()) {
            requestId = UUID.randomUUID().toString();
        }
        ctx.header(REQUEST_ID_HEADER, requestId);

        MDC.put(MDC_REQUEST_ID, requestId);
        try {
            proxy(ctx, requestId);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private void proxy(Context ctx, String requestId) throws InterruptedException {
        String method = ctx.method().name();

        // --- Inbound: path first, then route, then query ---
        RequestUrl inbound = adapter.wrapRequest(ctx);
        PathDecryptionResult path = engine.decryptPath(inbound.path());
        TargetShape shape = bindingMatcher
                .findBestMatch(path.path(), method)
                .map(RouteBinding::shape)
                .orElse(null);
        QueryDecryptionResult query =
                engine.decryptQuery(inbound.query(), RoutingPhase.POST_ROUTING, shape, path.path());

        UrlTransformResult result =
                new UrlTransformResult(inbound, new RequestUrl(path.path(), query.query()), path, query);
        adapter.applyChanges(result, ctx);

        String target = buildForwardTarget(ctx, result);
        LOG.debug(
                "Proxying {} {}: decryptedSegments={}, shape={}, strategy={}",
                method,
                ctx.path(),
                path.decryptedSegments().size(),
                shape != null ? shape.name() : null,
                query.strategy());

        // --- Forward ---
        Map<String, String> forwardHeaders = adapter.requestHeaders(ctx);
        forwardHeaders.put(REQUEST_ID_HEADER, requestId);
        if (forwardedHeadersEnabled) {
            forwardHeaders = injectForwardedHeaders(forwardHeaders, ctx);
        }

        UpstreamResponse upstreamResponse;
        try {
            upstreamResponse = upstreamClient.forward(method, target, ctx.bodyAsBytes(), forwardHeaders);
        } catch (UpstreamTimeoutException e) {
            LOG.warn("Backend timeout: {}", e.getMessage(), e);
            writeProblemResponse(ctx, 504, ProblemDetail.gatewayTimeout(e.getMessage(), ctx.path()));
            return;
        } catch (UpstreamConnectException e) {
            LOG.warn("Backend unreachable: {}", e.getMessage(), e);
            writeProblemResponse(ctx, 502, ProblemDetail.backendUnreachable(e.getMessage(), ctx.path()));
            return;
        } catch (UpstreamException e) {
            LOG.warn("Backend call failed: {}", e.getMessage(), e);
            writeProblemResponse(ctx, 502, ProblemDetail.backendUnreachable(e.getMessage(), ctx.path()));
            return;
        }

        // --- Outbound ---
        ctx.status(upstreamResponse.statusCode());
        // Jetty sets framing headers from the body actually written
        upstreamResponse.headers().forEach((name, value) -> {
            if (!"content-length".equals(name) && !"transfer-encoding".equals(name)) {
                ctx.header(name, value);
            }
        });
        String location = upstreamResponse.header("location");
        if (reencryptLocation && location != null) {
            String rewritten = rewriteLocation(location, path);
            if (!rewritten.equals(location)) {
                LOG.debug("Location re-encrypted: {} -> {}", location, rewritten);
                ctx.header("location", rewritten);
            }
        }
        ctx.result(upstreamResponse.body());
    }

    /**
     * Path and query of the forwarded request. Parts that were not changed are
     * forwarded in their raw inbound form.
     */
    static String buildForwardTarget(Context ctx, UrlTransformResult result) {
        RequestUrl original = result.original();
        RequestUrl transformed = result.transformed();

        String forwardPath = result.path().anyDecrypted() ? result.path().encodedPath() : ctx.path();
        String forwardQuery = transformed.query().equals(original.query())
                ? ctx.queryString()
                : transformed.queryString();

        if (forwardQuery == null || forwardQuery.isEmpty()) {
            return forwardPath;
        }
        return forwardPath + "?" + forwardQuery;
    }

    /**
     * Re-encrypts the segments of an origin-relative Location (starting with a
     * single {@code '/'}) that equal a plaintext decrypted from the inbound
     * path. Absolute URLs and other forms are returned unchanged, as is the
     * query or fragment part.
     */
    String rewriteLocation(String location, PathDecryptionResult inboundPath) {
        if (!inboundPath.anyDecrypted() || !location.startsWith("/") || location.startsWith("//")) {
            return location;
        }
        int end = location.length();
        int q = location.indexOf('?');
        int f = location.indexOf('#');
        if (q >= 0) end = q;
        if (f >= 0 && f < end) end = f;

        List<String> decoded = new ArrayList<>();
        for (String rawSegment : PathSegments.split(location.substring(0, end))) {
            decoded.add(PathSegments.decodeSegment(rawSegment));
        }
        List<String> reencrypted = engine.reencryptSegments(decoded, inboundPath);
        if (reencrypted.equals(decoded)) {
            return location;
        }
        return PathSegments.encodeSegments(reencrypted) + location.substring(end);
    }

    private static void writeProblemResponse(Context ctx, int statusCode, JsonNode problem) {
        ctx.status(statusCode);
        ctx.contentType("application/problem+json");
        ctx.result(problem.toString());
    }

    /**
     * Adds {@code X-Forwarded-For} (appending to an existing chain per RFC
     * 7239), {@code X-Forwarded-Proto} and {@code X-Forwarded-Host}.
     */
    private static Map<String, String> injectForwardedHeaders(Map<String, String> headers, Context ctx) {
        Map<String, String> mutable = new LinkedHashMap<>(headers);

        String clientIp = ctx.ip();
        String existingXff = mutable.get("x-forwarded-for");
        if (existingXff != null && !existingXff.isEmpty()) {
            mutable.put("x-forwarded-for", existingXff + ", " + clientIp);
        } else {
            mutable.put("x-forwarded-for", clientIp);
        }

        mutable.put("x-forwarded-proto", ctx.scheme());

        String host = ctx.header("Host");
        if (host != null && !host.isEmpty()) {
            mutable.put("x-forwarded-host", host);
        }
        return mutable;
    }
}

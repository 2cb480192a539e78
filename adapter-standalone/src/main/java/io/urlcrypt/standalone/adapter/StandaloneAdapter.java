package io.urlcrypt.standalone.adapter;

import io.javalin.http.Context;
import io.urlcrypt.core.model.PathSegments;
import io.urlcrypt.core.model.RequestUrl;
import io.urlcrypt.core.model.UrlTransformResult;
import io.urlcrypt.core.spi.GatewayAdapter;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link GatewayAdapter} for Javalin's {@link Context}.
 *
 * <p>
 * {@link #wrapRequest} snapshots the raw request URI: path segments are
 * percent-decoded (a literal {@code '+'} is kept) and the raw query string is
 * parsed into ordered parameters. {@link #applyChanges} stores the rewritten
 * path and query on the context as attributes, where the proxy handler and any
 * later Javalin handler pick them up.
 *
 * <p>
 * Stateless, so one instance serves all request threads.
 */
public final class StandaloneAdapter implements GatewayAdapter<Context> {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneAdapter.class);

    /** Context attribute holding the decrypted path (decoded form). */
    public static final String PATH_ATTRIBUTE = "urlcrypt.path";

    /** Context attribute holding the decrypted query string, or absent. */
    public static final String QUERY_ATTRIBUTE = "urlcrypt.query";

    @Override
    public RequestUrl wrapRequest(Context ctx) {
        String rawPath = ctx.path();
        String rawQuery = ctx.queryString();
        RequestUrl url = RequestUrl.of(PathSegments.decodePath(rawPath), rawQuery);

        LOG.debug(
                "wrapRequest: {} {} (query params={})",
                ctx.method().name(),
                rawPath,
                url.query().size());
        return url;
    }

    @Override
    public void applyChanges(UrlTransformResult result, Context ctx) {
        RequestUrl transformed = result.transformed();
        ctx.attribute(PATH_ATTRIBUTE, transformed.path());
        String query = transformed.queryString();
        if (query != null) {
            ctx.attribute(QUERY_ATTRIBUTE, query);
        }

        LOG.debug(
                "applyChanges: modified={}, decryptedSegments={}, queryWarnings={}",
                result.isModified(),
                result.path().decryptedSegments().size(),
                result.query().keysWithErrors().size());
    }

    /**
     * Request headers with lowercase names. For repeated headers the values are
     * joined with {@code ", "}.
     */
    public Map<String, String> requestHeaders(Context ctx) {
        Map<String, String> headers = new LinkedHashMap<>();
        Enumeration<String> names = ctx.req().getHeaderNames();
        if (names == null) {
            return headers;
        }
        while (names.hasMoreElements()) {
            String name = names.nextElement();
            Enumeration<String> values = ctx.req().getHeaders(name);
            StringBuilder joined = new StringBuilder();
            if (values != null) {
                while (values.hasMoreElements()) {
                    if (joined.length() > 0) {
                        joined.append(", ");
                    }
                    joined.append(values.nextElement());
                }
            }
            headers.merge(name.toLowerCase(Locale.ROOT), joined.toString(), (a, b) -> a + ", " + b);
        }
        return headers;
    }
}

package io.urlcrypt.core.engine;

import io.urlcrypt.core.model.PathDecryptionResult;
import io.urlcrypt.core.model.PathSegments;
import io.urlcrypt.core.model.QueryDecryptionResult;
import io.urlcrypt.core.model.QueryParameters;
import io.urlcrypt.core.model.QueryStrategyKind;
import io.urlcrypt.core.model.RequestUrl;
import io.urlcrypt.core.model.RoutingPhase;
import io.urlcrypt.core.model.TargetShape;
import io.urlcrypt.core.model.UrlCryptOptions;
import io.urlcrypt.core.model.UrlTransformResult;
import io.urlcrypt.core.protect.Protector;
import io.urlcrypt.core.protect.ProtectorProvider;
import io.urlcrypt.core.spi.DecryptionListener;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies path and query decryption to inbound request URLs.
 *
 * <p>One path {@link Protector} and one query {@link Protector} are created at construction, under
 * the configured purposes, and reused for every request. All strategies are immutable, so a single
 * engine instance is safe to share across request threads.
 *
 * <p>Query strategy selection:
 *
 * <ul>
 *   <li>{@link RoutingPhase#PRE_ROUTING}: always {@link QueryStrategyKind#GREEDY}, since no binding is
 *       known yet.
 *   <li>{@link RoutingPhase#POST_ROUTING} with a bound shape: {@link QueryStrategyKind#SCHEMA_DRIVEN}.
 *   <li>{@link RoutingPhase#POST_ROUTING} without a shape: the configured {@link
 *       UrlCryptOptions#unboundQueryStrategy()}.
 * </ul>
 *
 * <p>No method here fails a request because a value did not decrypt.
 */
public final class UrlTransformEngine {

    private static final Logger LOG = LoggerFactory.getLogger(UrlTransformEngine.class);

    private final UrlCryptOptions options;
    private final Protector pathProtector;
    private final Protector queryProtector;
    private final PathCryptography pathCryptography;
    private final QueryDecryptionStrategy greedyQuery;
    private final QueryDecryptionStrategy schemaDrivenQuery;
    private final DecryptionListener listener;

    /** Creates an engine with default options and no listener. */
    public UrlTransformEngine(ProtectorProvider protectorProvider) {
        this(protectorProvider, UrlCryptOptions.defaults(), null);
    }

    public UrlTransformEngine(ProtectorProvider protectorProvider, UrlCryptOptions options) {
        this(protectorProvider, options, null);
    }

    /**
     * @param protectorProvider source of the path and query protectors
     * @param options           purposes, warning suppression and unbound strategy
     * @param listener          optional listener for decryption events, may be null
     */
    public UrlTransformEngine(
            ProtectorProvider protectorProvider, UrlCryptOptions options, DecryptionListener listener) {
        Objects.requireNonNull(protectorProvider, "protectorProvider must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.listener = listener; // nullable
        this.pathProtector = protectorProvider.createProtector(options.pathPurpose());
        this.queryProtector = protectorProvider.createProtector(options.queryPurpose());
        this.pathCryptography = new GreedyPathCryptography(pathProtector, options.showFullCryptographicException());
        this.greedyQuery = new GreedyQueryDecryption(queryProtector, options.showFullCryptographicException());
        this.schemaDrivenQuery = new SchemaDrivenQueryDecryption(
                queryProtector,
                options.ignoreUnencryptedQueryWarnings(),
                listener,
                options.showFullCryptographicException());
        LOG.info(
                "URL transform engine ready: pathPurpose={}, queryPurpose={}, unboundQueryStrategy={}, "
                        + "ignoreUnencryptedQueryWarnings={}",
                options.pathPurpose(),
                options.queryPurpose(),
                options.unboundQueryStrategy(),
                options.ignoreUnencryptedQueryWarnings());
    }

    public UrlCryptOptions options() {
        return options;
    }

    // ── Inbound ──

    /** Decrypts every path segment; failed segments pass through unchanged. */
    public PathDecryptionResult decryptPath(String path) {
        PathDecryptionResult result = pathCryptography.decrypt(path);
        notifyPathDecrypted(path, result.decryptedSegments().size());
        return result;
    }

    /** Decrypts query values with the variant selected for {@code phase} and {@code shape}. */
    public QueryDecryptionResult decryptQuery(QueryParameters query, RoutingPhase phase, TargetShape shape) {
        return decryptQuery(query, phase, shape, null);
    }

    /**
     * Same as {@link #decryptQuery(QueryParameters, RoutingPhase, TargetShape)}, with the request
     * path carried into warning events.
     */
    public QueryDecryptionResult decryptQuery(
            QueryParameters query, RoutingPhase phase, TargetShape shape, String requestPath) {
        Objects.requireNonNull(query, "query must not be null");
        QueryStrategyKind kind = selectQueryStrategy(phase, shape);
        QueryDecryptionStrategy strategy = kind == QueryStrategyKind.SCHEMA_DRIVEN ? schemaDrivenQuery : greedyQuery;
        LOG.debug(
                "Query decryption: phase={}, shape={}, strategy={}",
                phase,
                shape != null ? shape.name() : null,
                kind);
        return strategy.decrypt(query, shape, requestPath);
    }

    public QueryStrategyKind selectQueryStrategy(RoutingPhase phase, TargetShape shape) {
        Objects.requireNonNull(phase, "phase must not be null");
        if (phase == RoutingPhase.PRE_ROUTING) {
            return QueryStrategyKind.GREEDY;
        }
        return shape != null ? QueryStrategyKind.SCHEMA_DRIVEN : options.unboundQueryStrategy();
    }

    /**
     * Full inbound transform for a request whose binding is already resolved: path first, then the
     * query post-routing.
     *
     * @param url   the inbound URL
     * @param shape the bound target shape, or {@code null}
     */
    public UrlTransformResult transformInbound(RequestUrl url, TargetShape shape) {
        Objects.requireNonNull(url, "url must not be null");
        PathDecryptionResult path = decryptPath(url.path());
        QueryDecryptionResult query = decryptQuery(url.query(), RoutingPhase.POST_ROUTING, shape, path.path());
        return new UrlTransformResult(url, new RequestUrl(path.path(), query.query()), path, query);
    }

    // ── Outbound ──

    /** Encrypts the path segments at the given 0-based positions. */
    public String encryptPath(String path, Set<Integer> positions) {
        return pathCryptography.encrypt(path, positions);
    }

    /** Encrypts every path segment. */
    public String encryptPath(String path) {
        return pathCryptography.encryptAll(path);
    }

    /**
     * Re-encrypts, in an outbound path, every segment equal to a plaintext that was decrypted from
     * the inbound path. Used to rewrite relative {@code Location} headers.
     *
     * @return the rewritten path, or {@code outboundPath} unchanged when nothing matches
     */
    public String reencryptPath(String outboundPath, PathDecryptionResult inbound) {
        if (outboundPath == null || inbound == null || !inbound.anyDecrypted()) {
            return outboundPath;
        }
        List<String> segments = PathSegments.split(outboundPath);
        List<String> reencrypted = reencryptSegments(segments, inbound);
        return reencrypted.equals(segments) ? outboundPath : PathSegments.join(reencrypted);
    }

    /**
     * Segment-list form of {@link #reencryptPath(String, PathDecryptionResult)}, for callers that
     * split a raw path themselves and must keep {@code %2F} inside a segment.
     *
     * @return a new list, equal to {@code outboundSegments} when nothing matches
     */
    public List<String> reencryptSegments(List<String> outboundSegments, PathDecryptionResult inbound) {
        if (inbound == null || !inbound.anyDecrypted()) {
            return List.copyOf(outboundSegments);
        }
        Set<String> plaintexts = new HashSet<>(inbound.decryptedValues());
        Set<Integer> positions = new TreeSet<>();
        for (int i = 0; i < outboundSegments.size(); i++) {
            if (plaintexts.contains(outboundSegments.get(i))) {
                positions.add(i);
            }
        }
        if (positions.isEmpty()) {
            return List.copyOf(outboundSegments);
        }
        LOG.debug("Re-encrypting {} segment(s) of outbound path", positions.size());
        return pathCryptography.encrypt(outboundSegments, positions);
    }

    /** Mints a path segment token under the configured path purpose. */
    public String protectPathSegment(String plaintext) {
        return pathProtector.encrypt(plaintext);
    }

    /** Mints a query value token under the configured query purpose. */
    public String protectQueryValue(String plaintext) {
        return queryProtector.encrypt(plaintext);
    }

    private void notifyPathDecrypted(String originalPath, int decryptedSegments) {
        if (listener == null) return;
        try {
            listener.onPathDecrypted(new DecryptionListener.PathDecryptedEvent(originalPath, decryptedSegments));
        } catch (Exception e) {
            LOG.warn("DecryptionListener.onPathDecrypted failed", e);
        }
    }
}

package io.urlcrypt.standalone.proxy;

import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import io.urlcrypt.core.engine.UrlTransformEngine;
import io.urlcrypt.core.protect.AesGcmProtectorProvider;
import io.urlcrypt.core.protect.ProtectorProvider;
import io.urlcrypt.core.spi.DecryptionListener;
import io.urlcrypt.standalone.adapter.StandaloneAdapter;
import io.urlcrypt.standalone.config.ConfigLoader;
import io.urlcrypt.standalone.config.ProxyConfig;
import java.nio.file.Path;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup sequence of the standalone proxy.
 *
 * <ol>
 * <li>Load configuration from YAML plus env overlay</li>
 * <li>Configure Logback from the {@code logging} section</li>
 * <li>Build the protector provider from the master key</li>
 * <li>Create the {@link UrlTransformEngine} and the binding matcher</li>
 * <li>Start the Javalin HTTP server</li>
 * </ol>
 *
 * <p>
 * Separate from {@link io.urlcrypt.standalone.StandaloneMain} so integration
 * tests can start a proxy without going through {@code main()}.
 */
public final class ProxyApp {

    private static final Logger LOG = LoggerFactory.getLogger(ProxyApp.class);

    private static final Set<String> ALLOWED_METHODS =
            Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "HEAD", "OPTIONS");

    private final Javalin app;
    private final UrlTransformEngine engine;
    private final ProxyConfig config;

    private ProxyApp(Javalin app, UrlTransformEngine engine, ProxyConfig config) {
        this.app = app;
        this.engine = engine;
        this.config = config;
    }

    /**
     * Loads the configuration named by {@code args} and starts the proxy.
     *
     * @param args command-line arguments, e.g. {@code --config proxy.yaml}
     * @throws io.urlcrypt.standalone.config.ConfigLoadException if the
     *                                                           configuration
     *                                                           is invalid
     */
    public static ProxyApp start(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        ProxyConfig config = ConfigLoader.load(configPath);

        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);

        return start(config);
    }

    /** Starts the proxy for an already-loaded configuration. */
    public static ProxyApp start(ProxyConfig config) {
        return start(config, AesGcmProtectorProvider.fromBase64(config.masterKey()), null);
    }

    /**
     * Starts the proxy with an explicit protector provider and an optional
     * decryption listener.
     */
    public static ProxyApp start(ProxyConfig config, ProtectorProvider provider, DecryptionListener listener) {
        long startTime = System.nanoTime();

        UrlTransformEngine engine = new UrlTransformEngine(provider, config.toOptions(), listener);
        BindingMatcher bindingMatcher = new BindingMatcher(config.bindings());
        UpstreamClient upstreamClient = new UpstreamClient(config);
        ProxyHandler proxyHandler = new ProxyHandler(
                engine,
                new StandaloneAdapter(),
                bindingMatcher,
                upstreamClient,
                config.forwardedHeadersEnabled(),
                config.reencryptLocation());

        Javalin app = Javalin.create();

        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler());
        }

        app.before("/<path>", ctx -> {
            String method = ctx.method().name();
            if (!ALLOWED_METHODS.contains(method)) {
                ctx.status(405);
                ctx.contentType("application/problem+json");
                ctx.result(ProblemDetail.methodNotAllowed("HTTP method " + method + " is not supported", ctx.path())
                        .toString());
                ctx.skipRemainingHandlers();
            }
        });
        for (String method : ALLOWED_METHODS) {
            app.addHttpHandler(HandlerType.valueOf(method), "/<path>", proxyHandler);
        }
        app.exception(Exception.class, (e, ctx) -> {
            LOG.error("Unhandled error for {} {}", ctx.method().name(), ctx.path(), e);
            ctx.status(500);
            ctx.contentType("application/problem+json");
            ctx.result(ProblemDetail.internalError("Unexpected proxy error", ctx.path()).toString());
        });

        app.start(config.proxyHost(), config.proxyPort());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "url-crypt-proxy started: port={}, backend={}://{}:{}, shapes={}, bindings={}, "
                        + "unboundQueryStrategy={}, reencryptLocation={}, startupMs={}",
                app.port(),
                config.backendScheme(),
                config.backendHost(),
                config.backendPort(),
                config.shapes().size(),
                config.bindings().size(),
                config.unboundQueryStrategy(),
                config.reencryptLocation(),
                elapsedMs);

        return new ProxyApp(app, engine, config);
    }

    public int port() {
        return app.port();
    }

    public Javalin javalin() {
        return app;
    }

    /** The engine; tests use it to mint tokens under the configured purposes. */
    public UrlTransformEngine engine() {
        return engine;
    }

    public ProxyConfig config() {
        return config;
    }

    public void stop() {
        if (app != null) {
            app.stop();
        }
        LOG.info("url-crypt-proxy stopped");
    }
}

package io.urlcrypt.standalone.config;

import io.urlcrypt.core.model.QueryStrategyKind;
import io.urlcrypt.core.model.TargetShape;
import io.urlcrypt.core.model.UrlCryptOptions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration for the standalone URL-decrypting proxy.
 *
 * <p>
 * All fields provide defaults except {@code backendHost}, which is required.
 * Use {@link #builder()} to construct instances.
 *
 * @param proxyHost                     bind address for the HTTP server
 * @param proxyPort                     listen port for the HTTP server
 * @param backendScheme                 backend scheme: http or https
 * @param backendHost                   backend hostname or IP (required)
 * @param backendPort                   backend port, derived from the scheme if
 *                                      omitted
 * @param backendConnectTimeoutMs       TCP connect timeout in ms
 * @param backendReadTimeoutMs          response read timeout in ms
 * @param forwardedHeadersEnabled       add X-Forwarded-* headers upstream
 * @param masterKey                     base64 master key; {@code null} selects an
 *                                      ephemeral key
 * @param pathPurpose                   purpose string of the path protector
 * @param queryPurpose                  purpose string of the query protector
 * @param ignoreUnencryptedWarnings     suppress the aggregated query warning
 * @param unboundQueryStrategy          query variant for unbound routes
 * @param reencryptLocation             re-encrypt relative Location headers
 * @param showFullCryptographicException include crypto stack traces in DEBUG
 *                                      logs
 * @param shapes                        declared target shapes by name
 * @param bindings                      route bindings, in declaration order
 * @param healthEnabled                 enable the health endpoint
 * @param healthPath                    health endpoint path
 * @param loggingFormat                 json or text
 * @param loggingLevel                  root log level
 */
public record ProxyConfig(
        String proxyHost,
        int proxyPort,
        String backendScheme,
        String backendHost,
        int backendPort,
        int backendConnectTimeoutMs,
        int backendReadTimeoutMs,
        boolean forwardedHeadersEnabled,
        String masterKey,
        String pathPurpose,
        String queryPurpose,
        boolean ignoreUnencryptedWarnings,
        QueryStrategyKind unboundQueryStrategy,
        boolean reencryptLocation,
        boolean showFullCryptographicException,
        Map<String, TargetShape> shapes,
        List<RouteBinding> bindings,
        boolean healthEnabled,
        String healthPath,
        String loggingFormat,
        String loggingLevel) {

    public ProxyConfig {
        shapes = shapes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(shapes));
        bindings = bindings == null ? List.of() : List.copyOf(bindings);
    }

    /** Engine options derived from the crypto section. */
    public UrlCryptOptions toOptions() {
        return UrlCryptOptions.builder()
                .pathPurpose(pathPurpose)
                .queryPurpose(queryPurpose)
                .ignoreUnencryptedQueryWarnings(ignoreUnencryptedWarnings)
                .unboundQueryStrategy(unboundQueryStrategy)
                .showFullCryptographicException(showFullCryptographicException)
                .build();
    }

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link ProxyConfig}. All fields have defaults except
     * {@code backendHost}.
     */
    public static final class Builder {
        private String proxyHost = "0.0.0.0";
        private int proxyPort = 9090;
        private String backendScheme = "http";
        private String backendHost;
        private Integer backendPort; // null → derive from scheme
        private int backendConnectTimeoutMs = 5000;
        private int backendReadTimeoutMs = 30000;
        private boolean forwardedHeadersEnabled = true;
        private String masterKey;
        private String pathPurpose = UrlCryptOptions.DEFAULT_PATH_PURPOSE;
        private String queryPurpose = UrlCryptOptions.DEFAULT_QUERY_PURPOSE;
        private boolean ignoreUnencryptedWarnings = false;
        private QueryStrategyKind unboundQueryStrategy = QueryStrategyKind.GREEDY;
        private boolean reencryptLocation = true;
        private boolean showFullCryptographicException = false;
        private Map<String, TargetShape> shapes = new LinkedHashMap<>();
        private final List<RouteBinding> bindings = new ArrayList<>();
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String loggingFormat = "json";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder proxyHost(String proxyHost) {
            this.proxyHost = proxyHost;
            return this;
        }

        public Builder proxyPort(int proxyPort) {
            this.proxyPort = proxyPort;
            return this;
        }

        public Builder backendScheme(String backendScheme) {
            this.backendScheme = backendScheme;
            return this;
        }

        public Builder backendHost(String backendHost) {
            this.backendHost = backendHost;
            return this;
        }

        public Builder backendPort(int backendPort) {
            this.backendPort = backendPort;
            return this;
        }

        public Builder backendConnectTimeoutMs(int backendConnectTimeoutMs) {
            this.backendConnectTimeoutMs = backendConnectTimeoutMs;
            return this;
        }

        public Builder backendReadTimeoutMs(int backendReadTimeoutMs) {
            this.backendReadTimeoutMs = backendReadTimeoutMs;
            return this;
        }

        public Builder forwardedHeadersEnabled(boolean forwardedHeadersEnabled) {
            this.forwardedHeadersEnabled = forwardedHeadersEnabled;
            return this;
        }

        public Builder masterKey(String masterKey) {
            this.masterKey = masterKey;
            return this;
        }

        public Builder pathPurpose(String pathPurpose) {
            this.pathPurpose = pathPurpose;
            return this;
        }

        public Builder queryPurpose(String queryPurpose) {
            this.queryPurpose = queryPurpose;
            return this;
        }

        public Builder ignoreUnencryptedWarnings(boolean ignoreUnencryptedWarnings) {
            this.ignoreUnencryptedWarnings = ignoreUnencryptedWarnings;
            return this;
        }

        public Builder unboundQueryStrategy(QueryStrategyKind unboundQueryStrategy) {
            this.unboundQueryStrategy = unboundQueryStrategy;
            return this;
        }

        public Builder reencryptLocation(boolean reencryptLocation) {
            this.reencryptLocation = reencryptLocation;
            return this;
        }

        public Builder showFullCryptographicException(boolean showFullCryptographicException) {
            this.showFullCryptographicException = showFullCryptographicException;
            return this;
        }

        public Builder shapes(Map<String, TargetShape> shapes) {
            this.shapes = new LinkedHashMap<>(shapes);
            return this;
        }

        public Builder binding(RouteBinding binding) {
            this.bindings.add(binding);
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the {@link ProxyConfig}, deriving {@code backendPort} from the
         * scheme if not set.
         */
        public ProxyConfig build() {
            int resolvedPort = backendPort != null ? backendPort : ("https".equalsIgnoreCase(backendScheme) ? 443 : 80);

            return new ProxyConfig(
                    proxyHost,
                    proxyPort,
                    backendScheme,
                    backendHost,
                    resolvedPort,
                    backendConnectTimeoutMs,
                    backendReadTimeoutMs,
                    forwardedHeadersEnabled,
                    masterKey,
                    pathPurpose,
                    queryPurpose,
                    ignoreUnencryptedWarnings,
                    unboundQueryStrategy,
                    reencryptLocation,
                    showFullCryptographicException,
                    shapes,
                    bindings,
                    healthEnabled,
                    healthPath,
                    loggingFormat,
                    loggingLevel);
        }
    }
}

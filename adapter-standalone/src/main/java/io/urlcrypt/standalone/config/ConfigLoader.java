package io.urlcrypt.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.urlcrypt.core.error.ShapeDefinitionException;
import io.urlcrypt.core.model.QueryStrategyKind;
import io.urlcrypt.core.model.TargetShape;
import io.urlcrypt.core.schema.ShapeParser;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ProxyConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code url-crypt-proxy.yaml} from the current
 * directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * Missing keys receive the defaults from {@link ProxyConfig.Builder}. The
 * {@code shapes} section is handed to {@link ShapeParser}; each entry of
 * {@code bindings} must reference one of the declared shapes.
 *
 * <p>
 * Env vars take precedence over YAML values. An env var is "set" if and only
 * if it is defined and its trimmed value is non-empty; blank values leave the
 * YAML value in place.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "url-crypt-proxy.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link ProxyConfig} from the given YAML file, applying overrides
     * from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is invalid YAML or
     *                             declares an invalid value
     */
    public static ProxyConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link ProxyConfig} from the given YAML file, applying overrides
     * from the supplied lookup function. Returning {@code null} from
     * {@code envLookup} means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, is invalid YAML or
     *                             declares an invalid value
     */
    public static ProxyConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode()) {
                throw new ConfigLoadException("Configuration file is empty: " + configPath);
            }
            return mapToConfig(root, envLookup, configPath.toString());
        } catch (ConfigLoadException e) {
            throw e;
        } catch (ShapeDefinitionException e) {
            throw new ConfigLoadException("Invalid shapes section in " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (Exception e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the resolved config file path
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    /**
     * Parses a strategy name such as {@code greedy} or {@code schema-driven}.
     *
     * @throws ConfigLoadException for unknown names
     */
    static QueryStrategyKind parseStrategy(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return QueryStrategyKind.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(
                    "Unknown query strategy '" + value + "'; expected 'greedy' or 'schema-driven'", e);
        }
    }

    private static ProxyConfig mapToConfig(JsonNode root, Function<String, String> envLookup, String source) {
        ProxyConfig.Builder builder = ProxyConfig.builder();

        // Proxy section
        JsonNode proxy = root.path("proxy");
        if (proxy.has("host")) builder.proxyHost(proxy.get("host").asText());
        if (proxy.has("port")) builder.proxyPort(proxy.get("port").asInt());
        JsonNode forwarded = proxy.path("forwarded-headers");
        if (forwarded.has("enabled"))
            builder.forwardedHeadersEnabled(forwarded.get("enabled").asBoolean());

        // Backend section
        JsonNode backend = root.path("backend");
        if (backend.has("scheme")) builder.backendScheme(backend.get("scheme").asText());
        if (backend.has("host")) builder.backendHost(backend.get("host").asText());
        if (backend.has("port")) builder.backendPort(backend.get("port").asInt());
        if (backend.has("connect-timeout-ms"))
            builder.backendConnectTimeoutMs(backend.get("connect-timeout-ms").asInt());
        if (backend.has("read-timeout-ms"))
            builder.backendReadTimeoutMs(backend.get("read-timeout-ms").asInt());

        // Crypto section
        JsonNode crypto = root.path("crypto");
        builder.masterKey(textOrNull(crypto, "master-key"));
        builder.showFullCryptographicException(boolOrDefault(crypto, "show-full-exception", false));
        JsonNode path = crypto.path("path");
        if (path.has("purpose")) builder.pathPurpose(path.get("purpose").asText());
        if (path.has("reencrypt-location"))
            builder.reencryptLocation(path.get("reencrypt-location").asBoolean());
        JsonNode query = crypto.path("query");
        if (query.has("purpose")) builder.queryPurpose(query.get("purpose").asText());
        if (query.has("ignore-unencrypted-warnings"))
            builder.ignoreUnencryptedWarnings(query.get("ignore-unencrypted-warnings").asBoolean());
        if (query.has("unbound-strategy"))
            builder.unboundQueryStrategy(parseStrategy(query.get("unbound-strategy").asText()));

        // Shapes and bindings
        Map<String, TargetShape> shapes = new ShapeParser().parse(root.get("shapes"), source);
        builder.shapes(shapes);
        mapBindings(root.path("bindings"), shapes, builder);

        // Health section
        JsonNode health = root.path("health");
        if (health.has("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
        if (health.has("path")) builder.healthPath(health.get("path").asText());

        // Logging section
        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        applyEnvOverrides(builder, envLookup);

        ProxyConfig config = builder.build();
        if (config.backendHost() == null || config.backendHost().isBlank()) {
            throw new ConfigLoadException("backend.host is required (or set BACKEND_HOST)");
        }
        return config;
    }

    private static void mapBindings(JsonNode bindings, Map<String, TargetShape> shapes, ProxyConfig.Builder builder) {
        if (bindings.isMissingNode() || bindings.isNull()) {
            return;
        }
        if (!bindings.isArray()) {
            throw new ConfigLoadException("bindings must be a list");
        }
        int index = 0;
        for (JsonNode entry : bindings) {
            String pathPattern = textOrNull(entry, "path");
            String shapeName = textOrNull(entry, "shape");
            if (pathPattern == null || shapeName == null) {
                throw new ConfigLoadException("bindings[" + index + "] requires 'path' and 'shape'");
            }
            TargetShape shape = shapes.get(shapeName);
            if (shape == null) {
                throw new ConfigLoadException("bindings[" + index + "] references unknown shape '" + shapeName
                        + "'; declared shapes are: " + shapes.keySet());
            }
            try {
                builder.binding(new RouteBinding(textOrNull(entry, "method"), pathPattern, shape));
            } catch (IllegalArgumentException e) {
                throw new ConfigLoadException("bindings[" + index + "]: " + e.getMessage(), e);
            }
            index++;
        }
    }

    private static void applyEnvOverrides(ProxyConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "PROXY_HOST", builder::proxyHost);
        envString(envLookup, "BACKEND_SCHEME", builder::backendScheme);
        envString(envLookup, "BACKEND_HOST", builder::backendHost);
        envString(envLookup, "URLCRYPT_MASTER_KEY", builder::masterKey);
        envString(envLookup, "URLCRYPT_PATH_PURPOSE", builder::pathPurpose);
        envString(envLookup, "URLCRYPT_QUERY_PURPOSE", builder::queryPurpose);
        envString(envLookup, "HEALTH_PATH", builder::healthPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
        envString(envLookup, "URLCRYPT_UNBOUND_QUERY_STRATEGY", v -> builder.unboundQueryStrategy(parseStrategy(v)));

        envInt(envLookup, "PROXY_PORT", builder::proxyPort);
        envInt(envLookup, "BACKEND_PORT", builder::backendPort);
        envInt(envLookup, "BACKEND_CONNECT_TIMEOUT_MS", builder::backendConnectTimeoutMs);
        envInt(envLookup, "BACKEND_READ_TIMEOUT_MS", builder::backendReadTimeoutMs);

        envBool(envLookup, "URLCRYPT_IGNORE_UNENCRYPTED_WARNINGS", builder::ignoreUnencryptedWarnings);
        envBool(envLookup, "URLCRYPT_REENCRYPT_LOCATION", builder::reencryptLocation);
        envBool(envLookup, "HEALTH_ENABLED", builder::healthEnabled);
        envBool(envLookup, "PROXY_FORWARDED_HEADERS_ENABLED", builder::forwardedHeadersEnabled);
    }

    // --- Env var helpers ---

    /** Defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static boolean boolOrDefault(JsonNode node, String field, boolean defaultValue) {
        return node.has(field) ? node.get(field).asBoolean() : defaultValue;
    }
}

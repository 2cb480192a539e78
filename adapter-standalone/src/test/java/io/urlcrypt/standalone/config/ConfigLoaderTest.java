package io.urlcrypt.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.urlcrypt.core.model.QueryStrategyKind;
import io.urlcrypt.core.model.ShapeMember;
import io.urlcrypt.core.model.TargetShape;
import io.urlcrypt.core.model.UrlCryptOptions;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** {@link ConfigLoader} YAML mapping, defaults and error paths. */
@DisplayName("YAML config loader")
class ConfigLoaderTest {

    private static final Map<String, String> NO_ENV = Map.of();

    static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class
                .getClassLoader()
                .getResource("config/" + name)
                .toURI());
    }

    @Nested
    @DisplayName("Minimal config")
    class MinimalConfig {

        @Test
        @DisplayName("backend fields from YAML, everything else defaulted")
        void defaultsApplied() throws Exception {
            ProxyConfig config = ConfigLoader.load(fixture("minimal-config.yaml"), NO_ENV::get);

            assertThat(config.backendHost()).isEqualTo("backend.local");
            assertThat(config.backendPort()).isEqualTo(8080);

            assertThat(config.proxyHost()).isEqualTo("0.0.0.0");
            assertThat(config.proxyPort()).isEqualTo(9090);
            assertThat(config.backendScheme()).isEqualTo("http");
            assertThat(config.backendConnectTimeoutMs()).isEqualTo(5000);
            assertThat(config.backendReadTimeoutMs()).isEqualTo(30000);
            assertThat(config.forwardedHeadersEnabled()).isTrue();
            assertThat(config.masterKey()).isNull();
            assertThat(config.pathPurpose()).isEqualTo(UrlCryptOptions.DEFAULT_PATH_PURPOSE);
            assertThat(config.queryPurpose()).isEqualTo(UrlCryptOptions.DEFAULT_QUERY_PURPOSE);
            assertThat(config.ignoreUnencryptedWarnings()).isFalse();
            assertThat(config.unboundQueryStrategy()).isEqualTo(QueryStrategyKind.GREEDY);
            assertThat(config.reencryptLocation()).isTrue();
            assertThat(config.showFullCryptographicException()).isFalse();
            assertThat(config.shapes()).isEmpty();
            assertThat(config.bindings()).isEmpty();
            assertThat(config.healthEnabled()).isTrue();
            assertThat(config.healthPath()).isEqualTo("/health");
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("INFO");
        }
    }

    @Nested
    @DisplayName("Full config")
    class FullConfig {

        @Test
        @DisplayName("all sections mapped")
        void allFieldsPopulated() throws Exception {
            ProxyConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV::get);

            assertThat(config.proxyHost()).isEqualTo("127.0.0.1");
            assertThat(config.proxyPort()).isEqualTo(8443);
            assertThat(config.forwardedHeadersEnabled()).isFalse();
            assertThat(config.backendScheme()).isEqualTo("https");
            assertThat(config.backendHost()).isEqualTo("api.internal");
            assertThat(config.backendPort()).isEqualTo(9443);
            assertThat(config.backendConnectTimeoutMs()).isEqualTo(1500);
            assertThat(config.backendReadTimeoutMs()).isEqualTo(12000);
            assertThat(config.masterKey()).isEqualTo("AAECAwQFBgcICQoLDA0ODxAREhMUFRYXGBkaGxwdHh8=");
            assertThat(config.showFullCryptographicException()).isTrue();
            assertThat(config.pathPurpose()).isEqualTo("orders.path.v1");
            assertThat(config.reencryptLocation()).isFalse();
            assertThat(config.queryPurpose()).isEqualTo("orders.query.v1");
            assertThat(config.ignoreUnencryptedWarnings()).isTrue();
            assertThat(config.unboundQueryStrategy()).isEqualTo(QueryStrategyKind.SCHEMA_DRIVEN);
            assertThat(config.healthEnabled()).isFalse();
            assertThat(config.healthPath()).isEqualTo("/live");
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }

        @Test
        @DisplayName("shapes parsed and bindings resolved by name")
        void shapesAndBindings() throws Exception {
            ProxyConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV::get);

            assertThat(config.shapes()).containsOnlyKeys("customer-search", "address");
            TargetShape search = config.shapes().get("customer-search");
            assertThat(search.members()).extracting(ShapeMember::name).containsExactly("lastName", "page", "address");

            assertThat(config.bindings()).hasSize(2);
            RouteBinding first = config.bindings().get(0);
            assertThat(first.method()).isEqualTo("GET");
            assertThat(first.pathPattern()).isEqualTo("/customers");
            assertThat(first.shape()).isSameAs(search);
            RouteBinding second = config.bindings().get(1);
            assertThat(second.method()).isNull();
            assertThat(second.shape().name()).isEqualTo("address");
        }

        @Test
        @DisplayName("crypto section becomes engine options")
        void toOptions() throws Exception {
            UrlCryptOptions options =
                    ConfigLoader.load(fixture("full-config.yaml"), NO_ENV::get).toOptions();

            assertThat(options.pathPurpose()).isEqualTo("orders.path.v1");
            assertThat(options.queryPurpose()).isEqualTo("orders.query.v1");
            assertThat(options.ignoreUnencryptedQueryWarnings()).isTrue();
            assertThat(options.unboundQueryStrategy()).isEqualTo(QueryStrategyKind.SCHEMA_DRIVEN);
            assertThat(options.showFullCryptographicException()).isTrue();
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("missing file → ConfigLoadException naming --config")
        void missingFile(@TempDir Path dir) {
            assertThatThrownBy(() -> ConfigLoader.load(dir.resolve("nope.yaml"), NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("not found")
                    .hasMessageContaining("--config");
        }

        @Test
        @DisplayName("malformed YAML → ConfigLoadException")
        void malformedYaml() throws Exception {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("malformed.yaml"), NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML");
        }

        @Test
        @DisplayName("empty file → ConfigLoadException")
        void emptyFile(@TempDir Path dir) throws Exception {
            Path empty = Files.writeString(dir.resolve("empty.yaml"), "");

            assertThatThrownBy(() -> ConfigLoader.load(empty, NO_ENV::get)).isInstanceOf(ConfigLoadException.class);
        }

        @Test
        @DisplayName("missing backend.host → required")
        void missingBackendHost() throws Exception {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("missing-backend-host.yaml"), NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("backend.host")
                    .hasMessageContaining("required");
        }

        @Test
        @DisplayName("binding to an undeclared shape → names the declared ones")
        void unknownShape() throws Exception {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("unknown-shape-binding.yaml"), NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("unknown shape 'order'")
                    .hasMessageContaining("orders");
        }

        @Test
        @DisplayName("shape failing schema validation → ConfigLoadException")
        void invalidShape() throws Exception {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("invalid-shape.yaml"), NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Invalid shapes section");
        }

        @Test
        @DisplayName("unknown unbound strategy → ConfigLoadException")
        void unknownStrategy(@TempDir Path dir) throws Exception {
            Path file = Files.writeString(dir.resolve("c.yaml"), """
                    backend:
                      host: b
                    crypto:
                      query:
                        unbound-strategy: clever
                    """);

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("clever");
        }

        @Test
        @DisplayName("relative binding path → ConfigLoadException")
        void relativeBindingPath(@TempDir Path dir) throws Exception {
            Path file = Files.writeString(dir.resolve("c.yaml"), """
                    backend:
                      host: b
                    shapes:
                      s:
                        members:
                          - name: id
                    bindings:
                      - path: orders
                        shape: s
                    """);

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("bindings[0]");
        }
    }

    @Nested
    @DisplayName("resolveConfigPath")
    class ResolveConfigPath {

        @Test
        @DisplayName("no arguments → url-crypt-proxy.yaml")
        void defaultPath() {
            assertThat(ConfigLoader.resolveConfigPath(new String[0])).isEqualTo(Path.of("url-crypt-proxy.yaml"));
        }

        @Test
        @DisplayName("--config <path> → that path")
        void explicitPath() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"--config", "/etc/proxy.yaml"}))
                    .isEqualTo(Path.of("/etc/proxy.yaml"));
        }

        @Test
        @DisplayName("--config without value → IllegalArgumentException")
        void missingValue() {
            assertThatThrownBy(() -> ConfigLoader.resolveConfigPath(new String[] {"--config"}))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("scheme https without port → 443")
    void httpsPortDerived() {
        ProxyConfig config =
                ProxyConfig.builder().backendHost("h").backendScheme("https").build();

        assertThat(config.backendPort()).isEqualTo(443);
    }
}

package io.urlcrypt.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.urlcrypt.core.model.PathDecryptionResult;
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
import io.urlcrypt.core.testkit.CapturingDecryptionListener;
import io.urlcrypt.core.testkit.TestProtectors;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("UrlTransformEngine")
class UrlTransformEngineTest {

    private static final TargetShape SEARCH =
            TargetShape.builder("search").encrypted("lastName").plain("firstName").build();

    private final CapturingDecryptionListener listener = new CapturingDecryptionListener();
    private final UrlTransformEngine engine =
            new UrlTransformEngine(TestProtectors.provider(), UrlCryptOptions.defaults(), listener);

    @Nested
    @DisplayName("strategy selection")
    class Selection {

        @Test
        void preRoutingIsAlwaysGreedy() {
            assertThat(engine.selectQueryStrategy(RoutingPhase.PRE_ROUTING, null)).isEqualTo(QueryStrategyKind.GREEDY);
            assertThat(engine.selectQueryStrategy(RoutingPhase.PRE_ROUTING, SEARCH))
                    .isEqualTo(QueryStrategyKind.GREEDY);
        }

        @Test
        void postRoutingWithShapeIsSchemaDriven() {
            assertThat(engine.selectQueryStrategy(RoutingPhase.POST_ROUTING, SEARCH))
                    .isEqualTo(QueryStrategyKind.SCHEMA_DRIVEN);
        }

        @Test
        void postRoutingWithoutShapeUsesConfiguredUnboundStrategy() {
            UrlTransformEngine schemaDefault = new UrlTransformEngine(
                    TestProtectors.provider(),
                    UrlCryptOptions.builder()
                            .unboundQueryStrategy(QueryStrategyKind.SCHEMA_DRIVEN)
                            .build());

            assertThat(engine.selectQueryStrategy(RoutingPhase.POST_ROUTING, null))
                    .isEqualTo(QueryStrategyKind.GREEDY);
            assertThat(schemaDefault.selectQueryStrategy(RoutingPhase.POST_ROUTING, null))
                    .isEqualTo(QueryStrategyKind.SCHEMA_DRIVEN);
        }

        @Test
        void preRoutingGreedyDecryptsUndeclaredKeysToo() {
            QueryParameters query = QueryParameters.parse("other=" + engine.protectQueryValue("x"));

            QueryDecryptionResult pre = engine.decryptQuery(query, RoutingPhase.PRE_ROUTING, SEARCH);
            QueryDecryptionResult post = engine.decryptQuery(query, RoutingPhase.POST_ROUTING, SEARCH);

            assertThat(pre.query().first("other")).isEqualTo("x");
            assertThat(post.query().first("other")).isEqualTo(query.first("other"));
        }
    }

    @Nested
    @DisplayName("protectors")
    class Protectors {

        @Test
        void protectorsAreCreatedOnceWithConfiguredPurposes() {
            List<String> purposes = new ArrayList<>();
            ProtectorProvider counting = purpose -> {
                purposes.add(purpose);
                return TestProtectors.provider().createProtector(purpose);
            };
            UrlTransformEngine e = new UrlTransformEngine(
                    counting,
                    UrlCryptOptions.builder().pathPurpose("p").queryPurpose("q").build());

            e.decryptPath("/a/b");
            e.decryptQuery(QueryParameters.parse("a=1"), RoutingPhase.PRE_ROUTING, null);
            e.transformInbound(RequestUrl.of("/x", "y=1"), SEARCH);

            assertThat(purposes).containsExactly("p", "q");
        }

        @Test
        void pathAndQueryPurposesAreIsolated() {
            String queryToken = engine.protectQueryValue("42");
            String pathToken = engine.protectPathSegment("Doe");

            assertThat(engine.decryptPath("/orders/" + queryToken).path()).isEqualTo("/orders/" + queryToken);
            assertThat(engine.decryptQuery(
                                    QueryParameters.parse("lastName=" + pathToken), RoutingPhase.POST_ROUTING, SEARCH)
                            .keysWithErrors())
                    .containsExactly("lastName");
        }

        @Test
        void customProtectorIsUsedThroughTheInterface() {
            Protector reversing = new Protector() {
                @Override
                public String encrypt(String plaintext) {
                    return "enc." + plaintext;
                }

                @Override
                public String decrypt(String token) {
                    if (token == null || !token.startsWith("enc.")) {
                        throw new io.urlcrypt.core.error.InvalidCiphertextException("not ours");
                    }
                    return token.substring(4);
                }
            };
            UrlTransformEngine e = new UrlTransformEngine(purpose -> reversing);

            assertThat(e.decryptPath("/enc.orders/42").path()).isEqualTo("/orders/42");
        }
    }

    @Nested
    @DisplayName("transformInbound")
    class Inbound {

        @Test
        void decryptsPathThenQuery() {
            RequestUrl url = new RequestUrl(
                    "/orders/" + engine.protectPathSegment("42"),
                    QueryParameters.parse("lastName=" + engine.protectQueryValue("Doe") + "&firstName=John"));

            UrlTransformResult result = engine.transformInbound(url, SEARCH);

            assertThat(result.transformed().path()).isEqualTo("/orders/42");
            assertThat(result.transformed().query().toQueryString()).isEqualTo("lastName=Doe&firstName=John");
            assertThat(result.query().strategy()).isEqualTo(QueryStrategyKind.SCHEMA_DRIVEN);
            assertThat(result.isModified()).isTrue();
            assertThat(result.original()).isEqualTo(url);
        }

        @Test
        void warningEventCarriesDecryptedPath() {
            RequestUrl url = new RequestUrl(
                    "/orders/" + engine.protectPathSegment("42"), QueryParameters.parse("lastName=garbage"));

            engine.transformInbound(url, SEARCH);

            assertThat(listener.warnings).hasSize(1);
            assertThat(listener.warnings.get(0).requestPath()).isEqualTo("/orders/42");
        }

        @Test
        void pathEventIsEmittedForEveryRequest() {
            engine.decryptPath("/plain/path");
            engine.decryptPath("/x/" + engine.protectPathSegment("1") + "/" + engine.protectPathSegment("2"));

            assertThat(listener.paths)
                    .extracting(DecryptionListener.PathDecryptedEvent::decryptedSegments)
                    .containsExactly(0, 2);
        }

        @Test
        void throwingPathListenerIsContained() {
            UrlTransformEngine e = new UrlTransformEngine(
                    TestProtectors.provider(), UrlCryptOptions.defaults(), new DecryptionListener() {
                        @Override
                        public void onPathDecrypted(PathDecryptedEvent event) {
                            throw new IllegalStateException("boom");
                        }
                    });

            assertThat(e.decryptPath("/" + e.protectPathSegment("ok")).path()).isEqualTo("/ok");
        }

        @Test
        void unmodifiedRequestReportsNoChange() {
            UrlTransformResult result = engine.transformInbound(RequestUrl.of("/health", null), null);

            assertThat(result.isModified()).isFalse();
            assertThat(result.query().strategy()).isEqualTo(QueryStrategyKind.GREEDY);
        }
    }

    @Nested
    @DisplayName("outbound")
    class Outbound {

        @Test
        void reencryptsSegmentsDecryptedFromTheInboundPath() {
            PathDecryptionResult inbound = engine.decryptPath("/orders/" + engine.protectPathSegment("42"));

            String location = engine.reencryptPath("/orders/42/items/42/7", inbound);

            assertThat(location).startsWith("/orders/").doesNotContain("/42");
            assertThat(location).endsWith("/7");
            assertThat(engine.decryptPath(location).path()).isEqualTo("/orders/42/items/42/7");
        }

        @Test
        @DisplayName("plaintext with a slash is matched as one segment")
        void reencryptsSlashPlaintextAsOneSegment() {
            PathDecryptionResult inbound = engine.decryptPath("/files/" + engine.protectPathSegment("a/b"));

            List<String> location = engine.reencryptSegments(List.of("files", "a/b", "x"), inbound);

            assertThat(location).hasSize(3);
            assertThat(location.get(0)).isEqualTo("files");
            assertThat(location.get(1)).isNotEqualTo("a/b");
            assertThat(location.get(2)).isEqualTo("x");
            assertThat(engine.decryptPath(String.join("/", location)).segments())
                    .containsExactly("files", "a/b", "x");
        }

        @Test
        @DisplayName("unrelated segments are not re-encrypted")
        void onlyDecryptedPlaintextsAreReencrypted() {
            PathDecryptionResult inbound = engine.decryptPath("/files/" + engine.protectPathSegment("a/b"));

            assertThat(engine.reencryptSegments(List.of("a", "b"), inbound)).containsExactly("a", "b");
        }

        @Test
        void leavesPathAloneWhenNothingWasDecrypted() {
            PathDecryptionResult inbound = engine.decryptPath("/orders/42");

            assertThat(engine.reencryptPath("/orders/42", inbound)).isEqualTo("/orders/42");
        }

        @Test
        void encryptPathAtPositions() {
            String encrypted = engine.encryptPath("/orders/42", Set.of(1));

            assertThat(encrypted).startsWith("/orders/");
            assertThat(engine.decryptPath(encrypted).path()).isEqualTo("/orders/42");
        }
    }
}

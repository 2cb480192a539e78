package io.urlcrypt.standalone.proxy;

import static org.assertj.core.api.Assertions.assertThat;

import io.urlcrypt.core.model.TargetShape;
import io.urlcrypt.standalone.config.RouteBinding;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class BindingMatcherTest {

    private static final TargetShape ORDERS = TargetShape.builder("orders").encrypted("id").build();
    private static final TargetShape ORDER_ITEMS = TargetShape.builder("order-items").encrypted("sku").build();
    private static final TargetShape ANY_ORDER = TargetShape.builder("any-order").plain("x").build();

    @Nested
    @DisplayName("pathMatches")
    class PathMatches {

        @ParameterizedTest(name = "{0} vs {1} → {2}")
        @CsvSource({
            "/orders, /orders, true",
            "/orders, /orders/42, false",
            "/orders/*, /orders/42, true",
            "/orders/*, /orders, false",
            "/orders/*/items, /orders/42/items, true",
            "/orders/*/items, /orders/42/lines, false",
            "/orders/**, /orders, true",
            "/orders/**, /orders/42/items/7, true",
            "/**, /anything/at/all, true",
            "/orders/**/items, /orders/a/b/items, true",
            "/orders/, /orders, true"
        })
        void patterns(String pattern, String path, boolean expected) {
            assertThat(BindingMatcher.pathMatches(pattern, path)).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("findBestMatch")
    class FindBestMatch {

        @Test
        @DisplayName("most literal segments wins")
        void mostSpecificWins() {
            BindingMatcher matcher = new BindingMatcher(List.of(
                    new RouteBinding(null, "/orders/**", ANY_ORDER),
                    new RouteBinding(null, "/orders/*/items", ORDER_ITEMS),
                    new RouteBinding(null, "/orders/*", ORDERS)));

            assertThat(matcher.findBestMatch("/orders/42/items", "GET"))
                    .map(RouteBinding::shape)
                    .contains(ORDER_ITEMS);
            assertThat(matcher.findBestMatch("/orders/42", "GET"))
                    .map(RouteBinding::shape)
                    .contains(ORDERS);
            assertThat(matcher.findBestMatch("/orders/42/notes/1", "GET"))
                    .map(RouteBinding::shape)
                    .contains(ANY_ORDER);
        }

        @Test
        @DisplayName("method constraint breaks ties")
        void methodBreaksTie() {
            BindingMatcher matcher = new BindingMatcher(List.of(
                    new RouteBinding(null, "/orders/*", ANY_ORDER), new RouteBinding("get", "/orders/*", ORDERS)));

            assertThat(matcher.findBestMatch("/orders/42", "GET"))
                    .map(RouteBinding::shape)
                    .contains(ORDERS);
            assertThat(matcher.findBestMatch("/orders/42", "DELETE"))
                    .map(RouteBinding::shape)
                    .contains(ANY_ORDER);
        }

        @Test
        @DisplayName("equal specificity keeps declaration order")
        void declarationOrder() {
            BindingMatcher matcher = new BindingMatcher(List.of(
                    new RouteBinding(null, "/orders/*", ORDERS), new RouteBinding(null, "/*/42", ANY_ORDER)));

            assertThat(matcher.findBestMatch("/orders/42", "GET"))
                    .map(RouteBinding::shape)
                    .contains(ORDERS);
        }

        @Test
        @DisplayName("no binding → empty")
        void noMatch() {
            BindingMatcher matcher = new BindingMatcher(List.of(new RouteBinding("POST", "/orders", ORDERS)));

            assertThat(matcher.findBestMatch("/orders", "GET")).isEqualTo(Optional.empty());
            assertThat(matcher.findBestMatch("/customers", "POST")).isEmpty();
        }
    }
}

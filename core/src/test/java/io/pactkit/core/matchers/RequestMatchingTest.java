package io.pactkit.core.matchers;

import static org.assertj.core.api.Assertions.assertThat;

import io.pactkit.core.model.Body;
import io.pactkit.core.model.HttpRequest;
import io.pactkit.core.model.JsonValues;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link RequestMatching}. */
@DisplayName("RequestMatching")
class RequestMatchingTest {

    private static HttpRequest request(String method, String path) {
        return HttpRequest.defaults().withMethod(method).withPath(path);
    }

    @Test
    @DisplayName("identical requests match")
    void identical() {
        HttpRequest expected = request("GET", "/widgets").withQuery(Map.of("page", List.of("1")));
        assertThat(RequestMatching.match(expected, expected)).isEmpty();
    }

    @Test
    @DisplayName("method comparison ignores case")
    void methodCase() {
        assertThat(RequestMatching.match(request("GET", "/a"), request("get", "/a"))).isEmpty();
    }

    @Test
    @DisplayName("reports method and path differences together")
    void methodAndPath() {
        List<Mismatch> mismatches = RequestMatching.match(request("GET", "/widgets"), request("POST", "/gadgets"));

        assertThat(mismatches).extracting(Mismatch::type).containsExactly("MethodMismatch", "PathMismatch");
        assertThat(mismatches.get(1).description()).isEqualTo("Expected path '/widgets' but received '/gadgets'");
    }

    @Test
    @DisplayName("a path rule replaces equality")
    void pathRule() {
        MatchingRules rules = MatchingRules.EMPTY.with(
                MatchingRules.PATH, MatchingRuleCategory.SINGLE_KEY, RuleList.of(new MatchingRule.Regex("/widgets/\\d+")));
        HttpRequest expected = request("GET", "/widgets/1").withMatchingRules(rules);

        assertThat(RequestMatching.match(expected, request("GET", "/widgets/99"))).isEmpty();
        assertThat(RequestMatching.sameMethodAndPath(expected, request("GET", "/widgets/x"))).isFalse();
    }

    @Nested
    @DisplayName("query")
    class Query {

        @Test
        void missingAndUnexpectedParameters() {
            HttpRequest expected = request("GET", "/").withQuery(Map.of("a", List.of("1")));
            HttpRequest actual = request("GET", "/").withQuery(Map.of("b", List.of("2")));

            assertThat(RequestMatching.match(expected, actual))
                    .extracting(Mismatch::description)
                    .containsExactly(
                            "Expected query parameter 'a' but was missing", "Unexpected query parameter 'b' received");
        }

        @Test
        void valueDifference() {
            HttpRequest expected = request("GET", "/").withQuery(Map.of("a", List.of("1")));
            HttpRequest actual = request("GET", "/").withQuery(Map.of("a", List.of("2")));

            assertThat(RequestMatching.match(expected, actual))
                    .singleElement()
                    .satisfies(m -> assertThat(m.description())
                            .isEqualTo("Expected query parameter 'a' to have value '1' but was '2'"));
        }

        @Test
        void ruleAppliesToEveryValue() {
            MatchingRules rules = MatchingRules.EMPTY.with(
                    MatchingRules.QUERY, "id", RuleList.of(new MatchingRule.Regex("\\d+")));
            HttpRequest expected =
                    request("GET", "/").withQuery(Map.of("id", List.of("1"))).withMatchingRules(rules);

            assertThat(RequestMatching.match(expected, request("GET", "/").withQuery(Map.of("id", List.of("7", "8")))))
                    .isEmpty();
            assertThat(RequestMatching.match(expected, request("GET", "/").withQuery(Map.of("id", List.of("7", "x")))))
                    .hasSize(1);
        }
    }

    @Nested
    @DisplayName("headers")
    class Headers {

        @Test
        void namesAreCaseInsensitiveAndExtraHeadersAreAllowed() {
            HttpRequest expected = request("GET", "/").withHeaders(Map.of("X-Api-Key", List.of("k")));
            HttpRequest actual =
                    request("GET", "/").withHeaders(Map.of("x-api-key", List.of("k"), "User-Agent", List.of("test")));

            assertThat(RequestMatching.match(expected, actual)).isEmpty();
        }

        @Test
        void missingHeader() {
            HttpRequest expected = request("GET", "/").withHeaders(Map.of("X-Api-Key", List.of("k")));

            assertThat(RequestMatching.match(expected, request("GET", "/")))
                    .singleElement()
                    .satisfies(m -> {
                        assertThat(m.type()).isEqualTo("HeaderMismatch");
                        assertThat(m.description()).isEqualTo("Expected header 'X-Api-Key' but was missing");
                    });
        }

        @Test
        void commaSeparatedValuesAreSplit() {
            HttpRequest expected = request("GET", "/").withHeaders(Map.of("Accept-Encoding", List.of("gzip", "br")));
            HttpRequest actual = request("GET", "/").withHeaders(Map.of("Accept-Encoding", List.of("gzip, br")));

            assertThat(RequestMatching.match(expected, actual)).isEmpty();
        }

        @Test
        void contentTypeParametersOnlyMatterWhenExpected() {
            HttpRequest expected =
                    request("GET", "/").withHeaders(Map.of("Content-Type", List.of("application/json")));
            HttpRequest actual = request("GET", "/")
                    .withHeaders(Map.of("Content-Type", List.of("application/json; charset=UTF-8")));

            assertThat(RequestMatching.match(expected, actual)).isEmpty();
            assertThat(RequestMatching.match(actual, expected)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("body")
    class Bodies {

        @Test
        void requestBodiesRejectUnexpectedKeys() {
            HttpRequest expected = request("POST", "/").withBody(Body.json(JsonValues.parse("{\"a\":1}")));
            HttpRequest actual = request("POST", "/").withBody(Body.of("{\"a\":1,\"b\":2}", "application/json"));

            assertThat(RequestMatching.match(expected, actual))
                    .singleElement()
                    .satisfies(m -> assertThat(m.type()).isEqualTo("BodyMismatch"));
        }

        @Test
        void contentTypeFamilyMismatch() {
            HttpRequest expected = request("POST", "/").withBody(Body.json(JsonValues.parse("{\"a\":1}")));
            HttpRequest actual = request("POST", "/").withBody(Body.of("<a>1</a>", "application/xml"));

            assertThat(RequestMatching.match(expected, actual))
                    .singleElement()
                    .satisfies(m -> {
                        assertThat(m.type()).isEqualTo("BodyTypeMismatch");
                        assertThat(m.description())
                                .isEqualTo("Expected a body of 'application/json' but the actual content type was"
                                        + " 'application/xml'");
                    });
        }

        @Test
        void missingBody() {
            HttpRequest expected = request("POST", "/").withBody(Body.json(JsonValues.parse("{\"a\":1}")));

            assertThat(RequestMatching.match(expected, request("POST", "/")))
                    .singleElement()
                    .satisfies(m -> assertThat(m.description()).isEqualTo("Expected body '{\"a\":1}' but was missing"));
        }

        @Test
        void noExpectedBodyAcceptsAnything() {
            assertThat(RequestMatching.match(
                            request("POST", "/"), request("POST", "/").withBody(Body.of("anything", "text/plain"))))
                    .isEmpty();
        }

        @Test
        void textBodiesCompareByEquality() {
            HttpRequest expected = request("POST", "/").withBody(Body.of("hello", "text/plain"));

            assertThat(RequestMatching.match(expected, request("POST", "/").withBody(Body.of("hello", "text/plain"))))
                    .isEmpty();
            assertThat(RequestMatching.match(expected, request("POST", "/").withBody(Body.of("bye", "text/plain"))))
                    .singleElement()
                    .satisfies(m -> assertThat(m.description())
                            .isEqualTo("Expected body 'hello' to match 'bye' using equality but did not match"));
        }
    }
}

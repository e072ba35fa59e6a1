package io.pactkit.core.matchers;

import static org.assertj.core.api.Assertions.assertThat;

import io.pactkit.core.model.Body;
import io.pactkit.core.model.HttpResponse;
import io.pactkit.core.model.JsonValues;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link ResponseMatching}. */
class ResponseMatchingTest {

    @Test
    void statusDifference() {
        assertThat(ResponseMatching.match(HttpResponse.defaults(), HttpResponse.defaults().withStatus(404)))
                .singleElement()
                .satisfies(m -> {
                    assertThat(m.type()).isEqualTo("StatusMismatch");
                    assertThat(m.description()).isEqualTo("Expected status 200 but was 404");
                });
    }

    @Test
    void statusRuleAcceptsAGroup() {
        MatchingRules rules = MatchingRules.EMPTY.with(
                MatchingRules.STATUS,
                MatchingRuleCategory.SINGLE_KEY,
                RuleList.of(new MatchingRule.StatusCode(StatusGroup.SUCCESS)));
        HttpResponse expected = HttpResponse.defaults().withMatchingRules(rules);

        assertThat(ResponseMatching.match(expected, HttpResponse.defaults().withStatus(204))).isEmpty();
        assertThat(ResponseMatching.match(expected, HttpResponse.defaults().withStatus(500))).hasSize(1);
    }

    @Test
    void responseBodiesTolerateUnexpectedKeys() {
        HttpResponse expected = HttpResponse.defaults().withBody(Body.json(JsonValues.parse("{\"id\":1}")));
        HttpResponse actual = HttpResponse.defaults()
                .withHeaders(Map.of("Content-Type", List.of("application/json")))
                .withBody(Body.of("{\"id\":1,\"name\":\"w\"}", "application/json"));

        assertThat(ResponseMatching.match(expected, actual)).isEmpty();
    }

    @Test
    void bodyRulesComeFromTheExpectedResponse() {
        MatchingRules rules =
                MatchingRules.EMPTY.with(MatchingRules.BODY, "$.id", RuleList.of(new MatchingRule.IntegerType()));
        HttpResponse expected = HttpResponse.defaults()
                .withBody(Body.json(JsonValues.parse("{\"id\":1}")))
                .withMatchingRules(rules);

        assertThat(ResponseMatching.match(expected, HttpResponse.defaults().withBody(Body.of("{\"id\":42}", null))))
                .isEmpty();
        assertThat(ResponseMatching.match(expected, HttpResponse.defaults().withBody(Body.of("{\"id\":4.2}", null))))
                .singleElement()
                .satisfies(m -> assertThat(m.description()).isEqualTo("Expected 4.2 to be an integer"));
    }
}

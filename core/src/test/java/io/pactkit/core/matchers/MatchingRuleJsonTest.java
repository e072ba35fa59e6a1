package io.pactkit.core.matchers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pactkit.core.model.JsonValues;
import io.pactkit.core.model.SpecVersion;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("MatchingRuleJson")
class MatchingRuleJsonTest {

    @Nested
    @DisplayName("V2 flat layout")
    class V2 {

        @Test
        void keysAreSplitIntoCategories() {
            var rules = MatchingRuleJson.read(JsonValues.parse("{"
                    + "\"$.body.id\":{\"match\":\"type\"},"
                    + "\"$.headers.X-Trace\":{\"regex\":\"[a-f0-9]+\"},"
                    + "\"$.query.page\":{\"match\":\"integer\"},"
                    + "\"$.path\":{\"regex\":\"/widgets/\\\\d+\"}}"));

            assertThat(rules.category(MatchingRules.BODY).rules()).containsKey("$.id");
            assertThat(rules.category(MatchingRules.HEADER).forName("X-Trace", false).rules())
                    .containsExactly(new MatchingRule.Regex("[a-f0-9]+"));
            assertThat(rules.category(MatchingRules.QUERY).forName("page", false).rules())
                    .containsExactly(new MatchingRule.IntegerType());
            assertThat(rules.category(MatchingRules.PATH).single().rules())
                    .containsExactly(new MatchingRule.Regex("/widgets/\\d+"));
        }

        @Test
        void writesOneRulePerKey() {
            var rules = MatchingRules.EMPTY
                    .with(MatchingRules.BODY, "$.id", RuleList.of(new MatchingRule.MinType(1)))
                    .with(MatchingRules.HEADER, "Accept", RuleList.of(new MatchingRule.Regex("text/.*")));

            var json = MatchingRuleJson.write(rules, SpecVersion.V2);

            assertThat(json.get("$.body.id").get("min").asInt()).isEqualTo(1);
            assertThat(json.get("$.headers.Accept").get("regex").asText()).isEqualTo("text/.*");
        }

        @Test
        void unknownKeyIsRejected() {
            assertThatThrownBy(() -> MatchingRuleJson.read(JsonValues.parse("{\"$.cookies.a\":{\"match\":\"type\"}}")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("$.cookies.a");
        }
    }

    @Nested
    @DisplayName("V3 nested layout")
    class V3 {

        @Test
        void readsCombineAndSingleValuedCategories() {
            var rules = MatchingRuleJson.read(JsonValues.parse("{"
                    + "\"body\":{\"$.name\":{\"matchers\":[{\"match\":\"regex\",\"regex\":\"a.*\"},"
                    + "{\"match\":\"include\",\"value\":\"z\"}],\"combine\":\"OR\"}},"
                    + "\"status\":{\"matchers\":[{\"match\":\"statusCode\",\"status\":\"clientError\"}]}}"));

            RuleList name = rules.category(MatchingRules.BODY).rules().get("$.name");
            assertThat(name.logic()).isEqualTo(RuleLogic.OR);
            assertThat(name.rules()).hasSize(2);
            assertThat(rules.category(MatchingRules.STATUS).single().rules())
                    .singleElement()
                    .isInstanceOf(MatchingRule.StatusCode.class);
        }

        @Test
        void headersAliasIsNormalised() {
            var rules = MatchingRuleJson.read(
                    JsonValues.parse("{\"headers\":{\"X-Id\":{\"matchers\":[{\"match\":\"type\"}]}}}"));

            assertThat(rules.category(MatchingRules.HEADER).rules()).containsKey("X-Id");
        }

        @Test
        void writtenRulesReadBackEqual() {
            var rules = MatchingRules.EMPTY
                    .with(MatchingRules.BODY, "$.items", RuleList.of(new MatchingRule.MinMaxType(1, 5)))
                    .with(MatchingRules.BODY, "$.items[*].at", RuleList.of(new MatchingRule.Timestamp("yyyy-MM-dd")))
                    .with(MatchingRules.PATH, MatchingRuleCategory.SINGLE_KEY,
                            RuleList.of(new MatchingRule.Regex("/items")));

            var json = MatchingRuleJson.write(rules, SpecVersion.V3);

            assertThat(json.get("path").has("matchers")).isTrue();
            assertThat(MatchingRuleJson.read(json)).isEqualTo(rules);
        }
    }

    @Nested
    @DisplayName("single rules")
    class Rules {

        @ParameterizedTest
        @ValueSource(strings = {
            "{\"match\":\"number\"}",
            "{\"match\":\"boolean\"}",
            "{\"match\":\"semver\"}",
            "{\"match\":\"notEmpty\"}",
            "{\"match\":\"values\"}",
            "{\"match\":\"contentType\",\"value\":\"image/png\"}",
            "{\"match\":\"time\",\"format\":\"HH:mm\"}"
        })
        void roundTripThroughJson(String json) {
            var rule = MatchingRuleJson.ruleFromJson(JsonValues.parse(json));

            assertThat(MatchingRuleJson.toJson(rule)).isEqualTo(JsonValues.parse(json));
        }

        @Test
        void typeWithMinAndMaxBecomesMinMax() {
            assertThat(MatchingRuleJson.ruleFromJson(JsonValues.parse("{\"match\":\"type\",\"min\":1,\"max\":3}")))
                    .isEqualTo(new MatchingRule.MinMaxType(1, 3));
        }

        @Test
        void legacyRuleWithoutMatchIsGuessed() {
            assertThat(MatchingRuleJson.ruleFromJson(JsonValues.parse("{\"timestamp\":\"yyyy\"}")))
                    .isEqualTo(new MatchingRule.Timestamp("yyyy"));
        }

        @Test
        void statusCodesMayBeListed() {
            var rule = MatchingRuleJson.ruleFromJson(JsonValues.parse("{\"match\":\"statusCode\",\"status\":[200,201]}"));

            assertThat(rule).isEqualTo(new MatchingRule.StatusCode(new StatusGroup.Codes(List.of(200, 201))));
        }

        @Test
        void arrayContainsVariantsKeepTheirRules() {
            var rule = MatchingRuleJson.ruleFromJson(JsonValues.parse("{\"match\":\"arrayContains\",\"variants\":["
                    + "{\"index\":0,\"rules\":{\"$.id\":{\"matchers\":[{\"match\":\"integer\"}]}}}]}"));

            assertThat(rule).isInstanceOfSatisfying(MatchingRule.ArrayContains.class, contains -> {
                assertThat(contains.variants()).hasSize(1);
                assertThat(contains.variants().get(0).rules().rules()).containsKey("$.id");
            });
        }

        @Test
        void unknownTypeIsRejected() {
            assertThatThrownBy(() -> MatchingRuleJson.ruleFromJson(JsonValues.parse("{\"match\":\"fuzzy\"}")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("'fuzzy' is not a valid matching rule type");
        }

        @Test
        void missingAttributeIsRejected() {
            assertThatThrownBy(() -> MatchingRuleJson.ruleFromJson(JsonValues.parse("{\"match\":\"regex\"}")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("regex matcher missing 'regex' field");
        }
    }
}

package io.pactkit.core.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pactkit.core.error.LastError;
import io.pactkit.core.matchers.ValueType;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MatcherApi")
class MatcherApiTest {

    @AfterEach
    void clearLastError() {
        LastError.clear();
    }

    @Nested
    @DisplayName("parseMatcherDefinition")
    class Parse {

        @Test
        void successExposesValueTypeAndRules() {
            var result = MatcherApi.parseMatcherDefinition("matching(integer, 42), atLeast(1)");

            assertThat(result.error()).isNull();
            assertThat(result.value()).isEqualTo("42");
            assertThat(result.valueType()).isEqualTo(ValueType.INTEGER);
            List<String> types = new ArrayList<>();
            result.rules().forEachRemaining(rule -> types.add(rule.ruleType()));
            assertThat(types).containsExactly("integer", "type");
        }

        @Test
        void ruleIteratorCanOnlyBeTakenOnce() {
            var result = MatcherApi.parseMatcherDefinition("matching(type, 'a')");
            result.rules();

            assertThatThrownBy(result::rules)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("The rule iterator of a matcher definition can only be taken once");
        }

        @Test
        void referenceRules() {
            var rule = MatcherApi.parseMatcherDefinition("matching($'items')").rules().next();

            assertThat(rule.isReference()).isTrue();
            assertThat(rule.referenceName()).isEqualTo("items");
        }

        @Test
        void ruleJsonIsPactJson() {
            var rule = MatcherApi.parseMatcherDefinition("matching(regex, '\\d+', '1')").rules().next();

            assertThat(rule.ruleJson()).isEqualTo("{\"match\":\"regex\",\"regex\":\"\\\\d+\"}");
        }

        @Test
        void failureSetsLastError() {
            var result = MatcherApi.parseMatcherDefinition("matching(integer, 'x')");

            assertThat(result.error()).isEqualTo("Expected an integer (got ''x'' at offset 18)");
            assertThat(result.value()).isNull();
            assertThat(result.valueType()).isEqualTo(ValueType.UNKNOWN);
            assertThat(result.rules().hasNext()).isFalse();
            assertThat(LastError.get()).isEqualTo(result.error());
        }

        @Test
        void nullExpression() {
            assertThat(MatcherApi.parseMatcherDefinition(null).parseError().message()).isEqualTo("Expression is null");
        }
    }

    @Test
    void checkRegexRequiresAFullMatch() {
        assertThat(MatcherApi.checkRegex("\\d+", "123")).isTrue();
        assertThat(MatcherApi.checkRegex("\\d+", "123a")).isFalse();
    }

    @Test
    void invalidRegexIsFalseWithLastError() {
        assertThat(MatcherApi.checkRegex("[a-", "a")).isFalse();
        assertThat(LastError.get()).startsWith("Invalid regex '[a-'");
    }

    @Test
    void generatedRegexValueMatches() {
        assertThat(MatcherApi.generateRegexValue("[a-z]{5}\\d", new Random(3))).matches("[a-z]{5}\\d");
        assertThat(MatcherApi.generateRegexValue("(a)\\1")).isNull();
    }

    @Test
    void datetimeStringUsesTheFormat() {
        assertThat(MatcherApi.generateDatetimeString("yyyy-MM-dd")).matches("\\d{4}-\\d{2}-\\d{2}");
        assertThat(MatcherApi.generateDatetimeString("yyyy-bb")).isNull();
        assertThat(LastError.get()).startsWith("Invalid date-time format 'yyyy-bb'");
    }
}

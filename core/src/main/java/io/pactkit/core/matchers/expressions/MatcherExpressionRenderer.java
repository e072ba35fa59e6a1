package io.pactkit.core.matchers.expressions;

import com.fasterxml.jackson.databind.JsonNode;
import io.pactkit.core.generators.Generator;
import io.pactkit.core.matchers.MatchingRule;
import io.pactkit.core.matchers.MatchingRuleDefinition;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link MatchingRuleDefinition} back into matcher expression text. The output parses
 * back to an equal definition.
 *
 * <p>Rules with no expression form (array-contains, values, null, status code, min/max pairs)
 * are rejected with {@link IllegalArgumentException}.
 */
public final class MatcherExpressionRenderer {

    private MatcherExpressionRenderer() {}

    public static String render(MatchingRuleDefinition definition) {
        if (definition.rules().isEmpty()) {
            if (definition.generator() instanceof Generator.ProviderState state) {
                return "fromProviderState(" + quote(state.expression()) + ", " + primitive(definition.value()) + ")";
            }
            if (definition.generator() != null) {
                throw new IllegalArgumentException(
                        "A " + definition.generator().type() + " generator without a rule has no expression form");
            }
            return definition.value().isTextual() ? definition.value().textValue() : definition.value().toString();
        }
        List<String> terms = new ArrayList<>();
        Term term = new Term(definition.value());
        for (MatchingRule rule : definition.rules()) {
            terms.add(rule.accept(term));
        }
        if (definition.generator() instanceof Generator.ProviderState state) {
            terms.add("fromProviderState(" + quote(state.expression()) + ", " + primitive(definition.value()) + ")");
        }
        return String.join(", ", terms);
    }

    private static String quote(String s) {
        if (s == null) {
            return "''";
        }
        return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private static String primitive(JsonNode value) {
        if (value.isTextual()) {
            return quote(value.textValue());
        }
        if (value.isNull()) {
            return "null";
        }
        return value.asText();
    }

    /** Renders one rule of a definition, using the definition's example. */
    private static final class Term implements MatchingRule.Visitor<String> {

        private final JsonNode value;

        Term(JsonNode value) {
            this.value = value;
        }

        private String text() {
            return quote(value.isNull() ? "" : value.asText());
        }

        private static String unsupported(MatchingRule rule) {
            throw new IllegalArgumentException(
                    "The '" + rule.name() + "' rule (" + rule + ") has no matcher expression form");
        }

        @Override
        public String visitEquality(MatchingRule.Equality rule) {
            return "matching(equalTo, " + primitive(value) + ")";
        }

        @Override
        public String visitRegex(MatchingRule.Regex rule) {
            return "matching(regex, " + quote(rule.regex()) + ", " + text() + ")";
        }

        @Override
        public String visitType(MatchingRule.Type rule) {
            return "matching(type, " + primitive(value) + ")";
        }

        @Override
        public String visitMinType(MatchingRule.MinType rule) {
            return "atLeast(" + rule.min() + ")";
        }

        @Override
        public String visitMaxType(MatchingRule.MaxType rule) {
            return "atMost(" + rule.max() + ")";
        }

        @Override
        public String visitMinMaxType(MatchingRule.MinMaxType rule) {
            return unsupported(rule);
        }

        @Override
        public String visitTimestamp(MatchingRule.Timestamp rule) {
            return "matching(datetime, " + quote(rule.format()) + ", " + text() + ")";
        }

        @Override
        public String visitTime(MatchingRule.Time rule) {
            return "matching(time, " + quote(rule.format()) + ", " + text() + ")";
        }

        @Override
        public String visitDate(MatchingRule.Date rule) {
            return "matching(date, " + quote(rule.format()) + ", " + text() + ")";
        }

        @Override
        public String visitNumber(MatchingRule.NumberType rule) {
            return "matching(number, " + value.asText() + ")";
        }

        @Override
        public String visitInteger(MatchingRule.IntegerType rule) {
            return "matching(integer, " + value.asText() + ")";
        }

        @Override
        public String visitDecimal(MatchingRule.DecimalType rule) {
            return "matching(decimal, " + value.asText() + ")";
        }

        @Override
        public String visitNull(MatchingRule.NullType rule) {
            return unsupported(rule);
        }

        @Override
        public String visitBoolean(MatchingRule.BooleanType rule) {
            return "matching(boolean, " + value.asText() + ")";
        }

        @Override
        public String visitContentType(MatchingRule.ContentType rule) {
            return "matching(contentType, " + quote(rule.mimeType()) + ", " + text() + ")";
        }

        @Override
        public String visitArrayContains(MatchingRule.ArrayContains rule) {
            return unsupported(rule);
        }

        @Override
        public String visitEachKey(MatchingRule.EachKey rule) {
            return "eachKey(" + render(rule.definition()) + ")";
        }

        @Override
        public String visitEachValue(MatchingRule.EachValue rule) {
            return "eachValue(" + render(rule.definition()) + ")";
        }

        @Override
        public String visitInclude(MatchingRule.Include rule) {
            return "matching(include, " + quote(rule.value()) + ")";
        }

        @Override
        public String visitNotEmpty(MatchingRule.NotEmpty rule) {
            return "notEmpty(" + primitive(value) + ")";
        }

        @Override
        public String visitSemver(MatchingRule.Semver rule) {
            return "matching(semver, " + text() + ")";
        }

        @Override
        public String visitStatusCode(MatchingRule.StatusCode rule) {
            return unsupported(rule);
        }

        @Override
        public String visitValues(MatchingRule.Values rule) {
            return unsupported(rule);
        }

        @Override
        public String visitReference(MatchingRule.Reference rule) {
            return "matching($" + quote(rule.referenceName()) + ")";
        }
    }
}

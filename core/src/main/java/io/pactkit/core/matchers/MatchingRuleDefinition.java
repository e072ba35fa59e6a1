package io.pactkit.core.matchers;

import com.fasterxml.jackson.databind.JsonNode;
import io.pactkit.core.generators.Generator;
import java.util.List;
import java.util.Objects;

/**
 * Result of parsing a matcher expression: an example value, the rules that apply to it and an
 * optional generator. A definition with no rules and no generator is a plain value matched by
 * equality.
 *
 * @param value     the example value, used literally when the pact is written
 * @param valueType the example value's type tag
 * @param rules     rules in declaration order, possibly empty
 * @param generator generator implied by the rules, or {@code null}
 */
public record MatchingRuleDefinition(JsonNode value, ValueType valueType, List<MatchingRule> rules, Generator generator) {

    public MatchingRuleDefinition {
        Objects.requireNonNull(value, "value must not be null");
        valueType = valueType == null ? ValueType.UNKNOWN : valueType;
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /** True if this definition matches by plain equality. */
    public boolean isPlainValue() {
        return rules.isEmpty() && generator == null;
    }
}

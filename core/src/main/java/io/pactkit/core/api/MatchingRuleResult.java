package io.pactkit.core.api;

import io.pactkit.core.matchers.MatchingRule;
import io.pactkit.core.matchers.MatchingRuleJson;
import io.pactkit.core.model.JsonValues;
import java.util.Objects;

/**
 * One item of a {@link MatcherDefinitionResult}'s rule iterator: either a matching rule or a
 * reference to a named definition ({@code matching($'name')}).
 *
 * @param rule the rule
 */
public record MatchingRuleResult(MatchingRule rule) {

    public MatchingRuleResult {
        Objects.requireNonNull(rule, "rule must not be null");
    }

    public boolean isReference() {
        return rule instanceof MatchingRule.Reference;
    }

    /** Name of the referenced definition, or {@code null} for a plain rule. */
    public String referenceName() {
        return rule instanceof MatchingRule.Reference ref ? ref.referenceName() : null;
    }

    /** The {@code match} name used in pact JSON. */
    public String ruleType() {
        return rule.name();
    }

    /** Pact JSON form of the rule. */
    public String ruleJson() {
        return JsonValues.write(MatchingRuleJson.toJson(rule));
    }
}

package io.pactkit.core.api;

import io.pactkit.core.generators.Generator;
import io.pactkit.core.matchers.MatchingRule;
import io.pactkit.core.matchers.MatchingRuleDefinition;
import io.pactkit.core.matchers.ValueType;
import io.pactkit.core.matchers.expressions.ParseError;
import io.pactkit.core.model.JsonValues;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Result of {@link MatcherApi#parseMatcherDefinition}. Holds either an error or a parsed
 * definition.
 *
 * <p>{@link #rules()} hands out a forward-only cursor over the rules exactly once; parse the
 * expression again to iterate again.
 */
public final class MatcherDefinitionResult {

    private final MatchingRuleDefinition definition;
    private final ParseError error;
    private final AtomicBoolean iterated = new AtomicBoolean();

    private MatcherDefinitionResult(MatchingRuleDefinition definition, ParseError error) {
        this.definition = definition;
        this.error = error;
    }

    static MatcherDefinitionResult success(MatchingRuleDefinition definition) {
        return new MatcherDefinitionResult(definition, null);
    }

    static MatcherDefinitionResult failure(ParseError error) {
        return new MatcherDefinitionResult(null, error);
    }

    /** Error description, or {@code null} if parsing succeeded. */
    public String error() {
        return error == null ? null : error.describe();
    }

    /** Structured error, or {@code null} if parsing succeeded. */
    public ParseError parseError() {
        return error;
    }

    /** The example value as a string (JSON for non-string values), or {@code null} on error. */
    public String value() {
        return definition == null ? null : JsonValues.asString(definition.value());
    }

    /** Type tag of the example value; {@link ValueType#UNKNOWN} on error. */
    public ValueType valueType() {
        return definition == null ? ValueType.UNKNOWN : definition.valueType();
    }

    /** The generator, or {@code null}. */
    public Generator generator() {
        return definition == null ? null : definition.generator();
    }

    /** The definition, or {@code null} on error. */
    public MatchingRuleDefinition definition() {
        return definition;
    }

    /**
     * One-shot iterator over the rules, in declaration order. Empty on error.
     *
     * @throws IllegalStateException if called a second time
     */
    public Iterator<MatchingRuleResult> rules() {
        if (!iterated.compareAndSet(false, true)) {
            throw new IllegalStateException("The rule iterator of a matcher definition can only be taken once");
        }
        List<MatchingRule> rules = definition == null ? List.of() : definition.rules();
        return new Iterator<>() {
            private int next;

            @Override
            public boolean hasNext() {
                return next < rules.size();
            }

            @Override
            public MatchingRuleResult next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return new MatchingRuleResult(rules.get(next++));
            }
        };
    }
}

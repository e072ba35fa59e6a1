package io.pactkit.core.matchers.expressions;

import io.pactkit.core.error.MatcherExpressionException;
import io.pactkit.core.matchers.MatchingRuleDefinition;
import java.util.Objects;

/** Outcome of parsing a matcher expression. Parsing never throws; failures are values. */
public sealed interface ParseResult {

    boolean isSuccess();

    /**
     * The definition, or a {@link MatcherExpressionException} for a failure.
     *
     * @throws MatcherExpressionException if parsing failed
     */
    MatchingRuleDefinition orElseThrow();

    record Success(MatchingRuleDefinition definition) implements ParseResult {
        public Success {
            Objects.requireNonNull(definition, "definition must not be null");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public MatchingRuleDefinition orElseThrow() {
            return definition;
        }
    }

    record Failure(ParseError error) implements ParseResult {
        public Failure {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public MatchingRuleDefinition orElseThrow() {
            throw new MatcherExpressionException(error);
        }
    }
}

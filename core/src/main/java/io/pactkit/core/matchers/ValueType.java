package io.pactkit.core.matchers;

/** Type tag of the example value in a {@link MatchingRuleDefinition}. */
public enum ValueType {
    UNKNOWN,
    STRING,
    NUMBER,
    INTEGER,
    DECIMAL,
    BOOLEAN;

    /**
     * Combines the tags of two definitions describing the same value. String dominates, then the
     * most specific numeric tag; unknown and boolean give way to anything else.
     */
    public ValueType merge(ValueType other) {
        if (this == STRING || other == STRING) {
            return STRING;
        }
        if (this == UNKNOWN || this == BOOLEAN && other != UNKNOWN) {
            return other;
        }
        if (other == UNKNOWN || other == BOOLEAN) {
            return this;
        }
        if (this == DECIMAL || other == DECIMAL) {
            return DECIMAL;
        }
        if (this == INTEGER || other == INTEGER) {
            return INTEGER;
        }
        return NUMBER;
    }
}

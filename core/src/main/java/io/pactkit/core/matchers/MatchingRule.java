package io.pactkit.core.matchers;

import io.pactkit.core.generators.Generators;
import java.util.List;
import java.util.Objects;

/**
 * A predicate, more permissive than strict equality, applied to one part of a request, response
 * or message.
 *
 * <p>The variants form a closed hierarchy. Code that must handle every kind (evaluation, JSON
 * serialisation, rendering back to the matcher DSL) implements {@link Visitor}, so adding a kind
 * fails compilation until each of them handles it.
 *
 * <p>Thread-safe and immutable.
 */
public sealed interface MatchingRule {

    /** The {@code match} name used in pact JSON. */
    String name();

    <R> R accept(Visitor<R> visitor);

    /** True for type-like rules that also govern the children of the value they are attached to. */
    default boolean cascades() {
        return false;
    }

    /** One callback per rule kind. */
    interface Visitor<R> {
        R visitEquality(Equality rule);

        R visitRegex(Regex rule);

        R visitType(Type rule);

        R visitMinType(MinType rule);

        R visitMaxType(MaxType rule);

        R visitMinMaxType(MinMaxType rule);

        R visitTimestamp(Timestamp rule);

        R visitTime(Time rule);

        R visitDate(Date rule);

        R visitNumber(NumberType rule);

        R visitInteger(IntegerType rule);

        R visitDecimal(DecimalType rule);

        R visitNull(NullType rule);

        R visitBoolean(BooleanType rule);

        R visitContentType(ContentType rule);

        R visitArrayContains(ArrayContains rule);

        R visitEachKey(EachKey rule);

        R visitEachValue(EachValue rule);

        R visitInclude(Include rule);

        R visitNotEmpty(NotEmpty rule);

        R visitSemver(Semver rule);

        R visitStatusCode(StatusCode rule);

        R visitValues(Values rule);

        R visitReference(Reference rule);
    }

    record Equality() implements MatchingRule {
        @Override
        public String name() {
            return "equality";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEquality(this);
        }
    }

    /** Full match of the value's string form against a regular expression. */
    record Regex(String regex) implements MatchingRule {
        public Regex {
            Objects.requireNonNull(regex, "regex must not be null");
        }

        @Override
        public String name() {
            return "regex";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRegex(this);
        }
    }

    record Type() implements MatchingRule {
        @Override
        public String name() {
            return "type";
        }

        @Override
        public boolean cascades() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitType(this);
        }
    }

    record MinType(int min) implements MatchingRule {
        public MinType {
            if (min < 0) {
                throw new IllegalArgumentException("min must not be negative, got: " + min);
            }
        }

        @Override
        public String name() {
            return "type";
        }

        @Override
        public boolean cascades() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMinType(this);
        }
    }

    record MaxType(int max) implements MatchingRule {
        public MaxType {
            if (max < 0) {
                throw new IllegalArgumentException("max must not be negative, got: " + max);
            }
        }

        @Override
        public String name() {
            return "type";
        }

        @Override
        public boolean cascades() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMaxType(this);
        }
    }

    record MinMaxType(int min, int max) implements MatchingRule {
        public MinMaxType {
            if (min < 0 || max < min) {
                throw new IllegalArgumentException("Invalid bounds: min=" + min + ", max=" + max);
            }
        }

        @Override
        public String name() {
            return "type";
        }

        @Override
        public boolean cascades() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMinMaxType(this);
        }
    }

    /** Date and time in the given format pattern. */
    record Timestamp(String format) implements MatchingRule {
        @Override
        public String name() {
            return "datetime";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTimestamp(this);
        }
    }

    record Time(String format) implements MatchingRule {
        @Override
        public String name() {
            return "time";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTime(this);
        }
    }

    record Date(String format) implements MatchingRule {
        @Override
        public String name() {
            return "date";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDate(this);
        }
    }

    record NumberType() implements MatchingRule {
        @Override
        public String name() {
            return "number";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    record IntegerType() implements MatchingRule {
        @Override
        public String name() {
            return "integer";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInteger(this);
        }
    }

    record DecimalType() implements MatchingRule {
        @Override
        public String name() {
            return "decimal";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDecimal(this);
        }
    }

    record NullType() implements MatchingRule {
        @Override
        public String name() {
            return "null";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNull(this);
        }
    }

    record BooleanType() implements MatchingRule {
        @Override
        public String name() {
            return "boolean";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoolean(this);
        }
    }

    /** The value's detected media type must equal {@code mimeType}. */
    record ContentType(String mimeType) implements MatchingRule {
        public ContentType {
            Objects.requireNonNull(mimeType, "mimeType must not be null");
        }

        @Override
        public String name() {
            return "contentType";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContentType(this);
        }
    }

    /**
     * Each variant must match at least one element of the actual array, in any order.
     *
     * @param variants the variants; the example for a variant is the expected array element at its index
     */
    record ArrayContains(List<Variant> variants) implements MatchingRule {
        public ArrayContains {
            Objects.requireNonNull(variants, "variants must not be null");
            variants = List.copyOf(variants);
        }

        @Override
        public String name() {
            return "arrayContains";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitArrayContains(this);
        }
    }

    /**
     * One variant of an {@link ArrayContains} rule.
     *
     * @param index      index of the example element in the expected array
     * @param rules      rules relative to the element ({@code $} is the element itself)
     * @param generators generators relative to the element
     */
    record Variant(int index, MatchingRuleCategory rules, Generators generators) {
        public Variant {
            rules = rules == null ? MatchingRuleCategory.empty("body") : rules;
            generators = generators == null ? Generators.EMPTY : generators;
        }
    }

    /** The definition applies to every key of an object. */
    record EachKey(MatchingRuleDefinition definition) implements MatchingRule {
        public EachKey {
            Objects.requireNonNull(definition, "definition must not be null");
        }

        @Override
        public String name() {
            return "eachKey";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEachKey(this);
        }
    }

    /** The definition applies to every value of an object or element of an array. */
    record EachValue(MatchingRuleDefinition definition) implements MatchingRule {
        public EachValue {
            Objects.requireNonNull(definition, "definition must not be null");
        }

        @Override
        public String name() {
            return "eachValue";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEachValue(this);
        }
    }

    /** The value's string form must contain {@code value}. */
    record Include(String value) implements MatchingRule {
        public Include {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String name() {
            return "include";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInclude(this);
        }
    }

    record NotEmpty() implements MatchingRule {
        @Override
        public String name() {
            return "notEmpty";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNotEmpty(this);
        }
    }

    record Semver() implements MatchingRule {
        @Override
        public String name() {
            return "semver";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSemver(this);
        }
    }

    record StatusCode(StatusGroup group) implements MatchingRule {
        public StatusCode {
            Objects.requireNonNull(group, "group must not be null");
        }

        @Override
        public String name() {
            return "statusCode";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStatusCode(this);
        }
    }

    /** Object values are matched by type, whatever their keys. */
    record Values() implements MatchingRule {
        @Override
        public String name() {
            return "values";
        }

        @Override
        public boolean cascades() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitValues(this);
        }
    }

    /**
     * A named reference to a reusable definition ({@code matching($'name')}). Evaluated as a type
     * match against the example value.
     */
    record Reference(String referenceName) implements MatchingRule {
        public Reference {
            Objects.requireNonNull(referenceName, "referenceName must not be null");
        }

        @Override
        public String name() {
            return "type";
        }

        @Override
        public boolean cascades() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReference(this);
        }
    }
}

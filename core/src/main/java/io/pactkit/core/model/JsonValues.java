package io.pactkit.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import java.util.Comparator;

/**
 * Shared helpers over Jackson {@link JsonNode} trees, which are the value model for bodies,
 * message contents and matcher examples.
 *
 * <p>Thread-safe, stateless utility class.
 */
public final class JsonValues {

    /** Shared mapper; configured once and never mutated afterwards. */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Compares numbers by kind, then by value: {@code 1} and {@code 1.0} differ, while {@code 1.5}
     * held as a double and as a {@code BigDecimal} compare equal.
     */
    private static final Comparator<JsonNode> NUMERIC_AWARE = (a, b) -> {
        if (a.isNumber() && b.isNumber()) {
            if (a.isIntegralNumber() != b.isIntegralNumber()) {
                return 1;
            }
            return a.decimalValue().compareTo(b.decimalValue());
        }
        return a.equals(b) ? 0 : 1;
    };

    private JsonValues() {}

    /**
     * Deep structural equality. Object key order is ignored. Numbers must be the same
     * kind (integer or decimal) and the same value.
     *
     * @return true if both trees hold the same data
     */
    public static boolean deepEquals(JsonNode expected, JsonNode actual) {
        if (expected == null || actual == null) {
            return expected == actual;
        }
        return expected.equals(NUMERIC_AWARE, actual);
    }

    /**
     * Name of the value's type as used in mismatch messages: Map, List, String, Integer, Decimal,
     * Boolean or Null.
     */
    public static String typeName(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "Missing";
        }
        JsonNodeType type = node.getNodeType();
        return switch (type) {
            case OBJECT, POJO -> "Map";
            case ARRAY -> "List";
            case STRING, BINARY -> "String";
            case BOOLEAN -> "Boolean";
            case NULL, MISSING -> "Null";
            case NUMBER -> node.isIntegralNumber() ? "Integer" : "Decimal";
        };
    }

    /**
     * True if both values have the same type tag. Integers and decimals are distinct tags, decided
     * by whether the literal had a fractional or exponent part.
     */
    public static boolean sameType(JsonNode expected, JsonNode actual) {
        return typeName(expected).equals(typeName(actual));
    }

    /** String form used by regex, include and similar rules: raw text for strings, JSON otherwise. */
    public static String asString(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "";
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        return node.toString();
    }

    /** Compact JSON rendering for messages, with strings quoted. */
    public static String display(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "<missing>";
        }
        return node.toString();
    }

    /** True for null, an empty string, an empty array or an empty object. */
    public static boolean isEmpty(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return true;
        }
        if (node.isTextual()) {
            return node.textValue().isEmpty();
        }
        return node.isContainerNode() && node.isEmpty();
    }

    /**
     * Parses JSON text.
     *
     * @throws IllegalArgumentException if {@code json} is not valid JSON
     */
    public static JsonNode parse(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses JSON text, returning {@code null} instead of failing. */
    public static JsonNode tryParse(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /** Serialises a tree to compact JSON text. */
    public static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise JSON tree", e);
        }
    }

    /** Serialises a tree to indented JSON text. */
    public static String writePretty(JsonNode node) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise JSON tree", e);
        }
    }
}

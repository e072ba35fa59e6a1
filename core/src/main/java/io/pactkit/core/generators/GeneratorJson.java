package io.pactkit.core.generators;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pactkit.core.model.JsonValues;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/** Reads and writes generators in pact JSON form. */
public final class GeneratorJson {

    private static final String[] SINGLE_VALUED = {"path", "status"};

    private GeneratorJson() {}

    /**
     * Reads one generator, e.g. {@code {"type":"RandomInt","min":0,"max":10}}.
     *
     * @throws IllegalArgumentException for an unknown type or missing attributes
     */
    public static Generator fromJson(JsonNode node) {
        String type = node.path("type").asText("");
        return switch (type) {
            case "RandomInt" -> new Generator.RandomInt(node.path("min").asInt(0), node.path("max").asInt(10));
            case "RandomDecimal" -> new Generator.RandomDecimal(node.path("digits").asInt(10));
            case "RandomHexadecimal" -> new Generator.RandomHexadecimal(node.path("digits").asInt(10));
            case "RandomString" -> new Generator.RandomString(node.path("size").asInt(10));
            case "Regex" -> new Generator.Regex(required(node, "regex"));
            case "Uuid" -> new Generator.Uuid(Generator.UuidFormat.parse(textOrNull(node, "format")));
            case "Date" -> new Generator.Date(textOrNull(node, "format"), textOrNull(node, "expression"));
            case "Time" -> new Generator.Time(textOrNull(node, "format"), textOrNull(node, "expression"));
            case "DateTime", "Timestamp" -> new Generator.DateTime(
                    textOrNull(node, "format"), textOrNull(node, "expression"));
            case "RandomBoolean" -> new Generator.RandomBoolean();
            case "ProviderState" -> new Generator.ProviderState(
                    required(node, "expression"), Generator.DataType.parse(textOrNull(node, "dataType")));
            case "MockServerURL" -> new Generator.MockServerUrl(required(node, "example"), required(node, "regex"));
            default -> throw new IllegalArgumentException("Unknown generator type: '" + type + "'");
        };
    }

    /** Reads a whole {@code generators} block keyed by category. */
    public static Generators readGenerators(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Generators.EMPTY;
        }
        Map<String, Map<String, Generator>> categories = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> category = fields.next();
            Map<String, Generator> inner = new LinkedHashMap<>();
            JsonNode value = category.getValue();
            if (value.has("type") && value.get("type").isTextual()) {
                inner.put("", fromJson(value));
            } else {
                Iterator<Map.Entry<String, JsonNode>> entries = value.fields();
                while (entries.hasNext()) {
                    Map.Entry<String, JsonNode> entry = entries.next();
                    inner.put(entry.getKey(), fromJson(entry.getValue()));
                }
            }
            categories.put(category.getKey(), inner);
        }
        return Generators.of(categories);
    }

    /** Writes a {@code generators} block; single-valued categories are written without a key level. */
    public static ObjectNode writeGenerators(Generators generators) {
        ObjectNode root = JsonValues.MAPPER.createObjectNode();
        for (Map.Entry<String, Map<String, Generator>> category : generators.categories().entrySet()) {
            if (category.getValue().isEmpty()) {
                continue;
            }
            if (isSingleValued(category.getKey()) && category.getValue().containsKey("")) {
                root.set(category.getKey(), category.getValue().get("").toJson());
                continue;
            }
            ObjectNode inner = root.putObject(category.getKey());
            category.getValue().forEach((key, generator) -> inner.set(key, generator.toJson()));
        }
        return root;
    }

    private static boolean isSingleValued(String category) {
        for (String single : SINGLE_VALUED) {
            if (single.equals(category)) {
                return true;
            }
        }
        return false;
    }

    private static String required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException(
                    "Generator '" + node.path("type").asText() + "' requires attribute '" + field + "'");
        }
        return value.asText();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}

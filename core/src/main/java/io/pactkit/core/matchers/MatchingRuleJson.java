package io.pactkit.core.matchers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.pactkit.core.generators.Generator;
import io.pactkit.core.generators.GeneratorJson;
import io.pactkit.core.generators.Generators;
import io.pactkit.core.model.JsonValues;
import io.pactkit.core.model.SpecVersion;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads and writes matching rules in pact JSON form.
 *
 * <p>Two layouts exist. V2 pacts use one flat map keyed by {@code $.body...}, {@code $.headers.X},
 * {@code $.query.q} and {@code $.path}, with a single rule object per key. V3 and later nest rules
 * by category, each key holding {@code {"matchers":[...],"combine":"AND"}}; the {@code path} and
 * {@code status} categories hold that object directly.
 *
 * <p>Unknown rule types raise {@link IllegalArgumentException}; pact readers wrap it.
 */
public final class MatchingRuleJson {

    private MatchingRuleJson() {}

    /** Reads a {@code matchingRules} block in either layout. */
    public static MatchingRules read(JsonNode node) {
        if (node == null || !node.isObject() || node.isEmpty()) {
            return MatchingRules.EMPTY;
        }
        String first = node.fieldNames().next();
        return first.startsWith("$") ? readV2(node) : readV3(node);
    }

    private static MatchingRules readV2(JsonNode node) {
        MatchingRules rules = MatchingRules.EMPTY;
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String key = entry.getKey();
            RuleList list = new RuleList(List.of(ruleFromJson(entry.getValue())), RuleLogic.AND);
            if (key.equals("$.path")) {
                rules = rules.with(MatchingRules.PATH, MatchingRuleCategory.SINGLE_KEY, list);
            } else if (key.startsWith("$.body")) {
                rules = rules.with(MatchingRules.BODY, "$" + key.substring("$.body".length()), list);
            } else if (key.startsWith("$.headers.") || key.startsWith("$.header.")) {
                rules = rules.with(MatchingRules.HEADER, key.substring(key.indexOf('.', 2) + 1), list);
            } else if (key.startsWith("$.query.")) {
                rules = rules.with(MatchingRules.QUERY, key.substring("$.query.".length()), list);
            } else {
                throw new IllegalArgumentException("Unrecognised V2 matching rule key: '" + key + "'");
            }
        }
        return rules;
    }

    private static MatchingRules readV3(JsonNode node) {
        Map<String, MatchingRuleCategory> categories = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String name = normaliseCategory(entry.getKey());
            MatchingRuleCategory category = readCategory(name, entry.getValue());
            categories.merge(name, category, MatchingRuleCategory::merge);
        }
        return MatchingRules.of(categories);
    }

    private static String normaliseCategory(String name) {
        return switch (name) {
            case "headers" -> MatchingRules.HEADER;
            case "content", "contents" -> MatchingRules.BODY;
            default -> name;
        };
    }

    /** Reads one category: either a single rule list or a map of key to rule list. */
    public static MatchingRuleCategory readCategory(String name, JsonNode node) {
        if (node == null || !node.isObject()) {
            return MatchingRuleCategory.empty(name);
        }
        if (node.has("matchers")) {
            return MatchingRuleCategory.of(name, Map.of(MatchingRuleCategory.SINGLE_KEY, readRuleList(node)));
        }
        Map<String, RuleList> rules = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            rules.put(entry.getKey(), readRuleList(entry.getValue()));
        }
        return MatchingRuleCategory.of(name, rules);
    }

    /** Reads {@code {"matchers":[...],"combine":"AND"|"OR"}}. */
    public static RuleList readRuleList(JsonNode node) {
        RuleLogic logic = "OR".equalsIgnoreCase(node.path("combine").asText("AND")) ? RuleLogic.OR : RuleLogic.AND;
        List<MatchingRule> rules = new ArrayList<>();
        JsonNode matchers = node.get("matchers");
        if (matchers != null && matchers.isArray()) {
            for (JsonNode matcher : matchers) {
                rules.add(ruleFromJson(matcher));
            }
        } else if (node.isObject() && !node.isEmpty()) {
            rules.add(ruleFromJson(node));
        }
        return new RuleList(rules, logic);
    }

    /**
     * Reads one rule, e.g. {@code {"match":"regex","regex":"\\d+"}}. Rule objects without a
     * {@code match} attribute are recognised by their other attributes, as older pacts write them.
     *
     * @throws IllegalArgumentException if the rule type is unknown or an attribute is missing
     */
    public static MatchingRule ruleFromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Matching rule JSON is not an object: " + node);
        }
        JsonNode match = node.get("match");
        if (match == null) {
            return guessRule(node);
        }
        String type = match.asText();
        return switch (type) {
            case "equality" -> new MatchingRule.Equality();
            case "regex" -> new MatchingRule.Regex(required(node, "regex", type));
            case "type" -> typeRule(node);
            case "min" -> new MatchingRule.MinType(requiredInt(node, "min", type));
            case "max" -> new MatchingRule.MaxType(requiredInt(node, "max", type));
            case "timestamp", "datetime" -> new MatchingRule.Timestamp(format(node, type));
            case "date" -> new MatchingRule.Date(format(node, type));
            case "time" -> new MatchingRule.Time(format(node, type));
            case "number" -> new MatchingRule.NumberType();
            case "integer" -> new MatchingRule.IntegerType();
            case "decimal", "real" -> new MatchingRule.DecimalType();
            case "null" -> new MatchingRule.NullType();
            case "boolean" -> new MatchingRule.BooleanType();
            case "contentType" -> new MatchingRule.ContentType(required(node, "value", type));
            case "include" -> new MatchingRule.Include(required(node, "value", type));
            case "notEmpty" -> new MatchingRule.NotEmpty();
            case "semver" -> new MatchingRule.Semver();
            case "values" -> new MatchingRule.Values();
            case "statusCode" -> new MatchingRule.StatusCode(statusGroup(node.get("status")));
            case "arrayContains" -> arrayContains(node);
            case "eachKey" -> new MatchingRule.EachKey(definition(node));
            case "eachValue" -> new MatchingRule.EachValue(definition(node));
            default -> throw new IllegalArgumentException("'" + type + "' is not a valid matching rule type");
        };
    }

    private static MatchingRule guessRule(JsonNode node) {
        if (node.has("regex")) {
            return new MatchingRule.Regex(node.get("regex").asText());
        }
        if (node.has("min") || node.has("max")) {
            return typeRule(node);
        }
        if (node.has("timestamp")) {
            return new MatchingRule.Timestamp(node.get("timestamp").asText());
        }
        if (node.has("time")) {
            return new MatchingRule.Time(node.get("time").asText());
        }
        if (node.has("date")) {
            return new MatchingRule.Date(node.get("date").asText());
        }
        throw new IllegalArgumentException("Matching rule missing 'match' field and unable to guess its type: " + node);
    }

    private static MatchingRule typeRule(JsonNode node) {
        JsonNode min = node.get("min");
        JsonNode max = node.get("max");
        if (node.hasNonNull("reference")) {
            return new MatchingRule.Reference(node.get("reference").asText());
        }
        if (min != null && max != null) {
            return new MatchingRule.MinMaxType(min.asInt(), max.asInt());
        }
        if (min != null) {
            return new MatchingRule.MinType(min.asInt());
        }
        if (max != null) {
            return new MatchingRule.MaxType(max.asInt());
        }
        return new MatchingRule.Type();
    }

    private static String format(JsonNode node, String type) {
        JsonNode format = node.has("format") ? node.get("format") : node.get(type);
        return format == null || format.isNull() ? null : format.asText();
    }

    /** Reads a status group: a group name or an array of codes. Missing means success. */
    static StatusGroup statusGroup(JsonNode status) {
        if (status == null || status.isNull()) {
            return StatusGroup.SUCCESS;
        }
        if (status.isArray()) {
            List<Integer> codes = new ArrayList<>();
            status.forEach(code -> codes.add(code.asInt()));
            return new StatusGroup.Codes(codes);
        }
        return StatusGroup.named(status.asText());
    }

    private static MatchingRule arrayContains(JsonNode node) {
        JsonNode variants = node.get("variants");
        if (variants == null || !variants.isArray()) {
            throw new IllegalArgumentException("ArrayContains matcher requires a 'variants' array");
        }
        List<MatchingRule.Variant> result = new ArrayList<>();
        for (JsonNode variant : variants) {
            int index = variant.path("index").asInt(0);
            MatchingRuleCategory rules = variant.has("rules")
                    ? readCategory(MatchingRules.BODY, variant.get("rules"))
                    : MatchingRuleCategory.empty(MatchingRules.BODY);
            Generators generators = Generators.EMPTY;
            JsonNode gens = variant.get("generators");
            if (gens != null && gens.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = gens.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> entry = fields.next();
                    generators = generators.with(
                            MatchingRules.BODY, entry.getKey(), GeneratorJson.fromJson(entry.getValue()));
                }
            }
            result.add(new MatchingRule.Variant(index, rules, generators));
        }
        return new MatchingRule.ArrayContains(result);
    }

    private static MatchingRuleDefinition definition(JsonNode node) {
        List<MatchingRule> rules = new ArrayList<>();
        JsonNode list = node.get("rules");
        if (list != null && list.isArray()) {
            for (JsonNode rule : list) {
                rules.add(ruleFromJson(rule));
            }
        }
        JsonNode value = node.has("value") ? node.get("value") : TextNode.valueOf("");
        Generator generator = node.has("generator") ? GeneratorJson.fromJson(node.get("generator")) : null;
        return new MatchingRuleDefinition(value, ValueType.UNKNOWN, rules, generator);
    }

    private static String required(JsonNode node, String field, String type) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException(
                    String.format(Locale.ROOT, "%s matcher missing '%s' field", type, field));
        }
        return value.asText();
    }

    private static int requiredInt(JsonNode node, String field, String type) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt()) {
            throw new IllegalArgumentException(
                    String.format(Locale.ROOT, "%s matcher missing numeric '%s' field", type, field));
        }
        return value.asInt();
    }

    // ---- writing ----

    /** Writes a {@code matchingRules} block in the layout of {@code version}. */
    public static ObjectNode write(MatchingRules rules, SpecVersion version) {
        return version.nestedRules() ? writeV3(rules) : writeV2(rules);
    }

    private static ObjectNode writeV3(MatchingRules rules) {
        ObjectNode root = JsonValues.MAPPER.createObjectNode();
        for (Map.Entry<String, MatchingRuleCategory> entry : rules.categories().entrySet()) {
            MatchingRuleCategory category = entry.getValue();
            if (category.isEmpty()) {
                continue;
            }
            if (isSingleValued(entry.getKey())) {
                root.set(entry.getKey(), writeRuleList(category.single()));
            } else {
                root.set(entry.getKey(), writeCategory(category));
            }
        }
        return root;
    }

    /** Writes a category as a map of key to rule list. */
    public static ObjectNode writeCategory(MatchingRuleCategory category) {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        category.rules().forEach((key, list) -> node.set(key, writeRuleList(list)));
        return node;
    }

    private static ObjectNode writeV2(MatchingRules rules) {
        ObjectNode root = JsonValues.MAPPER.createObjectNode();
        for (Map.Entry<String, MatchingRuleCategory> entry : rules.categories().entrySet()) {
            String name = entry.getKey();
            for (Map.Entry<String, RuleList> rule : entry.getValue().rules().entrySet()) {
                if (rule.getValue().isEmpty()) {
                    continue;
                }
                String key;
                if (MatchingRules.PATH.equals(name)) {
                    key = "$.path";
                } else if (MatchingRules.BODY.equals(name)) {
                    key = "$.body" + rule.getKey().substring(rule.getKey().startsWith("$") ? 1 : 0);
                } else if (MatchingRules.HEADER.equals(name)) {
                    key = "$.headers." + rule.getKey();
                } else {
                    key = "$." + name + "." + rule.getKey();
                }
                // V2 has room for a single rule per key
                root.set(key, toJson(rule.getValue().rules().get(0)));
            }
        }
        return root;
    }

    private static boolean isSingleValued(String category) {
        return MatchingRules.PATH.equals(category) || MatchingRules.STATUS.equals(category);
    }

    public static ObjectNode writeRuleList(RuleList list) {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        ArrayNode matchers = node.putArray("matchers");
        list.rules().forEach(rule -> matchers.add(toJson(rule)));
        node.put("combine", list.logic().name());
        return node;
    }

    /** JSON form of one rule, with its {@code match} attribute. */
    public static ObjectNode toJson(MatchingRule rule) {
        return rule.accept(new Writer());
    }

    private static final class Writer implements MatchingRule.Visitor<ObjectNode> {

        private static ObjectNode match(String type) {
            return JsonValues.MAPPER.createObjectNode().put("match", type);
        }

        @Override
        public ObjectNode visitEquality(MatchingRule.Equality rule) {
            return match("equality");
        }

        @Override
        public ObjectNode visitRegex(MatchingRule.Regex rule) {
            return match("regex").put("regex", rule.regex());
        }

        @Override
        public ObjectNode visitType(MatchingRule.Type rule) {
            return match("type");
        }

        @Override
        public ObjectNode visitMinType(MatchingRule.MinType rule) {
            return match("type").put("min", rule.min());
        }

        @Override
        public ObjectNode visitMaxType(MatchingRule.MaxType rule) {
            return match("type").put("max", rule.max());
        }

        @Override
        public ObjectNode visitMinMaxType(MatchingRule.MinMaxType rule) {
            return match("type").put("min", rule.min()).put("max", rule.max());
        }

        private static ObjectNode withFormat(String type, String format) {
            ObjectNode node = match(type);
            if (format != null) {
                node.put("format", format);
            }
            return node;
        }

        @Override
        public ObjectNode visitTimestamp(MatchingRule.Timestamp rule) {
            return withFormat("datetime", rule.format());
        }

        @Override
        public ObjectNode visitTime(MatchingRule.Time rule) {
            return withFormat("time", rule.format());
        }

        @Override
        public ObjectNode visitDate(MatchingRule.Date rule) {
            return withFormat("date", rule.format());
        }

        @Override
        public ObjectNode visitNumber(MatchingRule.NumberType rule) {
            return match("number");
        }

        @Override
        public ObjectNode visitInteger(MatchingRule.IntegerType rule) {
            return match("integer");
        }

        @Override
        public ObjectNode visitDecimal(MatchingRule.DecimalType rule) {
            return match("decimal");
        }

        @Override
        public ObjectNode visitNull(MatchingRule.NullType rule) {
            return match("null");
        }

        @Override
        public ObjectNode visitBoolean(MatchingRule.BooleanType rule) {
            return match("boolean");
        }

        @Override
        public ObjectNode visitContentType(MatchingRule.ContentType rule) {
            return match("contentType").put("value", rule.mimeType());
        }

        @Override
        public ObjectNode visitArrayContains(MatchingRule.ArrayContains rule) {
            ObjectNode node = match("arrayContains");
            ArrayNode variants = node.putArray("variants");
            for (MatchingRule.Variant variant : rule.variants()) {
                ObjectNode v = variants.addObject();
                v.put("index", variant.index());
                v.set("rules", writeCategory(variant.rules()));
                Map<String, Generator> generators = variant.generators().category(MatchingRules.BODY);
                if (!generators.isEmpty()) {
                    ObjectNode gens = v.putObject("generators");
                    generators.forEach((key, generator) -> gens.set(key, generator.toJson()));
                }
            }
            return node;
        }

        private static ObjectNode each(String type, MatchingRuleDefinition definition) {
            ObjectNode node = match(type);
            ArrayNode rules = node.putArray("rules");
            definition.rules().forEach(r -> rules.add(toJson(r)));
            node.set("value", definition.value());
            if (definition.generator() != null) {
                node.set("generator", definition.generator().toJson());
            }
            return node;
        }

        @Override
        public ObjectNode visitEachKey(MatchingRule.EachKey rule) {
            return each("eachKey", rule.definition());
        }

        @Override
        public ObjectNode visitEachValue(MatchingRule.EachValue rule) {
            return each("eachValue", rule.definition());
        }

        @Override
        public ObjectNode visitInclude(MatchingRule.Include rule) {
            return match("include").put("value", rule.value());
        }

        @Override
        public ObjectNode visitNotEmpty(MatchingRule.NotEmpty rule) {
            return match("notEmpty");
        }

        @Override
        public ObjectNode visitSemver(MatchingRule.Semver rule) {
            return match("semver");
        }

        @Override
        public ObjectNode visitStatusCode(MatchingRule.StatusCode rule) {
            ObjectNode node = match("statusCode");
            if (rule.group() instanceof StatusGroup.Named named) {
                node.put("status", named.name());
            } else {
                ArrayNode codes = node.putArray("status");
                ((StatusGroup.Codes) rule.group()).codes().forEach(codes::add);
            }
            return node;
        }

        @Override
        public ObjectNode visitValues(MatchingRule.Values rule) {
            return match("values");
        }

        @Override
        public ObjectNode visitReference(MatchingRule.Reference rule) {
            return match("type").put("reference", rule.referenceName());
        }
    }
}

package io.pactkit.core.matchers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.pactkit.core.generators.Generator;
import io.pactkit.core.generators.GeneratorJson;
import io.pactkit.core.generators.Generators;
import io.pactkit.core.model.DocPath;
import io.pactkit.core.model.JsonValues;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts matchers embedded in consumer-supplied JSON.
 *
 * <p>Test frameworks describe matchers inline, e.g.
 * {@code {"id": {"pact:matcher:type": "integer", "value": 1}}}. Processing replaces each matcher
 * object by its example value and records the rule (and any {@code pact:generator:type}) at the
 * value's path. A matcher whose value is an array applies its rule to the array and treats the
 * elements as templates at {@code [*]}.
 *
 * <p>A malformed matcher is logged and skipped; its example value is kept.
 */
public final class IntegrationJson {

    private static final Logger LOG = LoggerFactory.getLogger(IntegrationJson.class);

    static final String MATCHER_TYPE = "pact:matcher:type";
    static final String GENERATOR_TYPE = "pact:generator:type";

    /**
     * Result of processing.
     *
     * @param value      the document with every matcher replaced by its example
     * @param rules      rules by key (path expression for bodies, item name otherwise)
     * @param generators generators by the same keys
     */
    public record Processed(JsonNode value, MatchingRuleCategory rules, Map<String, Generator> generators) {
        public Processed {
            generators = Map.copyOf(generators);
        }
    }

    private MatchingRuleCategory rules;
    private final Map<String, Generator> generators = new LinkedHashMap<>();

    private IntegrationJson(String category) {
        this.rules = MatchingRuleCategory.empty(category);
    }

    /** Processes a body or message contents. Rules are keyed by path expression. */
    public static Processed processBody(JsonNode body) {
        IntegrationJson processor = new IntegrationJson(MatchingRules.BODY);
        JsonNode value = processor.process(body, DocPath.root(), false, false);
        return new Processed(value, processor.rules, processor.generators);
    }

    /**
     * Processes a single header, query or path value. When {@code raw} is a matcher object its
     * rule is recorded under {@code key}; otherwise {@code raw} is returned unchanged.
     */
    public static Processed processItem(String category, String key, String raw) {
        IntegrationJson processor = new IntegrationJson(category);
        JsonNode parsed = raw == null ? null : JsonValues.tryParse(raw);
        if (parsed == null || !parsed.isObject() || !parsed.has(MATCHER_TYPE)) {
            JsonNode value = raw == null ? NullNode.getInstance() : TextNode.valueOf(raw);
            return new Processed(value, processor.rules, Map.of());
        }
        processor.recordMatcher((ObjectNode) parsed, key);
        JsonNode value = parsed.get("value");
        return new Processed(value == null ? NullNode.getInstance() : value, processor.rules, processor.generators);
    }

    /** True if the text is JSON containing at least one embedded matcher. */
    public static boolean containsMatchers(JsonNode node) {
        if (node == null) {
            return false;
        }
        if (node.isObject() && node.has(MATCHER_TYPE)) {
            return true;
        }
        for (JsonNode child : node) {
            if (containsMatchers(child)) {
                return true;
            }
        }
        return false;
    }

    private JsonNode process(JsonNode node, DocPath path, boolean skipMatchers, boolean typeTemplate) {
        if (node.isObject()) {
            return processObject((ObjectNode) node, path, skipMatchers);
        }
        if (node.isArray()) {
            ArrayNode result = JsonValues.MAPPER.createArrayNode();
            for (int i = 0; i < node.size(); i++) {
                DocPath itemPath = typeTemplate ? anyIndex(path) : path.index(i);
                result.add(process(node.get(i), itemPath, skipMatchers, false));
            }
            return result;
        }
        return node;
    }

    private static DocPath anyIndex(DocPath path) {
        return DocPath.parse(path + "[*]");
    }

    private JsonNode processObject(ObjectNode obj, DocPath path, boolean skipMatchers) {
        if (!obj.has(MATCHER_TYPE)) {
            ObjectNode result = JsonValues.MAPPER.createObjectNode();
            boolean values = rules.resolve(path).rules().stream().anyMatch(MatchingRule.Values.class::isInstance);
            Iterator<Map.Entry<String, JsonNode>> fields = obj.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getKey().startsWith("pact:")) {
                    continue;
                }
                DocPath itemPath = values ? DocPath.parse(path + ".*") : path.field(field.getKey());
                result.set(field.getKey(), process(field.getValue(), itemPath, skipMatchers, false));
            }
            return result;
        }
        MatchingRule rule = skipMatchers ? null : recordMatcher(obj, path.toString());
        if (rule instanceof MatchingRule.ArrayContains) {
            JsonNode variants = obj.get("variants");
            return variants == null ? NullNode.getInstance() : process(variants, path, true, false);
        }
        JsonNode value = obj.get("value");
        if (value == null) {
            return NullNode.getInstance();
        }
        return process(value, path, skipMatchers, !skipMatchers && value.isArray());
    }

    /** Records the rule and generator of a matcher object under {@code key}; null if the rule is invalid. */
    private MatchingRule recordMatcher(ObjectNode obj, String key) {
        String type = obj.get(MATCHER_TYPE).asText();
        MatchingRule rule = null;
        try {
            rule = "arrayContains".equals(type) || "array-contains".equals(type)
                    ? arrayContains(obj)
                    : MatchingRuleJson.ruleFromJson(asRuleJson(obj, type));
            rules = rules.with(key, RuleList.of(rule));
        } catch (IllegalArgumentException e) {
            LOG.error("Failed to parse matching rule from JSON at {}: {}", key, e.getMessage());
        }
        JsonNode generatorType = obj.get(GENERATOR_TYPE);
        if (generatorType != null) {
            ObjectNode generatorJson = obj.deepCopy();
            generatorJson.put("type", generatorType.asText());
            try {
                generators.put(key, GeneratorJson.fromJson(generatorJson));
            } catch (IllegalArgumentException e) {
                LOG.warn("Ignoring generator at {}: {}", key, e.getMessage());
            }
        }
        return rule;
    }

    private static ObjectNode asRuleJson(ObjectNode obj, String type) {
        ObjectNode copy = obj.deepCopy();
        copy.put("match", "array-contains".equals(type) ? "arrayContains" : type);
        return copy;
    }

    private static MatchingRule arrayContains(ObjectNode obj) {
        JsonNode variants = obj.get("variants");
        if (variants == null || !variants.isArray()) {
            throw new IllegalArgumentException("ArrayContains 'variants' attribute is missing or not an array");
        }
        List<MatchingRule.Variant> result = new ArrayList<>();
        for (int i = 0; i < variants.size(); i++) {
            IntegrationJson nested = new IntegrationJson(MatchingRules.BODY);
            JsonNode variant = variants.get(i);
            if (variant.isObject()) {
                nested.processObject((ObjectNode) variant, DocPath.root(), false);
            } else {
                LOG.warn("arrayContains: variant {} is not an object: {}", i, variant);
            }
            Generators generators = Generators.EMPTY;
            for (Map.Entry<String, Generator> g : nested.generators.entrySet()) {
                generators = generators.with(MatchingRules.BODY, g.getKey(), g.getValue());
            }
            result.add(new MatchingRule.Variant(i, nested.rules, generators));
        }
        return new MatchingRule.ArrayContains(result);
    }
}

package io.pactkit.core.generators;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.pactkit.core.matchers.MatchingRuleCategory;
import io.pactkit.core.model.Body;
import io.pactkit.core.model.DocPath;
import io.pactkit.core.model.HttpRequest;
import io.pactkit.core.model.HttpResponse;
import io.pactkit.core.model.JsonValues;
import io.pactkit.core.model.Message;
import io.pactkit.core.model.MultiValues;
import io.pactkit.core.model.ProviderState;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies generators to documents.
 *
 * <p>Generation never fails: a generator that cannot produce a value (missing provider-state
 * parameter, no mock server URL, unsupported regex) leaves the example value in place.
 *
 * <p>Thread-safe, stateless utility class. Determinism depends only on the context's random source.
 */
public final class GeneratorEngine {

    private static final Logger LOG = LoggerFactory.getLogger(GeneratorEngine.class);

    private GeneratorEngine() {}

    /**
     * Runs one generator.
     *
     * @param generator   the generator
     * @param placeholder value to fall back to
     * @param context     generation inputs
     * @return the generated value, or {@code placeholder} if generation was not possible
     */
    public static JsonNode generate(Generator generator, JsonNode placeholder, GenerationContext context) {
        try {
            JsonNode value = generator.generate(placeholder, context);
            return value != null ? value : placeholder;
        } catch (RuntimeException e) {
            LOG.debug("Generator {} fell back to the example value: {}", generator.type(), e.getMessage());
            return placeholder;
        }
    }

    /** Merges the parameters of all provider states, later states overriding earlier ones. */
    public static GenerationContext withProviderStates(GenerationContext context, List<ProviderState> states) {
        Map<String, JsonNode> params = new LinkedHashMap<>(context.providerStateParams());
        for (ProviderState state : states) {
            params.putAll(state.params());
        }
        return context.withProviderStateParams(params);
    }

    /**
     * Returns a copy of {@code body} with every generator applied at the nodes its path expression
     * selects.
     */
    public static JsonNode applyToBody(JsonNode body, Map<String, Generator> byPath, GenerationContext context) {
        if (body == null || byPath.isEmpty()) {
            return body;
        }
        JsonNode result = body.deepCopy();
        for (Map.Entry<String, Generator> entry : byPath.entrySet()) {
            DocPath expression;
            try {
                expression = DocPath.parse(entry.getKey());
            } catch (IllegalArgumentException e) {
                LOG.warn("Ignoring generator with invalid path '{}': {}", entry.getKey(), e.getMessage());
                continue;
            }
            if (expression.matchesExactly(DocPath.root())) {
                result = generate(entry.getValue(), result, context);
            } else {
                replaceMatching(result, DocPath.root(), expression, entry.getValue(), context);
            }
        }
        return result;
    }

    private static void replaceMatching(
            JsonNode node, DocPath path, DocPath expression, Generator generator, GenerationContext context) {
        if (node instanceof ObjectNode object) {
            List<String> names = new ArrayList<>();
            Iterator<String> it = object.fieldNames();
            it.forEachRemaining(names::add);
            for (String name : names) {
                DocPath child = path.field(name);
                if (expression.matchesExactly(child)) {
                    object.set(name, generate(generator, object.get(name), context));
                } else if (expression.length() > child.length()) {
                    replaceMatching(object.get(name), child, expression, generator, context);
                }
            }
        } else if (node instanceof ArrayNode array) {
            for (int i = 0; i < array.size(); i++) {
                DocPath child = path.index(i);
                if (expression.matchesExactly(child)) {
                    array.set(i, generate(generator, array.get(i), context));
                } else if (expression.length() > child.length()) {
                    replaceMatching(array.get(i), child, expression, generator, context);
                }
            }
        }
    }

    /** Applies response generators: status, headers and body. */
    public static HttpResponse applyToResponse(HttpResponse response, GenerationContext context) {
        Generators generators = response.generators();
        if (generators.isEmpty()) {
            return response;
        }
        HttpResponse result = response;
        Generator status = generators.category("status").get(MatchingRuleCategory.SINGLE_KEY);
        if (status != null) {
            JsonNode generated = generate(status, JsonValues.MAPPER.getNodeFactory().numberNode(response.status()), context);
            if (generated.canConvertToInt()) {
                result = result.withStatus(generated.asInt());
            }
        }
        result = result.withHeaders(applyToValues(response.headers(), generators.category("header"), context, true));
        return result.withBody(applyToBodyOf(response.body(), generators.category("body"), context));
    }

    /** Applies request generators: path, query, headers and body. */
    public static HttpRequest applyToRequest(HttpRequest request, GenerationContext context) {
        Generators generators = request.generators();
        if (generators.isEmpty()) {
            return request;
        }
        HttpRequest result = request;
        Generator path = generators.category("path").get(MatchingRuleCategory.SINGLE_KEY);
        if (path != null) {
            result = result.withPath(JsonValues.asString(generate(path, TextNode.valueOf(request.path()), context)));
        }
        result = result.withQuery(applyToValues(request.query(), generators.category("query"), context, false));
        result = result.withHeaders(applyToValues(request.headers(), generators.category("header"), context, true));
        return result.withBody(applyToBodyOf(request.body(), generators.category("body"), context));
    }

    /** Applies message generators: contents and metadata. */
    public static Message applyToMessage(Message message, GenerationContext context) {
        Generators generators = message.generators();
        if (generators.isEmpty()) {
            return message;
        }
        Map<String, JsonNode> metadata = new LinkedHashMap<>(message.metadata());
        generators.category("metadata").forEach((key, generator) -> {
            String name = key.startsWith("$.") ? key.substring(2) : key;
            metadata.put(name, generate(generator, metadata.get(name), context));
        });
        return message.withMetadata(metadata)
                .withContents(applyToBodyOf(message.contents(), generators.category("body"), context));
    }

    private static Body applyToBodyOf(Body body, Map<String, Generator> byPath, GenerationContext context) {
        if (!body.isPresent() || byPath.isEmpty()) {
            return body;
        }
        return body.withContent(applyToBody(body.content(), byPath, context));
    }

    private static Map<String, List<String>> applyToValues(
            Map<String, List<String>> values,
            Map<String, Generator> generators,
            GenerationContext context,
            boolean caseInsensitive) {
        Map<String, List<String>> result = values;
        for (Map.Entry<String, Generator> entry : generators.entrySet()) {
            List<String> current = caseInsensitive
                    ? MultiValues.getIgnoreCase(values, entry.getKey()).orElse(List.of(""))
                    : values.getOrDefault(entry.getKey(), List.of(""));
            for (int i = 0; i < Math.max(1, current.size()); i++) {
                String example = i < current.size() ? current.get(i) : "";
                JsonNode generated = generate(entry.getValue(), TextNode.valueOf(example), context);
                result = MultiValues.withValue(result, entry.getKey(), i, JsonValues.asString(generated), caseInsensitive);
            }
        }
        return result;
    }
}

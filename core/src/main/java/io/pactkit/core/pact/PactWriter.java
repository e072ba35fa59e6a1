package io.pactkit.core.pact;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pactkit.core.generators.GeneratorJson;
import io.pactkit.core.generators.Generators;
import io.pactkit.core.matchers.MatchingRuleJson;
import io.pactkit.core.matchers.MatchingRules;
import io.pactkit.core.model.Body;
import io.pactkit.core.model.HttpRequest;
import io.pactkit.core.model.HttpResponse;
import io.pactkit.core.model.Interaction;
import io.pactkit.core.model.JsonValues;
import io.pactkit.core.model.Message;
import io.pactkit.core.model.Pact;
import io.pactkit.core.model.ProviderState;
import io.pactkit.core.model.SpecVersion;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Serialises a {@link Pact} to pact JSON in the layout of its {@link SpecVersion}.
 *
 * <ul>
 *   <li>V1/V2: a single {@code providerState}, query as a string, flat matching rules.
 *   <li>V3: {@code providerStates} with params, query as a map, nested rules, {@code messages}.
 *   <li>V4: typed {@code interactions} holding both HTTP and message interactions, bodies
 *       wrapped as {@code {"content","contentType","encoded"}}, headers as arrays.
 * </ul>
 *
 * <p>Thread-safe, stateless utility class.
 */
public final class PactWriter {

    /** Implementation version recorded in pact metadata. */
    public static final String IMPLEMENTATION_VERSION = "0.1.0";

    private PactWriter() {}

    public static ObjectNode toJson(Pact pact) {
        SpecVersion version = pact.specVersion();
        ObjectNode root = JsonValues.MAPPER.createObjectNode();
        root.putObject("consumer").put("name", pact.consumer());
        root.putObject("provider").put("name", pact.provider());
        if (version == SpecVersion.V4) {
            ArrayNode interactions = root.putArray("interactions");
            pact.interactions().forEach(i -> interactions.add(interactionJson(i, version)));
            pact.messages().forEach(m -> interactions.add(messageJson(m, version)));
        } else if (!pact.messages().isEmpty() && pact.interactions().isEmpty()) {
            ArrayNode messages = root.putArray("messages");
            pact.messages().forEach(m -> messages.add(messageJson(m, version)));
        } else {
            ArrayNode interactions = root.putArray("interactions");
            pact.interactions().forEach(i -> interactions.add(interactionJson(i, version)));
            if (!pact.messages().isEmpty()) {
                ArrayNode messages = root.putArray("messages");
                pact.messages().forEach(m -> messages.add(messageJson(m, version)));
            }
        }
        root.set("metadata", metadata(pact));
        return root;
    }

    public static String toJsonString(Pact pact) {
        return JsonValues.writePretty(toJson(pact));
    }

    private static ObjectNode metadata(Pact pact) {
        ObjectNode metadata = JsonValues.MAPPER.createObjectNode();
        pact.metadata().forEach(metadata::set);
        metadata.putObject("pactSpecification").put("version", pact.specVersion().label());
        metadata.putObject("pact-kit").put("version", IMPLEMENTATION_VERSION);
        return metadata;
    }

    /** JSON form of one HTTP interaction. */
    public static ObjectNode interactionJson(Interaction interaction, SpecVersion version) {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        if (version == SpecVersion.V4) {
            node.put("type", "Synchronous/HTTP");
        }
        node.put("description", interaction.description());
        writeProviderStates(node, interaction.providerStates(), version);
        node.set("request", requestJson(interaction.request(), version));
        node.set("response", responseJson(interaction.response(), version));
        if (version == SpecVersion.V4 && interaction.pending()) {
            node.put("pending", true);
        }
        return node;
    }

    /** JSON form of one message. */
    public static ObjectNode messageJson(Message message, SpecVersion version) {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        if (version == SpecVersion.V4) {
            node.put("type", "Asynchronous/Messages");
        }
        node.put("description", message.description());
        writeProviderStates(node, message.providerStates(), version);
        if (message.contents().isPresent()) {
            node.set("contents", bodyJson(message.contents(), version));
        }
        ObjectNode metadata = node.putObject("metadata");
        message.metadata().forEach(metadata::set);
        writeRulesAndGenerators(node, message.matchingRules(), message.generators(), version);
        return node;
    }

    private static void writeProviderStates(ObjectNode node, List<ProviderState> states, SpecVersion version) {
        if (states.isEmpty()) {
            return;
        }
        if (!version.nestedRules()) {
            node.put("providerState", states.get(0).name());
            return;
        }
        ArrayNode array = node.putArray("providerStates");
        for (ProviderState state : states) {
            ObjectNode s = array.addObject().put("name", state.name());
            if (!state.params().isEmpty()) {
                ObjectNode params = s.putObject("params");
                state.params().forEach(params::set);
            }
        }
    }

    private static ObjectNode requestJson(HttpRequest request, SpecVersion version) {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        node.put("method", request.method());
        node.put("path", request.path());
        if (!request.query().isEmpty()) {
            if (version.nestedRules()) {
                ObjectNode query = node.putObject("query");
                request.query().forEach((k, v) -> {
                    ArrayNode values = query.putArray(k);
                    v.forEach(values::add);
                });
            } else {
                node.put("query", queryString(request.query()));
            }
        }
        writeHeaders(node, request.headers(), version);
        if (request.body().isPresent()) {
            node.set("body", bodyJson(request.body(), version));
        }
        writeRulesAndGenerators(node, request.matchingRules(), request.generators(), version);
        return node;
    }

    private static ObjectNode responseJson(HttpResponse response, SpecVersion version) {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        node.put("status", response.status());
        writeHeaders(node, response.headers(), version);
        if (response.body().isPresent()) {
            node.set("body", bodyJson(response.body(), version));
        }
        writeRulesAndGenerators(node, response.matchingRules(), response.generators(), version);
        return node;
    }

    private static void writeHeaders(ObjectNode node, Map<String, List<String>> headers, SpecVersion version) {
        if (headers.isEmpty()) {
            return;
        }
        ObjectNode out = node.putObject("headers");
        headers.forEach((k, v) -> {
            if (version == SpecVersion.V4) {
                ArrayNode values = out.putArray(k);
                v.forEach(values::add);
            } else {
                out.put(k, String.join(", ", v));
            }
        });
    }

    private static JsonNode bodyJson(Body body, SpecVersion version) {
        if (version != SpecVersion.V4) {
            return body.content();
        }
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        node.set("content", body.content());
        if (body.contentType() != null) {
            node.put("contentType", body.contentType());
        }
        if (body.base64()) {
            node.put("encoded", "base64");
        } else {
            node.put("encoded", false);
        }
        return node;
    }

    private static void writeRulesAndGenerators(
            ObjectNode node, MatchingRules rules, Generators generators, SpecVersion version) {
        if (!rules.isEmpty()) {
            node.set("matchingRules", MatchingRuleJson.write(rules, version));
        }
        if (!generators.isEmpty() && version.nestedRules()) {
            node.set("generators", GeneratorJson.writeGenerators(generators));
        }
    }

    static String queryString(Map<String, List<String>> query) {
        StringJoiner joiner = new StringJoiner("&");
        query.forEach((k, values) -> {
            for (String v : values) {
                joiner.add(URLEncoder.encode(k, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(v, StandardCharsets.UTF_8));
            }
        });
        return joiner.toString();
    }
}

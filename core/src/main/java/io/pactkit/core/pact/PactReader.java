package io.pactkit.core.pact;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.pactkit.core.error.InvalidPactException;
import io.pactkit.core.generators.GeneratorJson;
import io.pactkit.core.generators.Generators;
import io.pactkit.core.matchers.MatchingRuleJson;
import io.pactkit.core.matchers.MatchingRules;
import io.pactkit.core.model.Body;
import io.pactkit.core.model.ContentTypes;
import io.pactkit.core.model.HttpRequest;
import io.pactkit.core.model.HttpResponse;
import io.pactkit.core.model.Interaction;
import io.pactkit.core.model.JsonValues;
import io.pactkit.core.model.Message;
import io.pactkit.core.model.MultiValues;
import io.pactkit.core.model.Pact;
import io.pactkit.core.model.ProviderState;
import io.pactkit.core.model.SpecVersion;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads pact JSON of any specification version (V1 to V4), for HTTP and message pacts.
 *
 * <p>Structural problems raise {@link InvalidPactException} naming the offending element.
 *
 * <p>Thread-safe, stateless utility class.
 */
public final class PactReader {

    private static final Logger LOG = LoggerFactory.getLogger(PactReader.class);

    private PactReader() {}

    /**
     * Parses pact JSON text.
     *
     * @throws InvalidPactException if the text is not JSON or not a pact
     */
    public static Pact read(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidPactException("Pact JSON is empty");
        }
        JsonNode root;
        try {
            root = JsonValues.MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidPactException("Pact is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return read(root);
    }

    /**
     * Reads a pact file.
     *
     * @throws InvalidPactException if the file cannot be read or is not a pact
     */
    public static Pact read(Path file) {
        try {
            return read(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new InvalidPactException("Failed to read pact file " + file + ": " + e.getMessage(), e);
        }
    }

    /** Reads an already parsed pact document. */
    public static Pact read(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidPactException("Pact JSON must be an object");
        }
        SpecVersion version = specVersion(root);
        String consumer = root.path("consumer").path("name").asText("consumer");
        String provider = root.path("provider").path("name").asText("provider");
        List<Interaction> interactions = new ArrayList<>();
        List<Message> messages = new ArrayList<>();
        JsonNode interactionsNode = root.path("interactions");
        int index = 0;
        for (JsonNode node : interactionsNode) {
            String type = node.path("type").asText("");
            try {
                if (type.startsWith("Asynchronous/Messages") || type.startsWith("Synchronous/Messages")) {
                    messages.add(message(node, version));
                } else {
                    interactions.add(interaction(node, version));
                }
            } catch (IllegalArgumentException e) {
                throw new InvalidPactException("Invalid interaction at index " + index + ": " + e.getMessage(), e);
            }
            index++;
        }
        index = 0;
        for (JsonNode node : root.path("messages")) {
            try {
                messages.add(message(node, version));
            } catch (IllegalArgumentException e) {
                throw new InvalidPactException("Invalid message at index " + index + ": " + e.getMessage(), e);
            }
            index++;
        }
        Map<String, JsonNode> metadata = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.path("metadata").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String key = entry.getKey();
            if (!key.equals("pactSpecification") && !key.equals("pact-specification")
                    && !key.equals("pactSpecificationVersion") && !key.equals("pact-kit")) {
                metadata.put(key, entry.getValue());
            }
        }
        LOG.debug("Read pact {}-{} (spec {}): {} interactions, {} messages",
                consumer, provider, version.label(), interactions.size(), messages.size());
        return new Pact(consumer, provider, interactions, messages, metadata, version);
    }

    static SpecVersion specVersion(JsonNode root) {
        JsonNode metadata = root.path("metadata");
        JsonNode version = metadata.path("pactSpecification").path("version");
        if (version.isMissingNode()) {
            version = metadata.path("pact-specification").path("version");
        }
        if (version.isMissingNode()) {
            version = metadata.path("pactSpecificationVersion");
        }
        if (version.isTextual()) {
            try {
                return SpecVersion.parse(version.textValue());
            } catch (IllegalArgumentException e) {
                LOG.warn("Unknown pact specification version '{}', assuming 3.0.0", version.textValue());
                return SpecVersion.V3;
            }
        }
        for (JsonNode interaction : root.path("interactions")) {
            if (interaction.has("type")) {
                return SpecVersion.V4;
            }
        }
        return root.has("messages") ? SpecVersion.V3 : SpecVersion.V2;
    }

    private static Interaction interaction(JsonNode node, SpecVersion version) {
        String description = node.path("description").asText("");
        JsonNode requestNode = node.path("request");
        JsonNode responseNode = node.path("response");
        Map<String, List<String>> requestHeaders = headers(requestNode.path("headers"));
        HttpRequest request = new HttpRequest(
                requestNode.path("method").asText("GET"),
                requestNode.path("path").asText("/"),
                query(requestNode.get("query")),
                requestHeaders,
                body(requestNode.get("body"), header(requestHeaders, "Content-Type"), version),
                MatchingRuleJson.read(requestNode.get("matchingRules")),
                GeneratorJson.readGenerators(requestNode.get("generators")));
        Map<String, List<String>> responseHeaders = headers(responseNode.path("headers"));
        HttpResponse response = new HttpResponse(
                responseNode.path("status").asInt(200),
                responseHeaders,
                body(responseNode.get("body"), header(responseHeaders, "Content-Type"), version),
                MatchingRuleJson.read(responseNode.get("matchingRules")),
                GeneratorJson.readGenerators(responseNode.get("generators")));
        return new Interaction(description, providerStates(node), request, response, node.path("pending").asBoolean(false));
    }

    private static Message message(JsonNode node, SpecVersion version) {
        Map<String, JsonNode> metadata = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.path("metadata").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            metadata.put(entry.getKey(), entry.getValue());
        }
        String contentType = null;
        for (String key : List.of("contentType", "content-type", "Content-Type")) {
            if (metadata.containsKey(key)) {
                contentType = metadata.get(key).asText();
            }
        }
        JsonNode contentsNode = node.has("contents") ? node.get("contents") : node.get("content");
        MatchingRules rules = MatchingRuleJson.read(node.get("matchingRules"));
        Generators generators = GeneratorJson.readGenerators(node.get("generators"));
        return new Message(
                node.path("description").asText(""),
                providerStates(node),
                body(contentsNode, contentType, version),
                metadata,
                rules,
                generators);
    }

    private static List<ProviderState> providerStates(JsonNode node) {
        List<ProviderState> states = new ArrayList<>();
        if (node.has("providerStates") && node.get("providerStates").isArray()) {
            for (JsonNode state : node.get("providerStates")) {
                Map<String, JsonNode> params = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> fields = state.path("params").fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> entry = fields.next();
                    params.put(entry.getKey(), entry.getValue());
                }
                states.add(new ProviderState(state.path("name").asText(""), params));
            }
        } else {
            JsonNode single = node.has("providerState") ? node.get("providerState") : node.get("provider_state");
            if (single != null && single.isTextual() && !single.textValue().isEmpty()) {
                states.add(ProviderState.of(single.textValue()));
            }
        }
        return states;
    }

    private static Map<String, List<String>> headers(JsonNode node) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            headers.put(entry.getKey(), values(entry.getValue()));
        }
        return headers;
    }

    private static String header(Map<String, List<String>> headers, String name) {
        return MultiValues.getIgnoreCase(headers, name)
                .filter(v -> !v.isEmpty())
                .map(v -> v.get(0))
                .orElse(null);
    }

    private static List<String> values(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(v -> values.add(v.asText()));
        } else if (!node.isNull()) {
            values.add(node.asText());
        }
        return values;
    }

    /** Reads a query given as a map of arrays or strings (V3+) or as a query string (V1/V2). */
    static Map<String, List<String>> query(JsonNode node) {
        Map<String, List<String>> query = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return query;
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                query.put(entry.getKey(), values(entry.getValue()));
            }
            return query;
        }
        return parseQueryString(node.asText());
    }

    /** Parses {@code a=1&b=2&a=3} into an ordered multi-map. */
    public static Map<String, List<String>> parseQueryString(String text) {
        Map<String, List<String>> query = new LinkedHashMap<>();
        if (text == null || text.isEmpty()) {
            return query;
        }
        for (String pair : text.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = URLDecoder.decode(eq >= 0 ? pair.substring(0, eq) : pair, StandardCharsets.UTF_8);
            String value = eq >= 0 ? URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8) : "";
            query.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        }
        return query;
    }

    /**
     * Reads a body. V4 bodies are wrapped as {@code {"content","contentType","encoded"}}; older
     * bodies are the content itself.
     */
    private static Body body(JsonNode node, String headerContentType, SpecVersion version) {
        if (node == null || node.isMissingNode()) {
            return Body.MISSING;
        }
        if (version == SpecVersion.V4 && node.isObject() && node.has("content")) {
            JsonNode content = node.get("content");
            String contentType = node.hasNonNull("contentType") ? node.get("contentType").asText() : headerContentType;
            JsonNode encoded = node.get("encoded");
            boolean base64 = encoded != null && encoded.isTextual() && encoded.textValue().equalsIgnoreCase("base64");
            if (encoded != null && encoded.isTextual() && encoded.textValue().equalsIgnoreCase("json")) {
                JsonNode parsed = JsonValues.tryParse(content.asText());
                content = parsed != null ? parsed : content;
            }
            if (contentType == null) {
                contentType = content.isContainerNode() ? ContentTypes.JSON : ContentTypes.sniff(content.asText());
            }
            return new Body(content, contentType, base64);
        }
        String contentType = headerContentType;
        if (contentType == null) {
            contentType = node.isContainerNode() ? ContentTypes.JSON : ContentTypes.sniff(node.asText());
        }
        if (node.isTextual() && !ContentTypes.isJson(contentType)) {
            return new Body(TextNode.valueOf(node.textValue()), contentType, false);
        }
        return new Body(node, contentType, false);
    }
}

package io.pactkit.core.handles;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pactkit.core.model.Interaction;
import io.pactkit.core.model.JsonValues;
import io.pactkit.core.model.Message;
import io.pactkit.core.model.Pact;
import io.pactkit.core.model.SpecVersion;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pact-level state behind a pact or message-pact handle. Interactions and messages live in their
 * own handle tables and point back at the pact handle.
 *
 * @param consumer    consumer name
 * @param provider    provider name
 * @param specVersion specification version used when writing
 * @param metadata    extra metadata sections keyed by namespace
 */
public record PactDraft(String consumer, String provider, SpecVersion specVersion, Map<String, JsonNode> metadata) {

    public PactDraft {
        Objects.requireNonNull(consumer, "consumer must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        specVersion = specVersion == null ? SpecVersion.V3 : specVersion;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static PactDraft of(String consumer, String provider) {
        return new PactDraft(consumer, provider, SpecVersion.V3, Map.of());
    }

    public PactDraft withSpecVersion(SpecVersion version) {
        return new PactDraft(consumer, provider, version, metadata);
    }

    /** Returns a copy with {@code metadata[namespace][name] = value}. */
    public PactDraft withMetadata(String namespace, String name, String value) {
        Map<String, JsonNode> next = new LinkedHashMap<>(metadata);
        ObjectNode section = JsonValues.MAPPER.createObjectNode();
        JsonNode existing = next.get(namespace);
        if (existing != null && existing.isObject()) {
            section.setAll((ObjectNode) existing.deepCopy());
        }
        section.put(name, value);
        next.put(namespace, section);
        return new PactDraft(consumer, provider, specVersion, next);
    }

    public Pact toPact(List<Interaction> interactions, List<Message> messages) {
        return new Pact(consumer, provider, interactions, messages, metadata, specVersion);
    }
}

package io.pactkit.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A contract between a consumer and a provider: HTTP interactions, messages, or both (V4).
 *
 * @param consumer     consumer name
 * @param provider     provider name
 * @param interactions HTTP interactions, in registration order
 * @param messages     asynchronous messages, in registration order
 * @param metadata     extra metadata sections keyed by namespace
 * @param specVersion  the specification version used when writing
 */
public record Pact(
        String consumer,
        String provider,
        List<Interaction> interactions,
        List<Message> messages,
        Map<String, JsonNode> metadata,
        SpecVersion specVersion) {

    public Pact {
        Objects.requireNonNull(consumer, "consumer must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        interactions = interactions == null ? List.of() : List.copyOf(interactions);
        messages = messages == null ? List.of() : List.copyOf(messages);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        specVersion = specVersion == null ? SpecVersion.V3 : specVersion;
    }

    /** File name the pact is written to: {@code <consumer>-<provider>.json}. */
    public String fileName() {
        return consumer + "-" + provider + ".json";
    }

    public Pact withInteractions(List<Interaction> newInteractions) {
        return new Pact(consumer, provider, newInteractions, messages, metadata, specVersion);
    }

    public Pact withMessages(List<Message> newMessages) {
        return new Pact(consumer, provider, interactions, newMessages, metadata, specVersion);
    }
}

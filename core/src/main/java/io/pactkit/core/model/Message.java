package io.pactkit.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.pactkit.core.generators.Generators;
import io.pactkit.core.matchers.MatchingRules;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An asynchronous message expectation.
 *
 * @param description    unique description within the pact
 * @param providerStates states the provider must be in, in order
 * @param contents       message payload
 * @param metadata       message metadata (e.g. {@code contentType}, destination)
 * @param matchingRules  rules for the {@code body} and {@code metadata} categories
 * @param generators     generators for the {@code body} and {@code metadata} categories
 */
public record Message(
        String description,
        List<ProviderState> providerStates,
        Body contents,
        Map<String, JsonNode> metadata,
        MatchingRules matchingRules,
        Generators generators) {

    public Message {
        Objects.requireNonNull(description, "description must not be null");
        providerStates = providerStates == null ? List.of() : List.copyOf(providerStates);
        contents = contents == null ? Body.MISSING : contents;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        matchingRules = matchingRules == null ? MatchingRules.EMPTY : matchingRules;
        generators = generators == null ? Generators.EMPTY : generators;
    }

    public static Message named(String description) {
        return new Message(description, List.of(), Body.MISSING, Map.of(), MatchingRules.EMPTY, Generators.EMPTY);
    }

    public Message withDescription(String newDescription) {
        return new Message(newDescription, providerStates, contents, metadata, matchingRules, generators);
    }

    public Message withProviderStates(List<ProviderState> states) {
        return new Message(description, states, contents, metadata, matchingRules, generators);
    }

    public Message withContents(Body newContents) {
        return new Message(description, providerStates, newContents, metadata, matchingRules, generators);
    }

    public Message withMetadata(Map<String, JsonNode> newMetadata) {
        return new Message(description, providerStates, contents, newMetadata, matchingRules, generators);
    }

    public Message withMatchingRules(MatchingRules rules) {
        return new Message(description, providerStates, contents, metadata, rules, generators);
    }

    public Message withGenerators(Generators newGenerators) {
        return new Message(description, providerStates, contents, metadata, matchingRules, newGenerators);
    }
}

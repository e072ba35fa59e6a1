package io.pactkit.core.generators;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Inputs available to generators.
 *
 * @param mockServerUrl       base URL of the running mock server, or {@code null}
 * @param providerStateParams parameters of the interaction's provider states, merged in order
 * @param random              source of randomness; pass a seeded instance for deterministic output
 */
public record GenerationContext(String mockServerUrl, Map<String, JsonNode> providerStateParams, Random random) {

    public GenerationContext {
        providerStateParams = providerStateParams == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(providerStateParams));
        random = random == null ? new Random() : random;
    }

    /** A context with no mock server URL, no provider state and an unseeded random source. */
    public static GenerationContext empty() {
        return new GenerationContext(null, Map.of(), new Random());
    }

    public GenerationContext withMockServerUrl(String url) {
        return new GenerationContext(url, providerStateParams, random);
    }

    public GenerationContext withProviderStateParams(Map<String, JsonNode> params) {
        return new GenerationContext(mockServerUrl, params, random);
    }

    public GenerationContext withRandom(Random newRandom) {
        return new GenerationContext(mockServerUrl, providerStateParams, newRandom);
    }
}

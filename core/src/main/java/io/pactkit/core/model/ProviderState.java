package io.pactkit.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named provider state with optional parameters.
 *
 * @param name   the state description, e.g. "a widget with id 10 exists"
 * @param params parameter values keyed by name, in insertion order
 */
public record ProviderState(String name, Map<String, JsonNode> params) {

    public ProviderState {
        Objects.requireNonNull(name, "name must not be null");
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static ProviderState of(String name) {
        return new ProviderState(name, Map.of());
    }

    /** Returns a copy with one more parameter. */
    public ProviderState withParam(String key, JsonNode value) {
        Map<String, JsonNode> next = new LinkedHashMap<>(params);
        next.put(key, value);
        return new ProviderState(name, next);
    }
}

package io.pactkit.core.generators;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Generators of a request, response or message, grouped by category ({@code body},
 * {@code header}, {@code query}, {@code path}, {@code status}, {@code metadata}) and then keyed by
 * path expression or name. Path and status use the empty key.
 *
 * <p>Thread-safe and immutable.
 */
public final class Generators {

    public static final Generators EMPTY = new Generators(Map.of());

    private final Map<String, Map<String, Generator>> categories;

    private Generators(Map<String, Map<String, Generator>> categories) {
        Map<String, Map<String, Generator>> copy = new LinkedHashMap<>();
        categories.forEach((k, v) -> copy.put(k, Collections.unmodifiableMap(new LinkedHashMap<>(v))));
        this.categories = Collections.unmodifiableMap(copy);
    }

    public static Generators of(Map<String, Map<String, Generator>> categories) {
        return new Generators(categories);
    }

    /** Generators of one category, or an empty map. */
    public Map<String, Generator> category(String name) {
        return categories.getOrDefault(name, Map.of());
    }

    public Map<String, Map<String, Generator>> categories() {
        return categories;
    }

    public boolean isEmpty() {
        return categories.values().stream().allMatch(Map::isEmpty);
    }

    /** Returns a copy with {@code generator} set at {@code key} of {@code category}. */
    public Generators with(String category, String key, Generator generator) {
        Map<String, Map<String, Generator>> next = new LinkedHashMap<>(categories);
        Map<String, Generator> inner = new LinkedHashMap<>(category(category));
        inner.put(key, generator);
        next.put(category, inner);
        return new Generators(next);
    }

    /** Returns a copy whose {@code category} holds exactly {@code byKey}. */
    public Generators withCategory(String category, Map<String, Generator> byKey) {
        Map<String, Map<String, Generator>> next = new LinkedHashMap<>(categories);
        next.put(category, new LinkedHashMap<>(byKey));
        return new Generators(next);
    }

    /** Returns a copy with every generator from {@code other} added, replacing on conflict. */
    public Generators merge(Generators other) {
        Generators result = this;
        for (Map.Entry<String, Map<String, Generator>> category : other.categories.entrySet()) {
            for (Map.Entry<String, Generator> entry : category.getValue().entrySet()) {
                result = result.with(category.getKey(), entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Generators other)) {
            return false;
        }
        return nonEmpty().equals(other.nonEmpty());
    }

    private Map<String, Map<String, Generator>> nonEmpty() {
        Map<String, Map<String, Generator>> result = new LinkedHashMap<>();
        categories.forEach((k, v) -> {
            if (!v.isEmpty()) {
                result.put(k, v);
            }
        });
        return result;
    }

    @Override
    public int hashCode() {
        return Objects.hash(nonEmpty());
    }

    @Override
    public String toString() {
        return "Generators" + categories;
    }
}

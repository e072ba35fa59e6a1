package io.pactkit.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Helpers for header and query maps of the form name to ordered values. */
public final class MultiValues {

    private MultiValues() {}

    /** Immutable deep copy that keeps key order. */
    public static Map<String, List<String>> copyOf(Map<String, List<String>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, v == null ? List.of() : List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Returns a copy with {@code value} stored at position {@code index} of {@code name}'s value
     * list, padding with empty strings when the index is past the end.
     */
    public static Map<String, List<String>> withValue(
            Map<String, List<String>> source, String name, int index, String value, boolean caseInsensitive) {
        Map<String, List<String>> copy = new LinkedHashMap<>(source);
        String key = caseInsensitive ? findKey(source, name).orElse(name) : name;
        List<String> values = new ArrayList<>(copy.getOrDefault(key, List.of()));
        while (values.size() <= index) {
            values.add("");
        }
        values.set(index, value);
        copy.put(key, values);
        return copyOf(copy);
    }

    /** Case-insensitive lookup of a header. */
    public static Optional<List<String>> getIgnoreCase(Map<String, List<String>> map, String name) {
        return findKey(map, name).map(map::get);
    }

    private static Optional<String> findKey(Map<String, List<String>> map, String name) {
        for (String key : map.keySet()) {
            if (key.equalsIgnoreCase(name)) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }
}

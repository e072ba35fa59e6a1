package io.pactkit.core.matchers;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * All matching rules of a request, response or message, grouped by category.
 *
 * <p>Thread-safe and immutable.
 */
public final class MatchingRules {

    public static final String BODY = "body";
    public static final String HEADER = "header";
    public static final String QUERY = "query";
    public static final String PATH = "path";
    public static final String STATUS = "status";
    public static final String METADATA = "metadata";

    public static final MatchingRules EMPTY = new MatchingRules(Map.of());

    private final Map<String, MatchingRuleCategory> categories;

    private MatchingRules(Map<String, MatchingRuleCategory> categories) {
        this.categories = Collections.unmodifiableMap(new LinkedHashMap<>(categories));
    }

    public static MatchingRules of(Map<String, MatchingRuleCategory> categories) {
        return new MatchingRules(categories);
    }

    /** The named category, or an empty one. */
    public MatchingRuleCategory category(String name) {
        MatchingRuleCategory category = categories.get(name);
        return category != null ? category : MatchingRuleCategory.empty(name);
    }

    public Map<String, MatchingRuleCategory> categories() {
        return categories;
    }

    public boolean isEmpty() {
        return categories.values().stream().allMatch(MatchingRuleCategory::isEmpty);
    }

    /** Returns a copy with {@code list} merged into {@code category} at {@code key}. */
    public MatchingRules with(String category, String key, RuleList list) {
        Map<String, MatchingRuleCategory> next = new LinkedHashMap<>(categories);
        next.put(category, category(category).with(key, list));
        return new MatchingRules(next);
    }

    /** Returns a copy with {@code replacement} in place of the category of the same name. */
    public MatchingRules withCategory(MatchingRuleCategory replacement) {
        Map<String, MatchingRuleCategory> next = new LinkedHashMap<>(categories);
        next.put(replacement.name(), replacement);
        return new MatchingRules(next);
    }

    /** Returns a copy with every rule in {@code other} merged in. */
    public MatchingRules merge(MatchingRules other) {
        Map<String, MatchingRuleCategory> next = new LinkedHashMap<>(categories);
        for (Map.Entry<String, MatchingRuleCategory> entry : other.categories.entrySet()) {
            next.put(entry.getKey(), category(entry.getKey()).merge(entry.getValue()));
        }
        return new MatchingRules(next);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof MatchingRules other)) {
            return false;
        }
        // empty categories are not significant
        return nonEmpty().equals(other.nonEmpty());
    }

    private Map<String, MatchingRuleCategory> nonEmpty() {
        Map<String, MatchingRuleCategory> result = new LinkedHashMap<>();
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
        return "MatchingRules" + categories.values();
    }
}

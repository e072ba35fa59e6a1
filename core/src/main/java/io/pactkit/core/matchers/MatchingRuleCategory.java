package io.pactkit.core.matchers;

import io.pactkit.core.model.DocPath;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The rules of one category ({@code body}, {@code header}, {@code query}, {@code path},
 * {@code status}, {@code metadata}) keyed by path expression or by name.
 *
 * <p>Body and metadata rules are keyed by path expressions such as {@code $.items[*].id}; header
 * and query rules by name; path and status rules by the empty key.
 *
 * <p>Thread-safe and immutable.
 */
public final class MatchingRuleCategory {

    /** Key used by the single-valued categories. */
    public static final String SINGLE_KEY = "";

    private final String name;
    private final Map<String, RuleList> rules;
    private final Map<String, DocPath> parsedPaths;

    private MatchingRuleCategory(String name, Map<String, RuleList> rules) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
        Map<String, DocPath> parsed = new LinkedHashMap<>();
        for (String key : rules.keySet()) {
            if (key.startsWith("$")) {
                parsed.put(key, DocPath.parse(key));
            }
        }
        this.parsedPaths = Collections.unmodifiableMap(parsed);
    }

    public static MatchingRuleCategory empty(String name) {
        return new MatchingRuleCategory(name, Map.of());
    }

    public static MatchingRuleCategory of(String name, Map<String, RuleList> rules) {
        return new MatchingRuleCategory(name, rules);
    }

    public String name() {
        return name;
    }

    /** All rule lists by key, in insertion order. */
    public Map<String, RuleList> rules() {
        return rules;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    /** Returns a copy with {@code list} merged into the rules at {@code key}. */
    public MatchingRuleCategory with(String key, RuleList list) {
        Map<String, RuleList> next = new LinkedHashMap<>(rules);
        next.merge(key, list, RuleList::merge);
        return new MatchingRuleCategory(name, next);
    }

    /** Returns a copy with every rule list from {@code other} merged in. */
    public MatchingRuleCategory merge(MatchingRuleCategory other) {
        MatchingRuleCategory result = this;
        for (Map.Entry<String, RuleList> entry : other.rules.entrySet()) {
            result = result.with(entry.getKey(), entry.getValue());
        }
        return result;
    }

    /**
     * Rules applying to a concrete document path. Among the path expressions matching the path,
     * the one with the highest weight wins, and on a tie the longer one. An expression matching only
     * a prefix of the path applies when its rules cascade (type-like rules).
     */
    public RuleList resolve(DocPath path) {
        RuleList best = RuleList.EMPTY;
        int bestWeight = 0;
        int bestLength = 0;
        for (Map.Entry<String, DocPath> entry : parsedPaths.entrySet()) {
            DocPath rulePath = entry.getValue();
            int weight = rulePath.weight(path);
            if (weight == 0) {
                continue;
            }
            RuleList list = rules.get(entry.getKey());
            if (rulePath.length() != path.length() && !list.cascades()) {
                continue;
            }
            if (weight > bestWeight || (weight == bestWeight && rulePath.length() > bestLength)) {
                best = list;
                bestWeight = weight;
                bestLength = rulePath.length();
            }
        }
        return best;
    }

    /** Rules for a named item, compared case-insensitively (headers) or exactly (query). */
    public RuleList forName(String itemName, boolean ignoreCase) {
        for (Map.Entry<String, RuleList> entry : rules.entrySet()) {
            String key = entry.getKey();
            if (ignoreCase ? key.equalsIgnoreCase(itemName) : key.equals(itemName)) {
                return entry.getValue();
            }
        }
        // tolerate "$.name" style keys written by older tools
        DocPath wanted = DocPath.root().field(itemName);
        for (Map.Entry<String, DocPath> entry : parsedPaths.entrySet()) {
            if (entry.getValue().matchesExactly(wanted)) {
                return rules.get(entry.getKey());
            }
        }
        return RuleList.EMPTY;
    }

    /** Rules of a single-valued category (path, status). */
    public RuleList single() {
        RuleList list = rules.get(SINGLE_KEY);
        if (list == null) {
            list = rules.get("$");
        }
        return list == null ? RuleList.EMPTY : list;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MatchingRuleCategory other && name.equals(other.name) && rules.equals(other.rules);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, rules);
    }

    @Override
    public String toString() {
        return "MatchingRuleCategory[" + name + "=" + rules + "]";
    }
}

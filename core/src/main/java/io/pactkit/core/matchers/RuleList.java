package io.pactkit.core.matchers;

import java.util.ArrayList;
import java.util.List;

/**
 * The rules attached to one path, with their combination logic.
 *
 * @param rules the rules, in order
 * @param logic AND (every rule must match) or OR (one is enough)
 */
public record RuleList(List<MatchingRule> rules, RuleLogic logic) {

    public static final RuleList EMPTY = new RuleList(List.of(), RuleLogic.AND);

    public RuleList {
        rules = rules == null ? List.of() : List.copyOf(rules);
        logic = logic == null ? RuleLogic.AND : logic;
    }

    public static RuleList of(MatchingRule... rules) {
        return new RuleList(List.of(rules), RuleLogic.AND);
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    /** True if every rule is type-like and therefore applies to descendants as well. */
    public boolean cascades() {
        return !rules.isEmpty() && rules.stream().allMatch(MatchingRule::cascades);
    }

    /** Returns a list with {@code other}'s rules appended, skipping duplicates. */
    public RuleList merge(RuleList other) {
        List<MatchingRule> merged = new ArrayList<>(rules);
        for (MatchingRule rule : other.rules) {
            if (!merged.contains(rule)) {
                merged.add(rule);
            }
        }
        return new RuleList(merged, logic);
    }
}

package io.pactkit.core.matchers;

/** How the rules in a {@link RuleList} combine. */
public enum RuleLogic {
    AND,
    OR
}

package io.pactkit.core.matchers;

import java.util.List;
import java.util.Objects;

/** Outcome of applying rules to a value: matched, or the list of every difference found. */
public sealed interface MatchResult {

    MatchResult MATCHED = new Matched();

    boolean matched();

    /** The differences; empty when matched. */
    List<Mismatch.BodyMismatch> mismatches();

    static MatchResult of(List<Mismatch.BodyMismatch> mismatches) {
        return mismatches.isEmpty() ? MATCHED : new Mismatched(mismatches);
    }

    record Matched() implements MatchResult {
        @Override
        public boolean matched() {
            return true;
        }

        @Override
        public List<Mismatch.BodyMismatch> mismatches() {
            return List.of();
        }
    }

    record Mismatched(List<Mismatch.BodyMismatch> mismatches) implements MatchResult {
        public Mismatched {
            Objects.requireNonNull(mismatches, "mismatches must not be null");
            if (mismatches.isEmpty()) {
                throw new IllegalArgumentException("Mismatched requires at least one mismatch");
            }
            mismatches = List.copyOf(mismatches);
        }

        @Override
        public boolean matched() {
            return false;
        }
    }
}

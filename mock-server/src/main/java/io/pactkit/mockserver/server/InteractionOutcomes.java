package io.pactkit.mockserver.server;

import io.pactkit.core.model.Interaction;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Outcome table of a running mock server: one append-only list per
 * interaction plus a list for requests that could not be attributed to any
 * interaction (a pact without interactions).
 *
 * <p>
 * Appends to one interaction are serialised; readers never block and see a
 * consistent snapshot of each list.
 */
final class InteractionOutcomes {

    private final List<Interaction> interactions;
    private final List<CopyOnWriteArrayList<MatchOutcome>> byInteraction;
    private final CopyOnWriteArrayList<MatchOutcome> unattributed = new CopyOnWriteArrayList<>();

    InteractionOutcomes(List<Interaction> interactions) {
        this.interactions = List.copyOf(interactions);
        this.byInteraction = new ArrayList<>(interactions.size());
        for (int i = 0; i < interactions.size(); i++) {
            byInteraction.add(new CopyOnWriteArrayList<>());
        }
    }

    void record(int index, MatchOutcome outcome) {
        if (index < 0) {
            unattributed.add(outcome);
        } else {
            byInteraction.get(index).add(outcome);
        }
    }

    /** Snapshot of the outcomes recorded for interaction {@code index}. */
    List<MatchOutcome> outcomes(int index) {
        return List.copyOf(byInteraction.get(index));
    }

    boolean isEmpty() {
        return unattributed.isEmpty() && byInteraction.stream().allMatch(List::isEmpty);
    }

    /**
     * True iff every interaction was matched at least once, no interaction
     * recorded a failure, and no request went unattributed.
     */
    boolean allMatched() {
        if (!unattributed.isEmpty()) {
            return false;
        }
        for (List<MatchOutcome> outcomes : byInteraction) {
            List<MatchOutcome> snapshot = List.copyOf(outcomes);
            if (snapshot.isEmpty() || !snapshot.stream().allMatch(MatchOutcome::matched)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Every failure in interaction order: recorded mismatches, then a
     * {@code missing-request} for each interaction with no outcome at all,
     * then unattributed requests.
     */
    List<MatchOutcome> failures() {
        List<MatchOutcome> failures = new ArrayList<>();
        for (int i = 0; i < interactions.size(); i++) {
            List<MatchOutcome> snapshot = List.copyOf(byInteraction.get(i));
            if (snapshot.isEmpty()) {
                Interaction interaction = interactions.get(i);
                failures.add(new MatchOutcome.MissingRequest(
                        interaction.description(),
                        interaction.request().method(),
                        interaction.request().path()));
                continue;
            }
            snapshot.stream().filter(o -> !o.matched()).forEach(failures::add);
        }
        failures.addAll(unattributed);
        return failures;
    }
}

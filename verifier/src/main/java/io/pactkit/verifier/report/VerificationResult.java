package io.pactkit.verifier.report;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * Outcome of one interaction, with where it came from.
 *
 * @param origin      file or URL of the pact
 * @param consumer    consumer that recorded the interaction
 * @param interaction interaction or message description
 * @param pending     a pending interaction is reported but does not fail the run
 * @param outcome     what happened
 */
public record VerificationResult(
        String origin, String consumer, String interaction, boolean pending, InteractionOutcome outcome) {

    public VerificationResult {
        Objects.requireNonNull(outcome, "outcome must not be null");
    }

    /** True if this result should make the run fail. */
    public boolean failsRun() {
        return !outcome.passed() && !pending;
    }

    public ObjectNode toJson() {
        ObjectNode node = outcome.toJson();
        node.put("origin", origin);
        node.put("consumer", consumer);
        node.put("interaction", interaction);
        node.put("pending", pending);
        return node;
    }
}

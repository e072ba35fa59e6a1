package io.pactkit.verifier.report;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pactkit.core.model.JsonValues;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Results of a verification run. Sources verified in parallel append
 * concurrently; nothing is lost or duplicated, and readers get a sorted copy.
 */
public final class VerificationReport {

    private static final Comparator<VerificationResult> DISPLAY_ORDER = Comparator
            .comparing(VerificationResult::origin, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(VerificationResult::interaction, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final Queue<VerificationResult> results = new ConcurrentLinkedQueue<>();
    private final Queue<String> sourceErrors = new ConcurrentLinkedQueue<>();

    public void record(VerificationResult result) {
        results.add(result);
    }

    /** A source that could not be loaded at all. */
    public void recordSourceError(String message) {
        sourceErrors.add(message);
    }

    /** All results, ordered by origin then interaction description. */
    public List<VerificationResult> results() {
        List<VerificationResult> copy = new ArrayList<>(results);
        copy.sort(DISPLAY_ORDER);
        return copy;
    }

    /** Results that did not pass, pending ones included. */
    public List<VerificationResult> failures() {
        List<VerificationResult> failures = new ArrayList<>();
        for (VerificationResult result : results()) {
            if (!result.outcome().passed()) {
                failures.add(result);
            }
        }
        return failures;
    }

    public List<String> sourceErrors() {
        List<String> copy = new ArrayList<>(sourceErrors);
        copy.sort(Comparator.naturalOrder());
        return copy;
    }

    /** True iff every source loaded and every non-pending interaction passed. */
    public boolean success() {
        return sourceErrors.isEmpty() && results.stream().noneMatch(VerificationResult::failsRun);
    }

    /** One line per failure plus totals, for logs and the console. */
    public String summary() {
        StringBuilder out = new StringBuilder();
        List<VerificationResult> all = results();
        long passed = all.stream().filter(r -> r.outcome().passed()).count();
        out.append(String.format("%d interaction(s), %d passed, %d failed", all.size(), passed, all.size() - passed));
        for (VerificationResult failure : failures()) {
            out.append(System.lineSeparator())
                    .append("  ")
                    .append(failure.pending() ? "[pending] " : "")
                    .append(failure.consumer())
                    .append(": ")
                    .append(failure.interaction())
                    .append(" -> ")
                    .append(failure.outcome().status());
            if (failure.outcome() instanceof InteractionOutcome.Failed failed) {
                failed.mismatches().forEach(m -> out.append(System.lineSeparator()).append("      ").append(m.description()));
            } else if (failure.outcome() instanceof InteractionOutcome.ProviderError error) {
                out.append(" (").append(error.message()).append(')');
            }
        }
        for (String error : sourceErrors()) {
            out.append(System.lineSeparator()).append("  source error: ").append(error);
        }
        return out.toString();
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        node.put("success", success());
        ArrayNode array = node.putArray("results");
        results().forEach(r -> array.add(r.toJson()));
        ArrayNode errors = node.putArray("sourceErrors");
        sourceErrors().forEach(errors::add);
        return node;
    }
}

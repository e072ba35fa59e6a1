package io.pactkit.verifier.report;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pactkit.core.matchers.Mismatch;
import io.pactkit.core.model.JsonValues;
import java.util.List;

/** What happened when one interaction was replayed against the provider. */
public sealed interface InteractionOutcome {

    /** {@code passed}, {@code failed} or {@code provider-error}. */
    String status();

    default boolean passed() {
        return false;
    }

    ObjectNode toJson();

    /** The provider's response matched. */
    record Passed() implements InteractionOutcome {
        @Override
        public String status() {
            return "passed";
        }

        @Override
        public boolean passed() {
            return true;
        }

        @Override
        public ObjectNode toJson() {
            return JsonValues.MAPPER.createObjectNode().put("status", status());
        }
    }

    /** The provider answered, but not as recorded. Every mismatch found is listed. */
    record Failed(List<Mismatch> mismatches) implements InteractionOutcome {
        public Failed {
            mismatches = List.copyOf(mismatches);
        }

        @Override
        public String status() {
            return "failed";
        }

        @Override
        public ObjectNode toJson() {
            ObjectNode node = JsonValues.MAPPER.createObjectNode().put("status", status());
            ArrayNode array = node.putArray("mismatches");
            mismatches.forEach(m -> array.add(m.toJson()));
            return node;
        }
    }

    /**
     * The provider could not be asked: connection refused, timeout, or a
     * failed provider-state change.
     *
     * @param kind    exception type that caused it, e.g. {@code ProviderConnectException}
     * @param message the failure message
     */
    record ProviderError(String kind, String message) implements InteractionOutcome {
        @Override
        public String status() {
            return "provider-error";
        }

        @Override
        public ObjectNode toJson() {
            return JsonValues.MAPPER.createObjectNode()
                    .put("status", status())
                    .put("kind", kind)
                    .put("message", message);
        }
    }
}

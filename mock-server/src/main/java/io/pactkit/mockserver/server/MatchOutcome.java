package io.pactkit.mockserver.server;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pactkit.core.matchers.Mismatch;
import io.pactkit.core.model.JsonValues;
import java.util.List;

/**
 * What happened to one request received by a mock server, or to one
 * interaction that never saw a request.
 *
 * <p>
 * Only {@link RequestMatch} is a success. The other variants are what
 * {@code mismatches()} reports, each with the interaction it was attributed
 * to.
 */
public sealed interface MatchOutcome {

    /** Discriminator written as {@code type} in JSON. */
    String type();

    /** Description of the interaction the outcome belongs to, or {@code null}. */
    String interaction();

    String method();

    String path();

    default boolean matched() {
        return false;
    }

    /** JSON form: {@code type}, {@code method}, {@code path}, {@code interaction}, {@code mismatches}. */
    default ObjectNode toJson() {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        node.put("type", type());
        node.put("method", method());
        node.put("path", path());
        node.put("interaction", interaction());
        ArrayNode details = node.putArray("mismatches");
        for (Mismatch mismatch : mismatches()) {
            details.add(mismatch.toJson());
        }
        return node;
    }

    /** Differences that caused the outcome; empty for a match or a missing request. */
    default List<Mismatch> mismatches() {
        return List.of();
    }

    /**
     * The request satisfied an interaction.
     *
     * @param ambiguousWith descriptions of later interactions that matched as well
     */
    record RequestMatch(String interaction, String method, String path, List<String> ambiguousWith)
            implements MatchOutcome {

        public RequestMatch {
            ambiguousWith = List.copyOf(ambiguousWith);
        }

        @Override
        public String type() {
            return "request-match";
        }

        @Override
        public boolean matched() {
            return true;
        }
    }

    /** Method and path matched an interaction, but something else differed. */
    record RequestMismatch(String interaction, String method, String path, List<Mismatch> mismatches)
            implements MatchOutcome {

        public RequestMismatch {
            mismatches = List.copyOf(mismatches);
        }

        @Override
        public String type() {
            return "request-mismatch";
        }
    }

    /** No interaction had the request's method and path; attributed to the closest one, if any. */
    record RequestNotFound(String interaction, String method, String path, List<Mismatch> mismatches)
            implements MatchOutcome {

        public RequestNotFound {
            mismatches = List.copyOf(mismatches);
        }

        @Override
        public String type() {
            return "request-not-found";
        }
    }

    /** An interaction that never received a request. Method and path are the expected ones. */
    record MissingRequest(String interaction, String method, String path) implements MatchOutcome {
        @Override
        public String type() {
            return "missing-request";
        }
    }
}

package io.pactkit.mockserver.server;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pactkit.core.matchers.Mismatch;
import io.pactkit.core.model.JsonValues;

/**
 * Builds the RFC 9457 problem-detail bodies a mock server answers with when
 * it cannot replay an interaction.
 *
 * <pre>{@code
 * {
 *   "type": "urn:pact-kit:mock-server:request-not-found",
 *   "title": "Request Not Found",
 *   "status": 500,
 *   "detail": "No interaction matched GET /gadgets",
 *   "instance": "/gadgets",
 *   "interaction": "a request for widgets",
 *   "mismatches": [ { "type": "PathMismatch", ... } ]
 * }
 * }</pre>
 *
 * <p>
 * Thread-safe: all methods are stateless.
 */
public final class DiagnosticResponse {

    public static final String CONTENT_TYPE = "application/problem+json";

    static final String URN_REQUEST_MISMATCH = "urn:pact-kit:mock-server:request-mismatch";
    static final String URN_REQUEST_NOT_FOUND = "urn:pact-kit:mock-server:request-not-found";
    static final String URN_SHUTTING_DOWN = "urn:pact-kit:mock-server:shutting-down";
    static final String URN_INTERNAL_ERROR = "urn:pact-kit:mock-server:internal-error";

    private DiagnosticResponse() {
        // utility class
    }

    /**
     * A request no interaction accepted, with the mismatches against the
     * interaction it was attributed to.
     */
    public static ObjectNode unmatched(MatchOutcome outcome, String instancePath) {
        boolean samePath = outcome instanceof MatchOutcome.RequestMismatch;
        String detail = samePath
                ? String.format(
                        "Request %s %s did not match interaction '%s'",
                        outcome.method(), outcome.path(), outcome.interaction())
                : String.format("No interaction matched %s %s", outcome.method(), outcome.path());
        ObjectNode node = build(
                samePath ? URN_REQUEST_MISMATCH : URN_REQUEST_NOT_FOUND,
                samePath ? "Request Mismatch" : "Request Not Found",
                500,
                detail,
                instancePath);
        node.put("interaction", outcome.interaction());
        ArrayNode mismatches = node.putArray("mismatches");
        for (Mismatch mismatch : outcome.mismatches()) {
            mismatches.add(mismatch.toJson());
        }
        return node;
    }

    /** The server is draining and accepts no new requests. */
    public static ObjectNode shuttingDown(String instancePath) {
        return build(URN_SHUTTING_DOWN, "Service Unavailable", 503, "Mock server is shutting down", instancePath);
    }

    /** Unexpected failure while handling a request. */
    public static ObjectNode internalError(String detail, String instancePath) {
        return build(URN_INTERNAL_ERROR, "Internal Server Error", 500, detail, instancePath);
    }

    static ObjectNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }
}

package io.pactkit.mockserver.server;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pactkit.core.matchers.Mismatch;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DiagnosticResponseTest {

    @Test
    @DisplayName("a not-found request names the closest interaction and its mismatches")
    void notFound() {
        MatchOutcome outcome = new MatchOutcome.RequestNotFound(
                "a request for widgets", "GET", "/gadgets",
                List.of(new Mismatch.PathMismatch("/widgets", "/gadgets", "Expected path /widgets but was /gadgets")));

        ObjectNode problem = DiagnosticResponse.unmatched(outcome, "/gadgets");

        assertThat(problem.get("type").asText()).isEqualTo("urn:pact-kit:mock-server:request-not-found");
        assertThat(problem.get("title").asText()).isEqualTo("Request Not Found");
        assertThat(problem.get("status").asInt()).isEqualTo(500);
        assertThat(problem.get("detail").asText()).isEqualTo("No interaction matched GET /gadgets");
        assertThat(problem.get("instance").asText()).isEqualTo("/gadgets");
        assertThat(problem.get("interaction").asText()).isEqualTo("a request for widgets");
        assertThat(problem.get("mismatches")).hasSize(1);
    }

    @Test
    @DisplayName("a request-mismatch says which interaction it failed")
    void mismatch() {
        MatchOutcome outcome = new MatchOutcome.RequestMismatch("second page", "GET", "/widgets", List.of());

        ObjectNode problem = DiagnosticResponse.unmatched(outcome, "/widgets");

        assertThat(problem.get("type").asText()).isEqualTo("urn:pact-kit:mock-server:request-mismatch");
        assertThat(problem.get("detail").asText())
                .isEqualTo("Request GET /widgets did not match interaction 'second page'");
    }

    @Test
    void shuttingDown() {
        ObjectNode problem = DiagnosticResponse.shuttingDown("/widgets");

        assertThat(problem.get("status").asInt()).isEqualTo(503);
        assertThat(problem.get("type").asText()).isEqualTo("urn:pact-kit:mock-server:shutting-down");
    }
}

package io.pactkit.verifier.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.pactkit.verifier.ProviderStub;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("HttpPactFetcher")
class HttpPactFetcherTest {

    private ProviderStub server;
    private final HttpPactFetcher fetcher = new HttpPactFetcher(Duration.ofSeconds(5));

    @BeforeEach
    void start() throws IOException {
        server = new ProviderStub();
    }

    @AfterEach
    void stop() {
        server.close();
    }

    private URI uri(String path) {
        return URI.create(server.url() + path);
    }

    @Test
    @DisplayName("parses the document and sends HAL accept and credentials")
    void fetches() throws Exception {
        server.respond("/pact", 200, "application/hal+json", "{\"consumer\":{\"name\":\"web\"}}");

        JsonNode document = fetcher.fetch(uri("/pact"), Credentials.basic("user", "pass"));

        assertThat(document.path("consumer").path("name").asText()).isEqualTo("web");
        ProviderStub.Received received = server.received().get(0);
        assertThat(received.headers().getFirst("Accept")).contains("application/hal+json");
        assertThat(received.headers().getFirst("Authorization")).isEqualTo("Basic dXNlcjpwYXNz");
    }

    @ParameterizedTest(name = "status {0}")
    @CsvSource({"404, Resource not found", "401, Not authorized", "403, Not authorized", "500, failed with status 500"})
    void errorStatuses(int status, String message) {
        server.respond("/pact", status, "text/plain", "nope");

        assertThatThrownBy(() -> fetcher.fetch(uri("/pact"), Credentials.NONE))
                .isInstanceOf(PactSourceException.class)
                .hasMessageContaining(message);
    }

    @Test
    void notJson() {
        server.respond("/pact", 200, "text/html", "<html></html>");

        assertThatThrownBy(() -> fetcher.fetch(uri("/pact"), Credentials.NONE))
                .isInstanceOf(PactSourceException.class)
                .hasMessageContaining("is not JSON");
    }
}

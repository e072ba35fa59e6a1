package io.pactkit.mockserver;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.pactkit.core.api.InteractionPart;
import io.pactkit.core.api.PactHandles;
import io.pactkit.core.model.JsonValues;
import io.pactkit.mockserver.config.MockServerConfig;
import io.pactkit.mockserver.server.MockServerManager;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("MockServerApi")
class MockServerApiTest {

    private static final String WIDGETS_PACT = """
            {
              "consumer": {"name": "web"},
              "provider": {"name": "widgets"},
              "interactions": [
                {
                  "description": "a request for widgets",
                  "request": {"method": "GET", "path": "/widgets"},
                  "response": {"status": 200, "headers": {"Content-Type": "application/json"}, "body": {"id": 1}}
                }
              ],
              "metadata": {"pactSpecification": {"version": "3.0.0"}}
            }
            """;

    @TempDir
    Path tempDir;

    private final PactHandles handles = new PactHandles();
    private final MockServerManager manager = new MockServerManager();
    private final HttpClient client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    private MockServerApi api;

    @AfterEach
    void shutdown() {
        manager.shutdownAll();
    }

    private MockServerApi api() {
        if (api == null) {
            api = new MockServerApi(handles, manager,
                    MockServerConfig.builder().pactDir(tempDir.resolve("pacts").toString()).build());
        }
        return api;
    }

    private HttpResponse<String> get(int port, String path) throws IOException, InterruptedException {
        return client.send(
                HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + path))
                        .timeout(Duration.ofSeconds(10))
                        .GET()
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    @Nested
    @DisplayName("creation codes")
    class CreationCodes {

        @Test
        void nullArgument() {
            assertThat(api().createMockServer(null, "127.0.0.1:0", false)).isEqualTo(MockServerApi.NULL_ARGUMENT);
            assertThat(api().createMockServer(WIDGETS_PACT, null, false)).isEqualTo(MockServerApi.NULL_ARGUMENT);
            assertThat(PactHandles.lastError()).isNotBlank();
        }

        @Test
        void unknownHandle() {
            assertThat(api().createMockServerForPact(999, "127.0.0.1:0", false))
                    .isEqualTo(MockServerApi.NULL_ARGUMENT);
        }

        @Test
        void invalidPact() {
            assertThat(api().createMockServer("{not json", "127.0.0.1:0", false))
                    .isEqualTo(MockServerApi.INVALID_PACT);
            assertThat(PactHandles.lastError()).contains("not valid JSON");
        }

        @ParameterizedTest
        @ValueSource(strings = {"localhost", "127.0.0.1:", ":8080", "127.0.0.1:http", "127.0.0.1:70000"})
        void invalidAddress(String address) {
            assertThat(api().createMockServer(WIDGETS_PACT, address, false))
                    .isEqualTo(MockServerApi.INVALID_ADDRESS);
        }

        @Test
        @DisplayName("TLS without a keystore")
        void tlsFailure() {
            assertThat(api().createMockServer(WIDGETS_PACT, "127.0.0.1:0", true))
                    .isEqualTo(MockServerApi.TLS_FAILURE);
        }

        @Test
        @DisplayName("an occupied port")
        void bindFailure() throws IOException {
            try (ServerSocket occupied = new ServerSocket(0, 50, InetAddress.getByName("127.0.0.1"))) {
                assertThat(api().createMockServer(WIDGETS_PACT, "127.0.0.1:" + occupied.getLocalPort(), false))
                        .isEqualTo(MockServerApi.START_FAILED);
            }
        }
    }

    @Nested
    @DisplayName("matching by port")
    class MatchingByPort {

        @Test
        @DisplayName("a matching request makes the server matched with no mismatches")
        void fullPass() throws Exception {
            int port = api().createMockServer(WIDGETS_PACT, "127.0.0.1:0", false);
            assertThat(port).isPositive();
            assertThat(api().mockServerMatched(port)).isFalse();

            assertThat(get(port, "/widgets").statusCode()).isEqualTo(200);

            assertThat(api().mockServerMatched(port)).isTrue();
            assertThat(JsonValues.parse(api().mockServerMismatches(port))).isEmpty();
        }

        @Test
        @DisplayName("an unregistered path leaves exactly one mismatch entry")
        void mismatchAccumulation() throws Exception {
            int port = api().createMockServer(WIDGETS_PACT, "127.0.0.1:0", false);

            get(port, "/gadgets");

            assertThat(api().mockServerMatched(port)).isFalse();
            JsonNode mismatches = JsonValues.parse(api().mockServerMismatches(port));
            assertThat(mismatches).hasSize(1);
            JsonNode entry = mismatches.get(0);
            assertThat(entry.get("type").asText()).isEqualTo("request-not-found");
            assertThat(entry.get("interaction").asText()).isEqualTo("a request for widgets");
            assertThat(entry.get("path").asText()).isEqualTo("/gadgets");
            assertThat(entry.get("mismatches").get(0).get("type").asText()).isEqualTo("PathMismatch");
        }

        @Test
        @DisplayName("unknown ports are never matched and have no mismatch list")
        void unknownPort() {
            assertThat(api().mockServerMatched(1)).isFalse();
            assertThat(api().mockServerMismatches(1)).isNull();
            assertThat(PactHandles.lastError()).contains("No mock server");
        }

        @Test
        @DisplayName("cleanup succeeds once")
        void cleanup() {
            int port = api().createMockServer(WIDGETS_PACT, "127.0.0.1:0", false);

            assertThat(api().cleanupMockServer(port)).isTrue();
            assertThat(api().cleanupMockServer(port)).isFalse();
            assertThat(api().mockServerMatched(port)).isFalse();
        }
    }

    @Nested
    @DisplayName("servers built from handles")
    class FromHandles {

        private int widgetsInteraction(int pact) {
            int interaction = handles.newInteraction(pact, "a request for widgets");
            handles.withRequest(interaction, "GET", "/widgets");
            handles.responseStatus(interaction, 200);
            handles.withBody(interaction, InteractionPart.RESPONSE, "application/json", "{\"id\":1}");
            return interaction;
        }

        @Test
        @DisplayName("starting a server freezes the pact so later edits are refused")
        void freezesHandle() throws Exception {
            int pact = handles.newPact("web", "widgets");
            int interaction = widgetsInteraction(pact);

            int port = api().createMockServerForPact(pact, "127.0.0.1:0", false);
            assertThat(port).isPositive();

            assertThat(handles.isFrozen(pact)).isTrue();
            assertThat(handles.withBody(interaction, InteractionPart.RESPONSE, "application/json", "{\"id\":2}"))
                    .isFalse();
            assertThat(handles.newInteraction(pact, "another")).isZero();

            HttpResponse<String> response = get(port, "/widgets");
            assertThat(JsonValues.parse(response.body())).isEqualTo(JsonValues.parse("{\"id\":1}"));
            assertThat(api().mockServerMatched(port)).isTrue();
        }

        @Test
        @DisplayName("a failed start leaves the pact editable")
        void failedStartDoesNotFreeze() {
            int pact = handles.newPact("web", "widgets");
            int interaction = widgetsInteraction(pact);

            assertThat(api().createMockServerForPact(pact, "no-port-here", false))
                    .isEqualTo(MockServerApi.INVALID_ADDRESS);

            assertThat(handles.isFrozen(pact)).isFalse();
            assertThat(handles.withBody(interaction, InteractionPart.RESPONSE, "application/json", "{\"id\":2}"))
                    .isTrue();
            assertThat(handles.newInteraction(pact, "another")).isPositive();

            int port = api().createMockServerForPact(pact, "127.0.0.1:0", false);
            assertThat(port).isPositive();
            assertThat(handles.isFrozen(pact)).isTrue();
        }
    }

    @Nested
    @DisplayName("writing pact files")
    class Writing {

        @Test
        @DisplayName("a null directory writes to the configured pact directory")
        void defaultDirectory() {
            int port = api().createMockServer(WIDGETS_PACT, "127.0.0.1:0", false);

            assertThat(api().writePactFile(port, null, false)).isEqualTo(MockServerApi.WRITE_OK);

            Path written = tempDir.resolve("pacts").resolve("web-widgets.json");
            assertThat(written).exists();
            assertThat(JsonValues.parse(readString(written)).get("interactions")).hasSize(1);
        }

        @Test
        void noSuchServer() {
            assertThat(api().writePactFile(1, tempDir.toString(), false))
                    .isEqualTo(MockServerApi.WRITE_NO_SUCH_SERVER);
        }

        @Test
        @DisplayName("a conflicting interaction in the existing file is an IO error code")
        void mergeConflict() throws IOException {
            Files.writeString(tempDir.resolve("web-widgets.json"),
                    WIDGETS_PACT.replace("\"status\": 200", "\"status\": 404"));
            int port = api().createMockServer(WIDGETS_PACT, "127.0.0.1:0", false);

            assertThat(api().writePactFile(port, tempDir.toString(), false))
                    .isEqualTo(MockServerApi.WRITE_IO_ERROR);
            assertThat(PactHandles.lastError()).contains("a request for widgets");

            assertThat(api().writePactFile(port, tempDir.toString(), true)).isEqualTo(MockServerApi.WRITE_OK);
        }
    }

    private static String readString(Path file) {
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}

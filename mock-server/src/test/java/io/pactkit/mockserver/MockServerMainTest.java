package io.pactkit.mockserver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pactkit.core.error.InvalidPactException;
import io.pactkit.mockserver.server.MockServer;
import io.pactkit.mockserver.server.MockServerManager;
import io.pactkit.mockserver.server.MockServerState;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MockServerMainTest {

    @TempDir
    Path tempDir;

    private MockServer server;

    @AfterEach
    void stop() {
        if (server != null) {
            MockServerManager.shared().shutdown(server.port());
        }
    }

    private Path config() throws IOException {
        return Files.writeString(tempDir.resolve("mock.yaml"), """
                server:
                  port: 0
                logging:
                  level: WARN
                """);
    }

    @Test
    @DisplayName("starts a registered server for the pact file on an ephemeral port")
    void startsFromArguments() throws IOException {
        Path pact = Files.writeString(tempDir.resolve("web-widgets.json"), """
                {
                  "consumer": {"name": "web"},
                  "provider": {"name": "widgets"},
                  "interactions": [
                    {"description": "ping", "request": {"method": "GET", "path": "/ping"}, "response": {"status": 204}}
                  ],
                  "metadata": {"pactSpecification": {"version": "3.0.0"}}
                }
                """);

        server = MockServerMain.start(new String[] {"--pact", pact.toString(), "--config", config().toString()});

        assertThat(server.state()).isEqualTo(MockServerState.RUNNING);
        assertThat(MockServerManager.shared().find(server.port())).contains(server);
        assertThat(server.pact().provider()).isEqualTo("widgets");
    }

    @Test
    @DisplayName("--pact is required")
    void pactRequired() {
        assertThatThrownBy(() -> MockServerMain.start(new String[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--pact");
    }

    @Test
    @DisplayName("an unreadable pact file fails startup")
    void missingPact() throws IOException {
        String[] args = {"--pact", tempDir.resolve("absent.json").toString(), "--config", config().toString()};

        assertThatThrownBy(() -> MockServerMain.start(args)).isInstanceOf(InvalidPactException.class);
    }
}

package io.pactkit.verifier;

import static org.assertj.core.api.Assertions.assertThat;

import io.pactkit.core.error.LastError;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("VerifierApi")
class VerifierApiTest {

    private static final String PACT = """
            {
              "consumer": {"name": "web"},
              "provider": {"name": "widgets"},
              "interactions": [
                {
                  "description": "a request for widgets",
                  "request": {"method": "GET", "path": "/widgets"},
                  "response": {"status": 200, "body": {"id": 1}}
                }
              ],
              "metadata": {"pactSpecification": {"version": "3.0.0"}}
            }
            """;

    @TempDir
    Path tempDir;

    private ProviderStub provider;
    private Path pact;

    @BeforeEach
    void setUp() throws IOException {
        provider = new ProviderStub();
        pact = Files.writeString(tempDir.resolve("web-widgets.json"), PACT);
        LastError.clear();
    }

    @AfterEach
    void tearDown() {
        provider.close();
    }

    private String args(String... extra) {
        return String.join("\n", "--file", pact.toString(), "--hostname", "127.0.0.1",
                        "--port", String.valueOf(provider.port()))
                + "\n" + String.join("\n", extra);
    }

    @Test
    void nullArguments() {
        assertThat(VerifierApi.verify(null)).isEqualTo(VerifierCommand.EXIT_NULL_ARGUMENT);
        assertThat(LastError.get()).isNotBlank();
    }

    @Test
    @DisplayName("a provider that honours the pact exits 0")
    void success() {
        provider.respond("/widgets", 200, "application/json", "{\"id\":1}");

        assertThat(VerifierApi.verify(args())).isEqualTo(VerifierCommand.EXIT_OK);
    }

    @Test
    @DisplayName("verification failures exit 1 and write the JSON report")
    void failures() throws IOException {
        provider.respond("/widgets", 200, "application/json", "{\"id\":2}");
        Path report = tempDir.resolve("out/report.json");

        assertThat(VerifierApi.verify(args("--json", report.toString()))).isEqualTo(VerifierCommand.EXIT_FAILURES);

        assertThat(LastError.get()).contains("failures");
        assertThat(Files.readString(report)).contains("\"success\" : false");
    }

    @Test
    @DisplayName("blank lines and surrounding whitespace are ignored")
    void blankLines() {
        provider.respond("/widgets", 200, "application/json", "{\"id\":1}");

        assertThat(VerifierApi.verify("\n  " + args().replace("\n", "\n\n") + "  \n"))
                .isEqualTo(VerifierCommand.EXIT_OK);
    }

    @Test
    void help() {
        assertThat(VerifierApi.verify("--help")).isEqualTo(VerifierCommand.EXIT_OK);
    }

    @ParameterizedTest(name = "[{index}] {0}")
    @ValueSource(strings = {
        "--no-such-option",
        "",
        "--port\n70000\n--file\nx.json",
        "--port\nabc\n--file\nx.json",
        "--broker-url\nhttp://broker.example\n",
        "--file\nx.json\n--filter-description\n[unclosed",
        "--file\nx.json\n--filter-state\nx\n--filter-no-state",
        "--file\nx.json\n--parallel\n0"
    })
    @DisplayName("invalid arguments exit 4")
    void invalidArguments(String arguments) {
        assertThat(VerifierApi.verify(arguments)).isEqualTo(VerifierCommand.EXIT_INVALID_ARGUMENTS);
        assertThat(LastError.get()).isNotBlank();
    }
}

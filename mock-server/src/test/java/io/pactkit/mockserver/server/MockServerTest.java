package io.pactkit.mockserver.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.pactkit.core.error.MockServerBindException;
import io.pactkit.core.matchers.Mismatch;
import io.pactkit.core.model.JsonValues;
import io.pactkit.mockserver.config.MockServerConfig;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MockServer")
class MockServerTest {

    private static final String CREATE_PACT = """
            {
              "consumer": {"name": "web"},
              "provider": {"name": "widgets"},
              "interactions": [
                {
                  "description": "create a widget",
                  "request": {
                    "method": "POST",
                    "path": "/widgets",
                    "headers": {"Content-Type": "application/json"},
                    "body": {"id": 1}
                  },
                  "response": {"status": 201}
                }
              ],
              "metadata": {"pactSpecification": {"version": "3.0.0"}}
            }
            """;

    @Nested
    @DisplayName("matching")
    class Matching extends MockServerTestHarness {

        @Test
        @DisplayName("a matching request gets the registered response and the server is matched")
        void fullPass() throws Exception {
            start(WIDGETS_PACT);

            HttpResponse<String> response = get("/widgets");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                    ct -> assertThat(ct).startsWith("application/json"));
            assertThat(JsonValues.parse(response.body())).isEqualTo(JsonValues.parse("{\"id\":1}"));
            assertThat(server.matched()).isTrue();
            assertThat(server.mismatches()).isEmpty();
            assertThat(server.state()).isEqualTo(MockServerState.MATCHED);
        }

        @Test
        @DisplayName("before any request the interaction is reported as missing")
        void nothingReceived() {
            start(WIDGETS_PACT);

            assertThat(server.matched()).isFalse();
            assertThat(server.state()).isEqualTo(MockServerState.RUNNING);
            assertThat(server.mismatches())
                    .singleElement()
                    .satisfies(outcome -> {
                        assertThat(outcome.type()).isEqualTo("missing-request");
                        assertThat(outcome.interaction()).isEqualTo("a request for widgets");
                    });
        }

        @Test
        @DisplayName("an unregistered path yields one mismatch against the closest interaction")
        void unknownPath() throws Exception {
            start(WIDGETS_PACT);

            HttpResponse<String> response = get("/gadgets");

            assertThat(response.statusCode()).isEqualTo(500);
            assertThat(response.headers().firstValue("Content-Type"))
                    .hasValueSatisfying(ct -> assertThat(ct).startsWith(DiagnosticResponse.CONTENT_TYPE));
            JsonNode problem = JsonValues.parse(response.body());
            assertThat(problem.get("type").asText()).isEqualTo("urn:pact-kit:mock-server:request-not-found");
            assertThat(problem.get("interaction").asText()).isEqualTo("a request for widgets");

            assertThat(server.matched()).isFalse();
            assertThat(server.state()).isEqualTo(MockServerState.PARTIALLY_MATCHED);
            assertThat(server.mismatches()).singleElement().satisfies(outcome -> {
                assertThat(outcome.type()).isEqualTo("request-not-found");
                assertThat(outcome.interaction()).isEqualTo("a request for widgets");
                assertThat(outcome.path()).isEqualTo("/gadgets");
                assertThat(outcome.mismatches()).singleElement().isInstanceOf(Mismatch.PathMismatch.class);
            });
            assertThat(server.mismatchesJson()).hasSize(1);
        }

        @Test
        @DisplayName("same method and path with a different query is a request-mismatch")
        void queryMismatch() throws Exception {
            start("""
                    {
                      "consumer": {"name": "web"},
                      "provider": {"name": "widgets"},
                      "interactions": [
                        {
                          "description": "second page",
                          "request": {"method": "GET", "path": "/widgets", "query": {"page": ["2"]}},
                          "response": {"status": 200}
                        }
                      ],
                      "metadata": {"pactSpecification": {"version": "3.0.0"}}
                    }
                    """);

            HttpResponse<String> response = get("/widgets?page=3");

            assertThat(response.statusCode()).isEqualTo(500);
            assertThat(JsonValues.parse(response.body()).get("type").asText())
                    .isEqualTo("urn:pact-kit:mock-server:request-mismatch");
            assertThat(server.mismatches()).singleElement().satisfies(outcome -> assertThat(outcome.mismatches())
                    .singleElement()
                    .isInstanceOf(Mismatch.QueryMismatch.class));
        }

        @Test
        @DisplayName("a matched request after a mismatch leaves the server partially matched")
        void mismatchThenMatch() throws Exception {
            start(WIDGETS_PACT);

            get("/gadgets");
            get("/widgets");

            assertThat(server.matched()).isFalse();
            assertThat(server.outcomes(0)).extracting(MatchOutcome::type)
                    .containsExactly("request-not-found", "request-match");
        }

        @Test
        @DisplayName("when several interactions match, the first registered response is served")
        void ambiguous() throws Exception {
            start("""
                    {
                      "consumer": {"name": "web"},
                      "provider": {"name": "widgets"},
                      "interactions": [
                        {
                          "description": "first",
                          "request": {"method": "GET", "path": "/widgets"},
                          "response": {"status": 200, "body": "first"}
                        },
                        {
                          "description": "second",
                          "request": {"method": "GET", "path": "/widgets"},
                          "response": {"status": 202, "body": "second"}
                        }
                      ],
                      "metadata": {"pactSpecification": {"version": "3.0.0"}}
                    }
                    """);

            HttpResponse<String> response = get("/widgets");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(server.outcomes(0)).singleElement().satisfies(outcome ->
                    assertThat(((MatchOutcome.RequestMatch) outcome).ambiguousWith()).containsExactly("second"));
            assertThat(server.outcomes(1)).isEmpty();
        }

        @Test
        @DisplayName("a request body is matched against the expected JSON body")
        void requestBody() throws Exception {
            start(CREATE_PACT);

            HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/widgets"))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString("{\"id\": 1}")));

            assertThat(response.statusCode()).isEqualTo(201);
            assertThat(server.matched()).isTrue();
        }

        @Test
        @DisplayName("a binary response body is served byte for byte")
        void binaryBody() throws Exception {
            byte[] png = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n', 0, 1, 2};
            String encoded = Base64.getEncoder().encodeToString(png);
            start("""
                    {
                      "consumer": {"name": "web"},
                      "provider": {"name": "widgets"},
                      "interactions": [
                        {
                          "type": "Synchronous/HTTP",
                          "description": "a widget picture",
                          "request": {"method": "GET", "path": "/widgets/1/picture"},
                          "response": {
                            "status": 200,
                            "headers": {"Content-Type": "image/png"},
                            "body": {"content": "%s", "contentType": "image/png", "encoded": "base64"}
                          }
                        }
                      ],
                      "metadata": {"pactSpecification": {"version": "4.0"}}
                    }
                    """.formatted(encoded));

            HttpResponse<byte[]> response = client.send(
                    HttpRequest.newBuilder(uri("/widgets/1/picture")).GET().build(),
                    HttpResponse.BodyHandlers.ofByteArray());

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).containsExactly(png);
        }
    }

    @Nested
    @DisplayName("response generators")
    class Generators extends MockServerTestHarness {

        @Test
        @DisplayName("a MockServerURL generator rewrites the link onto this server")
        void mockServerUrl() throws Exception {
            start("""
                    {
                      "consumer": {"name": "web"},
                      "provider": {"name": "widgets"},
                      "interactions": [
                        {
                          "description": "a widget with a self link",
                          "request": {"method": "GET", "path": "/widgets/1"},
                          "response": {
                            "status": 200,
                            "headers": {"Content-Type": "application/json"},
                            "body": {"href": "http://example.com/widgets/1"},
                            "generators": {
                              "body": {
                                "$.href": {
                                  "type": "MockServerURL",
                                  "example": "http://example.com/widgets/1",
                                  "regex": ".*(/widgets/\\\\d+)$"
                                }
                              }
                            }
                          }
                        }
                      ],
                      "metadata": {"pactSpecification": {"version": "3.0.0"}}
                    }
                    """);

            HttpResponse<String> response = get("/widgets/1");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(JsonValues.parse(response.body()).get("href").asText())
                    .isEqualTo(server.url() + "/widgets/1");
        }
    }

    @Nested
    @DisplayName("CORS pre-flight")
    class Cors extends MockServerTestHarness {

        private HttpRequest.Builder preflight() {
            return HttpRequest.newBuilder(uri("/widgets"))
                    .header("Origin", "http://app.example")
                    .header("Access-Control-Request-Method", "GET")
                    .method("OPTIONS", HttpRequest.BodyPublishers.noBody());
        }

        @Test
        @DisplayName("enabled: an unmatched OPTIONS is answered and not recorded")
        void enabled() throws Exception {
            start(WIDGETS_PACT, MockServerConfig.builder().corsPreflight(true).build());

            HttpResponse<String> response = send(preflight());

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).hasValue("http://app.example");
            assertThat(response.headers().firstValue("Access-Control-Allow-Methods"))
                    .hasValueSatisfying(methods -> assertThat(methods).contains("GET"));
            assertThat(server.outcomes(0)).isEmpty();
        }

        @Test
        @DisplayName("disabled: an unmatched OPTIONS is a mismatch")
        void disabled() throws Exception {
            start(WIDGETS_PACT);

            HttpResponse<String> response = send(preflight());

            assertThat(response.statusCode()).isEqualTo(500);
            assertThat(server.outcomes(0)).extracting(MatchOutcome::type).containsExactly("request-not-found");
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle extends MockServerTestHarness {

        @Test
        @DisplayName("port 0 binds an ephemeral port")
        void ephemeralPort() {
            start(WIDGETS_PACT);

            assertThat(server.port()).isPositive();
            assertThat(server.url()).isEqualTo("http://127.0.0.1:" + server.port());
        }

        @Test
        @DisplayName("starting twice is rejected")
        void startTwice() {
            start(WIDGETS_PACT);

            assertThatThrownBy(server::start).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("stop is idempotent and the port stops accepting connections")
        void stop() {
            start(WIDGETS_PACT);
            String url = server.url();

            server.stop();
            server.stop();

            assertThat(server.state()).isEqualTo(MockServerState.STOPPED);
            assertThatThrownBy(() -> client.send(
                            HttpRequest.newBuilder(URI.create(url + "/widgets")).GET().build(),
                            HttpResponse.BodyHandlers.ofString()))
                    .isInstanceOf(ConnectException.class);
        }

        @Test
        @DisplayName("an occupied port is a bind failure and the server ends stopped")
        void bindConflict() throws IOException {
            try (ServerSocket occupied = new ServerSocket(0, 50, InetAddress.getByName("127.0.0.1"))) {
                MockServerConfig config = MockServerConfig.builder().port(occupied.getLocalPort()).build();

                assertThatThrownBy(() -> start(WIDGETS_PACT, config))
                        .isInstanceOf(MockServerBindException.class)
                        .hasMessageContaining(String.valueOf(occupied.getLocalPort()));
                assertThat(server.state()).isEqualTo(MockServerState.STOPPED);
            }
        }

        @Test
        @DisplayName("stop waits for a request that is already being handled")
        void drainsInFlightRequest() throws Exception {
            start(CREATE_PACT, MockServerConfig.builder().drainTimeoutMs(10_000).build());
            CountDownLatch release = new CountDownLatch(1);

            CompletableFuture<HttpResponse<String>> pending = client.sendAsync(
                    HttpRequest.newBuilder(uri("/widgets"))
                            .header("Content-Type", "application/json")
                            .POST(HttpRequest.BodyPublishers.ofInputStream(() -> new GatedBody(release)))
                            .build(),
                    HttpResponse.BodyHandlers.ofString());

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
            while (server.activeRequests() == 0 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertThat(server.activeRequests()).isEqualTo(1);

            CompletableFuture<Void> stopping = CompletableFuture.runAsync(server::stop);
            Thread.sleep(200);
            assertThat(stopping).isNotDone();
            assertThat(server.state()).isEqualTo(MockServerState.STOPPING);

            release.countDown();

            assertThat(pending.get(10, TimeUnit.SECONDS).statusCode()).isEqualTo(201);
            stopping.get(10, TimeUnit.SECONDS);
            assertThat(server.state()).isEqualTo(MockServerState.STOPPED);
            assertThat(server.matched()).isTrue();
        }

        @Test
        @DisplayName("a request arriving on an open connection while stopping is still served")
        void servesRequestOnOpenConnectionWhileStopping() throws Exception {
            start(WIDGETS_PACT, MockServerConfig.builder().drainTimeoutMs(10_000).build());
            String request = "GET /widgets HTTP/1.1\r\nHost: 127.0.0.1\r\n";
            CompletableFuture<Void> stopping;

            try (Socket socket = new Socket("127.0.0.1", server.port())) {
                socket.setSoTimeout(10_000);
                OutputStream out = socket.getOutputStream();
                InputStream in = socket.getInputStream();

                out.write((request + "\r\n").getBytes(StandardCharsets.US_ASCII));
                out.flush();
                assertThat(readResponse(in).status()).isEqualTo(200);

                // the next request is on the wire but incomplete when stop begins
                out.write(request.getBytes(StandardCharsets.US_ASCII));
                out.flush();
                Thread.sleep(200);

                stopping = CompletableFuture.runAsync(server::stop);
                Thread.sleep(200);
                assertThat(stopping).isNotDone();
                assertThat(server.state()).isEqualTo(MockServerState.STOPPING);

                out.write("\r\n".getBytes(StandardCharsets.US_ASCII));
                out.flush();
                RawResponse second = readResponse(in);

                assertThat(second.status()).isEqualTo(200);
                assertThat(second.headers()).containsEntry("connection", "close");
                assertThat(JsonValues.parse(second.body())).isEqualTo(JsonValues.parse("{\"id\":1}"));
                assertThat(in.read()).isEqualTo(-1);
            }
            stopping.get(10, TimeUnit.SECONDS);
            assertThat(server.state()).isEqualTo(MockServerState.STOPPED);
            assertThat(server.outcomes(0)).hasSize(2);
        }

        @Test
        @DisplayName("an idle keep-alive connection does not hold up stopping")
        void idleConnectionDoesNotBlockStop() throws Exception {
            start(WIDGETS_PACT, MockServerConfig.builder().drainTimeoutMs(10_000).build());
            assertThat(get("/widgets").statusCode()).isEqualTo(200);

            CompletableFuture<Void> stopping = CompletableFuture.runAsync(server::stop);

            stopping.get(5, TimeUnit.SECONDS);
            assertThat(server.state()).isEqualTo(MockServerState.STOPPED);
        }
    }

    /** A response read off a raw socket: status line, lower-cased header names, body. */
    private record RawResponse(int status, Map<String, String> headers, String body) {}

    private static RawResponse readResponse(InputStream in) throws IOException {
        String statusLine = readLine(in);
        Map<String, String> headers = new HashMap<>();
        for (String line = readLine(in); !line.isEmpty(); line = readLine(in)) {
            int colon = line.indexOf(':');
            headers.put(line.substring(0, colon).trim().toLowerCase(Locale.ROOT), line.substring(colon + 1).trim());
        }
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        if ("chunked".equalsIgnoreCase(headers.get("transfer-encoding"))) {
            for (int size = Integer.parseInt(readLine(in).trim(), 16); size > 0;
                    size = Integer.parseInt(readLine(in).trim(), 16)) {
                body.write(in.readNBytes(size));
                readLine(in);
            }
            readLine(in);
        } else if (headers.containsKey("content-length")) {
            body.write(in.readNBytes(Integer.parseInt(headers.get("content-length"))));
        }
        return new RawResponse(
                Integer.parseInt(statusLine.split(" ")[1]), headers, body.toString(StandardCharsets.UTF_8));
    }

    private static String readLine(InputStream in) throws IOException {
        StringBuilder line = new StringBuilder();
        for (int c = in.read(); c != '\n'; c = in.read()) {
            if (c < 0) {
                throw new EOFException("connection closed after: " + line);
            }
            if (c != '\r') {
                line.append((char) c);
            }
        }
        return line.toString();
    }

    /** Yields the first half of {@code {"id":1}}, then blocks until released. */
    private static final class GatedBody extends InputStream {

        private final byte[] head = "{\"id\":".getBytes(StandardCharsets.UTF_8);
        private final byte[] tail = "1}".getBytes(StandardCharsets.UTF_8);
        private final CountDownLatch release;
        private int position;

        GatedBody(CountDownLatch release) {
            this.release = release;
        }

        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            int n = read(one, 0, 1);
            return n < 0 ? -1 : one[0] & 0xff;
        }

        @Override
        public int read(byte[] buffer, int offset, int length) throws IOException {
            if (position < head.length) {
                int n = Math.min(length, head.length - position);
                System.arraycopy(head, position, buffer, offset, n);
                position += n;
                return n;
            }
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            }
            int index = position - head.length;
            if (index >= tail.length) {
                return -1;
            }
            int n = Math.min(length, tail.length - index);
            System.arraycopy(tail, index, buffer, offset, n);
            position += n;
            return n;
        }
    }
}

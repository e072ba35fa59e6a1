package io.pactkit.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link Body} construction from raw text and wire bytes. */
class BodyTest {

    // --- Text ---

    @Test
    @DisplayName("JSON text with a JSON content type is parsed")
    void jsonTextIsParsed() {
        Body body = Body.of("{\"id\":1}", "application/json; charset=UTF-8");

        assertThat(body.isJson()).isTrue();
        assertThat(body.content().get("id").asInt()).isEqualTo(1);
        assertThat(body.asText()).isEqualTo("{\"id\":1}");
    }

    @Test
    @DisplayName("malformed JSON is kept as text")
    void malformedJsonKeptAsText() {
        Body body = Body.of("{\"id\":", "application/json");

        assertThat(body.content().isTextual()).isTrue();
        assertThat(body.asText()).isEqualTo("{\"id\":");
    }

    @Test
    @DisplayName("a null raw value is a missing body")
    void nullIsMissing() {
        assertThat(Body.of(null, "text/plain")).isSameAs(Body.MISSING);
        assertThat(Body.MISSING.toBytes()).isEmpty();
    }

    // --- Wire bytes ---

    @Test
    @DisplayName("text bytes decode as UTF-8")
    void textBytes() {
        Body body = Body.fromBytes("héllo".getBytes(StandardCharsets.UTF_8), "text/plain");

        assertThat(body.base64()).isFalse();
        assertThat(body.asText()).isEqualTo("héllo");
    }

    @Test
    @DisplayName("binary bytes are held as base64 and restored exactly")
    void binaryBytes() {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G', 0, 1, 2, (byte) 0xFF};

        Body body = Body.fromBytes(png, null);

        assertThat(body.base64()).isTrue();
        assertThat(body.contentType()).isEqualTo("image/png");
        assertThat(body.toBytes()).containsExactly(png);
    }

    @Test
    @DisplayName("empty bytes are a missing body")
    void emptyBytes() {
        assertThat(Body.fromBytes(new byte[0], "application/json").isPresent()).isFalse();
    }

    @Test
    @DisplayName("undeclared JSON bytes are sniffed as JSON")
    void sniffedJson() {
        Body body = Body.fromBytes("[1,2]".getBytes(StandardCharsets.UTF_8), null);

        assertThat(body.isJson()).isTrue();
        assertThat(body.content().size()).isEqualTo(2);
    }
}

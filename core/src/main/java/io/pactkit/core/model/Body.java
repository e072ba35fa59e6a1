package io.pactkit.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * A request, response or message body.
 *
 * <p>JSON bodies hold the parsed tree. Every other content type holds a text node, which carries
 * base64 when {@code base64} is set.
 *
 * @param content     the body value, or {@code null} when the body is missing
 * @param contentType declared media type, may be {@code null}
 * @param base64      whether {@code content} is base64-encoded binary data
 */
public record Body(JsonNode content, String contentType, boolean base64) {

    /** No body at all. */
    public static final Body MISSING = new Body(null, null, false);

    /** A JSON body. */
    public static Body json(JsonNode content) {
        return new Body(content, ContentTypes.JSON, false);
    }

    /**
     * Builds a body from raw text: parsed as JSON when the content type says JSON (or, lacking a
     * content type, when the text sniffs as JSON), kept as text otherwise.
     */
    public static Body of(String raw, String contentType) {
        if (raw == null) {
            return MISSING;
        }
        String effectiveType = contentType != null ? contentType : ContentTypes.sniff(raw);
        if (ContentTypes.isJson(effectiveType)) {
            JsonNode parsed = JsonValues.tryParse(raw);
            if (parsed != null) {
                return new Body(parsed, effectiveType, false);
            }
        }
        return new Body(TextNode.valueOf(raw), effectiveType, false);
    }

    /**
     * Builds a body from bytes read off the wire. Textual media types are decoded as UTF-8, anything
     * else is held as base64. Without a declared type the bytes are sniffed.
     */
    public static Body fromBytes(byte[] data, String contentType) {
        if (data == null || data.length == 0) {
            return MISSING;
        }
        String effectiveType = contentType != null && !contentType.isBlank() ? contentType : ContentTypes.detect(data);
        if (ContentTypes.isText(effectiveType)) {
            return of(new String(data, StandardCharsets.UTF_8), effectiveType);
        }
        return new Body(TextNode.valueOf(Base64.getEncoder().encodeToString(data)), effectiveType, true);
    }

    public boolean isPresent() {
        return content != null;
    }

    /** True if the body is JSON (declared or held as a parsed structure). */
    public boolean isJson() {
        return content != null && (ContentTypes.isJson(contentType) || (contentType == null && content.isContainerNode()));
    }

    /** Wire form of the body: JSON text, or the raw text for other content types. */
    public String asText() {
        if (content == null) {
            return null;
        }
        if (!isJson() && content.isTextual()) {
            return content.textValue();
        }
        return JsonValues.write(content);
    }

    /** Bytes to put on the wire; empty when the body is missing. */
    public byte[] toBytes() {
        if (content == null) {
            return new byte[0];
        }
        if (base64 && content.isTextual()) {
            return Base64.getDecoder().decode(content.textValue());
        }
        return asText().getBytes(StandardCharsets.UTF_8);
    }

    /** Returns a copy with a different content value. */
    public Body withContent(JsonNode newContent) {
        return new Body(newContent, contentType, base64);
    }
}

package io.pactkit.core.matchers.expressions;

import java.util.Objects;

/**
 * Why a matcher expression could not be parsed.
 *
 * @param message what was expected
 * @param token   the offending token text, empty at end of input
 * @param offset  UTF-8 byte offset of the offending token
 */
public record ParseError(String message, String token, int offset) {

    public ParseError {
        Objects.requireNonNull(message, "message must not be null");
        token = token == null ? "" : token;
    }

    /** One-line description including the token and offset. */
    public String describe() {
        if (token.isEmpty()) {
            return message + " (at offset " + offset + ")";
        }
        return message + " (got '" + token + "' at offset " + offset + ")";
    }
}

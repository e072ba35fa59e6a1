package io.pactkit.verifier.source;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Authentication for remote pact sources: basic auth or a bearer token.
 * A token wins when both are given.
 */
public record Credentials(String username, String password, String token) {

    public static final Credentials NONE = new Credentials(null, null, null);

    public static Credentials basic(String username, String password) {
        return new Credentials(username, password, null);
    }

    public static Credentials bearer(String token) {
        return new Credentials(null, null, token);
    }

    /** Value for the {@code Authorization} header, if any credentials are set. */
    public Optional<String> authorizationHeader() {
        if (token != null && !token.isBlank()) {
            return Optional.of("Bearer " + token);
        }
        if (username != null && !username.isBlank()) {
            String pair = username + ":" + (password == null ? "" : password);
            return Optional.of("Basic " + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8)));
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return token != null ? "Credentials[bearer]" : username != null ? "Credentials[basic " + username + "]" : "Credentials[none]";
    }
}

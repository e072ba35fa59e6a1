package io.pactkit.core.model;

import io.pactkit.core.generators.Generators;
import io.pactkit.core.matchers.MatchingRules;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An expected or received HTTP response.
 *
 * @param status        status code
 * @param headers       headers; lookups are case-insensitive
 * @param body          response body
 * @param matchingRules rules for the {@code status}, {@code header} and {@code body} categories
 * @param generators    generators applied when the mock server replays this response
 */
public record HttpResponse(
        int status,
        Map<String, List<String>> headers,
        Body body,
        MatchingRules matchingRules,
        Generators generators) {

    public HttpResponse {
        headers = MultiValues.copyOf(headers);
        body = body == null ? Body.MISSING : body;
        matchingRules = matchingRules == null ? MatchingRules.EMPTY : matchingRules;
        generators = generators == null ? Generators.EMPTY : generators;
    }

    /** A bare {@code 200} response. */
    public static HttpResponse defaults() {
        return new HttpResponse(200, Map.of(), Body.MISSING, MatchingRules.EMPTY, Generators.EMPTY);
    }

    /** Case-insensitive header lookup. */
    public Optional<List<String>> header(String name) {
        return MultiValues.getIgnoreCase(headers, name);
    }

    /** The content type from the headers, falling back to the body's declared type. */
    public String contentType() {
        return header("Content-Type")
                .filter(v -> !v.isEmpty())
                .map(v -> v.get(0))
                .orElse(body.contentType());
    }

    public HttpResponse withStatus(int newStatus) {
        return new HttpResponse(newStatus, headers, body, matchingRules, generators);
    }

    public HttpResponse withHeaders(Map<String, List<String>> newHeaders) {
        return new HttpResponse(status, newHeaders, body, matchingRules, generators);
    }

    public HttpResponse withBody(Body newBody) {
        return new HttpResponse(status, headers, newBody, matchingRules, generators);
    }

    public HttpResponse withMatchingRules(MatchingRules rules) {
        return new HttpResponse(status, headers, body, rules, generators);
    }

    public HttpResponse withGenerators(Generators newGenerators) {
        return new HttpResponse(status, headers, body, matchingRules, newGenerators);
    }
}

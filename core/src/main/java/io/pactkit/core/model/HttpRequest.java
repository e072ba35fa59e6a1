package io.pactkit.core.model;

import io.pactkit.core.generators.Generators;
import io.pactkit.core.matchers.MatchingRules;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * An expected or received HTTP request.
 *
 * @param method        HTTP method, upper case
 * @param path          request path starting with {@code /}
 * @param query         query parameters, in order
 * @param headers       headers as sent; lookups are case-insensitive
 * @param body          request body
 * @param matchingRules rules for the {@code path}, {@code query}, {@code header} and {@code body} categories
 * @param generators    generators applied when the verifier sends this request
 */
public record HttpRequest(
        String method,
        String path,
        Map<String, List<String>> query,
        Map<String, List<String>> headers,
        Body body,
        MatchingRules matchingRules,
        Generators generators) {

    public HttpRequest {
        method = method == null ? "GET" : method.toUpperCase(Locale.ROOT);
        path = path == null ? "/" : path;
        query = MultiValues.copyOf(query);
        headers = MultiValues.copyOf(headers);
        body = body == null ? Body.MISSING : body;
        matchingRules = matchingRules == null ? MatchingRules.EMPTY : matchingRules;
        generators = generators == null ? Generators.EMPTY : generators;
    }

    /** A bare {@code GET /} request. */
    public static HttpRequest defaults() {
        return new HttpRequest("GET", "/", Map.of(), Map.of(), Body.MISSING, MatchingRules.EMPTY, Generators.EMPTY);
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

    public HttpRequest withMethod(String newMethod) {
        return new HttpRequest(newMethod, path, query, headers, body, matchingRules, generators);
    }

    public HttpRequest withPath(String newPath) {
        return new HttpRequest(method, newPath, query, headers, body, matchingRules, generators);
    }

    public HttpRequest withQuery(Map<String, List<String>> newQuery) {
        return new HttpRequest(method, path, newQuery, headers, body, matchingRules, generators);
    }

    public HttpRequest withHeaders(Map<String, List<String>> newHeaders) {
        return new HttpRequest(method, path, query, newHeaders, body, matchingRules, generators);
    }

    public HttpRequest withBody(Body newBody) {
        return new HttpRequest(method, path, query, headers, newBody, matchingRules, generators);
    }

    public HttpRequest withMatchingRules(MatchingRules rules) {
        return new HttpRequest(method, path, query, headers, body, rules, generators);
    }

    public HttpRequest withGenerators(Generators newGenerators) {
        return new HttpRequest(method, path, query, headers, body, matchingRules, newGenerators);
    }
}

package io.pactkit.mockserver.server;

import com.fasterxml.jackson.databind.JsonNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.pactkit.core.generators.GenerationContext;
import io.pactkit.core.generators.GeneratorEngine;
import io.pactkit.core.model.Body;
import io.pactkit.core.model.HttpRequest;
import io.pactkit.core.model.HttpResponse;
import io.pactkit.core.model.Interaction;
import io.pactkit.core.pact.PactReader;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles every request a mock server receives.
 *
 * <ol>
 * <li>Refuse the request with 503 once the server has stopped admitting
 * requests; while it drains, serve it and close the connection after the
 * response</li>
 * <li>Convert the Javalin context into an {@link HttpRequest}</li>
 * <li>Find the interaction it belongs to and record the outcome</li>
 * <li>Replay the interaction's response, with generators applied, or answer
 * with a diagnostic problem-detail body</li>
 * </ol>
 *
 * <p>
 * Unmatched {@code OPTIONS} requests are answered as CORS pre-flights when
 * enabled, and recorded nowhere.
 */
final class MockRequestHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(MockRequestHandler.class);

    private final List<Interaction> interactions;
    private final InteractionOutcomes outcomes;
    private final InFlightRequests inFlight;
    private final boolean corsPreflight;
    private final Supplier<String> baseUrl;

    MockRequestHandler(
            List<Interaction> interactions,
            InteractionOutcomes outcomes,
            InFlightRequests inFlight,
            boolean corsPreflight,
            Supplier<String> baseUrl) {
        this.interactions = List.copyOf(interactions);
        this.outcomes = outcomes;
        this.inFlight = inFlight;
        this.corsPreflight = corsPreflight;
        this.baseUrl = baseUrl;
    }

    @Override
    public void handle(Context ctx) {
        if (!inFlight.tryEnter()) {
            writeProblem(ctx, 503, DiagnosticResponse.shuttingDown(ctx.path()));
            return;
        }
        if (inFlight.isDraining()) {
            ctx.header("Connection", "close");
        }
        try {
            HttpRequest actual = toRequest(ctx);
            InteractionMatcher.Decision decision = InteractionMatcher.find(interactions, actual);
            MatchOutcome outcome = decision.outcome();

            if (outcome instanceof MatchOutcome.RequestMatch match) {
                outcomes.record(decision.index(), match);
                if (!match.ambiguousWith().isEmpty()) {
                    LOG.warn(
                            "Request {} {} matched '{}' and also {}; using the first registered",
                            actual.method(),
                            actual.path(),
                            match.interaction(),
                            match.ambiguousWith());
                }
                LOG.debug("Request {} {} matched '{}'", actual.method(), actual.path(), match.interaction());
                writeResponse(ctx, interactions.get(decision.index()));
                return;
            }

            if (corsPreflight && "OPTIONS".equals(actual.method())) {
                LOG.debug("Answering CORS pre-flight for {}", actual.path());
                writePreflight(ctx);
                return;
            }

            outcomes.record(decision.index(), outcome);
            LOG.warn(
                    "Request {} {} was not expected ({}, closest interaction '{}'): {} mismatch(es)",
                    actual.method(),
                    actual.path(),
                    outcome.type(),
                    outcome.interaction(),
                    outcome.mismatches().size());
            writeProblem(ctx, 500, DiagnosticResponse.unmatched(outcome, ctx.path()));
        } finally {
            inFlight.exit();
        }
    }

    /** Converts the received request. Header names keep their received case. */
    static HttpRequest toRequest(Context ctx) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : Collections.list(ctx.req().getHeaderNames())) {
            headers.put(name, Collections.list(ctx.req().getHeaders(name)));
        }
        return new HttpRequest(
                ctx.method().name(),
                decodePath(ctx.req().getRequestURI()),
                PactReader.parseQueryString(ctx.queryString()),
                headers,
                Body.fromBytes(ctx.bodyAsBytes(), ctx.contentType()),
                null,
                null);
    }

    /** Percent-decodes a path; {@code +} stays a literal plus. */
    static String decodePath(String rawPath) {
        if (rawPath == null || rawPath.isEmpty()) {
            return "/";
        }
        return URLDecoder.decode(rawPath.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    private void writeResponse(Context ctx, Interaction interaction) {
        GenerationContext context = GeneratorEngine.withProviderStates(
                GenerationContext.empty().withMockServerUrl(baseUrl.get()), interaction.providerStates());
        HttpResponse response = GeneratorEngine.applyToResponse(interaction.response(), context);

        ctx.status(response.status());
        response.headers().forEach((name, values) -> {
            if ("Content-Type".equalsIgnoreCase(name) && !values.isEmpty()) {
                ctx.contentType(values.get(0));
            } else {
                values.forEach(value -> ctx.res().addHeader(name, value));
            }
        });
        Body body = response.body();
        if (body.isPresent()) {
            if (response.header("Content-Type").isEmpty() && body.contentType() != null) {
                ctx.contentType(body.contentType());
            }
            ctx.result(body.toBytes());
        }
    }

    private static void writePreflight(Context ctx) {
        String origin = ctx.header("Origin");
        String requestedHeaders = ctx.header("Access-Control-Request-Headers");
        ctx.status(200);
        ctx.header("Access-Control-Allow-Origin", origin != null ? origin : "*");
        ctx.header("Access-Control-Allow-Methods", "GET, HEAD, POST, PUT, PATCH, DELETE, OPTIONS");
        ctx.header("Access-Control-Allow-Headers", requestedHeaders != null ? requestedHeaders : "*");
        ctx.header("Access-Control-Allow-Credentials", "true");
    }

    private static void writeProblem(Context ctx, int status, JsonNode problem) {
        ctx.status(status);
        ctx.contentType(DiagnosticResponse.CONTENT_TYPE);
        ctx.result(problem.toString());
    }
}

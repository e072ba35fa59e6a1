package io.pactkit.verifier.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.pactkit.core.model.JsonValues;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link PactFetcher} over the JDK {@link HttpClient}. */
public final class HttpPactFetcher implements PactFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpPactFetcher.class);

    private final HttpClient httpClient;
    private final Duration timeout;

    public HttpPactFetcher(Duration timeout) {
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public JsonNode fetch(URI uri, Credentials credentials) throws PactSourceException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/hal+json, application/json")
                .GET();
        credentials.authorizationHeader().ifPresent(value -> builder.header("Authorization", value));

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new PactSourceException("Failed to fetch " + uri + ": " + e.getMessage(), e);
        }
        LOG.debug("GET {} -> {}", uri, response.statusCode());
        if (response.statusCode() == 404) {
            throw new PactSourceException("Resource not found: " + uri);
        }
        if (response.statusCode() == 401 || response.statusCode() == 403) {
            throw new PactSourceException("Not authorized to fetch " + uri + " (status " + response.statusCode() + ")");
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new PactSourceException("Fetching " + uri + " failed with status " + response.statusCode());
        }
        try {
            return JsonValues.MAPPER.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new PactSourceException("Response from " + uri + " is not JSON: " + e.getOriginalMessage(), e);
        }
    }
}

package io.pactkit.verifier.provider;

import io.pactkit.core.generators.Generators;
import io.pactkit.core.matchers.MatchingRules;
import io.pactkit.core.model.Body;
import io.pactkit.core.model.HttpRequest;
import io.pactkit.core.model.HttpResponse;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDK {@link HttpClient}-based caller for the provider under verification.
 *
 * <p>
 * Replays an interaction's request against the provider's base URL and
 * converts the reply into an {@link HttpResponse} the response matchers can
 * compare. Uses HTTP/1.1 and never follows redirects, so a 3xx is compared as
 * recorded.
 *
 * <p>
 * Thread-safe: the underlying {@link HttpClient} is designed for concurrent use.
 */
public final class ProviderClient {

    private static final Logger LOG = LoggerFactory.getLogger(ProviderClient.class);

    /** Headers the JDK client manages itself and refuses to set. */
    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final ProviderInfo provider;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public ProviderClient(ProviderInfo provider) {
        this(provider, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(provider.requestTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build());
    }

    ProviderClient(ProviderInfo provider, HttpClient httpClient) {
        this.provider = provider;
        this.httpClient = httpClient;
        this.requestTimeout = Duration.ofMillis(provider.requestTimeoutMs());
        LOG.debug("ProviderClient initialized: provider={}", provider.baseUrl());
    }

    public ProviderInfo provider() {
        return provider;
    }

    /**
     * Sends {@code request} to the provider.
     *
     * @return the provider's response; header names are as the JDK client reports them (lowercase)
     * @throws ProviderConnectException if the provider is unreachable
     * @throws ProviderTimeoutException if the provider does not answer within the request timeout
     * @throws InterruptedException     if the thread is interrupted while waiting
     */
    public HttpResponse execute(HttpRequest request) throws ProviderException, InterruptedException {
        URI target = uri(request.path(), request.query());
        byte[] body = request.body().toBytes();

        java.net.http.HttpRequest.Builder builder = java.net.http.HttpRequest.newBuilder(target)
                .timeout(requestTimeout)
                .method(request.method(), body.length > 0
                        ? java.net.http.HttpRequest.BodyPublishers.ofByteArray(body)
                        : java.net.http.HttpRequest.BodyPublishers.noBody());

        boolean hasContentType = false;
        for (Map.Entry<String, List<String>> header : request.headers().entrySet()) {
            String name = header.getKey();
            if (RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT)) || provider.headers().containsKey(name)) {
                continue;
            }
            hasContentType |= "content-type".equalsIgnoreCase(name);
            for (String value : header.getValue()) {
                builder.header(name, value);
            }
        }
        if (!hasContentType && body.length > 0 && request.body().contentType() != null) {
            builder.header("Content-Type", request.body().contentType());
        }
        provider.headers().forEach(builder::setHeader);

        LOG.debug("Sending {} {} to provider", request.method(), target);
        java.net.http.HttpResponse<byte[]> response = send(builder.build(), target);
        LOG.debug("Provider responded: {} {} -> {}", request.method(), request.path(), response.statusCode());
        return toResponse(response);
    }

    /**
     * POSTs a JSON document to {@code target}. Used for message verification
     * and provider-state callbacks; the custom provider headers are added too.
     */
    public HttpResponse postJson(URI target, String json) throws ProviderException, InterruptedException {
        java.net.http.HttpRequest.Builder builder = java.net.http.HttpRequest.newBuilder(target)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(java.net.http.HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
        provider.headers().forEach(builder::setHeader);
        return toResponse(send(builder.build(), target));
    }

    /** Absolute URI for a provider path, with the base path prepended and the query encoded. */
    public URI uri(String path, Map<String, List<String>> query) throws ProviderConnectException {
        String fullPath = provider.normalizedBasePath() + (path.startsWith("/") ? path : "/" + path);
        try {
            URI base = new URI(provider.scheme(), null, provider.host(), provider.port(), fullPath, null, null);
            if (query.isEmpty()) {
                return base;
            }
            return URI.create(base.toASCIIString() + "?" + encodeQuery(query));
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new ProviderConnectException("Cannot build provider URL for path '" + path + "'", e);
        }
    }

    private java.net.http.HttpResponse<byte[]> send(java.net.http.HttpRequest request, URI target)
            throws ProviderException, InterruptedException {
        try {
            return httpClient.send(request, java.net.http.HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpConnectTimeoutException e) {
            throw new ProviderConnectException("Connect timeout to " + target, e);
        } catch (HttpTimeoutException e) {
            throw new ProviderTimeoutException("Request timeout from " + target, e);
        } catch (ConnectException e) {
            throw new ProviderConnectException("Connection refused by " + target, e);
        } catch (IOException e) {
            throw new ProviderConnectException("Failed to call " + target + ": " + e.getMessage(), e);
        }
    }

    private static HttpResponse toResponse(java.net.http.HttpResponse<byte[]> response) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        response.headers().map().forEach((name, values) -> {
            if (!name.startsWith(":")) {
                headers.put(name, List.copyOf(values));
            }
        });
        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        return new HttpResponse(
                response.statusCode(),
                headers,
                Body.fromBytes(response.body(), contentType),
                MatchingRules.EMPTY,
                Generators.EMPTY);
    }

    static String encodeQuery(Map<String, List<String>> query) {
        StringJoiner joiner = new StringJoiner("&");
        query.forEach((name, values) -> {
            if (values.isEmpty()) {
                joiner.add(encode(name));
            }
            for (String value : values) {
                joiner.add(value == null ? encode(name) : encode(name) + "=" + encode(value));
            }
        });
        return joiner.toString();
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}

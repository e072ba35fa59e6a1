package io.pactkit.verifier.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Where the provider under verification listens and how to call it.
 *
 * @param name             provider name, used to filter broker pacts and in the report
 * @param scheme           {@code http} or {@code https}
 * @param host             provider host
 * @param port             provider port
 * @param basePath         prefix added to every interaction path, e.g. {@code /api}
 * @param requestTimeoutMs per-request timeout; the connect timeout uses the same value
 * @param headers          headers added to every provider request, replacing recorded values
 */
public record ProviderInfo(
        String name,
        String scheme,
        String host,
        int port,
        String basePath,
        int requestTimeoutMs,
        Map<String, String> headers) {

    public ProviderInfo {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Base URL including the base path, without a trailing slash. */
    public String baseUrl() {
        return scheme + "://" + (host.contains(":") ? "[" + host + "]" : host) + ":" + port + normalizedBasePath();
    }

    /** The base path with a leading slash and no trailing slash, or empty. */
    public String normalizedBasePath() {
        if (basePath == null || basePath.isBlank() || "/".equals(basePath)) {
            return "";
        }
        String path = basePath.startsWith("/") ? basePath : "/" + basePath;
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }

    public static final class Builder {

        private String name = "provider";
        private String scheme = "http";
        private String host = "localhost";
        private int port = 8080;
        private String basePath = "";
        private int requestTimeoutMs = 5000;
        private final Map<String, String> headers = new LinkedHashMap<>();

        Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder scheme(String scheme) {
            this.scheme = scheme;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder basePath(String basePath) {
            this.basePath = basePath;
            return this;
        }

        public Builder requestTimeoutMs(int requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers.putAll(headers);
            return this;
        }

        public ProviderInfo build() {
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                throw new IllegalArgumentException("scheme must be http or https, got '" + scheme + "'");
            }
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("port must be between 1 and 65535, got " + port);
            }
            if (requestTimeoutMs <= 0) {
                throw new IllegalArgumentException("request timeout must be positive, got " + requestTimeoutMs);
            }
            return new ProviderInfo(name, scheme.toLowerCase(Locale.ROOT), host, port, basePath,
                    requestTimeoutMs, headers);
        }
    }
}

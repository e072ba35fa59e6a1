package io.pactkit.mockserver.config;

/**
 * Configuration for one mock server or for the mock-server process.
 *
 * <p>
 * Use {@link #builder()} for the documented defaults and
 * {@link #toBuilder()} to derive a per-server variant (address, TLS) from the
 * process-wide settings.
 *
 * @param host           bind address
 * @param port           listen port, {@code 0} for an OS-assigned port
 * @param corsPreflight  answer unmatched {@code OPTIONS} requests with
 *                       permissive CORS headers
 * @param drainTimeoutMs max wait for in-flight requests when stopping
 * @param pactDir        directory pact files are written to by default
 * @param loggingFormat  json or text
 * @param loggingLevel   root log level
 * @param tls            HTTPS settings
 */
public record MockServerConfig(
        String host,
        int port,
        boolean corsPreflight,
        int drainTimeoutMs,
        String pactDir,
        String loggingFormat,
        String loggingLevel,
        TlsConfig tls) {

    /** Creates a new builder with the defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** A builder pre-filled with this configuration. */
    public Builder toBuilder() {
        return new Builder()
                .host(host)
                .port(port)
                .corsPreflight(corsPreflight)
                .drainTimeoutMs(drainTimeoutMs)
                .pactDir(pactDir)
                .loggingFormat(loggingFormat)
                .loggingLevel(loggingLevel)
                .tls(tls);
    }

    /** Builder for {@link MockServerConfig}. Every field has a default. */
    public static final class Builder {
        private String host = "127.0.0.1";
        private int port;
        private boolean corsPreflight;
        private int drainTimeoutMs = 5000;
        private String pactDir = "./pacts";
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";
        private TlsConfig tls = TlsConfig.DISABLED;

        Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder corsPreflight(boolean corsPreflight) {
            this.corsPreflight = corsPreflight;
            return this;
        }

        public Builder drainTimeoutMs(int drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        public Builder pactDir(String pactDir) {
            this.pactDir = pactDir;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder tls(TlsConfig tls) {
            this.tls = tls;
            return this;
        }

        public MockServerConfig build() {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port must be between 0 and 65535, got " + port);
            }
            return new MockServerConfig(
                    host,
                    port,
                    corsPreflight,
                    drainTimeoutMs,
                    pactDir,
                    loggingFormat,
                    loggingLevel,
                    tls == null ? TlsConfig.DISABLED : tls);
        }
    }
}

package io.pactkit.mockserver.config;

/**
 * HTTPS settings for a mock server.
 *
 * @param enabled          whether the listener serves HTTPS
 * @param keystore         path to the server certificate keystore
 * @param keystorePassword keystore password
 * @param keystoreType     keystore type: PKCS12 or JKS
 */
public record TlsConfig(boolean enabled, String keystore, String keystorePassword, String keystoreType) {

    /** Default TLS configuration: plain HTTP. */
    public static final TlsConfig DISABLED = new TlsConfig(false, null, null, "PKCS12");

    public TlsConfig {
        keystoreType = keystoreType == null || keystoreType.isBlank() ? "PKCS12" : keystoreType;
    }

    /** Same keystore settings with HTTPS switched on or off. */
    public TlsConfig withEnabled(boolean tls) {
        return new TlsConfig(tls, keystore, keystorePassword, keystoreType);
    }
}

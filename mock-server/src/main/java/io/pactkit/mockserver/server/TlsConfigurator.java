package io.pactkit.mockserver.server;

import io.pactkit.core.error.TlsConfigurationException;
import io.pactkit.mockserver.config.TlsConfig;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import org.eclipse.jetty.server.HttpConfiguration;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.SecureRequestCustomizer;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.SslConnectionFactory;
import org.eclipse.jetty.util.ssl.SslContextFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the Jetty connector a mock server listens on, plain or HTTPS.
 *
 * <p>
 * The keystore is checked up front so a bad path or password surfaces as a
 * {@link TlsConfigurationException} instead of a failure deep inside Jetty.
 */
public final class TlsConfigurator {

    private static final Logger LOG = LoggerFactory.getLogger(TlsConfigurator.class);

    private TlsConfigurator() {}

    /**
     * Creates the listener connector for {@code host:port}.
     *
     * @param server     the Jetty server
     * @param httpConfig Javalin's HTTP configuration
     * @param tlsConfig  HTTPS settings; a plain connector is returned when disabled
     * @param host       bind address
     * @param port       bind port, {@code 0} for an OS-assigned one
     */
    public static ServerConnector connector(
            Server server, HttpConfiguration httpConfig, TlsConfig tlsConfig, String host, int port) {
        ServerConnector connector;
        if (tlsConfig.enabled()) {
            SslContextFactory.Server sslContextFactory = new SslContextFactory.Server();
            sslContextFactory.setKeyStorePath(tlsConfig.keystore());
            sslContextFactory.setKeyStorePassword(tlsConfig.keystorePassword());
            sslContextFactory.setKeyStoreType(tlsConfig.keystoreType());

            HttpConfiguration httpsConfig = new HttpConfiguration(httpConfig);
            // no SNI host check: clients reach a mock server by IP as often as by name
            httpsConfig.addCustomizer(new SecureRequestCustomizer(false));

            connector = new ServerConnector(
                    server,
                    new SslConnectionFactory(sslContextFactory, "http/1.1"),
                    new HttpConnectionFactory(httpsConfig));
            LOG.debug("HTTPS connector configured: keystore={}, keystoreType={}",
                    tlsConfig.keystore(), tlsConfig.keystoreType());
        } else {
            connector = new ServerConnector(server, new HttpConnectionFactory(httpConfig));
        }
        connector.setHost(host);
        connector.setPort(port);
        return connector;
    }

    /**
     * Checks that HTTPS can be served with {@code tlsConfig}: a keystore is
     * configured, exists, is readable and opens with the given password.
     *
     * @throws TlsConfigurationException if any check fails
     */
    public static void validate(TlsConfig tlsConfig) {
        if (!tlsConfig.enabled()) {
            return;
        }
        if (tlsConfig.keystore() == null || tlsConfig.keystore().isBlank()) {
            throw new TlsConfigurationException("TLS enabled but no keystore configured. "
                    + "Set server.tls.keystore or PACT_MOCK_TLS_KEYSTORE to a PKCS12 or JKS keystore file.");
        }
        Path storePath = Path.of(tlsConfig.keystore());
        if (!Files.isReadable(storePath)) {
            throw new TlsConfigurationException("TLS keystore does not exist or is not readable: " + storePath);
        }
        String password = tlsConfig.keystorePassword();
        try (InputStream in = Files.newInputStream(storePath)) {
            KeyStore keyStore = KeyStore.getInstance(tlsConfig.keystoreType());
            keyStore.load(in, password != null ? password.toCharArray() : null);
        } catch (Exception e) {
            throw new TlsConfigurationException(
                    "TLS keystore could not be loaded (wrong password or corrupt file?): " + storePath, e);
        }
    }
}

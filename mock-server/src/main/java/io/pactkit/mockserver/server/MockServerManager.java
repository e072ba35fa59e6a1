package io.pactkit.mockserver.server;

import io.pactkit.core.model.Pact;
import io.pactkit.mockserver.config.MockServerConfig;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running mock servers, keyed by bound port.
 *
 * <p>
 * Thread-safe. Starting and stopping different servers never block each
 * other.
 */
public final class MockServerManager {

    private static final Logger LOG = LoggerFactory.getLogger(MockServerManager.class);

    private static final MockServerManager SHARED = new MockServerManager();

    private final ConcurrentMap<Integer, MockServer> servers = new ConcurrentHashMap<>();

    /** Process-wide instance used by the control API. */
    public static MockServerManager shared() {
        return SHARED;
    }

    /**
     * Starts a mock server for {@code pact} and registers it under its port.
     *
     * @throws io.pactkit.core.error.MockServerBindException    if binding fails
     * @throws io.pactkit.core.error.TlsConfigurationException if HTTPS cannot be configured
     */
    public MockServer start(Pact pact, MockServerConfig config) {
        MockServer server = new MockServer(pact, config);
        int port = server.start();
        MockServer previous = servers.put(port, server);
        if (previous != null) {
            LOG.warn("Port {} was still registered to a stopped mock server; replacing it", port);
        }
        return server;
    }

    public Optional<MockServer> find(int port) {
        return Optional.ofNullable(servers.get(port));
    }

    /**
     * Stops and forgets the server on {@code port}.
     *
     * @return {@code false} if no server is registered on that port
     */
    public boolean shutdown(int port) {
        MockServer server = servers.remove(port);
        if (server == null) {
            return false;
        }
        server.stop();
        return true;
    }

    /** Stops every registered server. */
    public void shutdownAll() {
        for (Integer port : List.copyOf(servers.keySet())) {
            shutdown(port);
        }
    }

    public List<Integer> ports() {
        return List.copyOf(servers.keySet());
    }
}

package io.pactkit.mockserver;

import io.pactkit.core.api.PactHandles;
import io.pactkit.core.error.InvalidPactException;
import io.pactkit.core.error.LastError;
import io.pactkit.core.error.MockServerBindException;
import io.pactkit.core.error.PactWriteException;
import io.pactkit.core.error.TlsConfigurationException;
import io.pactkit.core.model.Pact;
import io.pactkit.core.pact.PactReader;
import io.pactkit.mockserver.config.MockServerConfig;
import io.pactkit.mockserver.server.MockServer;
import io.pactkit.mockserver.server.MockServerManager;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Port-based control surface for mock servers.
 *
 * <p>
 * Nothing here throws. Creation returns the bound port or a negative code,
 * writes return a status code, and the message behind a failure is available
 * from {@link PactHandles#lastError()} on the calling thread.
 *
 * <table>
 * <caption>createMockServer codes</caption>
 * <tr><td>-1</td><td>null argument or unknown pact handle</td></tr>
 * <tr><td>-2</td><td>invalid pact JSON</td></tr>
 * <tr><td>-3</td><td>failed to start or bind</td></tr>
 * <tr><td>-4</td><td>internal fault</td></tr>
 * <tr><td>-5</td><td>invalid address</td></tr>
 * <tr><td>-6</td><td>TLS configuration</td></tr>
 * </table>
 */
public final class MockServerApi {

    private static final Logger LOG = LoggerFactory.getLogger(MockServerApi.class);

    public static final int NULL_ARGUMENT = -1;
    public static final int INVALID_PACT = -2;
    public static final int START_FAILED = -3;
    public static final int INTERNAL_FAULT = -4;
    public static final int INVALID_ADDRESS = -5;
    public static final int TLS_FAILURE = -6;

    /** Pact file written. */
    public static final int WRITE_OK = 0;
    /** Unexpected failure while writing. */
    public static final int WRITE_FAULT = 1;
    /** IO failure or merge conflict. */
    public static final int WRITE_IO_ERROR = 2;
    /** No mock server on that port. */
    public static final int WRITE_NO_SUCH_SERVER = 3;

    private static final MockServerApi SHARED =
            new MockServerApi(PactHandles.shared(), MockServerManager.shared(), MockServerConfig.builder().build());

    private final PactHandles handles;
    private final MockServerManager manager;
    private final MockServerConfig defaults;

    /**
     * @param handles  where pact handles are resolved
     * @param manager  registry of running servers
     * @param defaults settings applied to every server; address and TLS flag come from each call
     */
    public MockServerApi(PactHandles handles, MockServerManager manager, MockServerConfig defaults) {
        this.handles = handles;
        this.manager = manager;
        this.defaults = defaults;
    }

    /** Process-wide instance over {@link PactHandles#shared()}. */
    public static MockServerApi shared() {
        return SHARED;
    }

    /**
     * Starts a mock server for a pact given as JSON.
     *
     * @param pactJson pact document
     * @param address  {@code host:port}; port 0 picks a free port
     * @param tls      serve HTTPS with the configured keystore
     * @return the bound port, or a negative code
     */
    public int createMockServer(String pactJson, String address, boolean tls) {
        if (pactJson == null || address == null) {
            LastError.record("pact JSON and address are required");
            return NULL_ARGUMENT;
        }
        Pact pact;
        try {
            pact = PactReader.read(pactJson);
        } catch (InvalidPactException e) {
            LOG.warn("Rejected pact for mock server: {}", e.getMessage());
            LastError.record(e);
            return INVALID_PACT;
        }
        return start(pact, address, tls);
    }

    /**
     * Starts a mock server for a pact handle. Once the server is up, the pact
     * and its interactions are frozen so later changes cannot diverge from what
     * is served. A failed start leaves the pact editable.
     *
     * @return the bound port, or a negative code
     */
    public int createMockServerForPact(int pactHandle, String address, boolean tls) {
        if (address == null) {
            LastError.record("address is required");
            return NULL_ARGUMENT;
        }
        if (handles.pact(pactHandle).isEmpty()) {
            LastError.record("Unknown pact handle " + pactHandle);
            return NULL_ARGUMENT;
        }
        Optional<Pact> pact = handles.pact(pactHandle);
        if (pact.isEmpty()) {
            LastError.record("Pact handle " + pactHandle + " was released while starting a mock server");
            return NULL_ARGUMENT;
        }
        int port = start(pact.get(), address, tls);
        if (port > 0) {
            handles.freezePact(pactHandle);
        }
        return port;
    }

    /** True iff the server on {@code port} exists and all its interactions matched cleanly. */
    public boolean mockServerMatched(int port) {
        return manager.find(port).map(MockServer::matched).orElse(false);
    }

    /** Mismatches as a JSON array, or {@code null} if there is no server on {@code port}. */
    public String mockServerMismatches(int port) {
        Optional<MockServer> server = manager.find(port);
        if (server.isEmpty()) {
            LastError.record("No mock server running on port " + port);
            return null;
        }
        return server.get().mismatchesJson().toString();
    }

    /**
     * Stops the server on {@code port} and releases it.
     *
     * @return {@code true} the first time, {@code false} once the port is no longer registered
     */
    public boolean cleanupMockServer(int port) {
        boolean stopped = manager.shutdown(port);
        if (!stopped) {
            LastError.record("No mock server running on port " + port);
        }
        return stopped;
    }

    /**
     * Writes the pact served on {@code port} to {@code directory}, or to the
     * configured pact directory when {@code directory} is null.
     *
     * @return {@link #WRITE_OK}, {@link #WRITE_FAULT}, {@link #WRITE_IO_ERROR}
     *         or {@link #WRITE_NO_SUCH_SERVER}
     */
    public int writePactFile(int port, String directory, boolean overwrite) {
        Optional<MockServer> server = manager.find(port);
        if (server.isEmpty()) {
            LastError.record("No mock server running on port " + port);
            return WRITE_NO_SUCH_SERVER;
        }
        String dir = directory != null ? directory : defaults.pactDir();
        try {
            server.get().writePact(Path.of(dir), overwrite);
            return WRITE_OK;
        } catch (PactWriteException e) {
            LOG.warn("Failed to write pact for mock server on port {}: {}", port, e.getMessage());
            LastError.record(e);
            return WRITE_IO_ERROR;
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure writing pact for mock server on port {}", port, e);
            LastError.record(e);
            return WRITE_FAULT;
        }
    }

    private int start(Pact pact, String address, boolean tls) {
        MockServerConfig config;
        try {
            config = configFor(address, tls);
        } catch (IllegalArgumentException e) {
            LastError.record(e);
            return INVALID_ADDRESS;
        }
        try {
            return manager.start(pact, config).port();
        } catch (TlsConfigurationException e) {
            LOG.warn("Mock server TLS setup failed: {}", e.getMessage());
            LastError.record(e);
            return TLS_FAILURE;
        } catch (MockServerBindException e) {
            LOG.warn("Mock server failed to start: {}", e.getMessage());
            LastError.record(e);
            return START_FAILED;
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure starting mock server on {}", address, e);
            LastError.record(e);
            return INTERNAL_FAULT;
        }
    }

    private MockServerConfig configFor(String address, boolean tls) {
        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw new IllegalArgumentException("Invalid address '" + address + "', expected host:port");
        }
        String host = address.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port;
        try {
            port = Integer.parseInt(address.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in address '" + address + "'", e);
        }
        if (host.isBlank()) {
            throw new IllegalArgumentException("Invalid address '" + address + "', host is empty");
        }
        return defaults.toBuilder()
                .host(host)
                .port(port)
                .tls(defaults.tls().withEnabled(tls))
                .build();
    }
}

package io.pactkit.mockserver.server;

import com.fasterxml.jackson.databind.node.ArrayNode;
import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import io.pactkit.core.error.MockServerBindException;
import io.pactkit.core.model.JsonValues;
import io.pactkit.core.model.Pact;
import io.pactkit.core.pact.PactFiles;
import io.pactkit.mockserver.config.MockServerConfig;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.eclipse.jetty.io.Connection;
import org.eclipse.jetty.io.EndPoint;
import org.eclipse.jetty.io.ssl.SslConnection;
import org.eclipse.jetty.server.HttpConnection;
import org.eclipse.jetty.server.ServerConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A Javalin listener that replays the interactions of one pact and records
 * how each received request matched.
 *
 * <p>
 * Lifecycle: {@code CREATED -> STARTING -> RUNNING -> STOPPING -> STOPPED}.
 * While running, {@link #state()} reports {@code MATCHED} or
 * {@code PARTIALLY_MATCHED} once requests have been recorded. Stopping first
 * closes the listening socket so no new connection is accepted. Requests on
 * connections already accepted are still served, each closing its connection
 * afterwards, until the server goes quiet or the drain timeout expires. Only
 * then are further requests refused and the server released.
 */
public final class MockServer {

    private static final Logger LOG = LoggerFactory.getLogger(MockServer.class);

    private static final List<HandlerType> METHODS = List.of(
            HandlerType.GET,
            HandlerType.POST,
            HandlerType.PUT,
            HandlerType.PATCH,
            HandlerType.DELETE,
            HandlerType.HEAD,
            HandlerType.OPTIONS);

    private static final long DRAIN_SETTLE_MS = 50;

    private static final long DRAIN_POLL_MS = 10;

    private final Pact pact;
    private final MockServerConfig config;
    private final InteractionOutcomes outcomes;
    private final InFlightRequests inFlight = new InFlightRequests();
    private final AtomicReference<MockServerState> lifecycle = new AtomicReference<>(MockServerState.CREATED);
    private final AtomicReference<ServerConnector> connector = new AtomicReference<>();
    private volatile Javalin app;
    private volatile int port;

    public MockServer(Pact pact, MockServerConfig config) {
        this.pact = Objects.requireNonNull(pact, "pact must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.outcomes = new InteractionOutcomes(pact.interactions());
    }

    /**
     * Binds the listener and starts serving.
     *
     * @return the bound port
     * @throws io.pactkit.core.error.TlsConfigurationException if HTTPS is enabled but the keystore is unusable
     * @throws MockServerBindException                         if the address cannot be bound
     * @throws IllegalStateException                           if the server was already started
     */
    public int start() {
        if (!lifecycle.compareAndSet(MockServerState.CREATED, MockServerState.STARTING)) {
            throw new IllegalStateException("Mock server has already been started");
        }
        long startTime = System.nanoTime();
        try {
            TlsConfigurator.validate(config.tls());
        } catch (RuntimeException e) {
            lifecycle.set(MockServerState.STOPPED);
            throw e;
        }

        MockRequestHandler handler = new MockRequestHandler(
                pact.interactions(), outcomes, inFlight, config.corsPreflight(), this::url);
        Javalin javalin = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;
            javalinConfig.jetty.defaultHost = config.host();
            javalinConfig.jetty.defaultPort = config.port();
            javalinConfig.jetty.addConnector((server, httpConfig) -> {
                ServerConnector serverConnector =
                        TlsConfigurator.connector(server, httpConfig, config.tls(), config.host(), config.port());
                connector.set(serverConnector);
                return serverConnector;
            });
        });
        for (HandlerType method : METHODS) {
            javalin.addHttpHandler(method, "/", handler);
            javalin.addHttpHandler(method, "/<path>", handler);
        }
        javalin.exception(Exception.class, (e, ctx) -> {
            LOG.error("Unexpected failure handling {} {}: {}", ctx.method(), ctx.path(), e.getMessage(), e);
            ctx.status(500);
            ctx.contentType(DiagnosticResponse.CONTENT_TYPE);
            ctx.result(DiagnosticResponse.internalError(e.getMessage(), ctx.path()).toString());
        });

        String address = config.host() + ":" + config.port();
        try {
            javalin.start();
        } catch (RuntimeException e) {
            lifecycle.set(MockServerState.STOPPED);
            stopQuietly(javalin);
            throw new MockServerBindException("Failed to bind mock server to " + address + ": " + e.getMessage(), address, e);
        }

        this.app = javalin;
        this.port = connector.get().getLocalPort();
        lifecycle.set(MockServerState.RUNNING);
        LOG.info(
                "Mock server started: url={}, tls={}, consumer={}, provider={}, interactions={}, startupMs={}",
                url(),
                config.tls().enabled(),
                pact.consumer(),
                pact.provider(),
                pact.interactions().size(),
                (System.nanoTime() - startTime) / 1_000_000);
        return port;
    }

    /** Bound port, or {@code 0} before {@link #start()}. */
    public int port() {
        return port;
    }

    /** Base URL requests are served on. */
    public String url() {
        String host = config.host();
        if (host == null || host.isBlank() || "0.0.0.0".equals(host) || "::".equals(host)) {
            host = "127.0.0.1";
        } else if (host.contains(":") && !host.startsWith("[")) {
            host = "[" + host + "]";
        }
        return (config.tls().enabled() ? "https" : "http") + "://" + host + ":" + port;
    }

    public Pact pact() {
        return pact;
    }

    public MockServerConfig config() {
        return config;
    }

    /** Lifecycle state, refined into {@code MATCHED} or {@code PARTIALLY_MATCHED} while running. */
    public MockServerState state() {
        MockServerState current = lifecycle.get();
        if (current != MockServerState.RUNNING || outcomes.isEmpty()) {
            return current;
        }
        return outcomes.allMatched() ? MockServerState.MATCHED : MockServerState.PARTIALLY_MATCHED;
    }

    /** True iff every interaction was matched at least once and nothing unexpected was received. */
    public boolean matched() {
        return outcomes.allMatched();
    }

    /** Every failure recorded so far, plus interactions that were never requested. */
    public List<MatchOutcome> mismatches() {
        return outcomes.failures();
    }

    /** {@link #mismatches()} as a JSON array. */
    public ArrayNode mismatchesJson() {
        ArrayNode array = JsonValues.MAPPER.createArrayNode();
        mismatches().forEach(outcome -> array.add(outcome.toJson()));
        return array;
    }

    /** Outcomes recorded for the interaction at {@code index}, in arrival order. */
    public List<MatchOutcome> outcomes(int index) {
        return outcomes.outcomes(index);
    }

    /** Requests currently being handled. */
    int activeRequests() {
        return inFlight.active();
    }

    /**
     * Writes the pact to {@code dir}, merging with an existing file unless
     * {@code overwrite} is set.
     *
     * @return the file written
     * @throws io.pactkit.core.error.PactWriteException on IO failure or merge conflict
     */
    public Path writePact(Path dir, boolean overwrite) {
        return PactFiles.write(pact, dir, overwrite);
    }

    /** Stops the server. Calling it again, or before start, has no effect. */
    public void stop() {
        MockServerState previous = lifecycle.getAndUpdate(
                s -> s == MockServerState.RUNNING ? MockServerState.STOPPING : s);
        if (previous != MockServerState.RUNNING) {
            return;
        }
        ServerConnector serverConnector = connector.get();
        try {
            serverConnector.close();
        } catch (Exception e) {
            LOG.warn("Failed to close listener on port {}: {}", port, e.getMessage());
        }
        inFlight.beginDrain();
        try {
            if (!drain(serverConnector, config.drainTimeoutMs())) {
                LOG.warn("Drain timeout of {} ms expired with {} request(s) in flight on port {}",
                        config.drainTimeoutMs(), inFlight.active(), port);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while draining mock server on port {}", port);
        }
        inFlight.close();
        app.stop();
        lifecycle.set(MockServerState.STOPPED);
        LOG.info("Mock server on port {} stopped (matched={})", port, outcomes.allMatched());
    }

    /**
     * Waits until no request is being handled and no accepted connection holds
     * a partly received request, and both have stayed true for
     * {@link #DRAIN_SETTLE_MS}.
     *
     * @return {@code true} if the server went quiet before the timeout
     */
    private boolean drain(ServerConnector serverConnector, long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        long quietSince = 0;
        boolean wasQuiet = false;
        while (true) {
            long now = System.nanoTime();
            boolean quiet = inFlight.active() == 0 && !hasPartialRequest(serverConnector);
            if (!quiet) {
                wasQuiet = false;
            } else if (!wasQuiet) {
                wasQuiet = true;
                quietSince = now;
            } else if (now - quietSince >= TimeUnit.MILLISECONDS.toNanos(DRAIN_SETTLE_MS)) {
                return true;
            }
            if (now - deadline >= 0) {
                return quiet;
            }
            Thread.sleep(DRAIN_POLL_MS);
        }
    }

    /** True if some open connection has received part of a request that has not reached the handler. */
    private static boolean hasPartialRequest(ServerConnector serverConnector) {
        for (EndPoint endPoint : serverConnector.getConnectedEndPoints()) {
            if (!endPoint.isOpen() || endPoint.isOutputShutdown()) {
                continue;
            }
            Connection connection = endPoint.getConnection();
            if (connection instanceof SslConnection ssl) {
                connection = ssl.getDecryptedEndPoint().getConnection();
            }
            if (connection instanceof HttpConnection http && !http.getParser().isStart()) {
                return true;
            }
        }
        return false;
    }

    private static void stopQuietly(Javalin javalin) {
        try {
            javalin.stop();
        } catch (RuntimeException e) {
            LOG.debug("Ignoring failure while releasing an unstarted server: {}", e.getMessage());
        }
    }
}

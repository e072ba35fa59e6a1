package io.pactkit.mockserver;

import io.pactkit.core.model.Pact;
import io.pactkit.core.pact.PactReader;
import io.pactkit.mockserver.config.ConfigLoader;
import io.pactkit.mockserver.config.MockServerConfig;
import io.pactkit.mockserver.server.LogbackConfigurator;
import io.pactkit.mockserver.server.MockServer;
import io.pactkit.mockserver.server.MockServerManager;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a standalone mock server for one pact file.
 *
 * <pre>{@code
 * java -jar pact-kit-mock-server.jar --pact pacts/web-widgets.json [--config pact-mock-server.yaml]
 * }</pre>
 *
 * <p>
 * The server runs until the JVM shuts down; on shutdown the outcome is logged
 * and the pact is written to the configured pact directory.
 */
public final class MockServerMain {

    private static final Logger LOG = LoggerFactory.getLogger(MockServerMain.class);

    private MockServerMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args {@code --pact <file>} and optionally {@code --config <file>}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            MockServer server = start(args);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(server), "mock-server-shutdown"));
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Loads configuration and the pact, configures logging and starts the
     * server. Separate from {@link #main(String[])} so it can be driven from tests.
     */
    static MockServer start(String[] args) {
        String pactFile = ConfigLoader.option(args, "--pact");
        if (pactFile == null) {
            throw new IllegalArgumentException("--pact <file> is required");
        }
        Path configPath = ConfigLoader.resolveConfigPath(args);
        boolean explicitConfig = ConfigLoader.option(args, "--config") != null;
        MockServerConfig config = explicitConfig || Files.exists(configPath)
                ? ConfigLoader.load(configPath)
                : ConfigLoader.fromEnvironment(System::getenv);

        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", Files.exists(configPath) ? configPath : "environment");

        Pact pact = PactReader.read(Path.of(pactFile));
        return MockServerManager.shared().start(pact, config);
    }

    private static void shutdown(MockServer server) {
        boolean matched = server.matched();
        if (!matched) {
            LOG.warn("Mock server finished with mismatches: {}", server.mismatchesJson());
        }
        MockServerManager.shared().shutdown(server.port());
        if (server.config().pactDir() != null && !server.config().pactDir().isBlank()) {
            try {
                Path file = server.writePact(Path.of(server.config().pactDir()), false);
                LOG.info("Pact written to {}", file);
            } catch (RuntimeException e) {
                LOG.error("Failed to write pact on shutdown: {}", e.getMessage(), e);
            }
        }
    }
}

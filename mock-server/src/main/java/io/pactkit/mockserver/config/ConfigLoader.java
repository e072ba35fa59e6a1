package io.pactkit.mockserver.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link MockServerConfig} from a YAML file with an environment
 * variable overlay.
 *
 * <p>
 * YAML layout:
 * <pre>{@code
 * server:
 *   host: 127.0.0.1
 *   port: 0
 *   cors-preflight: false
 *   drain-timeout-ms: 5000
 *   tls:
 *     enabled: false
 *     keystore: /path/server.p12
 *     keystore-password: changeit
 *     keystore-type: PKCS12
 * pact:
 *   dir: ./pacts
 * logging:
 *   format: text
 *   level: INFO
 * }</pre>
 *
 * <p>
 * Every key can be overridden by a {@code PACT_MOCK_*} environment variable.
 * An env var counts only if it is defined and non-blank after trimming.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "pact-mock-server.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration at {@code configPath}, applying overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static MockServerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration at {@code configPath}, applying overrides from the
     * supplied lookup. The lookup returns {@code null} for an undefined variable.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static MockServerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        return mapToConfig(root == null ? MissingNode.getInstance() : root, envLookup);
    }

    /** Defaults plus environment overrides, for running without a config file. */
    public static MockServerConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(MissingNode.getInstance(), envLookup);
    }

    /**
     * Resolves the config file path from {@code --config <path>}.
     *
     * @return the given path, or {@code pact-mock-server.yaml} in the working directory
     */
    public static Path resolveConfigPath(String[] args) {
        String value = option(args, "--config");
        return Path.of(value != null ? value : DEFAULT_CONFIG_FILE);
    }

    /** Value following {@code name} in {@code args}, or {@code null} if the option is absent. */
    public static String option(String[] args, String name) {
        for (int i = 0; i < args.length; i++) {
            if (name.equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException(name + " requires an argument");
                }
                return args[i + 1];
            }
        }
        return null;
    }

    private static MockServerConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        MockServerConfig.Builder builder = MockServerConfig.builder();

        // --- YAML mapping ---

        JsonNode server = root.path("server");
        if (server.has("host")) builder.host(server.get("host").asText());
        if (server.has("port")) builder.port(server.get("port").asInt());
        if (server.has("cors-preflight"))
            builder.corsPreflight(server.get("cors-preflight").asBoolean());
        if (server.has("drain-timeout-ms"))
            builder.drainTimeoutMs(server.get("drain-timeout-ms").asInt());

        JsonNode tls = server.path("tls");
        boolean yamlTlsEnabled = tls.path("enabled").asBoolean(false);
        String yamlKeystore = textOrNull(tls, "keystore");
        String yamlKeystorePassword = textOrNull(tls, "keystore-password");
        String yamlKeystoreType = tls.has("keystore-type") ? tls.get("keystore-type").asText() : "PKCS12";

        JsonNode pact = root.path("pact");
        if (pact.has("dir")) builder.pactDir(pact.get("dir").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---

        envString(envLookup, "PACT_MOCK_HOST", builder::host);
        envInt(envLookup, "PACT_MOCK_PORT", builder::port);
        envBool(envLookup, "PACT_MOCK_CORS_PREFLIGHT", builder::corsPreflight);
        envInt(envLookup, "PACT_MOCK_DRAIN_TIMEOUT_MS", builder::drainTimeoutMs);
        envString(envLookup, "PACT_MOCK_PACT_DIR", builder::pactDir);
        envString(envLookup, "PACT_MOCK_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "PACT_MOCK_LOG_LEVEL", builder::loggingLevel);

        builder.tls(new TlsConfig(
                envBoolOrDefault(envLookup, "PACT_MOCK_TLS_ENABLED", yamlTlsEnabled),
                envStringOrDefault(envLookup, "PACT_MOCK_TLS_KEYSTORE", yamlKeystore),
                envStringOrDefault(envLookup, "PACT_MOCK_TLS_KEYSTORE_PASSWORD", yamlKeystorePassword),
                envStringOrDefault(envLookup, "PACT_MOCK_TLS_KEYSTORE_TYPE", yamlKeystoreType)));

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid mock server configuration: " + e.getMessage(), e);
        }
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parseInt(envVar, envLookup.apply(envVar).trim()));
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    private static String envStringOrDefault(Function<String, String> envLookup, String envVar, String yamlDefault) {
        return isSet(envLookup, envVar) ? envLookup.apply(envVar).trim() : yamlDefault;
    }

    private static boolean envBoolOrDefault(Function<String, String> envLookup, String envVar, boolean yamlDefault) {
        return isSet(envLookup, envVar) ? Boolean.parseBoolean(envLookup.apply(envVar).trim()) : yamlDefault;
    }

    private static int parseInt(String envVar, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
        }
    }

    // --- YAML helpers ---

    private static String textOrNull(JsonNode node, String field) {
        return node.has(field) ? node.get(field).asText() : null;
    }
}

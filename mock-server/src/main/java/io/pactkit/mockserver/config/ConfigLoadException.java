package io.pactkit.mockserver.config;

/**
 * Thrown when the mock-server configuration cannot be loaded: missing file,
 * invalid YAML or a malformed environment override.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

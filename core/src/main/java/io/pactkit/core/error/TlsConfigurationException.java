package io.pactkit.core.error;

/** Thrown when TLS is requested for a mock server but the keystore setup is missing or unusable. */
public final class TlsConfigurationException extends PactKitException {

    private static final long serialVersionUID = 1L;

    public TlsConfigurationException(String message) {
        super(message, ErrorKind.TLS);
    }

    public TlsConfigurationException(String message, Throwable cause) {
        super(message, cause, ErrorKind.TLS);
    }
}

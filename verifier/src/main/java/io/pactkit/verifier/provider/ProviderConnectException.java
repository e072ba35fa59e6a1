package io.pactkit.verifier.provider;

/** Thrown when the provider cannot be reached or fails at the transport level. */
public class ProviderConnectException extends ProviderException {

    private static final long serialVersionUID = 1L;

    public ProviderConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.pactkit.verifier.provider;

/** Thrown when the provider does not answer within the configured request timeout. */
public class ProviderTimeoutException extends ProviderException {

    private static final long serialVersionUID = 1L;

    public ProviderTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.pactkit.verifier.provider;

/**
 * Base exception for transport failures while talking to the provider.
 *
 * <p>
 * Subtypes represent specific failure modes:
 * <ul>
 * <li>{@link ProviderConnectException}: connection refused, host unreachable
 * <li>{@link ProviderTimeoutException}: no response within the request timeout
 * <li>{@link StateChangeRejectedException}: the state-change callback answered with an error
 * </ul>
 * Either way the interaction is reported as a provider error, never as a
 * mismatch.
 */
public abstract class ProviderException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * @param message human-readable error description
     * @param cause   the underlying exception
     */
    protected ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}

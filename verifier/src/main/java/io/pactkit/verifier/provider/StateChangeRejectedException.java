package io.pactkit.verifier.provider;

/** Thrown when the state-change endpoint answers with a non-2xx status. */
public class StateChangeRejectedException extends ProviderException {

    private static final long serialVersionUID = 1L;

    private final int status;

    public StateChangeRejectedException(String message, int status) {
        super(message, null);
        this.status = status;
    }

    public int status() {
        return status;
    }
}

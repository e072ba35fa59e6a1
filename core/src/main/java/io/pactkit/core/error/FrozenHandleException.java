package io.pactkit.core.error;

/**
 * Thrown when a pact, interaction or message is modified after its mock server has started. The
 * handle API never lets this escape; mutators report it as a {@code false} return.
 */
public final class FrozenHandleException extends PactKitException {

    private static final long serialVersionUID = 1L;

    private final int handle;

    public FrozenHandleException(int handle) {
        super("Handle " + handle + " is frozen and can no longer be modified", ErrorKind.CONFIGURATION);
        this.handle = handle;
    }

    public int handle() {
        return handle;
    }
}

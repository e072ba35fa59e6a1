package io.pactkit.core.error;

/** Thrown when a pact file cannot be read back or written to disk. */
public class PactWriteException extends PactKitException {

    private static final long serialVersionUID = 1L;

    public PactWriteException(String message, Throwable cause) {
        super(message, cause, ErrorKind.PACT_WRITE);
    }

    protected PactWriteException(String message) {
        super(message, ErrorKind.PACT_WRITE);
    }
}

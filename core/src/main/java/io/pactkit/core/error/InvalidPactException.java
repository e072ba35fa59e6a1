package io.pactkit.core.error;

/** Thrown when a pact document is not valid JSON or does not have the expected structure. */
public final class InvalidPactException extends PactKitException {

    private static final long serialVersionUID = 1L;

    public InvalidPactException(String message) {
        super(message, ErrorKind.INVALID_PACT);
    }

    public InvalidPactException(String message, Throwable cause) {
        super(message, cause, ErrorKind.INVALID_PACT);
    }
}

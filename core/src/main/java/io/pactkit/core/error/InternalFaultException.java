package io.pactkit.core.error;

/** Thrown for defects: states the code never expects to reach. */
public final class InternalFaultException extends PactKitException {

    private static final long serialVersionUID = 1L;

    public InternalFaultException(String message) {
        super(message, ErrorKind.INTERNAL);
    }

    public InternalFaultException(String message, Throwable cause) {
        super(message, cause, ErrorKind.INTERNAL);
    }
}

package io.pactkit.core.error;

import io.pactkit.core.matchers.expressions.ParseError;

/** Thrown by callers that want a matcher expression failure as an exception rather than a value. */
public final class MatcherExpressionException extends PactKitException {

    private static final long serialVersionUID = 1L;

    private final transient ParseError error;

    public MatcherExpressionException(ParseError error) {
        super(error.describe(), ErrorKind.PARSE);
        this.error = error;
    }

    /** The parse error, with the offending token and its offset. */
    public ParseError error() {
        return error;
    }
}

package org.pragmatica.relq.error;

/**
 * Thrown when a failed parse result is unwrapped.
 * Carries the underlying {@link ParseError} with its source location.
 */
public class ParseException extends RuntimeException {

    private final transient ParseError error;

    public ParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError getError() {
        return error;
    }

    public int getLine() {
        return error.location().line();
    }

    public int getColumn() {
        return error.location().column();
    }
}

package org.pragmatica.relq.error;

import org.pragmatica.relq.source.SourceLocation;

/**
 * Reason a parse did not match, with the position it refers to.
 */
public sealed interface ParseError {
    SourceLocation location();

    String message();

    /**
     * Input present, but no alternative accepts it.
     */
    record UnexpectedInput(
    SourceLocation location,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }
    }

    /**
     * Input ended where more was required.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }

    /**
     * Block comment opened at {@code location} is never closed.
     */
    record UnterminatedComment(SourceLocation location) implements ParseError {
        @Override
        public String message() {
            return "Unterminated block comment at " + location + ", expected '*/'";
        }
    }

    /**
     * String literal opened at {@code location} is never closed.
     */
    record UnterminatedString(SourceLocation location) implements ParseError {
        @Override
        public String message() {
            return "Unterminated string literal at " + location + ", expected '''";
        }
    }

    /**
     * Integer literal does not fit a signed 64-bit value.
     */
    record IntegerOutOfRange(
    SourceLocation location,
    String digits) implements ParseError {
        @Override
        public String message() {
            return "Integer literal " + digits + " at " + location + " is out of 64-bit range";
        }
    }
}

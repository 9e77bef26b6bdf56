package org.pragmatica.relq.parser;

import org.pragmatica.relq.ast.Exp;

/**
 * Parser interface - turns Relq source text into an expression tree.
 * Implementations are immutable and may be shared between threads.
 *
 * <p>Parsing recurses once per precedence layer and nesting level. On a default thread stack
 * a {@link StackOverflowError} is thrown at roughly 75 nested parentheses, 550 chained lets,
 * 780 terms of one operator chain or 840 row cells (about 400 two-cell table rows).
 * Parse larger inputs on a thread created with a bigger stack size.
 */
public interface Parser {

    /**
     * Parse a complete program. Surrounding whitespace and comments are allowed;
     * anything else left after the expression is a failure.
     */
    ParseResult<Exp> parse(String input);

    /**
     * Parse complete input starting from a specific precedence layer.
     */
    ParseResult<Exp> parse(String input, Precedence startLayer);

    /**
     * Parse a program and pack the outcome with a renderable diagnostic for a failure.
     */
    ParseResultWithDiagnostics parseWithDiagnostics(String input);

    /**
     * Parse a complete program.
     *
     * @throws org.pragmatica.relq.error.ParseException if the input is not a valid program
     */
    default Exp parseOrThrow(String input) {
        return parse(input).unwrap();
    }
}

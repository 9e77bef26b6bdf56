package org.pragmatica.relq.parser;

import org.pragmatica.relq.ast.Exp;
import org.pragmatica.relq.error.ParseError;
import org.pragmatica.relq.source.SourceLocation;

/**
 * Token-level rules: literals, identifiers and the whitespace/comment skipper.
 */
public final class Lexical {
    private Lexical() {}

    public static final Rule<String> WHITESPACE = Lexical::whitespace;
    public static final Rule<String> LINE_COMMENT = Lexical::lineComment;
    public static final Rule<String> BLOCK_COMMENT = Lexical::blockComment;

    /**
     * Any run of whitespace and comments, possibly empty. Fails only on an unterminated block comment.
     */
    public static final Rule<String> JUNK = Lexical::junk;

    public static final Rule<String> IDENTIFIER = Lexical::identifier;
    public static final Rule<Exp.Var> VARIABLE = IDENTIFIER.map(Exp.Var::new);
    public static final Rule<Boolean> BOOLEAN = Lexical::bool;
    public static final Rule<Long> INTEGER = Lexical::integer;
    public static final Rule<String> STRING = Lexical::string;

    private static final Rule<String> JUNK_ITEM = Combinators.alt(WHITESPACE, LINE_COMMENT, BLOCK_COMMENT);

    private static ParseResult<String> junk(ParsingContext ctx, SourceLocation at) {
        var end = at;
        while (true) {
            var item = JUNK_ITEM.apply(ctx, end);
            if (item instanceof ParseResult.Success<String> skipped) {
                end = skipped.end();
            } else if (item instanceof ParseResult.Failure<String> failure
                       && failure.error() instanceof ParseError.UnterminatedComment) {
                return item;
            } else {
                return ParseResult.success(ctx.substring(at, end), end);
            }
        }
    }

    private static ParseResult<String> whitespace(ParsingContext ctx, SourceLocation at) {
        var end = at;
        while (!ctx.isAtEnd(end) && isWhitespace(ctx.peek(end))) {
            end = end.next(ctx.peek(end));
        }
        if (end.equals(at)) {
            return ParseResult.failure(ctx.unexpected(at, "whitespace"));
        }
        return ParseResult.success(ctx.substring(at, end), end);
    }

    private static ParseResult<String> lineComment(ParsingContext ctx, SourceLocation at) {
        if (!ctx.startsWith(at, "--")) {
            return ParseResult.failure(ctx.unexpected(at, "'--'"));
        }
        // Newline is left for the whitespace rule
        var end = ctx.advance(at, 2);
        while (!ctx.isAtEnd(end) && ctx.peek(end) != '\n') {
            end = end.next(ctx.peek(end));
        }
        return ParseResult.success(ctx.substring(at, end), end);
    }

    private static ParseResult<String> blockComment(ParsingContext ctx, SourceLocation at) {
        if (!ctx.startsWith(at, "/*")) {
            return ParseResult.failure(ctx.unexpected(at, "'/*'"));
        }
        int close = ctx.indexOf("*/", ctx.advance(at, 2));
        if (close < 0) {
            return ParseResult.failure(new ParseError.UnterminatedComment(at));
        }
        var end = ctx.advance(at, close + 2 - at.offset());
        return ParseResult.success(ctx.substring(at, end), end);
    }

    private static ParseResult<String> identifier(ParsingContext ctx, SourceLocation at) {
        if (ctx.isAtEnd(at) || !isIdentifierStart(ctx.peek(at))) {
            return ParseResult.failure(ctx.unexpected(at, "identifier"));
        }
        var end = at.next(ctx.peek(at));
        while (!ctx.isAtEnd(end) && isIdentifierPart(ctx.peek(end))) {
            end = end.next(ctx.peek(end));
        }
        return ParseResult.success(ctx.substring(at, end), end);
    }

    /**
     * Matches the spelling only: {@code truefoo} yields {@code true} and leaves {@code foo}.
     */
    private static ParseResult<Boolean> bool(ParsingContext ctx, SourceLocation at) {
        if (ctx.startsWith(at, "true")) {
            return ParseResult.success(Boolean.TRUE, ctx.advance(at, 4));
        }
        if (ctx.startsWith(at, "false")) {
            return ParseResult.success(Boolean.FALSE, ctx.advance(at, 5));
        }
        return ParseResult.failure(ctx.unexpected(at, "boolean"));
    }

    private static ParseResult<Long> integer(ParsingContext ctx, SourceLocation at) {
        var digitsStart = ctx.startsWith(at, "-") ? ctx.advance(at, 1) : at;
        var end = digitsStart;
        while (!ctx.isAtEnd(end) && isDigit(ctx.peek(end))) {
            end = end.next(ctx.peek(end));
        }
        if (end.equals(digitsStart)) {
            return ParseResult.failure(ctx.unexpected(at, "integer"));
        }
        var text = ctx.substring(at, end);
        try {
            return ParseResult.success(Long.parseLong(text), end);
        } catch (NumberFormatException e) {
            return ParseResult.failure(new ParseError.IntegerOutOfRange(at, text));
        }
    }

    private static ParseResult<String> string(ParsingContext ctx, SourceLocation at) {
        if (!ctx.startsWith(at, "'")) {
            return ParseResult.failure(ctx.unexpected(at, "string literal"));
        }
        var bodyStart = ctx.advance(at, 1);
        int close = ctx.indexOf("'", bodyStart);
        if (close < 0) {
            return ParseResult.failure(new ParseError.UnterminatedString(at));
        }
        var bodyEnd = ctx.advance(bodyStart, close - bodyStart.offset());
        return ParseResult.success(ctx.substring(bodyStart, bodyEnd), bodyEnd.next('\''));
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}

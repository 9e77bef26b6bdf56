package org.pragmatica.relq.parser;

import org.pragmatica.relq.ast.Exp;
import org.pragmatica.relq.error.Diagnostic;
import org.pragmatica.relq.error.ParseError;
import org.pragmatica.relq.source.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point of the expression grammar: skips incidental text around one expression and
 * requires the whole input to be consumed.
 */
public final class RelqEngine implements Parser {
    private static final Logger log = LoggerFactory.getLogger(RelqEngine.class);

    private final ParserConfig config;

    private RelqEngine(ParserConfig config) {
        this.config = config;
    }

    public static RelqEngine create(ParserConfig config) {
        return new RelqEngine(Objects.requireNonNull(config, "config"));
    }

    @Override
    public ParseResult<Exp> parse(String input) {
        return parse(input, Precedence.LET);
    }

    @Override
    public ParseResult<Exp> parse(String input, Precedence startLayer) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(startLayer, "startLayer");

        var ctx = ParsingContext.create(input, config);
        var result = Combinators.padded(ExpressionGrammar.layer(startLayer))
                                .apply(ctx, SourceLocation.START)
                                .flatMap((expression, end) -> requireEnd(ctx, expression, end));

        log.trace("Packrat cache held {} results after parsing {}", ctx.cachedResults(), config.sourceName());
        if (result instanceof ParseResult.Failure<Exp> failure) {
            log.debug("Parsing {} from {} failed: {}", config.sourceName(), startLayer.ruleName(), failure.error().message());
        } else {
            log.debug("Parsed {} characters of {} from {}", input.length(), config.sourceName(), startLayer.ruleName());
        }
        return result;
    }

    @Override
    public ParseResultWithDiagnostics parseWithDiagnostics(String input) {
        return parse(input).fold(
            error -> ParseResultWithDiagnostics.failure(Diagnostic.of(error, input), input, config.sourceName()),
            expression -> ParseResultWithDiagnostics.success(expression, input, config.sourceName())
        );
    }

    private static ParseResult<Exp> requireEnd(ParsingContext ctx, Exp expression, SourceLocation end) {
        if (ctx.isAtEnd(end)) {
            return ParseResult.success(expression, end);
        }
        return ParseResult.failure(new ParseError.UnexpectedInput(end,
                                                                  String.valueOf(ctx.peek(end)),
                                                                  "end of input"));
    }
}

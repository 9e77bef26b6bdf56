package org.pragmatica.relq.parser;

import org.pragmatica.relq.source.SourceLocation;

import java.util.function.Function;

/**
 * A grammar rule: matches input at a location and reports what it matched and where it stopped.
 * Rules hold no state; everything per-parse lives in {@link ParsingContext}.
 */
@FunctionalInterface
public interface Rule<T> {

    ParseResult<T> apply(ParsingContext ctx, SourceLocation at);

    default <R> Rule<R> map(Function<? super T, ? extends R> mapper) {
        return (ctx, at) -> apply(ctx, at).map(mapper);
    }
}

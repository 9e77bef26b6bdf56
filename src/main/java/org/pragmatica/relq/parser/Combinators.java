package org.pragmatica.relq.parser;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Builders that compose rules. Operator builders join their parts with junk and fall back to
 * {@code next} when any part fails; they never retry a different split of the left side.
 */
public final class Combinators {
    private Combinators() {}

    /**
     * Builds the node of a three-operand rule.
     */
    @FunctionalInterface
    public interface TernaryConstructor<L, M, R, T> {
        T apply(L left, M middle, R right);
    }

    /**
     * Exact text. The empty token always matches.
     */
    public static Rule<String> token(String text) {
        return (ctx, at) -> ctx.startsWith(at, text)
                            ? ParseResult.success(text, ctx.advance(at, text.length()))
                            : ParseResult.failure(ctx.unexpected(at, "'" + text + "'"));
    }

    /**
     * Rule surrounded by optional junk.
     */
    public static <T> Rule<T> padded(Rule<T> rule) {
        return (ctx, at) -> Lexical.JUNK.apply(ctx, at)
                                        .flatMap((leading, start) -> rule.apply(ctx, start))
                                        .flatMap((value, end) -> Lexical.JUNK.apply(ctx, end)
                                                                             .map(trailing -> value));
    }

    /**
     * Token surrounded by optional junk.
     */
    public static Rule<String> symbol(String text) {
        return padded(token(text));
    }

    /**
     * Ordered choice. When every alternative fails, the failure of the last one is reported.
     */
    @SafeVarargs
    public static <T> Rule<T> alt(Rule<T>... alternatives) {
        if (alternatives.length == 0) {
            throw new IllegalArgumentException("At least one alternative is required");
        }
        var rules = List.of(alternatives);
        return (ctx, at) -> {
            ParseResult<T> result = null;
            for (var rule : rules) {
                result = rule.apply(ctx, at);
                if (result.isSuccess()) {
                    return result;
                }
            }
            return result;
        };
    }

    /**
     * Replace any failure of {@code rule} with "expected {@code description}" at its start.
     */
    public static <T> Rule<T> expecting(Rule<T> rule, String description) {
        return (ctx, at) -> {
            var result = rule.apply(ctx, at);
            return result.isSuccess()
                   ? result
                   : ParseResult.failure(ctx.unexpected(at, description));
        };
    }

    /**
     * {@code op junk operand}, else {@code next}.
     */
    public static <O, T> Rule<T> unary(String op,
                                       Rule<O> operand,
                                       Function<O, T> constructor,
                                       Rule<T> next) {
        var operator = token(op);
        Rule<T> prefixed = (ctx, at) -> operator.apply(ctx, at)
                                                .flatMap((matched, afterOp) -> Lexical.JUNK.apply(ctx, afterOp))
                                                .flatMap((skipped, start) -> operand.apply(ctx, start))
                                                .map(constructor);
        return alt(prefixed, next);
    }

    /**
     * {@code left junk op junk right}, else {@code next}.
     */
    public static <L, R, T> Rule<T> binary(Rule<L> left,
                                           String op,
                                           Rule<R> right,
                                           BiFunction<L, R, T> constructor,
                                           Rule<T> next) {
        var operator = symbol(op);
        Rule<T> infix = (ctx, at) -> left.apply(ctx, at)
                                         .flatMap((lhs, afterLeft) -> operator.apply(ctx, afterLeft)
                                                                              .flatMap((matched, start) -> right.apply(ctx, start))
                                                                              .map(rhs -> constructor.apply(lhs, rhs)));
        return alt(infix, next);
    }

    /**
     * {@code left junk opLeft junk middle junk opRight junk right}, else {@code next}.
     * {@code opRight} may be empty, in which case middle and right are separated by junk only.
     */
    public static <L, M, R, T> Rule<T> ternary(Rule<L> left,
                                               String opLeft,
                                               Rule<M> middle,
                                               String opRight,
                                               Rule<R> right,
                                               TernaryConstructor<L, M, R, T> constructor,
                                               Rule<T> next) {
        var leftOperator = symbol(opLeft);
        var rightOperator = symbol(opRight);
        Rule<T> infix = (ctx, at) -> left.apply(ctx, at)
                                         .flatMap((lhs, afterLeft) -> leftOperator.apply(ctx, afterLeft)
                                                                                  .flatMap((matched, start) -> middle.apply(ctx, start))
                                                                                  .flatMap((mid, afterMiddle) -> rightOperator.apply(ctx, afterMiddle)
                                                                                                                              .flatMap((matched, start) -> right.apply(ctx, start))
                                                                                                                              .map(rhs -> constructor.apply(lhs, mid, rhs))));
        return alt(infix, next);
    }
}

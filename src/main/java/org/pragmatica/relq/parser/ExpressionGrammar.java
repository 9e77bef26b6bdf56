package org.pragmatica.relq.parser;

import org.pragmatica.relq.ast.Exp;
import org.pragmatica.relq.source.SourceLocation;

import java.util.ArrayList;
import java.util.List;

import static org.pragmatica.relq.parser.Combinators.binary;
import static org.pragmatica.relq.parser.Combinators.expecting;
import static org.pragmatica.relq.parser.Combinators.padded;
import static org.pragmatica.relq.parser.Combinators.ternary;
import static org.pragmatica.relq.parser.Combinators.token;
import static org.pragmatica.relq.parser.Combinators.unary;
import static org.pragmatica.relq.parser.Lexical.VARIABLE;

/**
 * Precedence cascade of the Relq grammar, from {@code Let} down to atoms.
 *
 * <p>Each layer is a method so that layers can refer to each other before the rule fields are
 * initialized. Layer results are memoized per offset through {@link ParsingContext#memoize}.
 * Every operator chain is right-recursive, so {@code a - b - c} groups as {@code a - (b - c)}.
 */
final class ExpressionGrammar {
    private ExpressionGrammar() {}

    private static final Rule<String> OPEN = token("(");
    private static final Rule<String> CLOSE = token(")");

    private static final Rule<Exp> PROGRAM = padded(ExpressionGrammar::let);

    private static final Rule<Exp> PARENS = (ctx, at) -> OPEN.apply(ctx, at)
                                                             .flatMap((open, start) -> program(ctx, start))
                                                             .flatMap((inner, end) -> CLOSE.apply(ctx, end)
                                                                                           .map(close -> inner));

    private static final Rule<Exp> ATOM = expecting(Combinators.<Exp>alt(PARENS,
                                                                         Lexical.BOOLEAN.<Exp>map(Exp.Bool::new),
                                                                         Lexical.INTEGER.<Exp>map(Exp.Int::new),
                                                                         Lexical.STRING.<Exp>map(Exp.Str::new),
                                                                         VARIABLE.<Exp>map(variable -> variable)),
                                                    "expression");

    private static final Rule<Exp> NOT = unary("!", ExpressionGrammar::not, Exp.Not::new, ExpressionGrammar::atom);
    private static final Rule<Exp> AND = binary(ExpressionGrammar::not, "&", ExpressionGrammar::and, Exp.And::new, ExpressionGrammar::not);
    private static final Rule<Exp> OR = binary(ExpressionGrammar::and, "|", ExpressionGrammar::or, Exp.Or::new, ExpressionGrammar::and);
    private static final Rule<Exp> EQUALS = binary(ExpressionGrammar::or, "==", ExpressionGrammar::equality, Exp.Equals::new, ExpressionGrammar::or);
    private static final Rule<Exp> CELL = binary(VARIABLE, ":", ExpressionGrammar::cell, Exp.Cell::new, ExpressionGrammar::equality);
    private static final Rule<Exp> ROW = binary(ExpressionGrammar::cell, ",", ExpressionGrammar::row, Exp.Row::new, ExpressionGrammar::cell);
    private static final Rule<Exp> TABLE = binary(ExpressionGrammar::row, ";", ExpressionGrammar::table, Exp.Table::new, ExpressionGrammar::row);
    private static final Rule<Exp> PRODUCT = binary(ExpressionGrammar::table, "*", ExpressionGrammar::product, Exp.Product::new, ExpressionGrammar::table);
    private static final Rule<Exp> DIFFERENCE = binary(ExpressionGrammar::product, "-", ExpressionGrammar::difference, Exp.Difference::new, ExpressionGrammar::product);
    private static final Rule<Exp> UNION = binary(ExpressionGrammar::difference, "+", ExpressionGrammar::union, Exp.Union::new, ExpressionGrammar::difference);
    private static final Rule<Exp> WHERE = binary(ExpressionGrammar::union, "?", ExpressionGrammar::where, Exp.Where::new, ExpressionGrammar::union);

    // One variable, optionally followed by ", more-variables"
    private static final Rule<List<Exp.Var>> VARIABLES = binary(VARIABLE,
                                                                ",",
                                                                ExpressionGrammar::variables,
                                                                ExpressionGrammar::prepend,
                                                                VARIABLE.<List<Exp.Var>>map(single -> List.of(single)));

    private static final Rule<Exp> SELECT = binary(ExpressionGrammar::variables, "<-", ExpressionGrammar::select, Exp.Select::new, ExpressionGrammar::where);

    // Bound expression and body are separated by junk only
    private static final Rule<Exp> LET = ternary(VARIABLE, "=", ExpressionGrammar::let, "", ExpressionGrammar::let, Exp.Let::new, ExpressionGrammar::select);

    /**
     * Rule for the given layer.
     */
    static Rule<Exp> layer(Precedence precedence) {
        return switch (precedence) {
            case LET -> ExpressionGrammar::let;
            case SELECT -> ExpressionGrammar::select;
            case WHERE -> ExpressionGrammar::where;
            case UNION -> ExpressionGrammar::union;
            case DIFFERENCE -> ExpressionGrammar::difference;
            case PRODUCT -> ExpressionGrammar::product;
            case TABLE -> ExpressionGrammar::table;
            case ROW -> ExpressionGrammar::row;
            case CELL -> ExpressionGrammar::cell;
            case EQUALS -> ExpressionGrammar::equality;
            case OR -> ExpressionGrammar::or;
            case AND -> ExpressionGrammar::and;
            case NOT -> ExpressionGrammar::not;
            case ATOM -> ExpressionGrammar::atom;
        };
    }

    /**
     * Junk, one {@code Let}-level expression, junk. Does not require end of input.
     */
    static ParseResult<Exp> program(ParsingContext ctx, SourceLocation at) {
        return ctx.memoize("Program", at, PROGRAM);
    }

    static ParseResult<Exp> let(ParsingContext ctx, SourceLocation at) {
        return ctx.memoize(Precedence.LET.ruleName(), at, LET);
    }

    static ParseResult<Exp> select(ParsingContext ctx, SourceLocation at) {
        return ctx.memoize(Precedence.SELECT.ruleName(), at, SELECT);
    }

    static ParseResult<List<Exp.Var>> variables(ParsingContext ctx, SourceLocation at) {
        return VARIABLES.apply(ctx, at);
    }

    static ParseResult<Exp> where(ParsingContext ctx, SourceLocation at) {
        return ctx.memoize(Precedence.WHERE.ruleName(), at, WHERE);
    }

    static ParseResult<Exp> union(ParsingContext ctx, SourceLocation at) {
        return ctx.memoize(Precedence.UNION.ruleName(), at, UNION);
    }

    static ParseResult<Exp> difference(ParsingContext ctx, SourceLocation at) {
        return ctx.memoize(Precedence.DIFFERENCE.ruleName(), at, DIFFERENCE);
    }

    static ParseResult<Exp> product(ParsingContext ctx, SourceLocation at) {
        return ctx.memoize(Precedence.PRODUCT.ruleName(), at, PRODUCT);
    }

    static ParseResult<Exp> table(ParsingContext ctx, SourceLocation at) {
        return ctx.memoize(Precedence.TABLE.ruleName(), at, TABLE);
    }

    static ParseResult<Exp> row(ParsingContext ctx, SourceLocation at) {
        return ctx.memoize(Precedence.ROW.ruleName(), at, ROW);
    }

    static ParseResult<Exp> cell(ParsingContext ctx, SourceLocation at) {
        return ctx.memoize(Precedence.CELL.ruleName(), at, CELL);
    }

    static ParseResult<Exp> equality(ParsingContext ctx, SourceLocation at) {
        return ctx.memoize(Precedence.EQUALS.ruleName(), at, EQUALS);
    }

    static ParseResult<Exp> or(ParsingContext ctx, SourceLocation at) {
        return ctx.memoize(Precedence.OR.ruleName(), at, OR);
    }

    static ParseResult<Exp> and(ParsingContext ctx, SourceLocation at) {
        return ctx.memoize(Precedence.AND.ruleName(), at, AND);
    }

    static ParseResult<Exp> not(ParsingContext ctx, SourceLocation at) {
        return ctx.memoize(Precedence.NOT.ruleName(), at, NOT);
    }

    static ParseResult<Exp> atom(ParsingContext ctx, SourceLocation at) {
        return ctx.memoize(Precedence.ATOM.ruleName(), at, ATOM);
    }

    private static List<Exp.Var> prepend(Exp.Var head, List<Exp.Var> tail) {
        var vars = new ArrayList<Exp.Var>(tail.size() + 1);
        vars.add(head);
        vars.addAll(tail);
        return vars;
    }
}

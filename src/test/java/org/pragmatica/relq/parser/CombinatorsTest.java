package org.pragmatica.relq.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.relq.error.ParseError;
import org.pragmatica.relq.source.SourceLocation;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.relq.parser.Combinators.*;

/**
 * Tests for rule builders, using identifiers as operands.
 */
class CombinatorsTest {

    private static final Rule<String> WORD = Lexical.IDENTIFIER;

    private static final Rule<String> SUM = binary(WORD, "+", CombinatorsTest::sum, (l, r) -> "(" + l + "+" + r + ")", WORD);

    private static final Rule<String> SIGN = unary("#", CombinatorsTest::sign, s -> "#" + s, WORD);

    private static final Rule<String> CHOICE = ternary(WORD, "?", WORD, ":", WORD, (c, t, f) -> c + "->" + t + "|" + f, WORD);

    private static final Rule<String> BINDING = ternary(WORD, "=", WORD, "", WORD, (n, v, b) -> n + ":=" + v + " in " + b, WORD);

    private static ParseResult<String> sum(ParsingContext ctx, SourceLocation at) {
        return SUM.apply(ctx, at);
    }

    private static ParseResult<String> sign(ParsingContext ctx, SourceLocation at) {
        return SIGN.apply(ctx, at);
    }

    // === Tokens ===

    @Test
    void token_matchesExactText() {
        var result = apply(token("<-"), "<- x");

        assertEquals("<-", result.unwrap());
        assertEquals(2, endOffset(result));
    }

    @Test
    void token_empty_matchesWithoutConsuming() {
        var result = apply(token(""), "x");

        assertTrue(result.isSuccess());
        assertEquals(0, endOffset(result));
    }

    @Test
    void token_mismatch_reportsQuotedExpectation() {
        var result = apply(token("<-"), "<x");

        assertEquals(new ParseError.UnexpectedInput(SourceLocation.START, "<", "'<-'"), error(result));
    }

    @Test
    void symbol_consumesSurroundingJunk() {
        var result = apply(symbol("?"), " /* c */ ? -- note\n x");

        assertEquals("?", result.unwrap());
        assertEquals(20, endOffset(result));
    }

    // === Choice ===

    @Test
    void alt_returnsFirstSuccess() {
        var result = apply(alt(token("a"), token("ab")), "ab");

        assertEquals("a", result.unwrap());
    }

    @Test
    void alt_allFail_reportsLastFailure() {
        var result = apply(alt(token("a"), token("b")), "c");

        assertEquals(new ParseError.UnexpectedInput(SourceLocation.START, "c", "'b'"), error(result));
    }

    @Test
    void alt_withoutAlternatives_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> Combinators.<String>alt());
    }

    @Test
    void expecting_relabelsFailureAtStart() {
        var result = apply(expecting(token("a"), "letter a"), "b");

        assertEquals(new ParseError.UnexpectedInput(SourceLocation.START, "b", "letter a"), error(result));
    }

    // === Operators ===

    @Test
    void binary_chain_groupsToTheRight() {
        assertEquals("(a+(b+c))", apply(SUM, "a + b + c").unwrap());
        assertEquals("(a+b)", apply(SUM, "a+b").unwrap());
    }

    @Test
    void binary_missingRightOperand_fallsBackToNext() {
        var result = apply(SUM, "a + ");

        assertEquals("a", result.unwrap());
        assertEquals(1, endOffset(result));
    }

    @Test
    void binary_missingOperator_fallsBackToNext() {
        var result = apply(SUM, "a b");

        assertEquals("a", result.unwrap());
        assertEquals(1, endOffset(result));
    }

    @Test
    void unary_nested_appliesInnermostFirst() {
        assertEquals("##x", apply(SIGN, "# #x").unwrap());
        assertEquals("y", apply(SIGN, "y").unwrap());
    }

    @Test
    void unary_operatorWithoutOperand_failsThroughNext() {
        var result = apply(SIGN, "#");

        assertTrue(result.isFailure());
        assertEquals(new ParseError.UnexpectedInput(SourceLocation.START, "#", "identifier"), error(result));
    }

    @Test
    void ternary_matchesAllParts() {
        assertEquals("c->t|f", apply(CHOICE, "c ? t : f").unwrap());
    }

    @Test
    void ternary_missingSecondOperator_fallsBackToNext() {
        var result = apply(CHOICE, "c ? t f");

        assertEquals("c", result.unwrap());
        assertEquals(1, endOffset(result));
    }

    @Test
    void ternary_emptySecondOperator_separatesByJunk() {
        assertEquals("x:=y in z", apply(BINDING, "x = y\n-- body\nz").unwrap());
    }

    private static <T> ParseResult<T> apply(Rule<T> rule, String input) {
        return rule.apply(ParsingContext.create(input, ParserConfig.DEFAULT), SourceLocation.START);
    }

    private static int endOffset(ParseResult<?> result) {
        return ((ParseResult.Success<?>) result).end().offset();
    }

    private static ParseError error(ParseResult<?> result) {
        return ((ParseResult.Failure<?>) result).error();
    }
}

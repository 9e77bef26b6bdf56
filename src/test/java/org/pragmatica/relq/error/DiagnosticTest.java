package org.pragmatica.relq.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.relq.source.SourceLocation;
import org.pragmatica.relq.source.SourceSpan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    @Test
    void of_unexpectedInput_underlinesOneCharacter() {
        var at = SourceLocation.at(1, 3, 2);
        var diagnostic = Diagnostic.of(new ParseError.UnexpectedInput(at, "=", "end of input"), "x == ");

        assertEquals("E0001", diagnostic.code());
        assertEquals(SourceSpan.of(at, SourceLocation.at(1, 4, 3)), diagnostic.span());
        assertEquals("expected end of input", diagnostic.label());
        assertTrue(diagnostic.notes().isEmpty());
    }

    @Test
    void of_unexpectedEof_hasEmptySpan() {
        var at = SourceLocation.at(1, 5, 4);
        var diagnostic = Diagnostic.of(new ParseError.UnexpectedEof(at, "expression"), "x = ");

        assertEquals("E0002", diagnostic.code());
        assertTrue(diagnostic.span().isEmpty());
        assertThat(diagnostic.format("x = ", "query.relq")).contains("  |     ^ expected expression\n");
    }

    @Test
    void of_integerOutOfRange_coversDigitsAndNotesRange() {
        var digits = "99999999999999999999";
        var diagnostic = Diagnostic.of(new ParseError.IntegerOutOfRange(SourceLocation.START, digits), digits);

        assertEquals("E0005", diagnostic.code());
        assertEquals(digits.length(), diagnostic.span().length());
        assertEquals(digits, diagnostic.span().extract(digits));
        assertThat(diagnostic.notes()).containsExactly("allowed range is -9223372036854775808 to 9223372036854775807");
    }

    @Test
    void of_unterminatedString_suggestsFix() {
        var diagnostic = Diagnostic.of(new ParseError.UnterminatedString(SourceLocation.START), "'open");

        assertEquals("E0004", diagnostic.code());
        assertThat(diagnostic.notes()).containsExactly("help: string literals cannot contain an apostrophe");
    }

    @Test
    void format_unterminatedComment_rendersSourceExcerpt() {
        var source = "x /* open";
        var diagnostic = Diagnostic.of(new ParseError.UnterminatedComment(SourceLocation.at(1, 3, 2)), source);

        assertEquals("""
            error[E0003]: unterminated block comment
              --> query.relq:1:3
              |
            1 | x /* open
              |   ^^ comment opened here
              |
              = help: block comments do not nest and end at the first '*/'
            """, diagnostic.format(source, "query.relq"));
    }

    @Test
    void format_widensGutterForLongLineNumbers() {
        var source = "\n".repeat(9) + "x /* open";
        var diagnostic = Diagnostic.of(new ParseError.UnterminatedComment(SourceLocation.at(10, 3, 11)), source);

        assertThat(diagnostic.format(source, "query.relq"))
            .contains("  --> query.relq:10:3\n")
            .contains("10 | x /* open\n")
            .contains("   |   ^^ comment opened here\n");
    }

    @Test
    void formatSimple_joinsMessageAndLabel() {
        var diagnostic = Diagnostic.of(new ParseError.UnterminatedComment(SourceLocation.at(1, 3, 2)), "x /* open");

        assertEquals("query.relq:1:3: error: unterminated block comment, comment opened here",
                     diagnostic.formatSimple("query.relq"));
    }

    @Test
    void withNote_keepsEarlierNotes() {
        var diagnostic = Diagnostic.of(new ParseError.UnexpectedEof(SourceLocation.START, "expression"), "")
                                   .withNote("first")
                                   .withHelp("second");

        assertThat(diagnostic.notes()).containsExactly("first", "help: second");
    }
}

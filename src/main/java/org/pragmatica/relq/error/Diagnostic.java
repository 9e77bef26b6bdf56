package org.pragmatica.relq.error;

import org.pragmatica.relq.source.SourceLocation;
import org.pragmatica.relq.source.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Renderable report of a parse failure.
 *
 * <p>Example output:
 * <pre>
 * error[E0003]: unterminated block comment
 *   --> staff.relq:3:5
 *    |
 *  3 | bob /* rows
 *    |     ^^ comment opened here
 *    |
 *    = help: block comments do not nest and end at the first '*&#47;'
 * </pre>
 *
 * @param code    error code, one per {@link ParseError} variant
 * @param message primary message
 * @param span    source span the caret underline covers
 * @param label   text printed after the underline, may be empty
 * @param notes   trailing notes
 */
public record Diagnostic(
    String code,
    String message,
    SourceSpan span,
    String label,
    List<String> notes
) {
    /**
     * Build the diagnostic for a parse error against the source it came from.
     */
    public static Diagnostic of(ParseError error, String source) {
        var start = error.location();
        if (error instanceof ParseError.UnexpectedInput unexpected) {
            var span = SourceSpan.of(start, advance(start, source, 1));
            return new Diagnostic("E0001", "unexpected input", span, "expected " + unexpected.expected(), List.of());
        }
        if (error instanceof ParseError.UnexpectedEof eof) {
            return new Diagnostic("E0002", "unexpected end of input", SourceSpan.at(start), "expected " + eof.expected(), List.of());
        }
        if (error instanceof ParseError.UnterminatedComment) {
            var span = SourceSpan.of(start, advance(start, source, 2));
            return new Diagnostic("E0003", "unterminated block comment", span, "comment opened here", List.of())
                   .withHelp("block comments do not nest and end at the first '*/'");
        }
        if (error instanceof ParseError.UnterminatedString) {
            var span = SourceSpan.of(start, advance(start, source, 1));
            return new Diagnostic("E0004", "unterminated string literal", span, "string opened here", List.of())
                   .withHelp("string literals cannot contain an apostrophe");
        }
        var range = (ParseError.IntegerOutOfRange) error;
        var span = SourceSpan.of(start, advance(start, source, range.digits().length()));
        return new Diagnostic("E0005", "integer literal out of range", span, "does not fit in 64 bits", List.of())
               .withNote("allowed range is " + Long.MIN_VALUE + " to " + Long.MAX_VALUE);
    }

    private static SourceLocation advance(SourceLocation from, String source, int count) {
        var location = from;
        for (int i = 0; i < count && location.offset() < source.length(); i++) {
            location = location.next(source.charAt(location.offset()));
        }
        return location;
    }

    /**
     * Add a note.
     */
    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(code, message, span, label, List.copyOf(newNotes));
    }

    /**
     * Add a help suggestion.
     */
    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic with a source excerpt.
     *
     * @param source   The source text
     * @param filename Optional filename for display
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        var loc = span.start();

        sb.append("error[").append(code).append("]: ").append(message).append("\n");

        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc).append("\n");

        int gutterWidth = String.valueOf(loc.line()).length();
        var gutter = " ".repeat(gutterWidth + 1);

        sb.append(gutter).append("|\n");

        if (loc.line() <= lines.length) {
            var lineContent = lines[loc.line() - 1];
            sb.append(String.format("%" + gutterWidth + "d", loc.line()))
              .append(" | ")
              .append(lineContent)
              .append("\n");

            // Underline stops at the end of the first line for spans crossing a newline
            int width = span.end().line() == loc.line()
                        ? span.end().column() - loc.column()
                        : lineContent.length() + 1 - loc.column();
            sb.append(gutter).append("| ")
              .append(" ".repeat(loc.column() - 1))
              .append("^".repeat(Math.max(1, width)));
            if (!label.isEmpty()) {
                sb.append(" ").append(label);
            }
            sb.append("\n");
        }

        sb.append(gutter).append("|\n");

        for (var note : notes) {
            sb.append(gutter).append("= ").append(note).append("\n");
        }

        return sb.toString();
    }

    /**
     * Simple single-line format for logs.
     */
    public String formatSimple(String filename) {
        var loc = span.start();
        return String.format("%s:%d:%d: error: %s",
            filename, loc.line(), loc.column(), label.isEmpty() ? message : message + ", " + label);
    }
}

package org.pragmatica.relq.parser;

import org.pragmatica.relq.ast.Exp;
import org.pragmatica.relq.error.Diagnostic;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a parse together with the diagnostic explaining a failure.
 *
 * <p>On success {@code expression} is present and {@code diagnostics} is empty. On failure
 * {@code expression} is empty and {@code diagnostics} holds exactly one entry: parsing stops
 * at the first failure.
 *
 * @param expression  The parsed tree, or empty if parsing failed
 * @param diagnostics Diagnostic messages (empty on success)
 * @param source      The original source text (for formatting diagnostics)
 * @param sourceName  Name shown in formatted diagnostics
 */
public record ParseResultWithDiagnostics(
    Optional<Exp> expression,
    List<Diagnostic> diagnostics,
    String source,
    String sourceName
) {
    public static ParseResultWithDiagnostics success(Exp expression, String source, String sourceName) {
        return new ParseResultWithDiagnostics(Optional.of(expression), List.of(), source, sourceName);
    }

    public static ParseResultWithDiagnostics failure(Diagnostic diagnostic, String source, String sourceName) {
        return new ParseResultWithDiagnostics(Optional.empty(), List.of(diagnostic), source, sourceName);
    }

    public boolean isSuccess() {
        return expression.isPresent();
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Format all diagnostics with a source excerpt.
     */
    public String formatDiagnostics() {
        var sb = new StringBuilder();
        for (var diag : diagnostics) {
            sb.append(diag.format(source, sourceName));
        }
        return sb.toString();
    }
}

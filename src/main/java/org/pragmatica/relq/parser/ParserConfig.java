package org.pragmatica.relq.parser;

/**
 * Parser configuration options.
 *
 * @param packratEnabled memoize precedence layer results per input offset
 * @param maxInputSize   largest accepted input, in characters
 * @param sourceName     name shown in rendered diagnostics
 */
public record ParserConfig(
    boolean packratEnabled,
    int maxInputSize,
    String sourceName
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        true,
        1_000_000,
        "input"
    );

    public ParserConfig {
        if (maxInputSize <= 0) {
            throw new IllegalArgumentException("maxInputSize must be positive, got " + maxInputSize);
        }
        if (sourceName == null || sourceName.isBlank()) {
            throw new IllegalArgumentException("sourceName must not be blank");
        }
    }
}

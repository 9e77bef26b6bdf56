package org.pragmatica.relq;

import org.pragmatica.relq.ast.Exp;
import org.pragmatica.relq.parser.ParseResult;
import org.pragmatica.relq.parser.Parser;
import org.pragmatica.relq.parser.ParserConfig;
import org.pragmatica.relq.parser.RelqEngine;

/**
 * Entry point for creating Relq parsers.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = RelqParser.create();
 *
 * var result = parser.parse("""
 *     Staff = name: 'Alice', id: 1; name: 'Bob', id: 2
 *     name <- Staff ? id == 2
 *     """);
 * }</pre>
 */
public final class RelqParser {
    private RelqParser() {}

    /**
     * Create a parser with default configuration.
     */
    public static Parser create() {
        return create(ParserConfig.DEFAULT);
    }

    /**
     * Create a parser with custom configuration.
     */
    public static Parser create(ParserConfig config) {
        return RelqEngine.create(config);
    }

    /**
     * Parse a complete program with default configuration.
     */
    public static ParseResult<Exp> parse(String input) {
        return create().parse(input);
    }

    /**
     * Create a builder for parser configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean packratEnabled = ParserConfig.DEFAULT.packratEnabled();
        private int maxInputSize = ParserConfig.DEFAULT.maxInputSize();
        private String sourceName = ParserConfig.DEFAULT.sourceName();

        private Builder() {}

        public Builder packrat(boolean enabled) {
            this.packratEnabled = enabled;
            return this;
        }

        public Builder maxInputSize(int maxInputSize) {
            this.maxInputSize = maxInputSize;
            return this;
        }

        public Builder sourceName(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Parser build() {
            return create(new ParserConfig(packratEnabled, maxInputSize, sourceName));
        }
    }
}

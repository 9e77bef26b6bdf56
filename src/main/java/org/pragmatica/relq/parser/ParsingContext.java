package org.pragmatica.relq.parser;

import org.pragmatica.relq.error.ParseError;
import org.pragmatica.relq.source.SourceLocation;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-parse state: the input text and the packrat cache.
 * Positions are passed around as immutable {@link SourceLocation}s; only the cache mutates.
 */
public final class ParsingContext {

    private final String input;
    private final Map<Long, ParseResult<?>> packratCache;
    private final Map<String, Integer> ruleIds;

    private ParsingContext(String input, ParserConfig config) {
        this.input = input;
        this.packratCache = config.packratEnabled() ? new HashMap<>() : null;
        this.ruleIds = config.packratEnabled() ? new HashMap<>() : null;
    }

    public static ParsingContext create(String input, ParserConfig config) {
        if (input.length() > config.maxInputSize()) {
            throw new IllegalArgumentException(
            "Input exceeds maximum size of " + config.maxInputSize() + " characters");
        }
        return new ParsingContext(input, config);
    }

    // === Character Access ===

    public boolean isAtEnd(SourceLocation at) {
        return at.offset() >= input.length();
    }

    public char peek(SourceLocation at) {
        return input.charAt(at.offset());
    }

    public boolean startsWith(SourceLocation at, String text) {
        return input.startsWith(text, at.offset());
    }

    /**
     * Offset of the next occurrence of {@code text} at or after {@code at}, or -1.
     */
    public int indexOf(String text, SourceLocation at) {
        return input.indexOf(text, at.offset());
    }

    /**
     * Location {@code count} characters after {@code from}, keeping line and column in step.
     */
    public SourceLocation advance(SourceLocation from, int count) {
        var location = from;
        for (int i = 0; i < count; i++) {
            location = location.next(input.charAt(location.offset()));
        }
        return location;
    }

    public String substring(SourceLocation start, SourceLocation end) {
        return input.substring(start.offset(), end.offset());
    }

    // === Error Construction ===

    /**
     * Failure describing what was found at {@code at} instead of {@code expected}.
     */
    public ParseError unexpected(SourceLocation at, String expected) {
        if (isAtEnd(at)) {
            return new ParseError.UnexpectedEof(at, expected);
        }
        return new ParseError.UnexpectedInput(at, String.valueOf(peek(at)), expected);
    }

    // === Packrat Cache ===

    /**
     * Apply {@code rule} at {@code at}, reusing an earlier result for the same rule and offset.
     */
    @SuppressWarnings("unchecked")
    public <T> ParseResult<T> memoize(String ruleName, SourceLocation at, Rule<T> rule) {
        if (packratCache == null) {
            return rule.apply(this, at);
        }
        long key = packratKey(ruleName, at.offset());
        var cached = packratCache.get(key);
        if (cached != null) {
            return (ParseResult<T>) cached;
        }
        var result = rule.apply(this, at);
        packratCache.put(key, result);
        return result;
    }

    int cachedResults() {
        return packratCache == null ? 0 : packratCache.size();
    }

    private long packratKey(String ruleName, int position) {
        int ruleId = ruleIds.computeIfAbsent(ruleName, k -> ruleIds.size());
        return ((long) ruleId << 32) | (position & 0xFFFFFFFFL);
    }
}

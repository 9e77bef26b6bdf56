package org.pragmatica.relq.parser;

import org.pragmatica.relq.error.ParseError;
import org.pragmatica.relq.error.ParseException;
import org.pragmatica.relq.source.SourceLocation;

import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Result of applying a rule - either a value with the location where it ends, or a failure.
 */
public sealed interface ParseResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    <R> ParseResult<R> map(Function<? super T, ? extends R> mapper);

    /**
     * Continue with a rule applied at the end location of this result.
     */
    <R> ParseResult<R> flatMap(BiFunction<? super T, SourceLocation, ParseResult<R>> next);

    <R> R fold(Function<? super ParseError, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess);

    /**
     * Value of a successful result.
     *
     * @throws ParseException if this is a failure
     */
    T unwrap();

    static <T> ParseResult<T> success(T value, SourceLocation end) {
        return new Success<>(value, end);
    }

    static <T> ParseResult<T> failure(ParseError error) {
        return new Failure<>(error);
    }

    /**
     * Matched value and the location right after the matched text.
     */
    record Success<T>(T value, SourceLocation end) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value), end);
        }

        @Override
        public <R> ParseResult<R> flatMap(BiFunction<? super T, SourceLocation, ParseResult<R>> next) {
            return next.apply(value, end);
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }

        @Override
        public T unwrap() {
            return value;
        }
    }

    /**
     * No match. Nothing was consumed.
     */
    record Failure<T>(ParseError error) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Failure<>(error);
        }

        @Override
        public <R> ParseResult<R> flatMap(BiFunction<? super T, SourceLocation, ParseResult<R>> next) {
            return new Failure<>(error);
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onFailure.apply(error);
        }

        @Override
        public T unwrap() {
            throw new ParseException(error);
        }
    }
}

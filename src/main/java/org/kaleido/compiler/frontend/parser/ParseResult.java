package org.kaleido.compiler.frontend.parser;

import java.util.function.Function;

/**
 * The outcome of a parser operation: either the parsed value or the error that stopped it.
 * A failure never carries a partial tree.
 *
 * @param <T> The type of the parsed value.
 */
public sealed interface ParseResult<T> permits ParseResult.Ok, ParseResult.Failure {

    /**
     * A successful parse.
     * @param value The parsed value.
     * @param <T> The type of the parsed value.
     */
    record Ok<T>(T value) implements ParseResult<T> {}

    /**
     * A failed parse.
     * @param error The error.
     * @param <T> The type the parse would have produced.
     */
    record Failure<T>(ParseError error) implements ParseResult<T> {}

    static <T> ParseResult<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> ParseResult<T> failure(ParseError error) {
        return new Failure<>(error);
    }

    /**
     * @return true if the parse succeeded.
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * @return The parsed value.
     * @throws IllegalStateException if the parse failed.
     */
    default T value() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        throw new IllegalStateException("Parse failed: " + ((Failure<T>) this).error());
    }

    /**
     * @return The error.
     * @throws IllegalStateException if the parse succeeded.
     */
    default ParseError error() {
        if (this instanceof Failure<T> failure) {
            return failure.error();
        }
        throw new IllegalStateException("Parse succeeded, no error.");
    }

    /**
     * Transforms the value of a successful parse; failures pass through unchanged.
     * @param mapper The transformation.
     * @param <R> The new value type.
     * @return The transformed result.
     */
    default <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Ok<T> ok) {
            return new Ok<>(mapper.apply(ok.value()));
        }
        return new Failure<>(error());
    }
}

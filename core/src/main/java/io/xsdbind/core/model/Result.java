package io.xsdbind.core.model;

import java.util.Objects;

/**
 * One step of a decode or encode stream: either a produced value or an error. Streams yield any
 * number of {@link Error} steps and end with exactly one {@link Value}.
 *
 * @param <T> the value type
 */
public sealed interface Result<T> {

    /** Returns {@code true} for a {@link Value} step. */
    boolean isValue();

    static <T> Result<T> value(T value) {
        return new Value<>(value);
    }

    static <T> Result<T> error(ValidationError error) {
        return new Error<>(error);
    }

    /** A produced value. The payload may be {@code null} (e.g. a nil element). */
    record Value<T>(T value) implements Result<T> {
        @Override
        public boolean isValue() {
            return true;
        }
    }

    /** A reported failure. */
    record Error<T>(ValidationError error) implements Result<T> {
        public Error {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isValue() {
            return false;
        }
    }
}

package org.kidoni.calc;

import java.util.Objects;
import java.util.function.Function;

public sealed interface Result<T> {
    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(CalcError error) {
        return new Err<>(error);
    }

    default boolean isOk() {
        return this instanceof Ok<T>;
    }

    default <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (this instanceof Ok<T> ok) {
            return mapper.apply(ok.value());
        }
        return new Err<>(((Err<T>) this).error());
    }

    /**
     * @return the value of an {@link Ok}
     * @throws CalcException carrying the error of an {@link Err}
     */
    default T orElseThrow() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        CalcError error = ((Err<T>) this).error();
        throw new CalcException(error.kind(), error.message());
    }

    record Ok<T>(T value) implements Result<T> {
        public Ok {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record Err<T>(CalcError error) implements Result<T> {
        public Err {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public String toString() {
            return error.toString();
        }
    }
}

package com.xpdustry.lexicon.common.functional;

import java.util.function.Function;

public sealed interface Result<V, E> {

    static <V, E> Result<V, E> success(final V value) {
        return new Success<>(value);
    }

    static <V, E> Result<V, E> failure(final E error) {
        return new Failure<>(error);
    }

    V value();

    E error();

    boolean isSuccess();

    <R> Result<R, E> map(final Function<? super V, ? extends R> mapper);

    record Success<V, E>(V value) implements Result<V, E> {

        @Override
        public E error() {
            throw new NullPointerException("This success has no error");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <R> Result<R, E> map(final Function<? super V, ? extends R> mapper) {
            return new Success<>(mapper.apply(this.value));
        }
    }

    record Failure<V, E>(E error) implements Result<V, E> {

        @Override
        public V value() {
            throw new NullPointerException("This failure has no value");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <R> Result<R, E> map(final Function<? super V, ? extends R> mapper) {
            return new Failure<>(this.error);
        }
    }
}

package org.pragmatica.config;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/// Value of one of two types.
///
/// Used both as the result of reading and writing (failure on the left, success on the right)
/// and as the value type produced by `orElseEither` descriptors.
///
/// @param <L> Left type
/// @param <R> Right type
public sealed interface Either<L, R> {
    /// Fold both alternatives into a single value.
    <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight);

    default boolean isLeft() {
        return this instanceof Left;
    }

    default boolean isRight() {
        return !isLeft();
    }

    default <T> Either<L, T> map(Function<? super R, ? extends T> mapper) {
        return this.<Either<L, T>>fold(Either::left, value -> right(mapper.apply(value)));
    }

    default <T> Either<T, R> mapLeft(Function<? super L, ? extends T> mapper) {
        return this.<Either<T, R>>fold(value -> left(mapper.apply(value)), Either::right);
    }

    default <T> Either<L, T> flatMap(Function<? super R, Either<L, T>> mapper) {
        return this.<Either<L, T>>fold(Either::left, mapper);
    }

    default Either<L, R> onLeft(Consumer<? super L> action) {
        if (this instanceof Left<L, R> left) {
            action.accept(left.value());
        }
        return this;
    }

    default Either<L, R> onRight(Consumer<? super R> action) {
        if (this instanceof Right<L, R> right) {
            action.accept(right.value());
        }
        return this;
    }

    default Optional<L> leftValue() {
        return this.<Optional<L>>fold(Optional::of, right -> Optional.empty());
    }

    default Optional<R> rightValue() {
        return this.<Optional<R>>fold(left -> Optional.empty(), Optional::of);
    }

    default R orElse(R other) {
        return this.<R>fold(left -> other, right -> right);
    }

    /// Return the right value or throw the exception built from the left one.
    default <X extends RuntimeException> R orElseThrow(Function<? super L, X> exceptionFactory) {
        if (this instanceof Left<L, R> left) {
            throw exceptionFactory.apply(left.value());
        }
        return ((Right<L, R>) this).value();
    }

    /// Return the right value or throw [IllegalStateException].
    default R unwrap() {
        return orElseThrow(left -> new IllegalStateException("Unwrap of left value: " + left));
    }

    static <L, R> Either<L, R> left(L value) {
        return new Left<>(value);
    }

    static <L, R> Either<L, R> right(R value) {
        return new Right<>(value);
    }

    record Left<L, R>(L value) implements Either<L, R> {
        public Left {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight) {
            return onLeft.apply(value);
        }

        @Override
        public String toString() {
            return "Left(" + value + ")";
        }
    }

    record Right<L, R>(R value) implements Either<L, R> {
        public Right {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight) {
            return onRight.apply(value);
        }

        @Override
        public String toString() {
            return "Right(" + value + ")";
        }
    }
}

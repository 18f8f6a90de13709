package com.xpdustry.fallible.common.result;

import com.google.common.base.Preconditions;
import com.xpdustry.fallible.common.async.AsyncResult;
import com.xpdustry.fallible.common.equality.DeepEquality;
import com.xpdustry.fallible.common.functional.ThrowingSupplier;
import com.xpdustry.fallible.common.render.PayloadRenderer;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * The outcome of an operation that can fail, either {@link Ok} holding a value of type {@code T} or {@link Err}
 * holding an error of type {@code E}.
 *
 * <p>A result is immutable, every combinator returning a different content returns a new instance. Failures travel
 * through {@link #map(Function)}, {@link #andThen(Function)} and friends without being thrown, only the extraction
 * operations ({@link #unwrap()}, {@link #expect(String)} and their {@code Err} duals) throw, and only when called on
 * the wrong variant.
 *
 * <p>Equality is structural, see {@link DeepEquality}.
 *
 * @param <T> the type of the success value
 * @param <E> the type of the error
 */
public sealed interface Result<T, E> permits Result.Ok, Result.Err {

    static <T, E> Result<T, E> ok(final T value) {
        return new Ok<>(value);
    }

    static <T, E> Result<T, E> err(final E error) {
        return new Err<>(error);
    }

    /** Runs the computation, anything it throws becomes the error. An interruption is kept on the thread. */
    static <T> Result<T, Throwable> attempt(final ThrowingSupplier<? extends T, ?> supplier) {
        Preconditions.checkNotNull(supplier, "supplier");
        try {
            return ok(supplier.get());
        } catch (final VirtualMachineError e) {
            throw e;
        } catch (final Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return err(e);
        }
    }

    /**
     * Bridges a future into an {@link AsyncResult}. A normal completion settles to {@code Ok(value)}, an exceptional
     * one to {@code Err(cause)}. The error side is a plain {@link Throwable} since a future says nothing about what it
     * may fail with.
     */
    static <T> AsyncResult<T, Throwable> fromFuture(final CompletionStage<? extends T> future) {
        return AsyncResult.fromFuture(future);
    }

    static <T> AsyncResult<T, Throwable> fromFutureUnchecked(final CompletionStage<?> future) {
        return AsyncResult.fromFutureUnchecked(future);
    }

    boolean isOk();

    default boolean isErr() {
        return !this.isOk();
    }

    boolean isOkAnd(final Predicate<? super T> predicate);

    boolean isErrAnd(final Predicate<? super E> predicate);

    /**
     * Applies the function to the value of an {@code Ok}, an {@code Err} is carried over as is. Exceptions thrown by
     * the function are not caught, use {@link #andThen(Function)} for operations that can fail.
     */
    <U> Result<U, E> map(final Function<? super T, ? extends U> function);

    <F> Result<T, F> mapErr(final Function<? super E, ? extends F> function);

    <U> U mapOr(final U alternative, final Function<? super T, ? extends U> function);

    <U> U mapOrElse(final Function<? super E, ? extends U> onErr, final Function<? super T, ? extends U> onOk);

    <U> Result<U, E> and(final Result<U, E> other);

    <U> Result<U, E> andThen(final Function<? super T, ? extends Result<U, E>> function);

    Result<T, E> or(final Result<T, E> other);

    <F> Result<T, F> orElse(final Function<? super E, ? extends Result<T, F>> function);

    /**
     * Returns the value.
     *
     * @throws ResultUnwrapException if this is {@code Err}, the message contains the error
     */
    T unwrap();

    E unwrapErr();

    T expect(final String message);

    E expectErr(final String message);

    T unwrapOr(final T alternative);

    T unwrapOrElse(final Function<? super E, ? extends T> function);

    boolean contains(final @Nullable Object value);

    boolean containsErr(final @Nullable Object error);

    record Ok<T, E>(T value) implements Result<T, E> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isOkAnd(final Predicate<? super T> predicate) {
            return predicate.test(this.value);
        }

        @Override
        public boolean isErrAnd(final Predicate<? super E> predicate) {
            Preconditions.checkNotNull(predicate, "predicate");
            return false;
        }

        @Override
        public <U> Result<U, E> map(final Function<? super T, ? extends U> function) {
            return new Ok<>(function.apply(this.value));
        }

        @Override
        public <F> Result<T, F> mapErr(final Function<? super E, ? extends F> function) {
            Preconditions.checkNotNull(function, "function");
            return new Ok<>(this.value);
        }

        @Override
        public <U> U mapOr(final U alternative, final Function<? super T, ? extends U> function) {
            return function.apply(this.value);
        }

        @Override
        public <U> U mapOrElse(
                final Function<? super E, ? extends U> onErr, final Function<? super T, ? extends U> onOk) {
            Preconditions.checkNotNull(onErr, "onErr");
            return onOk.apply(this.value);
        }

        @Override
        public <U> Result<U, E> and(final Result<U, E> other) {
            return Preconditions.checkNotNull(other, "other");
        }

        @Override
        public <U> Result<U, E> andThen(final Function<? super T, ? extends Result<U, E>> function) {
            return Preconditions.checkNotNull(function.apply(this.value), "andThen function returned null");
        }

        @Override
        public Result<T, E> or(final Result<T, E> other) {
            Preconditions.checkNotNull(other, "other");
            return this;
        }

        @Override
        public <F> Result<T, F> orElse(final Function<? super E, ? extends Result<T, F>> function) {
            Preconditions.checkNotNull(function, "function");
            return new Ok<>(this.value);
        }

        @Override
        public T unwrap() {
            return this.value;
        }

        @Override
        public E unwrapErr() {
            throw new ResultUnwrapException("Called Result.unwrapErr() on an Ok value", this.value);
        }

        @Override
        public T expect(final String message) {
            Preconditions.checkNotNull(message, "message");
            return this.value;
        }

        @Override
        public E expectErr(final String message) {
            throw new ResultUnwrapException(Preconditions.checkNotNull(message, "message"), this.value);
        }

        @Override
        public T unwrapOr(final T alternative) {
            return this.value;
        }

        @Override
        public T unwrapOrElse(final Function<? super E, ? extends T> function) {
            Preconditions.checkNotNull(function, "function");
            return this.value;
        }

        @Override
        public boolean contains(final @Nullable Object value) {
            return DeepEquality.deepEquals(this.value, value);
        }

        @Override
        public boolean containsErr(final @Nullable Object error) {
            return false;
        }

        @Override
        public boolean equals(final @Nullable Object other) {
            return other instanceof Ok<?, ?> ok && DeepEquality.deepEquals(this.value, ok.value);
        }

        @Override
        public int hashCode() {
            return 31 + DeepEquality.deepHashCode(this.value);
        }

        @Override
        public String toString() {
            return "Ok(" + PayloadRenderer.global().render(this.value) + ")";
        }
    }

    record Err<T, E>(E error) implements Result<T, E> {

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isOkAnd(final Predicate<? super T> predicate) {
            Preconditions.checkNotNull(predicate, "predicate");
            return false;
        }

        @Override
        public boolean isErrAnd(final Predicate<? super E> predicate) {
            return predicate.test(this.error);
        }

        @Override
        public <U> Result<U, E> map(final Function<? super T, ? extends U> function) {
            Preconditions.checkNotNull(function, "function");
            return new Err<>(this.error);
        }

        @Override
        public <F> Result<T, F> mapErr(final Function<? super E, ? extends F> function) {
            return new Err<>(function.apply(this.error));
        }

        @Override
        public <U> U mapOr(final U alternative, final Function<? super T, ? extends U> function) {
            Preconditions.checkNotNull(function, "function");
            return alternative;
        }

        @Override
        public <U> U mapOrElse(
                final Function<? super E, ? extends U> onErr, final Function<? super T, ? extends U> onOk) {
            Preconditions.checkNotNull(onOk, "onOk");
            return onErr.apply(this.error);
        }

        @Override
        public <U> Result<U, E> and(final Result<U, E> other) {
            Preconditions.checkNotNull(other, "other");
            return new Err<>(this.error);
        }

        @Override
        public <U> Result<U, E> andThen(final Function<? super T, ? extends Result<U, E>> function) {
            Preconditions.checkNotNull(function, "function");
            return new Err<>(this.error);
        }

        @Override
        public Result<T, E> or(final Result<T, E> other) {
            return Preconditions.checkNotNull(other, "other");
        }

        @Override
        public <F> Result<T, F> orElse(final Function<? super E, ? extends Result<T, F>> function) {
            return Preconditions.checkNotNull(function.apply(this.error), "orElse function returned null");
        }

        @Override
        public T unwrap() {
            throw new ResultUnwrapException("Called Result.unwrap() on an Err value", this.error);
        }

        @Override
        public E unwrapErr() {
            return this.error;
        }

        @Override
        public T expect(final String message) {
            throw new ResultUnwrapException(Preconditions.checkNotNull(message, "message"), this.error);
        }

        @Override
        public E expectErr(final String message) {
            Preconditions.checkNotNull(message, "message");
            return this.error;
        }

        @Override
        public T unwrapOr(final T alternative) {
            return alternative;
        }

        @Override
        public T unwrapOrElse(final Function<? super E, ? extends T> function) {
            return function.apply(this.error);
        }

        @Override
        public boolean contains(final @Nullable Object value) {
            return false;
        }

        @Override
        public boolean containsErr(final @Nullable Object error) {
            return DeepEquality.deepEquals(this.error, error);
        }

        @Override
        public boolean equals(final @Nullable Object other) {
            return other instanceof Err<?, ?> err && DeepEquality.deepEquals(this.error, err.error);
        }

        @Override
        public int hashCode() {
            return 37 + DeepEquality.deepHashCode(this.error);
        }

        @Override
        public String toString() {
            return "Err(" + PayloadRenderer.global().render(this.error) + ")";
        }
    }
}

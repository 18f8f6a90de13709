package com.xpdustry.fallible.common.async;

import com.google.common.base.Preconditions;
import com.xpdustry.fallible.common.functional.ThrowingFunction;
import com.xpdustry.fallible.common.functional.ThrowingSupplier;
import com.xpdustry.fallible.common.result.Result;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link Result} that is not known yet.
 *
 * <p>An async result owns a pending computation and settles exactly once, to {@code Ok} or {@code Err}. Exceptions
 * thrown by the callbacks given to {@link #map}, {@link #mapErr} and {@link #andThen}, as well as failed futures
 * returned by them, become the error of the next stage. The only escape is an {@code onFailure} function that throws
 * itself, see {@link FailureConversionException}.
 *
 * <p>Since a captured {@link Throwable} has to fit in the error channel, every combinator exists in two shapes. The
 * single argument one widens the error type to {@code Object}. The other one takes a function converting the captured
 * failure into the current error type.
 *
 * <p>Continuations of a chain run one after the other, each one only once the previous stage settled. Once a stage
 * settles to {@code Err}, the following {@code map}/{@code andThen} callbacks are skipped and nothing else is awaited.
 * There is no cancellation, a computation already started keeps running and its outcome is discarded.
 *
 * @param <T> the type of the success value
 * @param <E> the type of the error
 */
public final class AsyncResult<T, E> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AsyncResult.class);

    private final CompletableFuture<Result<T, E>> future;
    private final Executor executor;

    private AsyncResult(final CompletableFuture<Result<T, E>> future, final Executor executor) {
        this.future = future;
        this.executor = executor;
    }

    public static <T, E> AsyncResult<T, E> ok(final T value) {
        return of(Result.<T, E>ok(value));
    }

    public static <T, E> AsyncResult<T, E> err(final E error) {
        return of(Result.<T, E>err(error));
    }

    public static <T, E> AsyncResult<T, E> of(final Result<? extends T, ? extends E> result) {
        Preconditions.checkNotNull(result, "result");
        return new AsyncResult<>(CompletableFuture.completedFuture(upcast(result)), AsyncDispatcher.global());
    }

    public static <T> AsyncResult<T, Throwable> fromFuture(final CompletionStage<? extends T> stage) {
        Preconditions.checkNotNull(stage, "stage");
        final var future = new CompletableFuture<Result<T, Throwable>>();
        stage.whenComplete((value, failure) ->
                future.complete(failure == null ? Result.ok(value) : Result.err(unwrapFailure(failure))));
        return new AsyncResult<>(future, AsyncDispatcher.global());
    }

    @SuppressWarnings("unchecked")
    public static <T> AsyncResult<T, Throwable> fromFutureUnchecked(final CompletionStage<?> stage) {
        return fromFuture((CompletionStage<T>) stage);
    }

    public static <T> AsyncResult<T, Throwable> supply(
            final ThrowingSupplier<? extends T, ?> supplier, final Executor executor) {
        Preconditions.checkNotNull(supplier, "supplier");
        Preconditions.checkNotNull(executor, "executor");
        final var future = new CompletableFuture<Result<T, Throwable>>();
        try {
            executor.execute(() -> future.complete(Result.<T>attempt(supplier).mapErr(AsyncResult::unwrapFailure)));
        } catch (final RejectedExecutionException e) {
            future.complete(Result.err(e));
        }
        return new AsyncResult<>(future, AsyncDispatcher.global());
    }

    /** Following continuations run on {@code executor}. */
    public AsyncResult<T, E> using(final Executor executor) {
        return new AsyncResult<>(this.future, Preconditions.checkNotNull(executor, "executor"));
    }

    public <U> AsyncResult<U, Object> map(final ThrowingFunction<? super T, ? extends U, ?> function) {
        return this.<Object>widen().map(function, failure -> failure);
    }

    public <U> AsyncResult<U, E> map(
            final ThrowingFunction<? super T, ? extends U, ?> function,
            final Function<? super Throwable, ? extends E> onFailure) {
        Preconditions.checkNotNull(function, "function");
        return this.mapAsync(value -> CompletableFuture.completedFuture(function.apply(value)), onFailure);
    }

    public <U> AsyncResult<U, Object> mapAsync(
            final ThrowingFunction<? super T, ? extends CompletionStage<? extends U>, ?> function) {
        return this.<Object>widen().mapAsync(function, failure -> failure);
    }

    public <U> AsyncResult<U, E> mapAsync(
            final ThrowingFunction<? super T, ? extends CompletionStage<? extends U>, ?> function,
            final Function<? super Throwable, ? extends E> onFailure) {
        Preconditions.checkNotNull(function, "function");
        Preconditions.checkNotNull(onFailure, "onFailure");
        return this.then(result -> {
            if (result instanceof Result.Err<T, E> err) {
                return CompletableFuture.completedFuture(Result.err(err.error()));
            }
            final CompletionStage<? extends U> stage;
            try {
                stage = Preconditions.checkNotNull(function.apply(result.unwrap()), "map function returned null");
            } catch (final Throwable e) {
                return CompletableFuture.completedFuture(Result.err(convert(onFailure, e)));
            }
            return stage.handle((value, failure) ->
                    failure == null ? Result.ok(value) : Result.err(convert(onFailure, failure)));
        });
    }

    public <F> AsyncResult<T, Object> mapErr(final ThrowingFunction<? super E, ? extends F, ?> function) {
        return this.mapErr(function, failure -> failure);
    }

    public <F> AsyncResult<T, F> mapErr(
            final ThrowingFunction<? super E, ? extends F, ?> function,
            final Function<? super Throwable, ? extends F> onFailure) {
        Preconditions.checkNotNull(function, "function");
        return this.mapErrAsync(error -> CompletableFuture.completedFuture(function.apply(error)), onFailure);
    }

    public <F> AsyncResult<T, Object> mapErrAsync(
            final ThrowingFunction<? super E, ? extends CompletionStage<? extends F>, ?> function) {
        return this.mapErrAsync(function, failure -> failure);
    }

    public <F> AsyncResult<T, F> mapErrAsync(
            final ThrowingFunction<? super E, ? extends CompletionStage<? extends F>, ?> function,
            final Function<? super Throwable, ? extends F> onFailure) {
        Preconditions.checkNotNull(function, "function");
        Preconditions.checkNotNull(onFailure, "onFailure");
        return this.then(result -> {
            if (result instanceof Result.Ok<T, E> ok) {
                return CompletableFuture.completedFuture(Result.ok(ok.value()));
            }
            final CompletionStage<? extends F> stage;
            try {
                stage = Preconditions.checkNotNull(
                        function.apply(result.unwrapErr()), "mapErr function returned null");
            } catch (final Throwable e) {
                return CompletableFuture.completedFuture(Result.err(convert(onFailure, e)));
            }
            return stage.handle((error, failure) ->
                    failure == null ? Result.err(error) : Result.err(convert(onFailure, failure)));
        });
    }

    public <U> AsyncResult<U, Object> andThen(
            final ThrowingFunction<? super T, ? extends Result<? extends U, ?>, ?> function) {
        return this.<Object>widen().andThen(function, failure -> failure);
    }

    public <U> AsyncResult<U, E> andThen(
            final ThrowingFunction<? super T, ? extends Result<? extends U, ? extends E>, ?> function,
            final Function<? super Throwable, ? extends E> onFailure) {
        Preconditions.checkNotNull(function, "function");
        return this.andThenAsync(value -> of(function.apply(value)), onFailure);
    }

    public <U> AsyncResult<U, Object> andThenAsync(
            final ThrowingFunction<? super T, ? extends AsyncResult<? extends U, ?>, ?> function) {
        return this.<Object>widen().andThenAsync(function, failure -> failure);
    }

    public <U> AsyncResult<U, E> andThenAsync(
            final ThrowingFunction<? super T, ? extends AsyncResult<? extends U, ? extends E>, ?> function,
            final Function<? super Throwable, ? extends E> onFailure) {
        Preconditions.checkNotNull(function, "function");
        Preconditions.checkNotNull(onFailure, "onFailure");
        return this.then(result -> {
            if (result instanceof Result.Err<T, E> err) {
                return CompletableFuture.completedFuture(Result.err(err.error()));
            }
            final AsyncResult<? extends U, ? extends E> next;
            try {
                next = Preconditions.checkNotNull(function.apply(result.unwrap()), "andThen function returned null");
            } catch (final Throwable e) {
                return CompletableFuture.completedFuture(Result.err(convert(onFailure, e)));
            }
            return next.future.handle((adopted, failure) ->
                    failure == null ? upcast(adopted) : Result.err(convert(onFailure, failure)));
        });
    }

    /**
     * Blocks until this result settles.
     *
     * @throws IllegalStateException if called from a serial dispatcher thread while still pending, since the
     *     continuation that would settle it is queued behind the caller
     * @throws FailureConversionException if an {@code onFailure} function of the chain threw
     */
    public Result<T, E> await() {
        Preconditions.checkState(
                this.future.isDone() || !AsyncDispatcher.isDispatcherThread(),
                "Cannot wait for a pending result on the dispatcher thread");
        try {
            return this.future.join();
        } catch (final CompletionException e) {
            throw escaped(e.getCause());
        }
    }

    public Result<T, E> await(final Duration timeout) throws InterruptedException, TimeoutException {
        Preconditions.checkNotNull(timeout, "timeout");
        try {
            return this.future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (final ExecutionException e) {
            throw escaped(e.getCause());
        }
    }

    /** A chain whose {@code onFailure} function threw counts as {@link State#SETTLED_ERR}. */
    public State state() {
        if (!this.future.isDone()) {
            return State.PENDING;
        }
        if (this.future.isCompletedExceptionally()) {
            return State.SETTLED_ERR;
        }
        return this.future.join().isOk() ? State.SETTLED_OK : State.SETTLED_ERR;
    }

    public boolean isDone() {
        return this.future.isDone();
    }

    /** A copy of the underlying future, completing it does not affect this result. */
    public CompletableFuture<Result<T, E>> toCompletableFuture() {
        return this.future.copy();
    }

    public CompletionStage<Result<T, E>> toCompletionStage() {
        return this.future.minimalCompletionStage();
    }

    @Override
    public String toString() {
        if (!this.future.isDone()) {
            return "AsyncResult(<pending>)";
        }
        return this.future.isCompletedExceptionally()
                ? "AsyncResult(<failed conversion>)"
                : "AsyncResult(" + this.future.join() + ")";
    }

    private <U, F> AsyncResult<U, F> then(
            final Function<Result<T, E>, ? extends CompletionStage<Result<U, F>>> continuation) {
        return new AsyncResult<>(this.future.thenComposeAsync(continuation, this::dispatch), this.executor);
    }

    // A rejected continuation runs inline, the chain has to settle either way
    private void dispatch(final Runnable task) {
        try {
            this.executor.execute(task);
        } catch (final RejectedExecutionException e) {
            LOGGER.warn("Executor {} rejected a continuation, running it on {}", this.executor, Thread.currentThread());
            task.run();
        }
    }

    // Results are immutable, reading one through a wider type is safe
    @SuppressWarnings("unchecked")
    private <F> AsyncResult<T, F> widen() {
        return (AsyncResult<T, F>) this;
    }

    @SuppressWarnings("unchecked")
    private static <T, E> Result<T, E> upcast(final Result<? extends T, ? extends E> result) {
        return (Result<T, E>) result;
    }

    private static <F> F convert(final Function<? super Throwable, ? extends F> onFailure, final Throwable failure) {
        final var captured = capture(failure);
        try {
            return onFailure.apply(captured);
        } catch (final VirtualMachineError e) {
            throw e;
        } catch (final Throwable e) {
            throw new FailureConversionException(captured, e);
        }
    }

    private static Throwable capture(final Throwable throwable) {
        if (throwable instanceof VirtualMachineError error) {
            throw error;
        }
        final var unwrapped = unwrapFailure(throwable);
        if (unwrapped instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        LOGGER.debug("Captured failure of an asynchronous callback", unwrapped);
        return unwrapped;
    }

    private static RuntimeException escaped(final Throwable cause) {
        if (cause instanceof FailureConversionException conversion) {
            return conversion;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("The result failed outside of its error channel", cause);
    }

    private static Throwable unwrapFailure(final Throwable throwable) {
        var current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public enum State {
        PENDING,
        SETTLED_OK,
        SETTLED_ERR
    }
}

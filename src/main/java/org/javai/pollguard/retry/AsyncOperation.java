package org.javai.pollguard.retry;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

import org.javai.pollguard.boundary.ThrowingSupplier;

/**
 * A caller-supplied asynchronous operation, started once per attempt.
 *
 * <p>A failure may be signalled either by throwing from {@link #start()} or by completing the
 * returned stage exceptionally; both paths are classified the same way.
 *
 * @param <T> The type of value produced
 */
@FunctionalInterface
public interface AsyncOperation<T> {

    /**
     * Starts one attempt.
     */
    CompletionStage<T> start() throws Exception;

    /**
     * Adapts a blocking call, running it on the calling thread.
     * Suitable for cheap calls and tests; slow calls should use {@link #blocking(ThrowingSupplier, Executor)}.
     */
    static <T> AsyncOperation<T> blocking(ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");
        return () -> CompletableFuture.completedFuture(work.get());
    }

    /**
     * Adapts a blocking call, running each attempt on the given executor.
     */
    static <T> AsyncOperation<T> blocking(ThrowingSupplier<T, ? extends Exception> work, Executor executor) {
        Objects.requireNonNull(work, "work must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        return () -> {
            CompletableFuture<T> future = new CompletableFuture<>();
            executor.execute(() -> {
                try {
                    future.complete(work.get());
                } catch (Exception e) {
                    future.completeExceptionally(e);
                }
            });
            return future;
        };
    }
}

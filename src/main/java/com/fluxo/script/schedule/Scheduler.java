package com.fluxo.script.schedule;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Single-threaded cooperative timer queue.
 *
 * Every task runs on the scheduler's own thread of control, one at a time.
 * Tasks with equal deadlines run in the order they were scheduled.
 */
public interface Scheduler {

    /** Current time on this scheduler's clock, in epoch milliseconds. */
    long now();

    Cancellable schedule(long delayMillis, Runnable task);

    /** Queues {@code task} to run as soon as the queue reaches it. */
    default Cancellable execute(Runnable task) {
        return schedule(0L, task);
    }

    /**
     * True when the caller is already on this scheduler's thread of control.
     * A scheduler driven by its caller always is.
     */
    default boolean inSchedulerThread() {
        return true;
    }

    /**
     * Starts {@code work} on this scheduler and returns its result. Runs it
     * directly when the caller is already on the scheduler thread, otherwise
     * queues it.
     */
    default <T> CompletableFuture<T> submit(Supplier<CompletableFuture<T>> work) {
        if (inSchedulerThread()) return work.get();
        CompletableFuture<T> result = new CompletableFuture<>();
        execute(() -> {
            try {
                work.get().whenComplete((v, err) -> {
                    if (err != null) result.completeExceptionally(err);
                    else result.complete(v);
                });
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }
}

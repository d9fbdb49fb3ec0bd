package com.phillippitts.enginecoordinator.service.pool;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Caller's view of a submitted pool task.
 *
 * <p>A task that raised completes exceptionally with
 * {@link com.phillippitts.enginecoordinator.exception.EngineCrashException}; a cancelled task
 * completes with {@link java.util.concurrent.CancellationException}.
 *
 * @param <T> result type
 */
public final class TaskHandle<T> {

    private final PooledTask<T> task;

    TaskHandle(PooledTask<T> task) {
        this.task = task;
    }

    public String id() {
        return task.id();
    }

    public boolean isDone() {
        return task.future().isDone();
    }

    /**
     * Waits for the result.
     *
     * @throws TimeoutException if the task has not finished within the timeout; the task keeps running
     */
    public T get(Duration timeout) throws InterruptedException, ExecutionException, TimeoutException {
        return task.future().get(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Dependent stage that completes with the task; completing it does not affect the task.
     */
    public CompletableFuture<T> toCompletableFuture() {
        return task.future().copy();
    }

    /**
     * Cancels the task: a queued task is dropped, a running one is interrupted and its worker
     * returns to the pool.
     *
     * @return true if this call cancelled the task
     */
    public boolean cancel() {
        return task.cancel();
    }
}

package com.phillippitts.enginecoordinator.service.pool;

import com.phillippitts.enginecoordinator.exception.EngineCrashException;
import org.apache.logging.log4j.ThreadContext;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Unit of work queued in the {@link WorkerPool}.
 *
 * <p>Lifecycle: QUEUED, then RUNNING on a worker, then DONE or CANCELLED. Transitions happen
 * under the task's monitor so a cancel can never interrupt a worker that has already moved on
 * to another task.
 *
 * @param <T> result type
 */
final class PooledTask<T> {

    enum Phase { QUEUED, RUNNING, DONE, CANCELLED }

    private final String id;
    private final String name;
    private final Callable<T> work;
    private final Map<String, String> context;
    private final CompletableFuture<T> future = new CompletableFuture<>();
    private final TaskHandle<T> handle;
    private final WorkerPool pool;

    private Phase phase = Phase.QUEUED;
    private Thread runner;

    PooledTask(String id, String name, Callable<T> work, WorkerPool pool) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name == null ? "task" : name;
        this.work = Objects.requireNonNull(work, "work");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.context = ThreadContext.getImmutableContext();
        this.handle = new TaskHandle<>(this);
    }

    String id() {
        return id;
    }

    String name() {
        return name;
    }

    TaskHandle<T> handle() {
        return handle;
    }

    CompletableFuture<T> future() {
        return future;
    }

    synchronized Phase phase() {
        return phase;
    }

    /**
     * Executes on the calling worker thread. Exceptions fail this task only; an {@link Error}
     * also fails the task and is rethrown so that the worker dies and gets replaced.
     */
    void run() {
        synchronized (this) {
            if (phase != Phase.QUEUED) {
                return;
            }
            phase = Phase.RUNNING;
            runner = Thread.currentThread();
        }
        if (!context.isEmpty()) {
            ThreadContext.putAll(context);
        }
        try {
            T result = work.call();
            if (finish()) {
                future.complete(result);
                pool.taskCompleted();
            }
        } catch (InterruptedException e) {
            if (finish()) {
                future.completeExceptionally(new EngineCrashException(name, e));
                pool.taskFailed(this, e);
            }
        } catch (Exception e) {
            if (finish()) {
                future.completeExceptionally(new EngineCrashException(name, e));
                pool.taskFailed(this, e);
            }
        } catch (Error err) {
            if (finish()) {
                future.completeExceptionally(new EngineCrashException(name, err));
                pool.taskFailed(this, err);
            }
            throw err;
        } finally {
            ThreadContext.clearMap();
            // a cancel that raced with completion may have left the flag set
            Thread.interrupted();
        }
    }

    /**
     * Cancels the task. Only the first of cancel and finish wins.
     */
    boolean cancel() {
        synchronized (this) {
            if (phase == Phase.DONE || phase == Phase.CANCELLED) {
                return false;
            }
            Phase was = phase;
            phase = Phase.CANCELLED;
            if (was == Phase.RUNNING && runner != null) {
                runner.interrupt();
            }
            runner = null;
        }
        future.completeExceptionally(new CancellationException("Task " + id + " cancelled"));
        pool.taskCancelled(this);
        return true;
    }

    private synchronized boolean finish() {
        if (phase != Phase.RUNNING) {
            return false;
        }
        phase = Phase.DONE;
        runner = null;
        return true;
    }
}

package com.phillippitts.enginecoordinator.service.pool;

import com.phillippitts.enginecoordinator.config.properties.WorkerPoolProperties;
import com.phillippitts.enginecoordinator.exception.QueueFullException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, autoscaling pool of worker threads fed by a bounded FIFO queue.
 *
 * <p>Guarantees while running:
 * <ul>
 *   <li>{@code minWorkers <= activeWorkers <= maxWorkers}.</li>
 *   <li>Submitting to a full queue fails immediately with {@link QueueFullException}.</li>
 *   <li>A raising task fails only its own handle. A worker killed by an {@link Error} is
 *       replaced at once.</li>
 * </ul>
 *
 * <p>Scale-down marks workers for retirement; the next worker to finish its current task (or
 * to sit idle) exits, and a busy worker is never interrupted to shrink the pool. A scale-up that
 * follows before the marked workers have exited takes them back instead of spawning threads, so
 * live worker threads never exceed {@code maxWorkers}.
 */
public class WorkerPool {

    private static final Logger LOG = LogManager.getLogger(WorkerPool.class);

    static final long IDLE_POLL_MILLIS = 100;

    private final WorkerPoolProperties props;
    private final ThreadFactory threadFactory;
    private final Clock clock;
    private final BlockingQueue<PooledTask<?>> queue;

    private final ReentrantLock scaleLock = new ReentrantLock();
    private final Set<Worker> workers = ConcurrentHashMap.newKeySet();
    private final AtomicInteger busy = new AtomicInteger();
    private final AtomicInteger pendingRetirements = new AtomicInteger();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong replaced = new AtomicLong();
    private final AtomicLong taskSequence = new AtomicLong();

    // guarded by scaleLock
    private int activeWorkers;
    private Instant lastScaleDownAt = Instant.EPOCH;

    private volatile boolean running;
    private volatile boolean accepting;
    private volatile ScheduledFuture<?> autoscaleLoop;

    public WorkerPool(WorkerPoolProperties props, ThreadFactory threadFactory, Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (props.getMinWorkers() > props.getMaxWorkers()) {
            throw new IllegalArgumentException("minWorkers (" + props.getMinWorkers()
                    + ") must not exceed maxWorkers (" + props.getMaxWorkers() + ")");
        }
        this.queue = new LinkedBlockingQueue<>(props.getQueueLimit());
    }

    /**
     * Spawns the minimum number of workers. Calling start twice is a no-op.
     */
    public void start() {
        scaleLock.lock();
        try {
            if (running) {
                return;
            }
            running = true;
            accepting = true;
            for (int i = 0; i < props.getMinWorkers(); i++) {
                spawnWorker();
            }
            activeWorkers = props.getMinWorkers();
        } finally {
            scaleLock.unlock();
        }
        LOG.info("Worker pool started: min={}, max={}, queueLimit={}",
                props.getMinWorkers(), props.getMaxWorkers(), props.getQueueLimit());
    }

    /**
     * Starts the periodic autoscale loop on the given scheduler.
     */
    public synchronized void startAutoscaling(TaskScheduler scheduler) {
        if (autoscaleLoop != null) {
            return;
        }
        autoscaleLoop = scheduler.scheduleAtFixedRate(this::autoscaleQuietly, props.getAutoscaleInterval());
    }

    /**
     * Queues a task without blocking.
     *
     * @param name label used in logs and crash reports
     * @param work task body
     * @return handle for awaiting or cancelling the task
     * @throws QueueFullException         if the queue is at its limit
     * @throws RejectedExecutionException if the pool is not accepting work
     */
    public <T> TaskHandle<T> submit(String name, Callable<T> work) {
        if (!accepting) {
            throw new RejectedExecutionException("Worker pool is not accepting tasks");
        }
        PooledTask<T> task = new PooledTask<>("t-" + taskSequence.incrementAndGet(), name, work, this);
        if (!queue.offer(task)) {
            LOG.warn("Worker queue full; rejecting task {} (depth={})", name, queue.size());
            throw new QueueFullException(queue.size(), props.getQueueLimit());
        }
        return task.handle();
    }

    /**
     * Runs one autoscale decision.
     *
     * <p>Scales up by {@code scaleUpStep} when utilization exceeds the up threshold or the queue
     * is deeper than the number of workers. Scales down by {@code scaleDownStep} when utilization
     * is below the down threshold, the queue is empty and the cooldown since the last scale-down
     * has elapsed.
     *
     * @return change in active workers; 0 when nothing happened
     */
    public int autoscale() {
        scaleLock.lock();
        try {
            if (!running) {
                return 0;
            }
            int depth = queue.size();
            double utilization = utilization();
            boolean pressure = utilization > props.getScaleUpThreshold() || depth > activeWorkers;
            if (pressure && activeWorkers < props.getMaxWorkers()) {
                int add = Math.min(props.getScaleUpStep(), props.getMaxWorkers() - activeWorkers);
                // a worker marked for retirement is still alive; keep it instead of spawning
                int reclaimed = reclaimRetirements(add);
                for (int i = reclaimed; i < add; i++) {
                    spawnWorker();
                }
                activeWorkers += add;
                LOG.info("Scaled up by {} to {} workers ({} reclaimed, utilization={}, queued={})",
                        add, activeWorkers, reclaimed, String.format("%.2f", utilization), depth);
                return add;
            }
            Instant now = clock.instant();
            boolean idle = utilization < props.getScaleDownThreshold() && depth == 0;
            boolean cooledDown = !now.isBefore(lastScaleDownAt.plus(props.getScaleDownCooldown()));
            if (idle && cooledDown && activeWorkers > props.getMinWorkers()) {
                int remove = Math.min(props.getScaleDownStep(), activeWorkers - props.getMinWorkers());
                pendingRetirements.addAndGet(remove);
                activeWorkers -= remove;
                lastScaleDownAt = now;
                LOG.info("Scaled down by {} to {} workers (utilization={})",
                        remove, activeWorkers, String.format("%.2f", utilization));
                return -remove;
            }
            return 0;
        } finally {
            scaleLock.unlock();
        }
    }

    public WorkerPoolState state() {
        int active;
        scaleLock.lock();
        try {
            active = activeWorkers;
        } finally {
            scaleLock.unlock();
        }
        int busyNow = busy.get();
        double utilization = active == 0 ? 0.0 : Math.min(1.0, (double) busyNow / active);
        return new WorkerPoolState(props.getMinWorkers(), props.getMaxWorkers(), active, busyNow,
                queue.size(), utilization, completed.get(), failed.get(), replaced.get());
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Stops accepting tasks, waits up to {@code drainTimeout} for queued and running tasks, then
     * cancels whatever is left and stops all workers.
     *
     * @return true if everything finished within the timeout
     */
    public boolean shutdown(Duration drainTimeout) {
        accepting = false;
        synchronized (this) {
            if (autoscaleLoop != null) {
                autoscaleLoop.cancel(false);
                autoscaleLoop = null;
            }
        }
        long deadline = System.nanoTime() + drainTimeout.toNanos();
        boolean drained = true;
        while (!queue.isEmpty() || busy.get() > 0) {
            if (System.nanoTime() >= deadline) {
                drained = false;
                break;
            }
            try {
                TimeUnit.MILLISECONDS.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                drained = false;
                break;
            }
        }

        List<PooledTask<?>> leftovers = new ArrayList<>();
        queue.drainTo(leftovers);
        leftovers.forEach(PooledTask::cancel);

        List<Worker> toStop;
        scaleLock.lock();
        try {
            running = false;
            activeWorkers = 0;
            toStop = new ArrayList<>(workers);
        } finally {
            scaleLock.unlock();
        }
        toStop.forEach(w -> w.thread.interrupt());
        if (drained) {
            LOG.info("Worker pool drained and stopped ({} completed, {} failed)", completed.get(), failed.get());
        } else {
            LOG.warn("Worker pool stopped before draining; {} queued task(s) cancelled", leftovers.size());
        }
        return drained;
    }

    void taskCompleted() {
        completed.incrementAndGet();
    }

    void taskFailed(PooledTask<?> task, Throwable cause) {
        failed.incrementAndGet();
        LOG.warn("Task {} ({}) failed: {}", task.id(), task.name(), cause.toString());
    }

    void taskCancelled(PooledTask<?> task) {
        queue.remove(task);
        LOG.debug("Task {} ({}) cancelled", task.id(), task.name());
    }

    /** Visible for tests. */
    int liveWorkerThreads() {
        return workers.size();
    }

    private double utilization() {
        return activeWorkers == 0 ? 0.0 : Math.min(1.0, (double) busy.get() / activeWorkers);
    }

    private void autoscaleQuietly() {
        try {
            autoscale();
        } catch (RuntimeException e) {
            LOG.error("Autoscale cycle failed", e);
        }
    }

    // callers hold scaleLock
    private void spawnWorker() {
        Worker worker = new Worker();
        Thread thread = threadFactory.newThread(worker);
        if (thread == null) {
            throw new IllegalStateException("Thread factory returned null");
        }
        worker.thread = thread;
        workers.add(worker);
        thread.start();
    }

    private boolean tryRetire() {
        while (true) {
            int pending = pendingRetirements.get();
            if (pending <= 0) {
                return false;
            }
            if (pendingRetirements.compareAndSet(pending, pending - 1)) {
                return true;
            }
        }
    }

    private int reclaimRetirements(int wanted) {
        while (true) {
            int pending = pendingRetirements.get();
            int take = Math.min(pending, wanted);
            if (take <= 0) {
                return 0;
            }
            if (pendingRetirements.compareAndSet(pending, pending - take)) {
                return take;
            }
        }
    }

    private void onWorkerExit(Worker worker, Throwable death) {
        scaleLock.lock();
        try {
            workers.remove(worker);
            if (death != null && running) {
                spawnWorker();
                replaced.incrementAndGet();
                LOG.error("Worker {} died; replacement spawned", worker.thread.getName(), death);
            }
        } finally {
            scaleLock.unlock();
        }
    }

    private final class Worker implements Runnable {

        private volatile Thread thread;

        @Override
        public void run() {
            Throwable death = null;
            try {
                loop();
            } catch (Throwable t) {
                death = t;
            } finally {
                onWorkerExit(this, death);
            }
        }

        private void loop() {
            while (running) {
                if (tryRetire()) {
                    LOG.debug("Worker {} retired", thread.getName());
                    return;
                }
                PooledTask<?> task;
                try {
                    task = queue.poll(IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    // stray interrupt from a cancel, or shutdown; the loop condition decides
                    continue;
                }
                if (task == null) {
                    continue;
                }
                busy.incrementAndGet();
                try {
                    task.run();
                } finally {
                    busy.decrementAndGet();
                }
            }
        }
    }
}

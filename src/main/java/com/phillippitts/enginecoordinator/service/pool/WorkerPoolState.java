package com.phillippitts.enginecoordinator.service.pool;

/**
 * Snapshot of the worker pool.
 *
 * @param minWorkers       configured lower bound
 * @param maxWorkers       configured upper bound
 * @param activeWorkers    workers currently counted towards the bounds
 * @param busyWorkers      workers executing a task right now
 * @param queueDepth       tasks waiting for a worker
 * @param utilization      busy fraction of active workers, 0..1
 * @param completedTasks   tasks that finished normally
 * @param failedTasks      tasks that raised
 * @param replacedWorkers  workers respawned after dying
 */
public record WorkerPoolState(
        int minWorkers,
        int maxWorkers,
        int activeWorkers,
        int busyWorkers,
        int queueDepth,
        double utilization,
        long completedTasks,
        long failedTasks,
        long replacedWorkers
) {}

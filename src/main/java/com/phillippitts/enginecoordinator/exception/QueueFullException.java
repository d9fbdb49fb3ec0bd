package com.phillippitts.enginecoordinator.exception;

/**
 * Backpressure signal from the worker pool: the queue is at its configured limit.
 * Callers should retry later.
 */
public class QueueFullException extends CoordinatorException {

    private final int queueDepth;
    private final int limit;

    public QueueFullException(int queueDepth, int limit) {
        super("Worker queue full (depth=" + queueDepth + ", limit=" + limit + ")");
        this.queueDepth = queueDepth;
        this.limit = limit;
    }

    public int getQueueDepth() {
        return queueDepth;
    }

    public int getLimit() {
        return limit;
    }
}

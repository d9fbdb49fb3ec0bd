package com.phillippitts.enginecoordinator.service.coordination;

import com.phillippitts.enginecoordinator.domain.CoordinationResult;
import com.phillippitts.enginecoordinator.domain.Task;

import java.time.Duration;

/**
 * Orchestrates one task across the engines it needs, under a global deadline.
 *
 * <p>Implementations never throw from {@link #coordinate}: every task ends in a
 * {@link CoordinationResult}, including tasks that arrive while the coordinator drains.
 */
public interface Coordinator {

    CoordinationResult coordinate(Task task);

    EngineStatusReport status();

    /**
     * Stops accepting tasks, waits for in-flight ones up to {@code drainTimeout}, then cancels
     * the rest.
     *
     * @return true if all in-flight tasks finished before the timeout
     */
    boolean shutdown(Duration drainTimeout);

    boolean isAccepting();
}

package com.phillippitts.enginecoordinator.config.coordination;

import com.phillippitts.enginecoordinator.service.coordination.Coordinator;
import com.phillippitts.enginecoordinator.service.pool.WorkerPool;
import com.phillippitts.enginecoordinator.service.provider.HealthMonitor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.Objects;

/**
 * Starts the worker pool and background loops after the context is refreshed, and drains them
 * in reverse order on shutdown: coordinator first, then the pool, then health probing.
 */
public class CoordinationLifecycle implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(CoordinationLifecycle.class);

    private final Coordinator coordinator;
    private final WorkerPool workerPool;
    private final HealthMonitor healthMonitor;
    private final TaskScheduler scheduler;
    private final Duration coordinatorDrain;
    private final Duration poolDrain;

    private volatile boolean running;

    public CoordinationLifecycle(Coordinator coordinator,
                                 WorkerPool workerPool,
                                 HealthMonitor healthMonitor,
                                 TaskScheduler scheduler,
                                 Duration coordinatorDrain,
                                 Duration poolDrain) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.workerPool = Objects.requireNonNull(workerPool, "workerPool");
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.coordinatorDrain = Objects.requireNonNull(coordinatorDrain, "coordinatorDrain");
        this.poolDrain = Objects.requireNonNull(poolDrain, "poolDrain");
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        workerPool.start();
        workerPool.startAutoscaling(scheduler);
        healthMonitor.start(scheduler);
        running = true;
        LOG.info("Coordination engines started");
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        boolean coordinatorDrained = coordinator.shutdown(coordinatorDrain);
        boolean poolDrained = workerPool.shutdown(poolDrain);
        healthMonitor.stop();
        running = false;
        if (coordinatorDrained && poolDrained) {
            LOG.info("Coordination engines stopped cleanly");
        } else {
            LOG.warn("Coordination engines stopped with work cancelled (coordinatorDrained={}, poolDrained={})",
                    coordinatorDrained, poolDrained);
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}

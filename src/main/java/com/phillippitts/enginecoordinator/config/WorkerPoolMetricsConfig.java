package com.phillippitts.enginecoordinator.config;

import com.phillippitts.enginecoordinator.service.pool.WorkerPool;
import com.phillippitts.enginecoordinator.service.pool.WorkerPoolState;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Exposes worker pool gauges via Micrometer:
 * <ul>
 *   <li>{@code coordinator.pool.active} - workers counted towards the bounds</li>
 *   <li>{@code coordinator.pool.busy} - workers executing a task</li>
 *   <li>{@code coordinator.pool.queued} - tasks waiting for a worker</li>
 * </ul>
 *
 * <p>Also logs a pool health summary every 5 minutes.
 */
@Configuration
public class WorkerPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(WorkerPoolMetricsConfig.class);

    private final ObjectProvider<WorkerPool> workerPoolProvider;

    public WorkerPoolMetricsConfig(ObjectProvider<WorkerPool> workerPoolProvider) {
        this.workerPoolProvider = workerPoolProvider;
    }

    @Bean
    public MeterBinder workerPoolMetrics() {
        return registry -> {
            WorkerPool pool = workerPoolProvider.getObject();

            Gauge.builder("coordinator.pool.active", pool, p -> p.state().activeWorkers())
                    .description("Active workers in the coordinator pool")
                    .register(registry);

            Gauge.builder("coordinator.pool.busy", pool, p -> p.state().busyWorkers())
                    .description("Workers executing a task")
                    .register(registry);

            Gauge.builder("coordinator.pool.queued", pool, p -> p.state().queueDepth())
                    .description("Tasks waiting in the worker queue")
                    .register(registry);

            LOG.info("Worker pool metrics registered: coordinator.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logWorkerPoolHealth() {
        WorkerPoolState s = workerPoolProvider.getObject().state();
        LOG.info("Worker pool health: workers={}/{} (min={}), busy={}, queued={}, completed={}, failed={}, replaced={}",
                s.activeWorkers(), s.maxWorkers(), s.minWorkers(), s.busyWorkers(), s.queueDepth(),
                s.completedTasks(), s.failedTasks(), s.replacedWorkers());
    }
}

package com.phillippitts.enginecoordinator.service.coordination;

import com.phillippitts.enginecoordinator.config.properties.CoordinationProperties;
import com.phillippitts.enginecoordinator.config.properties.CreativeProperties;
import com.phillippitts.enginecoordinator.config.properties.RecallProperties;
import com.phillippitts.enginecoordinator.service.creative.CreativeGenerator;
import com.phillippitts.enginecoordinator.service.metrics.CoordinationMetricsPublisher;
import com.phillippitts.enginecoordinator.service.pool.WorkerPool;
import com.phillippitts.enginecoordinator.service.provider.LlmRouter;
import com.phillippitts.enginecoordinator.service.provider.ProviderRegistry;
import com.phillippitts.enginecoordinator.service.recall.RecallStore;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Builder for {@link DefaultCoordinator}.
 *
 * <pre>{@code
 * Coordinator coordinator = CoordinatorBuilder.builder()
 *     .registry(registry)
 *     .router(router)
 *     .workerPool(pool)
 *     .recallStore(recall)
 *     .creativeGenerator(creative)
 *     .dispatchExecutor(executor)
 *     .coordinationProperties(props)
 *     .build();
 * }</pre>
 *
 * <p>Recall and creative properties default to their stock values; metrics default to a no-op
 * publisher and the clock to UTC system time.
 */
public final class CoordinatorBuilder {

    private ProviderRegistry registry;
    private LlmRouter router;
    private WorkerPool workerPool;
    private RecallStore recallStore;
    private CreativeGenerator creativeGenerator;
    private ExecutorService dispatchExecutor;
    private CoordinationProperties coordinationProperties;

    private RecallProperties recallProperties;
    private CreativeProperties creativeProperties;
    private CoordinationMetricsPublisher metricsPublisher;
    private Clock clock;

    private CoordinatorBuilder() {
    }

    public static CoordinatorBuilder builder() {
        return new CoordinatorBuilder();
    }

    public CoordinatorBuilder registry(ProviderRegistry registry) {
        this.registry = registry;
        return this;
    }

    public CoordinatorBuilder router(LlmRouter router) {
        this.router = router;
        return this;
    }

    public CoordinatorBuilder workerPool(WorkerPool workerPool) {
        this.workerPool = workerPool;
        return this;
    }

    public CoordinatorBuilder recallStore(RecallStore recallStore) {
        this.recallStore = recallStore;
        return this;
    }

    public CoordinatorBuilder creativeGenerator(CreativeGenerator creativeGenerator) {
        this.creativeGenerator = creativeGenerator;
        return this;
    }

    /**
     * Executor that runs engine calls. Needs enough threads for every call of the largest plan
     * across all concurrent tasks; calls block while their engine works.
     */
    public CoordinatorBuilder dispatchExecutor(ExecutorService dispatchExecutor) {
        this.dispatchExecutor = dispatchExecutor;
        return this;
    }

    public CoordinatorBuilder coordinationProperties(CoordinationProperties coordinationProperties) {
        this.coordinationProperties = coordinationProperties;
        return this;
    }

    public CoordinatorBuilder recallProperties(RecallProperties recallProperties) {
        this.recallProperties = recallProperties;
        return this;
    }

    public CoordinatorBuilder creativeProperties(CreativeProperties creativeProperties) {
        this.creativeProperties = creativeProperties;
        return this;
    }

    public CoordinatorBuilder metricsPublisher(CoordinationMetricsPublisher metricsPublisher) {
        this.metricsPublisher = metricsPublisher;
        return this;
    }

    public CoordinatorBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * @throws NullPointerException if a required dependency is missing
     */
    public Coordinator build() {
        Objects.requireNonNull(registry, "registry is required");
        Objects.requireNonNull(router, "router is required");
        Objects.requireNonNull(workerPool, "workerPool is required");
        Objects.requireNonNull(recallStore, "recallStore is required");
        Objects.requireNonNull(creativeGenerator, "creativeGenerator is required");
        Objects.requireNonNull(dispatchExecutor, "dispatchExecutor is required");
        Objects.requireNonNull(coordinationProperties, "coordinationProperties is required");

        RecallProperties effectiveRecall = recallProperties != null ? recallProperties : new RecallProperties();
        CreativeProperties effectiveCreative = creativeProperties != null ? creativeProperties : new CreativeProperties();
        DispatchPlanner planner = new DispatchPlanner(router, workerPool, recallStore, creativeGenerator,
                coordinationProperties, effectiveRecall, effectiveCreative);
        return new DefaultCoordinator(
                planner,
                dispatchExecutor,
                registry,
                workerPool,
                recallStore,
                coordinationProperties,
                metricsPublisher != null ? metricsPublisher : CoordinationMetricsPublisher.NOOP,
                clock != null ? clock : Clock.systemUTC()
        );
    }
}

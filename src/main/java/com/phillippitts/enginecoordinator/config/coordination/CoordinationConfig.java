package com.phillippitts.enginecoordinator.config.coordination;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.enginecoordinator.config.properties.CoordinationProperties;
import com.phillippitts.enginecoordinator.config.properties.CreativeProperties;
import com.phillippitts.enginecoordinator.config.properties.HealthProperties;
import com.phillippitts.enginecoordinator.config.properties.ProviderProperties;
import com.phillippitts.enginecoordinator.config.properties.RecallProperties;
import com.phillippitts.enginecoordinator.config.properties.RoutingProperties;
import com.phillippitts.enginecoordinator.config.properties.WorkerPoolProperties;
import com.phillippitts.enginecoordinator.service.coordination.Coordinator;
import com.phillippitts.enginecoordinator.service.coordination.CoordinatorBuilder;
import com.phillippitts.enginecoordinator.service.cost.UsageLedger;
import com.phillippitts.enginecoordinator.service.creative.CandidateScorer;
import com.phillippitts.enginecoordinator.service.creative.CandidateSource;
import com.phillippitts.enginecoordinator.service.creative.CreativeGenerator;
import com.phillippitts.enginecoordinator.service.creative.HeuristicCandidateScorer;
import com.phillippitts.enginecoordinator.service.creative.LlmCandidateSource;
import com.phillippitts.enginecoordinator.service.metrics.CoordinationMetrics;
import com.phillippitts.enginecoordinator.service.metrics.CoordinationMetricsPublisher;
import com.phillippitts.enginecoordinator.service.pool.WorkerPool;
import com.phillippitts.enginecoordinator.service.provider.HealthMonitor;
import com.phillippitts.enginecoordinator.service.provider.LlmRouter;
import com.phillippitts.enginecoordinator.service.provider.ProviderDescriptor;
import com.phillippitts.enginecoordinator.service.provider.ProviderRegistry;
import com.phillippitts.enginecoordinator.service.provider.adapter.ProviderFactory;
import com.phillippitts.enginecoordinator.service.recall.HashingEmbedder;
import com.phillippitts.enginecoordinator.service.recall.InMemoryVectorBackend;
import com.phillippitts.enginecoordinator.service.recall.MemoryBackend;
import com.phillippitts.enginecoordinator.service.recall.RecallStore;
import io.micrometer.core.instrument.MeterRegistry;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Wires the coordinator and its engines as explicit, owned instances.
 *
 * <p>Each component is constructed once here and handed to the next through its constructor;
 * nothing is looked up ambiently. Background loops are started by {@link CoordinationLifecycle}.
 */
@Configuration
public class CoordinationConfig {

    private static final Logger LOG = LogManager.getLogger(CoordinationConfig.class);

    @Bean
    public Clock coordinatorClock() {
        return Clock.systemUTC();
    }

    /**
     * Shared HTTP client; per-call deadlines are applied on each call.
     */
    @Bean
    public OkHttpClient providerHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .retryOnConnectionFailure(false)
                .build();
    }

    @Bean
    public CoordinationMetricsPublisher coordinationMetricsPublisher(MeterRegistry meterRegistry) {
        return new CoordinationMetricsPublisher(new CoordinationMetrics(meterRegistry));
    }

    @Bean
    public UsageLedger usageLedger() {
        return new UsageLedger();
    }

    /**
     * Registry populated from {@code coordinator.providers}, in declaration order.
     */
    @Bean
    public ProviderRegistry providerRegistry(UsageLedger ledger,
                                             RoutingProperties routingProperties,
                                             ProviderProperties providerProperties,
                                             OkHttpClient providerHttpClient,
                                             ObjectMapper objectMapper,
                                             CoordinationMetricsPublisher metrics) {
        ProviderRegistry registry = new ProviderRegistry(ledger, routingProperties.getTieBreak());
        ProviderFactory factory = new ProviderFactory(providerHttpClient, objectMapper);
        for (ProviderProperties.Provider entry : providerProperties.getProviders()) {
            ProviderDescriptor descriptor = factory.describe(entry);
            registry.register(descriptor);
            metrics.bindProviderHealth(descriptor);
        }
        if (registry.size() == 0) {
            LOG.warn("No providers configured under coordinator.providers; completions will fail");
        }
        return registry;
    }

    @Bean
    public HealthMonitor healthMonitor(ProviderRegistry registry,
                                       HealthProperties healthProperties,
                                       ApplicationEventPublisher publisher,
                                       @Qualifier("providerExecutor") ThreadPoolTaskExecutor providerExecutor,
                                       Clock clock) {
        return new HealthMonitor(registry, healthProperties, publisher,
                providerExecutor.getThreadPoolExecutor(), clock);
    }

    @Bean
    public LlmRouter llmRouter(ProviderRegistry registry,
                               HealthMonitor healthMonitor,
                               @Qualifier("providerExecutor") ThreadPoolTaskExecutor providerExecutor,
                               RoutingProperties routingProperties,
                               CoordinationMetricsPublisher metrics,
                               Clock clock) {
        return new LlmRouter(registry, healthMonitor, providerExecutor.getThreadPoolExecutor(),
                routingProperties, metrics, clock);
    }

    @Bean
    public WorkerPool workerPool(WorkerPoolProperties poolProperties, Clock clock) {
        return new WorkerPool(poolProperties, new CustomizableThreadFactory(poolProperties.getThreadNamePrefix()), clock);
    }

    @Bean
    public HashingEmbedder hashingEmbedder() {
        return new HashingEmbedder();
    }

    @Bean
    public MemoryBackend memoryBackend(HashingEmbedder embedder, Clock clock) {
        return new InMemoryVectorBackend(embedder, clock);
    }

    @Bean
    public RecallStore recallStore(MemoryBackend backend,
                                   @Qualifier("engineExecutor") ThreadPoolTaskExecutor engineExecutor,
                                   RecallProperties recallProperties) {
        return new RecallStore(backend, engineExecutor.getThreadPoolExecutor(), recallProperties);
    }

    @Bean
    public CandidateSource candidateSource(LlmRouter router) {
        return new LlmCandidateSource(router);
    }

    @Bean
    public CandidateScorer candidateScorer() {
        return new HeuristicCandidateScorer();
    }

    @Bean
    public CreativeGenerator creativeGenerator(CandidateSource source,
                                               CandidateScorer scorer,
                                               @Qualifier("engineExecutor") ThreadPoolTaskExecutor engineExecutor,
                                               CreativeProperties creativeProperties,
                                               CoordinationMetricsPublisher metrics) {
        return new CreativeGenerator(source, scorer, engineExecutor.getThreadPoolExecutor(),
                creativeProperties, metrics);
    }

    @Bean
    public Coordinator coordinator(ProviderRegistry registry,
                                   LlmRouter router,
                                   WorkerPool workerPool,
                                   RecallStore recallStore,
                                   CreativeGenerator creativeGenerator,
                                   @Qualifier("dispatchExecutor") ThreadPoolTaskExecutor dispatchExecutor,
                                   CoordinationProperties coordinationProperties,
                                   RecallProperties recallProperties,
                                   CreativeProperties creativeProperties,
                                   CoordinationMetricsPublisher metrics,
                                   Clock clock) {
        return CoordinatorBuilder.builder()
                .registry(registry)
                .router(router)
                .workerPool(workerPool)
                .recallStore(recallStore)
                .creativeGenerator(creativeGenerator)
                .dispatchExecutor(dispatchExecutor.getThreadPoolExecutor())
                .coordinationProperties(coordinationProperties)
                .recallProperties(recallProperties)
                .creativeProperties(creativeProperties)
                .metricsPublisher(metrics)
                .clock(clock)
                .build();
    }

    @Bean
    public CoordinationLifecycle coordinationLifecycle(Coordinator coordinator,
                                                       WorkerPool workerPool,
                                                       HealthMonitor healthMonitor,
                                                       @Qualifier("coordinatorScheduler") ThreadPoolTaskScheduler scheduler,
                                                       CoordinationProperties coordinationProperties,
                                                       WorkerPoolProperties poolProperties) {
        return new CoordinationLifecycle(coordinator, workerPool, healthMonitor, scheduler,
                coordinationProperties.getDrainTimeout(), poolProperties.getDrainTimeout());
    }
}

package com.phillippitts.enginecoordinator.service.metrics;

import com.phillippitts.enginecoordinator.service.provider.ProviderDescriptor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for the coordinator.
 *
 * <p>Provides:
 * <ul>
 *   <li>{@code coordinator.provider.call} - provider call duration per provider and outcome</li>
 *   <li>{@code coordinator.provider.health} - 1 while a provider accepts traffic, else 0</li>
 *   <li>{@code coordinator.creative.generation} - creative generation duration</li>
 *   <li>{@code coordinator.task.latency} - end-to-end coordination latency per kind and status</li>
 *   <li>{@code coordinator.engine.error} - error entries per engine and kind</li>
 * </ul>
 *
 * <p>Worker pool gauges are bound separately in {@code WorkerPoolMetricsConfig}.
 */
public class CoordinationMetrics {

    private static final String METRIC_PREFIX = "coordinator";

    private final MeterRegistry registry;

    public CoordinationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one provider call.
     *
     * @param providerId    provider id
     * @param durationNanos call duration in nanoseconds
     * @param success       whether the call produced a response
     */
    public void recordProviderCall(String providerId, long durationNanos, boolean success) {
        Timer.builder(METRIC_PREFIX + ".provider.call")
                .description("Duration of model provider calls")
                .tag("provider", providerId)
                .tag("outcome", success ? "success" : "failure")
                .publishPercentileHistogram()
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Registers the 0/1 health gauge of a provider. Safe to call more than once.
     */
    public void bindProviderHealth(ProviderDescriptor descriptor) {
        Gauge.builder(METRIC_PREFIX + ".provider.health", descriptor,
                        d -> d.healthState().acceptsTraffic() ? 1.0 : 0.0)
                .description("1 when the provider accepts traffic, 0 when unhealthy")
                .tag("provider", descriptor.id())
                .tag("kind", descriptor.kind().name().toLowerCase(Locale.ROOT))
                .register(registry);
    }

    public void recordCreativeGeneration(long durationNanos, boolean partial) {
        Timer.builder(METRIC_PREFIX + ".creative.generation")
                .description("Duration of creative candidate generation")
                .tag("partial", Boolean.toString(partial))
                .publishPercentileHistogram()
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordTaskLatency(String kind, String status, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".task.latency")
                .description("End-to-end coordination latency")
                .tag("kind", kind)
                .tag("status", status)
                .publishPercentileHistogram()
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementEngineError(String engine, String kind) {
        Counter.builder(METRIC_PREFIX + ".engine.error")
                .description("Error entries reported by engines")
                .tag("engine", engine)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}

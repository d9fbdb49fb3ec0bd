package com.phillippitts.enginecoordinator.service.metrics;

import com.phillippitts.enginecoordinator.domain.CoordinationResult;
import com.phillippitts.enginecoordinator.domain.EngineError;
import com.phillippitts.enginecoordinator.service.provider.ProviderDescriptor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

/**
 * Null-safe facade over {@link CoordinationMetrics} used by the router, the creative generator
 * and the coordinator.
 *
 * <p>{@link #NOOP} lets components run without a meter registry, which is how unit tests build
 * them.
 */
public final class CoordinationMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(CoordinationMetricsPublisher.class);

    /** Publisher that records nothing. */
    public static final CoordinationMetricsPublisher NOOP = new CoordinationMetricsPublisher(null);

    private final CoordinationMetrics metrics;

    /**
     * @param metrics metrics sink (nullable for test mode)
     */
    public CoordinationMetricsPublisher(CoordinationMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("CoordinationMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordProviderCall(String providerId, long durationNanos, boolean success) {
        if (metrics != null) {
            metrics.recordProviderCall(providerId, durationNanos, success);
        }
    }

    public void bindProviderHealth(ProviderDescriptor descriptor) {
        if (metrics != null) {
            metrics.bindProviderHealth(descriptor);
        }
    }

    public void recordCreativeGeneration(long durationNanos, boolean partial) {
        if (metrics != null) {
            metrics.recordCreativeGeneration(durationNanos, partial);
        }
    }

    /**
     * Records latency and error entries of a finished task.
     */
    public void recordTask(CoordinationResult result, long durationNanos) {
        if (metrics == null) {
            return;
        }
        String kind = result.kind() == null ? "unknown" : result.kind().name().toLowerCase(Locale.ROOT);
        metrics.recordTaskLatency(kind, result.status().name().toLowerCase(Locale.ROOT), durationNanos);
        for (EngineError error : result.errors()) {
            metrics.incrementEngineError(error.engine().name().toLowerCase(Locale.ROOT),
                    error.kind().name().toLowerCase(Locale.ROOT));
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}

package com.phillippitts.enginecoordinator.service.coordination;

import com.phillippitts.enginecoordinator.domain.CoordinationResult;
import com.phillippitts.enginecoordinator.domain.CoordinationStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Running totals of coordinated tasks with exponential moving averages of success and latency.
 */
public class CoordinationStats {

    static final double ALPHA = 0.1;

    private final Map<CoordinationStatus, Long> byStatus = new EnumMap<>(CoordinationStatus.class);
    private long total;
    private double successRate = 1.0;
    private double averageLatencyMs;

    /**
     * Point-in-time copy.
     *
     * @param totalTasks       tasks coordinated so far
     * @param byStatus         tasks per final status
     * @param successRate      EMA of usable outcomes (COMPLETED or DEGRADED)
     * @param averageLatencyMs EMA of total task latency
     */
    public record Snapshot(long totalTasks, Map<CoordinationStatus, Long> byStatus,
                           double successRate, double averageLatencyMs) {}

    public synchronized void record(CoordinationResult result) {
        byStatus.merge(result.status(), 1L, Long::sum);
        double sample = result.status().hasUsableResult() ? 1.0 : 0.0;
        if (total == 0) {
            successRate = sample;
            averageLatencyMs = result.totalLatencyMs();
        } else {
            successRate = ALPHA * sample + (1 - ALPHA) * successRate;
            averageLatencyMs = ALPHA * result.totalLatencyMs() + (1 - ALPHA) * averageLatencyMs;
        }
        total++;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(total, Collections.unmodifiableMap(new EnumMap<>(byStatus)),
                successRate, averageLatencyMs);
    }
}

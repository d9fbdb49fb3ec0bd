package com.phillippitts.enginecoordinator.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merged outcome of one coordinated task. Always produced, whatever happened to the engines.
 *
 * @param taskId           id of the task
 * @param kind             task kind
 * @param status           final status
 * @param engineResults    per-engine sub-results, including failed ones
 * @param providerUsed     id of the provider that served the LLM call, or null
 * @param costIncurred     total provider cost charged for this task
 * @param latencyBreakdown latency per engine in milliseconds
 * @param totalLatencyMs   end-to-end latency
 * @param errors           error entries, in the order they were observed
 */
public record CoordinationResult(
        String taskId,
        TaskKind kind,
        CoordinationStatus status,
        Map<EngineType, EngineOutcome> engineResults,
        String providerUsed,
        double costIncurred,
        Map<String, Long> latencyBreakdown,
        long totalLatencyMs,
        List<EngineError> errors
) {

    public CoordinationResult {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(status, "status");
        engineResults = engineResults == null || engineResults.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(engineResults));
        latencyBreakdown = latencyBreakdown == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(latencyBreakdown));
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Result for a task that was never dispatched.
     */
    public static CoordinationResult rejected(Task task, ErrorKind kind, String message, long latencyMs) {
        EngineType engine = task.kind().primaryEngine();
        return new CoordinationResult(task.id(), task.kind(), CoordinationStatus.FAILED,
                Map.of(), null, 0.0, Map.of(), latencyMs,
                List.of(new EngineError(engine, kind, message)));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public EngineOutcome outcome(EngineType engine) {
        return engineResults.get(engine);
    }
}

package com.phillippitts.enginecoordinator.domain;

import java.util.Objects;

/**
 * Sub-result of one engine within a coordinated task.
 *
 * @param engine    engine that ran
 * @param succeeded true when the engine produced a usable value
 * @param degraded  true when the value is partial or late (recall degraded, creative partial, ...)
 * @param value     engine-specific value; null when the engine failed
 * @param latencyMs wall time spent in the engine
 */
public record EngineOutcome(
        EngineType engine,
        boolean succeeded,
        boolean degraded,
        Object value,
        long latencyMs
) {

    public EngineOutcome {
        Objects.requireNonNull(engine, "engine");
    }

    public static EngineOutcome success(EngineType engine, Object value, boolean degraded, long latencyMs) {
        return new EngineOutcome(engine, true, degraded, value, latencyMs);
    }

    public static EngineOutcome failure(EngineType engine, long latencyMs) {
        return new EngineOutcome(engine, false, false, null, latencyMs);
    }
}

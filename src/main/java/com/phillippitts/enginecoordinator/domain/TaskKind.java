package com.phillippitts.enginecoordinator.domain;

import java.util.Locale;

/**
 * Kinds of work the coordinator accepts. Each kind selects a fixed subset of engines.
 */
public enum TaskKind {
    COMPLETION(EngineType.LLM),
    RECALL(EngineType.RECALL),
    PARALLEL(EngineType.WORKER_POOL),
    CREATIVE(EngineType.CREATIVE),
    COMPOSITE(EngineType.LLM);

    private final EngineType primaryEngine;

    TaskKind(EngineType primaryEngine) {
        this.primaryEngine = primaryEngine;
    }

    /** Engine whose failure fails a task of this kind. */
    public EngineType primaryEngine() {
        return primaryEngine;
    }

    /**
     * Parses a wire value such as {@code "completion"} or {@code "COMPOSITE"}.
     *
     * @throws IllegalArgumentException if the value is blank or names no known kind
     */
    public static TaskKind fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("taskKind must not be blank");
        }
        try {
            return TaskKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown taskKind: " + value, e);
        }
    }
}

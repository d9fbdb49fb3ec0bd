package com.phillippitts.enginecoordinator.domain;

/** Backing capabilities a task can be dispatched to. */
public enum EngineType {
    LLM,
    RECALL,
    WORKER_POOL,
    CREATIVE
}

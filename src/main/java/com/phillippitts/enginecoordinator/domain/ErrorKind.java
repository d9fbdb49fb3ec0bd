package com.phillippitts.enginecoordinator.domain;

/**
 * Error taxonomy reported in {@link CoordinationResult#errors()}.
 *
 * <p>Only {@link #ALL_PROVIDERS_EXHAUSTED} and {@link #ENGINE_CRASH} on a mandatory engine turn a
 * task into a failure; the remaining kinds describe degraded but usable results.
 */
public enum ErrorKind {
    /** A single provider failed and the chain moved on. */
    PROVIDER_UNAVAILABLE,
    /** Every provider in the chain failed. */
    ALL_PROVIDERS_EXHAUSTED,
    /** Worker pool refused work; retry later. */
    QUEUE_FULL,
    /** Recall answered late or partially. */
    RECALL_DEGRADED,
    /** Fewer creative candidates than requested. */
    GENERATION_PARTIAL,
    /** A deadline expired before the engine answered. */
    COORDINATION_TIMEOUT,
    /** An executing task raised. */
    ENGINE_CRASH,
    /** The coordinator is draining and did not dispatch the task. */
    REJECTED
}

package com.phillippitts.enginecoordinator.service.coordination;

import com.phillippitts.enginecoordinator.domain.CoordinationStatus;

/**
 * Phases of one coordinated task. The last four are terminal and mirror {@link CoordinationStatus}.
 */
public enum TaskPhase {
    CREATED,
    DISPATCHING,
    AWAITING_ENGINES,
    MERGING,
    COMPLETED,
    DEGRADED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return ordinal() >= COMPLETED.ordinal();
    }

    static TaskPhase of(CoordinationStatus status) {
        return switch (status) {
            case COMPLETED -> COMPLETED;
            case DEGRADED -> DEGRADED;
            case FAILED -> FAILED;
            case TIMED_OUT -> TIMED_OUT;
        };
    }
}

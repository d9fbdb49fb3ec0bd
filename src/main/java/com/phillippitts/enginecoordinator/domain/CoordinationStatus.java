package com.phillippitts.enginecoordinator.domain;

/** Final status of a coordinated task. */
public enum CoordinationStatus {
    COMPLETED,
    DEGRADED,
    FAILED,
    TIMED_OUT;

    /** True for statuses that still carry usable data. */
    public boolean hasUsableResult() {
        return this == COMPLETED || this == DEGRADED;
    }
}

package com.phillippitts.enginecoordinator.service.provider;

/**
 * Per-provider health.
 *
 * <pre>
 * HEALTHY --(K consecutive failures)--> DEGRADED --(M consecutive failures)--> UNHEALTHY
 * UNHEALTHY --(N consecutive successful probes)--> HEALTHY
 * </pre>
 */
public enum HealthState {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    /** Unhealthy providers only see recovery probes. */
    public boolean acceptsTraffic() {
        return this != UNHEALTHY;
    }
}

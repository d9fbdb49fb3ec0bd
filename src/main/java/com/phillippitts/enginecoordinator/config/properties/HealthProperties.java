package com.phillippitts.enginecoordinator.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Thresholds and timing for provider health tracking.
 */
@ConfigurationProperties(prefix = "coordinator.health")
@Validated
public class HealthProperties {

    /** Consecutive failures that move a healthy provider to DEGRADED. */
    @Positive(message = "Degraded threshold must be positive")
    private int failureThresholdDegraded = 3;

    /** Consecutive failures that move a provider to UNHEALTHY. */
    @Positive(message = "Unhealthy threshold must be positive")
    private int failureThresholdUnhealthy = 5;

    /** Consecutive successful recovery probes that restore an unhealthy provider. */
    @Positive(message = "Recovery probe successes must be positive")
    private int recoveryProbeSuccesses = 2;

    /** Interval between recovery probes of the same provider. */
    @NotNull
    private Duration probeInterval = Duration.ofSeconds(30);

    public int getFailureThresholdDegraded() {
        return failureThresholdDegraded;
    }

    public void setFailureThresholdDegraded(int failureThresholdDegraded) {
        this.failureThresholdDegraded = failureThresholdDegraded;
    }

    public int getFailureThresholdUnhealthy() {
        return failureThresholdUnhealthy;
    }

    public void setFailureThresholdUnhealthy(int failureThresholdUnhealthy) {
        this.failureThresholdUnhealthy = failureThresholdUnhealthy;
    }

    public int getRecoveryProbeSuccesses() {
        return recoveryProbeSuccesses;
    }

    public void setRecoveryProbeSuccesses(int recoveryProbeSuccesses) {
        this.recoveryProbeSuccesses = recoveryProbeSuccesses;
    }

    public Duration getProbeInterval() {
        return probeInterval;
    }

    public void setProbeInterval(Duration probeInterval) {
        this.probeInterval = probeInterval;
    }
}

package com.phillippitts.enginecoordinator.config.properties;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Sizing, backpressure and autoscaling policy of the worker pool.
 */
@ConfigurationProperties(prefix = "coordinator.pool")
@Validated
public class WorkerPoolProperties {

    @Positive(message = "Min workers must be positive")
    private int minWorkers = 4;

    @Positive(message = "Max workers must be positive")
    private int maxWorkers = 16;

    /** Queued tasks beyond which submit fails with QueueFull. */
    @Positive(message = "Queue limit must be positive")
    private int queueLimit = 100;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double scaleUpThreshold = 0.8;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double scaleDownThreshold = 0.3;

    @Positive
    private int scaleUpStep = 2;

    @Positive
    private int scaleDownStep = 1;

    @NotNull
    private Duration autoscaleInterval = Duration.ofSeconds(10);

    /** Minimum time between two scale-down actions. */
    @NotNull
    private Duration scaleDownCooldown = Duration.ofSeconds(30);

    /** How long shutdown waits for queued and running tasks. */
    @NotNull
    private Duration drainTimeout = Duration.ofSeconds(30);

    @NotBlank
    private String threadNamePrefix = "worker-";

    @AssertTrue(message = "minWorkers must not exceed maxWorkers")
    public boolean isBoundsValid() {
        return minWorkers <= maxWorkers;
    }

    @AssertTrue(message = "scaleDownThreshold must be below scaleUpThreshold")
    public boolean isThresholdsValid() {
        return scaleDownThreshold < scaleUpThreshold;
    }

    public int getMinWorkers() {
        return minWorkers;
    }

    public void setMinWorkers(int minWorkers) {
        this.minWorkers = minWorkers;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public void setMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
    }

    public int getQueueLimit() {
        return queueLimit;
    }

    public void setQueueLimit(int queueLimit) {
        this.queueLimit = queueLimit;
    }

    public double getScaleUpThreshold() {
        return scaleUpThreshold;
    }

    public void setScaleUpThreshold(double scaleUpThreshold) {
        this.scaleUpThreshold = scaleUpThreshold;
    }

    public double getScaleDownThreshold() {
        return scaleDownThreshold;
    }

    public void setScaleDownThreshold(double scaleDownThreshold) {
        this.scaleDownThreshold = scaleDownThreshold;
    }

    public int getScaleUpStep() {
        return scaleUpStep;
    }

    public void setScaleUpStep(int scaleUpStep) {
        this.scaleUpStep = scaleUpStep;
    }

    public int getScaleDownStep() {
        return scaleDownStep;
    }

    public void setScaleDownStep(int scaleDownStep) {
        this.scaleDownStep = scaleDownStep;
    }

    public Duration getAutoscaleInterval() {
        return autoscaleInterval;
    }

    public void setAutoscaleInterval(Duration autoscaleInterval) {
        this.autoscaleInterval = autoscaleInterval;
    }

    public Duration getScaleDownCooldown() {
        return scaleDownCooldown;
    }

    public void setScaleDownCooldown(Duration scaleDownCooldown) {
        this.scaleDownCooldown = scaleDownCooldown;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }
}

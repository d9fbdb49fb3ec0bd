package com.phillippitts.enginecoordinator.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Coordinator deadlines.
 *
 * <p>Every engine call gets {@code min(engineTimeout, remaining global budget)}; the global budget
 * is {@link #timeout} unless the task carries an earlier deadline.
 */
@ConfigurationProperties(prefix = "coordinator.coordination")
@Validated
public class CoordinationProperties {

    @NotNull
    private Duration timeout = Duration.ofSeconds(60);

    /** Budget of one routed completion, including fallbacks. */
    @NotNull
    private Duration llmTimeout = Duration.ofSeconds(30);

    /** Budget of a parallel batch on the worker pool. */
    @NotNull
    private Duration poolTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration drainTimeout = Duration.ofSeconds(30);

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Duration getLlmTimeout() {
        return llmTimeout;
    }

    public void setLlmTimeout(Duration llmTimeout) {
        this.llmTimeout = llmTimeout;
    }

    public Duration getPoolTimeout() {
        return poolTimeout;
    }

    public void setPoolTimeout(Duration poolTimeout) {
        this.poolTimeout = poolTimeout;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }
}

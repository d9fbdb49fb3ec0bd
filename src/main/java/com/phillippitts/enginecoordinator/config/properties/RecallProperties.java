package com.phillippitts.enginecoordinator.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Recall store limits.
 */
@ConfigurationProperties(prefix = "coordinator.recall")
@Validated
public class RecallProperties {

    /** Budget applied when a query carries none. */
    @NotNull
    private Duration latencyBudget = Duration.ofMillis(500);

    @Positive(message = "Default topK must be positive")
    private int defaultTopK = 5;

    /** Cached query results; 0 disables the cache. */
    @Min(value = 0, message = "Cache size must be >= 0")
    private int cacheSize = 256;

    public Duration getLatencyBudget() {
        return latencyBudget;
    }

    public void setLatencyBudget(Duration latencyBudget) {
        this.latencyBudget = latencyBudget;
    }

    public int getDefaultTopK() {
        return defaultTopK;
    }

    public void setDefaultTopK(int defaultTopK) {
        this.defaultTopK = defaultTopK;
    }

    public int getCacheSize() {
        return cacheSize;
    }

    public void setCacheSize(int cacheSize) {
        this.cacheSize = cacheSize;
    }
}

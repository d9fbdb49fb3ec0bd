package com.phillippitts.enginecoordinator.config.properties;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Creative generation: candidate count, timeout and ranking weights.
 */
@ConfigurationProperties(prefix = "coordinator.creative")
@Validated
public class CreativeProperties {

    @Positive(message = "Candidate count must be positive")
    private int count = 5;

    @NotNull
    private Duration generationTimeout = Duration.ofSeconds(20);

    @DecimalMin("0.0")
    private double noveltyWeight = 0.5;

    @DecimalMin("0.0")
    private double feasibilityWeight = 0.5;

    /** Token-set similarity at or above which a lower-ranked candidate is dropped. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.9;

    @AssertTrue(message = "At least one ranking weight must be positive")
    public boolean isWeightsValid() {
        return noveltyWeight + feasibilityWeight > 0;
    }

    public int getCount() {
        return count;
    }

    public void setCount(int count) {
        this.count = count;
    }

    public Duration getGenerationTimeout() {
        return generationTimeout;
    }

    public void setGenerationTimeout(Duration generationTimeout) {
        this.generationTimeout = generationTimeout;
    }

    public double getNoveltyWeight() {
        return noveltyWeight;
    }

    public void setNoveltyWeight(double noveltyWeight) {
        this.noveltyWeight = noveltyWeight;
    }

    public double getFeasibilityWeight() {
        return feasibilityWeight;
    }

    public void setFeasibilityWeight(double feasibilityWeight) {
        this.feasibilityWeight = feasibilityWeight;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }
}

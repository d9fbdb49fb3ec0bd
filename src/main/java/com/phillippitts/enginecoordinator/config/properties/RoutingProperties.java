package com.phillippitts.enginecoordinator.config.properties;

import com.phillippitts.enginecoordinator.service.provider.ProviderRegistry;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Provider routing policy: tie-break between equal priorities and the daily cloud budget.
 */
@ConfigurationProperties(prefix = "coordinator.routing")
@Validated
public class RoutingProperties {

    /** Order between providers sharing a priority. */
    @NotNull
    private ProviderRegistry.TieBreak tieBreak = ProviderRegistry.TieBreak.REGISTRATION_ORDER;

    /** Daily cloud spend after which only local providers are used. 0 disables the guard. */
    @DecimalMin(value = "0.0", message = "Daily cloud budget must be >= 0")
    private double dailyCloudBudget = 0.0;

    /** Premium price per 1k tokens that local usage is compared against in the cost summary. */
    @DecimalMin(value = "0.0", message = "Baseline cost must be >= 0")
    private double baselineCostPerKToken = 0.03;

    public ProviderRegistry.TieBreak getTieBreak() {
        return tieBreak;
    }

    public void setTieBreak(ProviderRegistry.TieBreak tieBreak) {
        this.tieBreak = tieBreak;
    }

    public double getDailyCloudBudget() {
        return dailyCloudBudget;
    }

    public void setDailyCloudBudget(double dailyCloudBudget) {
        this.dailyCloudBudget = dailyCloudBudget;
    }

    public double getBaselineCostPerKToken() {
        return baselineCostPerKToken;
    }

    public void setBaselineCostPerKToken(double baselineCostPerKToken) {
        this.baselineCostPerKToken = baselineCostPerKToken;
    }
}

package com.phillippitts.enginecoordinator.service.cost;

/**
 * Aggregate view over the cost ledger.
 *
 * @param totalCost        everything charged so far
 * @param localRequests    successful calls served by local providers
 * @param cloudRequests    successful calls served by cloud providers
 * @param failedRequests   failed calls of any kind
 * @param localRatio       share of successful calls served locally (0 when there were none)
 * @param cloudSpendToday  cloud spend for the current UTC day
 * @param dailyCloudBudget configured daily cloud budget; 0 means unlimited
 * @param budgetRemaining  budget left today; 0 when the budget is unlimited or spent
 * @param estimatedSavings what locally served tokens would have cost at the baseline price
 */
public record CostSummary(
        double totalCost,
        long localRequests,
        long cloudRequests,
        long failedRequests,
        double localRatio,
        double cloudSpendToday,
        double dailyCloudBudget,
        double budgetRemaining,
        double estimatedSavings
) {

    public boolean budgetEnforced() {
        return dailyCloudBudget > 0.0;
    }
}

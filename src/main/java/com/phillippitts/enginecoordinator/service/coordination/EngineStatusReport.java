package com.phillippitts.enginecoordinator.service.coordination;

import com.phillippitts.enginecoordinator.service.pool.WorkerPoolState;
import com.phillippitts.enginecoordinator.service.provider.ProviderStatus;

import java.time.Instant;
import java.util.List;

/**
 * Engine-wide status, served at {@code GET /api/v1/engines}.
 */
public record EngineStatusReport(
        boolean accepting,
        int inFlightTasks,
        List<ProviderStatus> providers,
        WorkerPoolState pool,
        int recallEntries,
        CoordinationStats.Snapshot stats,
        Instant generatedAt
) {

    public EngineStatusReport {
        providers = providers == null ? List.of() : List.copyOf(providers);
    }
}

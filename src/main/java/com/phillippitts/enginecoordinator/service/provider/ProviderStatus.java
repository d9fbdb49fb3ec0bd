package com.phillippitts.enginecoordinator.service.provider;

import java.time.Instant;

/**
 * Point-in-time view of a provider descriptor, safe to hand out to callers.
 */
public record ProviderStatus(
        String id,
        ProviderKind kind,
        String endpoint,
        int priority,
        double costPerKToken,
        HealthState healthState,
        int consecutiveFailures,
        Instant lastProbeAt
) {}

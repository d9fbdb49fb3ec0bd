package com.phillippitts.enginecoordinator.service.provider.event;

import com.phillippitts.enginecoordinator.service.provider.HealthState;

import java.time.Instant;

/**
 * Published whenever a provider moves between health states.
 *
 * <p>The reason is a technical diagnostic (timeout, HTTP status, probe result) and never contains
 * prompt text.
 */
public record ProviderStateChangedEvent(
        String provider,
        HealthState from,
        HealthState to,
        Instant at,
        String reason
) {
    public ProviderStateChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }

    public boolean isRecovery() {
        return to == HealthState.HEALTHY;
    }
}

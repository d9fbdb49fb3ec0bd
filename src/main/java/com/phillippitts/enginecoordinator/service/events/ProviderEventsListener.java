package com.phillippitts.enginecoordinator.service.events;

import com.phillippitts.enginecoordinator.service.provider.HealthState;
import com.phillippitts.enginecoordinator.service.provider.event.ProviderStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing log of provider health changes, throttled per provider and target state to
 * keep a flapping provider from flooding the log.
 */
@Component
class ProviderEventsListener {
    private static final Logger LOG = LogManager.getLogger(ProviderEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onProviderStateChanged(ProviderStateChangedEvent e) {
        String key = e.provider() + '-' + e.to();
        if (!shouldLog(key)) {
            return;
        }
        if (e.isRecovery()) {
            LOG.info("Provider {} is back in rotation ({} -> {})", e.provider(), e.from(), e.to());
        } else if (e.to() == HealthState.UNHEALTHY) {
            LOG.warn("Provider {} removed from rotation: {}. Recovery probes will retry it.",
                    e.provider(), e.reason());
        } else {
            LOG.warn("Provider {} degraded: {}", e.provider(), e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}

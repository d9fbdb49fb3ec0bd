package com.phillippitts.enginecoordinator.service.health;

import com.phillippitts.enginecoordinator.service.provider.HealthState;
import com.phillippitts.enginecoordinator.service.provider.ProviderRegistry;
import com.phillippitts.enginecoordinator.service.provider.ProviderStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Health indicator for the model provider chain.
 *
 * <p>Reports provider availability for monitoring and alerting:
 * <ul>
 *   <li>UP: every provider healthy</li>
 *   <li>DEGRADED: at least one provider still accepts traffic</li>
 *   <li>DOWN: no provider accepts traffic, or none is configured</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class ProviderHealthIndicator implements HealthIndicator {

    private final ProviderRegistry registry;

    public ProviderHealthIndicator(ProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        List<ProviderStatus> statuses = registry.statuses();
        long healthy = statuses.stream().filter(s -> s.healthState() == HealthState.HEALTHY).count();
        long routable = statuses.stream().filter(s -> s.healthState().acceptsTraffic()).count();

        Map<String, String> details = new LinkedHashMap<>();
        for (ProviderStatus s : statuses) {
            details.put(s.id(), s.healthState().name().toLowerCase(Locale.ROOT));
        }

        Health.Builder builder = new Health.Builder();
        if (!statuses.isEmpty() && healthy == statuses.size()) {
            builder.up().withDetail("status", "All providers operational");
        } else if (routable > 0) {
            builder.status("DEGRADED")
                    .withDetail("status", "Partial provider availability (" + routable + "/" + statuses.size() + ")");
        } else {
            builder.down().withDetail("status", statuses.isEmpty()
                    ? "No providers configured"
                    : "No providers available");
        }
        return builder.withDetail("providers", details).build();
    }
}

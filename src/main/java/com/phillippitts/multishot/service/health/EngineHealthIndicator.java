package com.phillippitts.multishot.service.health;

import com.phillippitts.multishot.service.runner.MultiShotService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Health indicator for the default engines.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: every default engine available</li>
 *   <li>DEGRADED: at least one default engine available</li>
 *   <li>DOWN: no default engine available</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health as {@code engines}.
 */
@Component("engines")
public class EngineHealthIndicator implements HealthIndicator {

    private final MultiShotService service;

    public EngineHealthIndicator(MultiShotService service) {
        this.service = service;
    }

    @Override
    public Health health() {
        Map<String, Boolean> status = service.engineStatus(null);
        long ready = status.values().stream().filter(Boolean::booleanValue).count();

        Health.Builder builder = new Health.Builder();
        if (!status.isEmpty() && ready == status.size()) {
            builder.up().withDetail("status", "All engines available");
        } else if (ready > 0) {
            builder.status("DEGRADED").withDetail("status", "Partial engine availability");
        } else {
            builder.down().withDetail("status", "No engines available");
        }
        status.forEach((name, ok) -> builder.withDetail(name, ok ? "ready" : "unavailable"));
        return builder.build();
    }
}

package com.phillippitts.watchkeeper.service.health;

import com.phillippitts.watchkeeper.domain.WatcherStatus;
import com.phillippitts.watchkeeper.service.watcher.Supervisor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for supervised watchers.
 *
 * <p>Only watchers that are supposed to be running count; a stopped watcher is neither healthy
 * nor unhealthy.
 * <ul>
 *   <li>UP: every active watcher runs its desired process count (or nothing is active)</li>
 *   <li>DEGRADED: some active watchers are short of processes or abandoned a slot</li>
 *   <li>DOWN: no active watcher is healthy</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class WatcherHealthIndicator implements HealthIndicator {

    private final Supervisor supervisor;

    public WatcherHealthIndicator(Supervisor supervisor) {
        this.supervisor = supervisor;
    }

    @Override
    public Health health() {
        List<WatcherStatus> statuses = supervisor.statuses();
        int active = 0;
        int healthy = 0;
        Map<String, Object> details = new LinkedHashMap<>();
        for (WatcherStatus s : statuses) {
            details.put(s.name(), describe(s));
            if (s.state().isActive()) {
                active++;
                if (s.isHealthy()) {
                    healthy++;
                }
            }
        }

        Health.Builder builder = new Health.Builder();
        if (healthy == active) {
            builder.up().withDetail("status", active == 0 ? "No active watchers" : "All watchers operational");
        } else if (healthy > 0) {
            builder.status("DEGRADED").withDetail("status", healthy + "/" + active + " active watchers healthy");
        } else {
            builder.down().withDetail("status", "No active watcher is healthy");
        }
        supervisor.activeCommand().ifPresent(c -> builder.withDetail("activeCommand", c));
        return builder.withDetail("watchers", details).build();
    }

    private static String describe(WatcherStatus s) {
        StringBuilder sb = new StringBuilder(s.state().name().toLowerCase())
                .append(' ').append(s.live()).append('/').append(s.desired());
        if (s.degraded()) {
            sb.append(" degraded");
        }
        return sb.toString();
    }
}

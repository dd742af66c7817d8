package com.phillippitts.livenesswatch.service.health;

import com.phillippitts.livenesswatch.domain.WatchdogSnapshot;
import com.phillippitts.livenesswatch.service.watchdog.Watchdog;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the monitored workload.
 *
 * <ul>
 *   <li>UP: watchdog idle, or running and fed within its threshold</li>
 *   <li>DOWN: the last episode ended in a timeout and the watchdog has not been fed since</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class WatchdogHealthIndicator implements HealthIndicator {

    private final Watchdog watchdog;

    public WatchdogHealthIndicator(Watchdog watchdog) {
        this.watchdog = watchdog;
    }

    @Override
    public Health health() {
        WatchdogSnapshot snapshot = watchdog.snapshot();

        Health.Builder builder = timedOut(snapshot) ? Health.down() : Health.up();
        builder.withDetail("name", snapshot.name())
                .withDetail("state", state(snapshot));
        if (snapshot.running()) {
            builder.withDetail("timeoutMs", snapshot.timeoutMs())
                    .withDetail("lastFeedTime", String.valueOf(snapshot.lastFeedTime()));
        }
        if (snapshot.lastTimeoutAt() != null) {
            builder.withDetail("lastTimeoutAt", snapshot.lastTimeoutAt().toString());
        }
        return builder.build();
    }

    private static boolean timedOut(WatchdogSnapshot snapshot) {
        return snapshot.timeoutOccurred() || snapshot.lastTimeoutAt() != null;
    }

    private String state(WatchdogSnapshot snapshot) {
        if (timedOut(snapshot)) {
            return "timeout";
        }
        return snapshot.running() ? "running" : "idle";
    }
}

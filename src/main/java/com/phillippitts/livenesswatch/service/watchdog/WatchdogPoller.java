package com.phillippitts.livenesswatch.service.watchdog;

import com.phillippitts.livenesswatch.service.metrics.WatchdogMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Recurring tick that turns a detected timeout into an alert.
 *
 * <p>Detection latency is bounded by {@code watchdog.poll-interval-ms}, not only by the
 * watchdog's threshold. The tick never waits for channel I/O: the delivery outcome of the
 * timeout alert is logged by the dispatch worker once the router is done with it.
 */
@Component
@ConditionalOnProperty(prefix = "watchdog", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WatchdogPoller {

    private static final Logger LOG = LogManager.getLogger(WatchdogPoller.class);

    static final String WATCHDOG_CONTEXT_KEY = "watchdog";

    private final Watchdog watchdog;
    private final WatchdogMetrics metrics;

    public WatchdogPoller(Watchdog watchdog, WatchdogMetrics metrics) {
        this.watchdog = Objects.requireNonNull(watchdog, "watchdog");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Scheduled(fixedDelayString = "${watchdog.poll-interval-ms:1000}")
    public void tick() {
        ThreadContext.put(WATCHDOG_CONTEXT_KEY, watchdog.getName());
        try {
            if (!watchdog.poll()) {
                return;
            }
            metrics.incrementTimeout(watchdog.getName());
            String name = watchdog.getName();
            watchdog.notifyTimeoutAsync().thenAccept(delivered -> {
                if (delivered) {
                    LOG.info("Timeout alert for watchdog {} delivered", name);
                } else {
                    LOG.warn("Timeout alert for watchdog {} was not delivered on any channel", name);
                }
            });
        } finally {
            ThreadContext.remove(WATCHDOG_CONTEXT_KEY);
        }
    }
}

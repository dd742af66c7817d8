package com.phillippitts.livenesswatch.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Centralized metrics for watchdog detections and alert delivery.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Timeouts detected per watchdog</li>
 *   <li>Delivery attempts per channel and outcome</li>
 *   <li>Alerts that no channel delivered</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class WatchdogMetrics {

    private static final String METRIC_PREFIX = "livenesswatch";

    private final MeterRegistry registry;

    public WatchdogMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Increments the timeout counter for a watchdog.
     *
     * @param watchdog watchdog name
     */
    public void incrementTimeout(String watchdog) {
        Counter.builder(METRIC_PREFIX + ".watchdog.timeouts")
                .description("Number of timeout episodes detected")
                .tag("watchdog", watchdog)
                .register(registry)
                .increment();
    }

    /**
     * Records one delivery attempt.
     *
     * @param channel channel id (telegram, wechat)
     * @param success whether the channel accepted the message
     */
    public void recordDelivery(String channel, boolean success) {
        Counter.builder(METRIC_PREFIX + ".notification.attempts")
                .description("Alert delivery attempts per channel")
                .tag("channel", channel)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    /** Increments the counter of alerts that no channel delivered. */
    public void incrementUndelivered() {
        Counter.builder(METRIC_PREFIX + ".notification.undelivered")
                .description("Alerts that could not be delivered on any channel")
                .register(registry)
                .increment();
    }
}

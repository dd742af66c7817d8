package com.phillippitts.livenesswatch.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the liveness watchdog and its polling tick.
 */
@ConfigurationProperties(prefix = "watchdog")
@Validated
public class WatchdogProperties {

    /** Enable/disable the scheduled polling tick. */
    private boolean enabled = true;

    /** Name of the monitored subject, used in log context and metric tags. */
    @NotBlank(message = "Watchdog name must not be blank")
    private String name = "default";

    /** Threshold applied when the first feed does not carry one, in milliseconds. */
    @PositiveOrZero(message = "Default timeout must not be negative")
    private long defaultTimeoutMs = 30_000;

    /** Delay between two polling ticks, in milliseconds. Bounds detection latency. */
    @Positive(message = "Poll interval must be positive")
    private long pollIntervalMs = 1_000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public long getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public void setDefaultTimeoutMs(long defaultTimeoutMs) {
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }
}

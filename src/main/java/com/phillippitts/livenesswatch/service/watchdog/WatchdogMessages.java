package com.phillippitts.livenesswatch.service.watchdog;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds the alert texts sent by the watchdog.
 *
 * <p>Sections are separated by a blank line; timestamps use {@code yyyy-MM-dd HH:mm:ss} in the
 * clock's zone.
 */
final class WatchdogMessages {

    static final String STARTED_TAG = "[WATCHDOG] Auto-Started";
    static final String UPDATED_TAG = "[WATCHDOG] Timeout Updated";
    static final String STOPPED_TAG = "[WATCHDOG] Auto-Stopped";
    static final String TIMEOUT_TAG = "[WATCHDOG] Timeout Alert!";

    private static final String SEPARATOR = "\n\n";

    private final DateTimeFormatter formatter;

    WatchdogMessages(Clock clock) {
        Objects.requireNonNull(clock, "clock");
        this.formatter = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT)
                .withZone(clock.getZone());
    }

    String started(long timeoutMs, String info, Instant at) {
        return STARTED_TAG + SEPARATOR
                + "Timeout: " + timeoutMs + "ms" + SEPARATOR
                + "Info: " + info + SEPARATOR
                + "Time: " + format(at);
    }

    String timeoutUpdated(long oldTimeoutMs, long newTimeoutMs, String info, Instant at) {
        return UPDATED_TAG + SEPARATOR
                + "Old Timeout: " + oldTimeoutMs + "ms" + SEPARATOR
                + "New Timeout: " + newTimeoutMs + "ms" + SEPARATOR
                + "Info: " + info + SEPARATOR
                + "Time: " + format(at);
    }

    String stopped(String reason, Instant at) {
        return STOPPED_TAG + SEPARATOR
                + "Reason: " + reason + SEPARATOR
                + "Time: " + format(at);
    }

    String timeoutAlert(String startInfo, long timeoutMs, double elapsedMs, Instant lastFeed, Instant at) {
        return TIMEOUT_TAG + SEPARATOR
                + "Start Info: " + startInfo + SEPARATOR
                + "Timeout Threshold: " + timeoutMs + "ms" + SEPARATOR
                + "Elapsed Time: " + formatElapsed(elapsedMs) + "ms" + SEPARATOR
                + "Last Feed: " + (lastFeed == null ? "Never" : format(lastFeed)) + SEPARATOR
                + "Alert Time: " + format(at);
    }

    String format(Instant instant) {
        return formatter.format(instant);
    }

    /** One decimal place, locale independent. */
    static String formatElapsed(double elapsedMs) {
        return String.format(Locale.ROOT, "%.1f", elapsedMs);
    }
}

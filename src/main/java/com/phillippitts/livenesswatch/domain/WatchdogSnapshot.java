package com.phillippitts.livenesswatch.domain;

import java.time.Instant;

/**
 * Point-in-time copy of a watchdog's state, taken under its state lock.
 *
 * @param name            monitored subject
 * @param running         true while armed
 * @param timeoutOccurred true between a detected expiry and the next feed or stop
 * @param timeoutMs       allowed silence before a timeout is detected
 * @param lastFeedTime    last arm/feed instant, null before the first feed
 * @param startInfo       context captured when the watchdog was armed
 * @param lastTimeoutAt   when the last timeout was detected; survives the auto-stop, null once
 *                        the watchdog is fed again
 */
public record WatchdogSnapshot(
        String name,
        boolean running,
        boolean timeoutOccurred,
        long timeoutMs,
        Instant lastFeedTime,
        String startInfo,
        Instant lastTimeoutAt
) {
}

package com.phillippitts.livenesswatch.service.watchdog;

import com.phillippitts.livenesswatch.domain.WatchdogSnapshot;
import com.phillippitts.livenesswatch.service.notification.AlertDispatcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Liveness watchdog for one monitored subject.
 *
 * <p>States: Idle and Running. The first {@link #feed} arms the watchdog; later feeds reset the
 * silence timer. {@link #poll()} detects an expired timer once per timeout episode, and
 * {@link #notifyTimeout()} sends the timeout alert and returns the watchdog to Idle. A
 * {@link #manualStop} also returns it to Idle. The instant of the last detected timeout is kept
 * after the auto-stop and cleared by the next feed, so the episode stays visible to health checks.
 *
 * <p>All reads and writes of the state fields happen under a single {@link ReentrantLock}, which
 * gives each instance a total order of operations. Alerts are only queued on the
 * {@link AlertDispatcher} while the lock is held; channel I/O runs on the dispatch worker, so a
 * slow channel never stalls {@code feed} or {@code poll}.
 *
 * <p>Invariants:
 * <ul>
 *   <li>{@code !running} implies {@code !timeoutSignaled}</li>
 *   <li>{@code running} implies {@code lastFeedTime != null}</li>
 *   <li>at most one {@code poll()} returns true between two feeds/stops</li>
 * </ul>
 */
public class Watchdog {

    private static final Logger LOG = LogManager.getLogger(Watchdog.class);

    static final String TIMEOUT_STOP_REASON = "Timeout occurred";

    private final String name;
    private final long defaultTimeoutMs;
    private final Clock clock;
    private final AlertDispatcher dispatcher;
    private final WatchdogMessages messages;

    private final ReentrantLock lock = new ReentrantLock();

    private boolean running;
    private long timeoutMs;
    private Instant lastFeedTime;
    private boolean timeoutSignaled;
    private String startInfo = "";
    private Instant lastTimeoutAt;

    public Watchdog(String name,
                    long defaultTimeoutMs,
                    Clock clock,
                    AlertDispatcher dispatcher) {
        if (defaultTimeoutMs < 0) {
            throw new IllegalArgumentException("defaultTimeoutMs must not be negative: " + defaultTimeoutMs);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.messages = new WatchdogMessages(clock);
    }

    /**
     * Feeds the watchdog, arming it first if it is idle.
     *
     * <ul>
     *   <li>Idle: arms with {@code timeoutMs}, or the default threshold when it is null, records
     *       {@code info} as start info and queues an "Auto-Started" alert.</li>
     *   <li>Running: resets the silence timer and clears a signaled timeout. When
     *       {@code timeoutMs} is given, also replaces the threshold and queues a
     *       "Timeout Updated" alert.</li>
     * </ul>
     *
     * @param timeoutMs allowed silence in milliseconds, or null if not provided
     * @param info      free-form context; null is treated as empty
     * @return always true; alert delivery does not affect the result
     * @throws IllegalArgumentException if {@code timeoutMs} is negative
     */
    public boolean feed(Long timeoutMs, String info) {
        if (timeoutMs != null && timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must not be negative: " + timeoutMs);
        }
        String safeInfo = info == null ? "" : info;
        lock.lock();
        try {
            Instant now = clock.instant();
            if (!running) {
                long threshold = timeoutMs != null ? timeoutMs : defaultTimeoutMs;
                LOG.debug("Watchdog not running, auto-starting with timeout: {}ms, info: {}", threshold, safeInfo);
                this.timeoutMs = threshold;
                this.startInfo = safeInfo;
                this.lastFeedTime = now;
                this.timeoutSignaled = false;
                this.lastTimeoutAt = null;
                this.running = true;
                LOG.info("Watchdog auto-started - timeout: {}ms, info: {}", threshold, safeInfo);
                dispatcher.dispatch(messages.started(threshold, safeInfo, now));
                return true;
            }

            this.lastFeedTime = now;
            this.timeoutSignaled = false;
            this.lastTimeoutAt = null;
            LOG.debug("Watchdog fed at {}", messages.format(now));

            if (timeoutMs != null) {
                long previous = this.timeoutMs;
                this.timeoutMs = timeoutMs;
                LOG.info("Watchdog timeout updated - old: {}ms, new: {}ms, info: {}", previous, timeoutMs, safeInfo);
                dispatcher.dispatch(messages.timeoutUpdated(previous, timeoutMs, safeInfo, now));
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Feeds the watchdog without changing its threshold.
     */
    public boolean feed(String info) {
        return feed(null, info);
    }

    /**
     * Checks whether the watchdog has gone silent for longer than its threshold.
     *
     * <p>Returns true only for the first poll of a timeout episode; polls after that return
     * false until the next feed or stop. Never sends alerts and never stops the watchdog.
     *
     * @return true if a new timeout was detected
     */
    public boolean poll() {
        lock.lock();
        try {
            if (!running) {
                return false;
            }
            Instant now = clock.instant();
            double elapsedMs = elapsedMillis(now);
            boolean expired = elapsedMs > timeoutMs;
            if (expired && !timeoutSignaled) {
                timeoutSignaled = true;
                lastTimeoutAt = now;
                LOG.debug("Watchdog timeout detected - elapsed: {}ms, timeout: {}ms",
                        WatchdogMessages.formatElapsed(elapsedMs), timeoutMs);
                return true;
            }
            LOG.trace("Watchdog poll - elapsed: {}ms, timeout: {}ms, expired: {}, alreadySignaled: {}",
                    WatchdogMessages.formatElapsed(elapsedMs), timeoutMs, expired, timeoutSignaled);
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sends the timeout alert, stops the watchdog and waits for the alert's delivery outcome.
     *
     * <p>The watchdog is Idle when this returns, whether or not the alert was delivered, so one
     * timeout episode produces one alert. The wait happens outside the state lock and lasts as
     * long as the router needs for this alert and for any alert queued ahead of it; each channel
     * attempt is bounded by the HTTP client's connect and read timeouts.
     *
     * @return true if a channel delivered the timeout alert; false if idle or undelivered
     */
    public boolean notifyTimeout() {
        return awaitDelivery(notifyTimeoutAsync());
    }

    /**
     * Same transition as {@link #notifyTimeout()} without waiting: the watchdog is Idle when this
     * returns and the future completes with the router's result once the alert has been handled.
     *
     * @return delivery outcome of the timeout alert; completed with false if the watchdog was idle
     */
    public CompletableFuture<Boolean> notifyTimeoutAsync() {
        lock.lock();
        try {
            if (!running) {
                return CompletableFuture.completedFuture(false);
            }
            Instant now = clock.instant();
            double elapsedMs = elapsedMillis(now);
            String alert = messages.timeoutAlert(startInfo, timeoutMs, elapsedMs, lastFeedTime, now);
            LOG.info("Watchdog timeout alert - elapsed: {}ms, threshold: {}ms, auto-stopping",
                    WatchdogMessages.formatElapsed(elapsedMs), timeoutMs);
            if (lastTimeoutAt == null) {
                lastTimeoutAt = now;
            }
            CompletableFuture<Boolean> delivery = dispatcher.dispatch(alert);
            stopLocked(TIMEOUT_STOP_REASON, now);
            return delivery;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops a running watchdog and queues an "Auto-Stopped" alert.
     *
     * @param info reason appended to the stop alert; null is treated as empty
     * @return true if the watchdog was running, false (no effect) if it was idle
     */
    public boolean manualStop(String info) {
        String safeInfo = info == null ? "" : info;
        lock.lock();
        try {
            if (!running) {
                LOG.debug("Watchdog is not running");
                return false;
            }
            stopLocked("Manual stop - " + safeInfo, clock.instant());
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        lock.lock();
        try {
            return running;
        } finally {
            lock.unlock();
        }
    }

    public boolean timeoutOccurred() {
        lock.lock();
        try {
            return timeoutSignaled;
        } finally {
            lock.unlock();
        }
    }

    public long currentTimeoutMs() {
        lock.lock();
        try {
            return timeoutMs;
        } finally {
            lock.unlock();
        }
    }

    /** Consistent copy of all state fields. */
    public WatchdogSnapshot snapshot() {
        lock.lock();
        try {
            return new WatchdogSnapshot(name, running, timeoutSignaled, timeoutMs, lastFeedTime, startInfo,
                    lastTimeoutAt);
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    private void stopLocked(String reason, Instant now) {
        running = false;
        timeoutSignaled = false;
        LOG.info("Watchdog auto-stopped - reason: {}", reason);
        dispatcher.dispatch(messages.stopped(reason, now));
    }

    private double elapsedMillis(Instant now) {
        return Duration.between(lastFeedTime, now).toNanos() / 1_000_000.0;
    }

    private static boolean awaitDelivery(CompletableFuture<Boolean> delivery) {
        try {
            return Boolean.TRUE.equals(delivery.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for timeout alert delivery");
            return false;
        } catch (ExecutionException e) {
            LOG.warn("Timeout alert delivery failed: {}", e.getCause() == null ? e.toString() : e.getCause().toString());
            return false;
        }
    }
}

/**
 * Liveness watchdog that raises a multi-channel alert when a workload stops reporting.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.phillippitts.livenesswatch.service.watchdog.Watchdog Watchdog} - state machine
 *       (arm on first feed, reset on feed, detect expiry, auto-stop on alert)</li>
 *   <li>{@link com.phillippitts.livenesswatch.service.watchdog.WatchdogPoller WatchdogPoller} -
 *       scheduled tick calling {@code poll()} and, on detection, {@code notifyTimeout()}</li>
 * </ul>
 *
 * <h2>Timeout episode example</h2>
 * <p>Threshold 1000 ms, fed at t=0:
 * <ul>
 *   <li><strong>t=500:</strong> poll → false</li>
 *   <li><strong>t=1100:</strong> poll → true (timeout detected)</li>
 *   <li><strong>t=1200:</strong> poll → false (already signaled)</li>
 *   <li><strong>t=1300:</strong> feed → timer reset, signal cleared</li>
 *   <li><strong>t=1350:</strong> poll → false</li>
 * </ul>
 *
 * <h2>Auto-stop policy</h2>
 * <p>{@code notifyTimeout()} always leaves the watchdog idle, even when no channel delivered the
 * alert. A workload that stays silent is therefore reported once; alerting resumes after the next
 * feed re-arms the watchdog.
 *
 * <h2>Thread Safety</h2>
 * <p>Every operation takes the instance's state lock. Alerts are queued under the lock and
 * delivered by {@link com.phillippitts.livenesswatch.service.notification.AlertDispatcher
 * AlertDispatcher}, so channel latency never blocks feeders or the poller.
 *
 * @since 1.0
 */
package com.phillippitts.livenesswatch.service.watchdog;

/**
 * Spring configuration for the liveness watchdog service.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.livenesswatch.config.WatchdogConfig} - clock and watchdog beans</li>
 *   <li>{@link com.phillippitts.livenesswatch.config.NotificationConfig} - HTTP client for channel
 *       transports</li>
 *   <li>{@link com.phillippitts.livenesswatch.config.ThreadPoolConfig} - alert dispatch executor</li>
 * </ul>
 *
 * <p>Typed settings live in {@code config.properties} and are bound from
 * {@code application.properties} under the {@code watchdog}, {@code notification} and
 * {@code threadpool} prefixes.
 *
 * @since 1.0
 */
package com.phillippitts.livenesswatch.config;

/**
 * Immutable value types shared by the watchdog, the notification router and the REST layer.
 *
 * <ul>
 *   <li>{@link com.phillippitts.livenesswatch.domain.ChannelId} - configured notification transports</li>
 *   <li>{@link com.phillippitts.livenesswatch.domain.DeliveryResult} - per-channel attempt outcome</li>
 *   <li>{@link com.phillippitts.livenesswatch.domain.WatchdogSnapshot} - consistent read of watchdog state</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.livenesswatch.domain;

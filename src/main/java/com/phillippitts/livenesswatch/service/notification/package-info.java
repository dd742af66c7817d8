/**
 * Alert delivery with per-channel fallback.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.phillippitts.livenesswatch.service.notification.NotificationRouter NotificationRouter} -
 *       tries the default channel, then the other enabled channels, until one delivers</li>
 *   <li>{@link com.phillippitts.livenesswatch.service.notification.AlertDispatcher AlertDispatcher} -
 *       queues alerts onto the {@code notifyExecutor} worker so callers never wait on channel I/O</li>
 *   <li>{@link com.phillippitts.livenesswatch.service.notification.NotificationSettings NotificationSettings} -
 *       default channel and enabled channels, read at dispatch time</li>
 *   <li>{@link com.phillippitts.livenesswatch.service.notification.ChannelNotifier ChannelNotifier} -
 *       one transport per channel, built lazily by a
 *       {@link com.phillippitts.livenesswatch.service.notification.ChannelNotifierFactory ChannelNotifierFactory}</li>
 * </ul>
 *
 * <h2>Failure handling</h2>
 * <p>Every attempt becomes a {@link com.phillippitts.livenesswatch.domain.DeliveryResult DeliveryResult}.
 * A {@code false} return, an exception and missing credentials are all failed attempts; the router
 * publishes a {@link com.phillippitts.livenesswatch.service.notification.event.ChannelFallbackEvent
 * ChannelFallbackEvent} for each and moves on. When no channel is enabled, or all fail, it publishes
 * {@link com.phillippitts.livenesswatch.service.notification.event.AllChannelsFailedEvent
 * AllChannelsFailedEvent} and returns {@code false}. No exception reaches the caller.
 *
 * @since 1.0
 */
package com.phillippitts.livenesswatch.service.notification;

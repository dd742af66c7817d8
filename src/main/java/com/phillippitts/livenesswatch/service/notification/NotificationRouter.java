package com.phillippitts.livenesswatch.service.notification;

import com.phillippitts.livenesswatch.domain.ChannelId;
import com.phillippitts.livenesswatch.domain.DeliveryResult;
import com.phillippitts.livenesswatch.service.metrics.WatchdogMetrics;
import com.phillippitts.livenesswatch.service.notification.event.AllChannelsFailedEvent;
import com.phillippitts.livenesswatch.service.notification.event.ChannelFallbackEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tries enabled channels in order until one delivers the alert: the default channel first,
 * then the remaining enabled channels in configured order.
 *
 * <p>Each channel is attempted at most once per call, with no delay between attempts. A channel
 * that returns false, throws, or has no usable credentials counts as a failed attempt; the fault
 * is logged and the next channel is tried. Nothing a channel does propagates to the caller.
 *
 * <p>Notifier handles are built on first use and reused afterwards. A channel whose credentials
 * are missing is not cached, so configuring it later takes effect on the next alert.
 */
@Service
public class NotificationRouter implements AlertSender {
    private static final Logger LOG = LogManager.getLogger(NotificationRouter.class);

    private final NotificationSettings settings;
    private final ChannelNotifierFactory notifierFactory;
    private final ApplicationEventPublisher publisher;
    private final WatchdogMetrics metrics;
    private final Clock clock;

    private final Map<ChannelId, ChannelNotifier> notifiers = new ConcurrentHashMap<>();

    public NotificationRouter(NotificationSettings settings,
                              ChannelNotifierFactory notifierFactory,
                              ApplicationEventPublisher publisher,
                              WatchdogMetrics metrics,
                              Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.notifierFactory = Objects.requireNonNull(notifierFactory, "notifierFactory");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public boolean send(String message) {
        Optional<ChannelId> defaultChannel = settings.defaultChannel();
        List<ChannelId> enabled = settings.enabledChannels();
        LOG.debug("Watchdog notification - default channel: {}, enabled channels: {}",
                defaultChannel.map(ChannelId::id).orElse("none"), enabled);

        if (enabled.isEmpty()) {
            LOG.debug("Watchdog notification skipped: no enabled notification channels");
            metrics.incrementUndelivered();
            publisher.publishEvent(new AllChannelsFailedEvent("no enabled channels", 0, clock.instant()));
            return false;
        }

        List<ChannelId> order = tryOrder(defaultChannel, enabled);
        LOG.debug("Watchdog notification try order: {}", order);

        for (ChannelId channel : order) {
            DeliveryResult result = attempt(channel, message);
            metrics.recordDelivery(channel.id(), result.success());
            if (result.success()) {
                LOG.info("Watchdog notification sent via {}", channel.id());
                return true;
            }
            publisher.publishEvent(new ChannelFallbackEvent(channel.id(), result.reason(), clock.instant()));
        }

        metrics.incrementUndelivered();
        publisher.publishEvent(new AllChannelsFailedEvent("all channels failed", order.size(), clock.instant()));
        return false;
    }

    /**
     * Builds the attempt order: default first when it is enabled, then the other enabled
     * channels in their given order. Visible for tests.
     */
    static List<ChannelId> tryOrder(Optional<ChannelId> defaultChannel, List<ChannelId> enabled) {
        List<ChannelId> order = new ArrayList<>(enabled.size());
        defaultChannel.filter(enabled::contains).ifPresent(order::add);
        for (ChannelId channel : enabled) {
            if (!order.contains(channel)) {
                order.add(channel);
            }
        }
        return order;
    }

    private DeliveryResult attempt(ChannelId channel, String message) {
        try {
            Optional<ChannelNotifier> notifier = notifierFor(channel);
            if (notifier.isEmpty()) {
                LOG.debug("Channel {} has no usable credentials, trying next channel", channel.id());
                return DeliveryResult.failed(channel, "not configured");
            }
            LOG.debug("Trying to send watchdog message via {}", channel.id());
            if (notifier.get().sendMessage(message)) {
                return DeliveryResult.delivered(channel);
            }
            LOG.debug("{} sending failed, trying next channel", channel.id());
            return DeliveryResult.failed(channel, "rejected");
        } catch (RuntimeException e) {
            LOG.debug("{} sending exception, trying next channel", channel.id(), e);
            return DeliveryResult.failed(channel, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Optional<ChannelNotifier> notifierFor(ChannelId channel) {
        ChannelNotifier cached = notifiers.get(channel);
        if (cached != null) {
            return Optional.of(cached);
        }
        return notifierFactory.create(channel)
                .map(created -> notifiers.computeIfAbsent(channel, c -> created));
    }
}

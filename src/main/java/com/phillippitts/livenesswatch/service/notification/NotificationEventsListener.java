package com.phillippitts.livenesswatch.service.notification;

import com.phillippitts.livenesswatch.service.notification.event.AllChannelsFailedEvent;
import com.phillippitts.livenesswatch.service.notification.event.ChannelFallbackEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Logs channel fallback events succinctly (alert text is never logged here). */
@Component
class NotificationEventsListener {
    private static final Logger LOG = LogManager.getLogger(NotificationEventsListener.class);

    @EventListener
    void onFallback(ChannelFallbackEvent e) {
        LOG.warn("Notification fallback: channel={}, reason={}", e.channel(), e.reason());
    }

    @EventListener
    void onAllFailed(AllChannelsFailedEvent e) {
        LOG.warn("Alert not delivered: reason={}, channelsAttempted={}", e.reason(), e.attempted());
    }
}

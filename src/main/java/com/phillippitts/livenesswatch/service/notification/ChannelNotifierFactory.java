package com.phillippitts.livenesswatch.service.notification;

import com.phillippitts.livenesswatch.domain.ChannelId;

import java.util.Optional;

/**
 * Builds the client handle for a channel from its current configuration.
 */
public interface ChannelNotifierFactory {

    /**
     * @param channel channel to build a notifier for
     * @return the notifier, or empty when the channel's credentials are not configured
     */
    Optional<ChannelNotifier> create(ChannelId channel);
}

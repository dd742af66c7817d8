package com.phillippitts.livenesswatch.service.notification;

import com.phillippitts.livenesswatch.domain.ChannelId;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the channel configuration, consulted on every dispatch.
 */
public interface NotificationSettings {

    /** Channel to try first, if one is configured. */
    Optional<ChannelId> defaultChannel();

    /** Enabled channels in fallback order, without duplicates. */
    List<ChannelId> enabledChannels();
}

package com.phillippitts.livenesswatch.service.notification;

import com.phillippitts.livenesswatch.domain.ChannelId;

/** Transport that delivers a text message over one notification channel. */
public interface ChannelNotifier {

    /**
     * Sends the message.
     *
     * @param text alert text
     * @return true if the backend accepted the message, false if it rejected it
     * @throws RuntimeException on transport failure; callers treat it like a {@code false} result
     */
    boolean sendMessage(String text);

    /** Channel this notifier delivers to. */
    ChannelId channel();
}

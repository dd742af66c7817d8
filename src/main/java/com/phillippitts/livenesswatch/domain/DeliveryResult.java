package com.phillippitts.livenesswatch.domain;

import java.util.Objects;

/**
 * Outcome of a single delivery attempt on one channel.
 *
 * @param channel channel that was attempted
 * @param success true when the channel accepted the message
 * @param reason  short failure description; empty on success
 */
public record DeliveryResult(ChannelId channel, boolean success, String reason) {

    public DeliveryResult {
        Objects.requireNonNull(channel, "channel");
        reason = reason == null ? "" : reason;
    }

    public static DeliveryResult delivered(ChannelId channel) {
        return new DeliveryResult(channel, true, "");
    }

    public static DeliveryResult failed(ChannelId channel, String reason) {
        return new DeliveryResult(channel, false, reason);
    }
}

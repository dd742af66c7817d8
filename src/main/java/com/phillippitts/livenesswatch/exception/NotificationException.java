package com.phillippitts.livenesswatch.exception;

/**
 * Thrown by a channel transport when a message could not be handed to its backend
 * (connection failure, HTTP error status, unreadable response).
 *
 * <p>The notification router converts it into a failed delivery and moves on to the next
 * channel; it never reaches watchdog callers.
 */
public class NotificationException extends LivenessWatchException {

    private final String channel;

    public NotificationException(String message, String channel) {
        super(formatMessage(message, channel));
        this.channel = channel;
    }

    public NotificationException(String message, String channel, Throwable cause) {
        super(formatMessage(message, channel), cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }

    private static String formatMessage(String message, String channel) {
        return message + " (channel: " + channel + ")";
    }
}

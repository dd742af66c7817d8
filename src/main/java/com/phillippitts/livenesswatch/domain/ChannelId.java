package com.phillippitts.livenesswatch.domain;

/**
 * Notification transports the router can fall back across.
 *
 * <p>Declaration order is the default fallback order when {@code notification.channels}
 * does not override it.
 */
public enum ChannelId {
    TELEGRAM("telegram"),
    WECHAT("wechat");

    private final String id;

    ChannelId(String id) {
        this.id = id;
    }

    /** Lowercase key used in configuration, logs and metric tags. */
    public String id() {
        return id;
    }
}

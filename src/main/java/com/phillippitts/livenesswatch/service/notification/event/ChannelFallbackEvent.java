package com.phillippitts.livenesswatch.service.notification.event;

import java.time.Instant;

/** Published when a channel fails to deliver an alert and the next channel is attempted. */
public record ChannelFallbackEvent(String channel, String reason, Instant at) { }

package com.phillippitts.livenesswatch.service.notification.event;

import java.time.Instant;

/** Published when an alert could not be delivered on any channel. */
public record AllChannelsFailedEvent(String reason, int attempted, Instant at) { }

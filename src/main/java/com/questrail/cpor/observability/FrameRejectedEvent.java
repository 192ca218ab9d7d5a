package com.questrail.cpor.observability;

import java.time.Instant;

/**
 * Record describing an inbound frame that was dropped because it could not be
 * decoded into a valid message. Such frames are never retried.
 */
public record FrameRejectedEvent(
    Instant timestamp,
    int frameLength,
    String reason,
    Throwable cause
) {
}

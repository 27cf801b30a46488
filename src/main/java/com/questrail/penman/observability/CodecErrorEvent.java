package com.questrail.penman.observability;

import java.time.Instant;

/**
 * Record representing an unexpected error contained by the codec.
 */
public record CodecErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}

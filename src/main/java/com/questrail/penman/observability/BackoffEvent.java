package com.questrail.penman.observability;

import com.questrail.penman.codec.BackoffReason;

import java.time.Instant;

/**
 * Record describing a fallback to the backoff graph.
 *
 * @param input the pointer text that could not be decoded
 * @param cause the underlying failure, {@code null} for an empty result
 */
public record BackoffEvent(
    Instant timestamp,
    BackoffReason reason,
    String detail,
    String input,
    Throwable cause
) {
}

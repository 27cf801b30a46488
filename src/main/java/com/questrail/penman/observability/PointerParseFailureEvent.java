package com.questrail.penman.observability;

import com.questrail.penman.codec.PointerParseError;

import java.time.Instant;

/**
 * Record describing input rejected by the strict pointer-notation parser.
 */
public record PointerParseFailureEvent(
    Instant timestamp,
    PointerParseError kind,
    String detail,
    int inputLength
) {
}

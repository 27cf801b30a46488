package com.questrail.penman.codec;

/**
 * PointerNotationDecoder
 * -----------------------------------------------------------------------------
 * Lenient front end turning pointer notation (typically the raw output of a
 * sequence model) back into a graph with generated variable names.
 *
 * <p>This decoder <strong>never throws</strong> for malformed input. Any
 * failure yields {@link PointerDecodeResult.Backoff}, carrying the fixed
 * single-node backoff graph, so a downstream pipeline keeps running.</p>
 */
public interface PointerNotationDecoder
{
    PointerDecodeResult decode(String pointerText);
}

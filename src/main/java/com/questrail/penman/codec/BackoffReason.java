package com.questrail.penman.codec;

/**
 * Why {@link PointerNotationDecoder} fell back to the backoff graph.
 */
public enum BackoffReason
{
    /** The pointer text could not be walked (unbalanced, missing concept, dangling role). */
    MALFORMED_INPUT,

    /** The generated Penman text was rejected by the Penman decoder. */
    DECODE_FAILURE,

    /** The decoded graph has no triples or no anchoring source. */
    EMPTY_GRAPH
}

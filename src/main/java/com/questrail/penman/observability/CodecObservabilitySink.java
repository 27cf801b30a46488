package com.questrail.penman.observability;

/**
 * Main interface for receiving codec observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface CodecObservabilitySink {
    /**
     * Called when the strict pointer-notation parser rejects its input.
     * @param event the failure details
     */
    void onParseFailure(PointerParseFailureEvent event);

    /**
     * Called when the lenient decoder substitutes the backoff graph.
     * @param event the backoff details
     */
    void onBackoff(BackoffEvent event);

    /**
     * Called when an unexpected error is contained at a codec boundary.
     * @param event the error event
     */
    void onError(CodecErrorEvent event);
}

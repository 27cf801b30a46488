package com.questrail.penman.observability;

/**
 * No-op implementation of CodecObservabilitySink.
 */
public final class NullObservabilitySink implements CodecObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onParseFailure(PointerParseFailureEvent event) {}

    @Override
    public void onBackoff(BackoffEvent event) {}

    @Override
    public void onError(CodecErrorEvent event) {}
}

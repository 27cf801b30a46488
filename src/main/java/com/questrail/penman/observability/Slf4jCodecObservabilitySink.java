package com.questrail.penman.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CodecObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCodecObservabilitySink implements CodecObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCodecObservabilitySink.class);

    @Override
    public void onParseFailure(PointerParseFailureEvent event) {
        log.debug("Pointer notation rejected ({} chars): {} {}",
            event.inputLength(),
            event.kind(),
            event.detail());
    }

    @Override
    public void onBackoff(BackoffEvent event) {
        if (event.cause() != null) {
            log.warn("Pointer decode backoff: {} {} input={}",
                event.reason(), event.detail(), event.input(), event.cause());
        } else {
            log.warn("Pointer decode backoff: {} {} input={}",
                event.reason(), event.detail(), event.input());
        }
    }

    @Override
    public void onError(CodecErrorEvent event) {
        log.error("Codec error: {}", event.message(), event.cause());
    }
}

package com.questrail.penman.observability;

import com.questrail.penman.codec.BackoffReason;
import com.questrail.penman.codec.PointerParseError;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class Slf4jCodecObservabilitySinkTest
{
    private final Slf4jCodecObservabilitySink sink = new Slf4jCodecObservabilitySink();

    @Test
    void logsEveryEventKindWithoutThrowing()
    {
        Instant now = Instant.now();
        assertDoesNotThrow(() -> {
            sink.onParseFailure(new PointerParseFailureEvent(now, PointerParseError.EXPECTING_SLASH, "detail", 9));
            sink.onBackoff(new BackoffEvent(now, BackoffReason.EMPTY_GRAPH, "empty", "", null));
            sink.onBackoff(new BackoffEvent(now, BackoffReason.MALFORMED_INPUT, "bad", "(((",
                    new IllegalArgumentException("unbalanced")));
            sink.onError(new CodecErrorEvent(now, "boom", new IllegalStateException("boom")));
        });
    }
}

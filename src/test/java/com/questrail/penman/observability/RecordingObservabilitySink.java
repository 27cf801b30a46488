package com.questrail.penman.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements CodecObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onParseFailure(PointerParseFailureEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onBackoff(BackoffEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(CodecErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<BackoffEvent> getBackoffs() {
        return events.stream()
            .filter(e -> e instanceof BackoffEvent)
            .map(e -> (BackoffEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<PointerParseFailureEvent> getParseFailures() {
        return events.stream()
            .filter(e -> e instanceof PointerParseFailureEvent)
            .map(e -> (PointerParseFailureEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}

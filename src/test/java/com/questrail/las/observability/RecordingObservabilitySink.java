package com.questrail.las.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements LasObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onLoad(LasLoadEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onParseSkip(LasParseSkipEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onMutation(LasMutationEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(LasErrorEvent event) {
        events.add(event);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}

package com.questrail.hostbridge.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements HostBridgeObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onCommandExecuted(CommandExecutionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onCommandRejected(CommandRejectedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(TransportObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(HostBridgeErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public List<CommandExecutionEvent> executions() {
        return eventsOfType(CommandExecutionEvent.class);
    }

    public List<CommandRejectedEvent> rejections() {
        return eventsOfType(CommandRejectedEvent.class);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}

package com.questrail.mcumgr.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements McuMgrObservabilitySink {
    private final List<Object> events = new ArrayList<>();
    private final List<int[]> mtuChanges = new ArrayList<>();

    @Override
    public synchronized void onRequestSent(McuMgrRequestEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onRequestCompleted(McuMgrCompletionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onMtuChanged(int oldMtu, int newMtu) {
        mtuChanges.add(new int[] {oldMtu, newMtu});
    }

    @Override
    public synchronized void onTransportEvent(McuMgrTransportEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(McuMgrErrorEvent event) {
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

    public synchronized List<McuMgrTransportEvent.Kind> transportEventKinds() {
        return eventsOfType(McuMgrTransportEvent.class).stream()
            .map(McuMgrTransportEvent::kind)
            .collect(Collectors.toList());
    }

    public synchronized List<int[]> mtuChanges() {
        return new ArrayList<>(mtuChanges);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}

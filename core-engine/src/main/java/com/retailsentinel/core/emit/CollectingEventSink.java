package com.retailsentinel.core.emit;

import com.retailsentinel.core.model.SentinelEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps every published event in memory, in publication order.
 *
 * <p>
 * Thread-safe: the processing thread publishes while readers take copies.
 * </p>
 */
public class CollectingEventSink implements EventSink {

    private final List<SentinelEvent> events = new ArrayList<>();

    @Override
    public synchronized void publish(List<SentinelEvent> batch) {
        events.addAll(batch);
    }

    /**
     * @return a snapshot of all events published so far
     */
    public synchronized List<SentinelEvent> getEvents() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    public synchronized void clear() {
        events.clear();
    }
}

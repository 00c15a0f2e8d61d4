package com.retailsentinel.core.emit;

import com.retailsentinel.core.config.SentinelConfig;
import com.retailsentinel.core.model.EventType;
import com.retailsentinel.core.model.SentinelEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Numbers, deduplicates and orders events before handing them to an
 * {@link EventSink}.
 *
 * <h3>Ordering and Identity</h3>
 * <ul>
 * <li>Each batch is stably sorted by timestamp, so events of the same window
 * keep rule order.</li>
 * <li>Ids are {@code "E"} plus a zero-padded counter, strictly increasing for
 * the emitter's lifetime.</li>
 * <li>An event whose {@code (scope, type, window start)} was already emitted
 * is dropped. The most recent {@code dedupCapacity} keys are remembered.</li>
 * </ul>
 *
 * <p>
 * Not thread-safe; called from the processing thread only.
 * </p>
 *
 * @since 1.0.0
 */
public class EventEmitter {

    private static final Logger LOG = LoggerFactory.getLogger(EventEmitter.class);

    private final EventSink sink;
    private final int dedupCapacity;
    private final String idFormat;
    private final LinkedHashSet<DedupKey> emittedKeys = new LinkedHashSet<>();

    private long nextId;
    private long duplicatesDropped;
    private long sinkFailures;

    public EventEmitter(SentinelConfig config, EventSink sink) {
        this(config.getDedupCapacity(), config.getEventIdWidth(), sink);
    }

    public EventEmitter(int dedupCapacity, int idWidth, EventSink sink) {
        if (dedupCapacity < 1) {
            throw new IllegalArgumentException("dedupCapacity must be >= 1, got: " + dedupCapacity);
        }
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.dedupCapacity = dedupCapacity;
        this.idFormat = "E%0" + idWidth + "d";
    }

    /**
     * Emit one batch of candidate events.
     *
     * @param candidates events in window-close order, then rule order
     * @return the events actually emitted, with ids assigned
     */
    public List<SentinelEvent> emit(List<SentinelEvent> candidates) {
        if (candidates.isEmpty()) {
            return Collections.emptyList();
        }
        List<SentinelEvent> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparing(SentinelEvent::getTimestamp));

        List<SentinelEvent> batch = new ArrayList<>(ordered.size());
        for (SentinelEvent candidate : ordered) {
            DedupKey key = new DedupKey(candidate.getScopeId(), candidate.getType(), candidate.getWindowStart());
            if (!remember(key)) {
                duplicatesDropped++;
                LOG.debug("Dropped duplicate event {}", key);
                continue;
            }
            batch.add(candidate.withEventId(String.format(idFormat, nextId++)));
        }

        if (batch.isEmpty()) {
            return batch;
        }
        try {
            sink.publish(batch);
        } catch (Exception e) {
            sinkFailures++;
            LOG.error("Event sink failed for {} event(s): {}", batch.size(), e.getMessage(), e);
        }
        return batch;
    }

    /**
     * Restart numbering and forget dedup keys.
     */
    public void reset() {
        nextId = 0;
        emittedKeys.clear();
        duplicatesDropped = 0;
        sinkFailures = 0;
    }

    public long getEmittedCount() {
        return nextId;
    }

    public long getDuplicatesDropped() {
        return duplicatesDropped;
    }

    public long getSinkFailures() {
        return sinkFailures;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private boolean remember(DedupKey key) {
        if (!emittedKeys.add(key)) {
            return false;
        }
        if (emittedKeys.size() > dedupCapacity) {
            Iterator<DedupKey> oldest = emittedKeys.iterator();
            oldest.next();
            oldest.remove();
        }
        return true;
    }

    private static final class DedupKey {
        private final String scopeId;
        private final EventType type;
        private final Instant windowStart;

        DedupKey(String scopeId, EventType type, Instant windowStart) {
            this.scopeId = scopeId;
            this.type = type;
            this.windowStart = windowStart;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof DedupKey)) {
                return false;
            }
            DedupKey other = (DedupKey) o;
            return scopeId.equals(other.scopeId) && type == other.type && windowStart.equals(other.windowStart);
        }

        @Override
        public int hashCode() {
            return Objects.hash(scopeId, type, windowStart);
        }

        @Override
        public String toString() {
            return scopeId + "/" + type + "@" + windowStart;
        }
    }
}

package com.retailsentinel.core.window;

import com.retailsentinel.core.model.SensorRecord;
import com.retailsentinel.core.model.TagRead;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A bounded time slice {@code [start, end)} of records for one scope: a
 * station, or the store as a whole.
 *
 * <p>
 * Records are kept in arrival order. Repeated tag reads with the same
 * {@code (tagId, timestamp)} are collapsed on append.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe; owned by the processing thread.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationWindow {

    private final String scopeId;
    private final boolean storeScope;
    private final Instant start;
    private final Instant end;
    private final List<SensorRecord> records = new ArrayList<>();
    private final Set<String> tagReadKeys = new HashSet<>();
    private WindowState state;

    CorrelationWindow(String scopeId, boolean storeScope, Instant start, Instant end, WindowState state) {
        this.scopeId = Objects.requireNonNull(scopeId, "scopeId must not be null");
        this.storeScope = storeScope;
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
    }

    /**
     * Append a record.
     *
     * @param record record whose timestamp lies in this window
     * @return {@code false} if the record duplicates a tag read already held
     * @throws IllegalStateException if the window is already closed
     */
    boolean append(SensorRecord record) {
        if (state == WindowState.CLOSED) {
            throw new IllegalStateException("Window " + this + " is closed");
        }
        if (record instanceof TagRead read
                && !tagReadKeys.add(read.getTagId() + '@' + read.getTimestamp().toEpochMilli())) {
            return false;
        }
        records.add(record);
        return true;
    }

    void markClosing() {
        if (state == WindowState.OPEN) {
            state = WindowState.CLOSING;
        }
    }

    void markClosed() {
        state = WindowState.CLOSED;
    }

    /**
     * @param timestamp a record timestamp
     * @return {@code true} if {@code start <= timestamp < end}
     */
    public boolean contains(Instant timestamp) {
        return !timestamp.isBefore(start) && timestamp.isBefore(end);
    }

    public String getScopeId() {
        return scopeId;
    }

    /**
     * @return {@code true} for the store-wide slice, {@code false} for a
     *         station window
     */
    public boolean isStoreScope() {
        return storeScope;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public WindowState getState() {
        return state;
    }

    /**
     * @return unmodifiable view of the buffered records, in arrival order
     */
    public List<SensorRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    /**
     * @param type record class to select
     * @param <T>  record type
     * @return records of the given type, in arrival order
     */
    public <T extends SensorRecord> List<T> recordsOf(Class<T> type) {
        List<T> selected = new ArrayList<>();
        for (SensorRecord record : records) {
            if (type.isInstance(record)) {
                selected.add(type.cast(record));
            }
        }
        return selected;
    }

    @Override
    public String toString() {
        return "CorrelationWindow{" +
                "scopeId='" + scopeId + '\'' +
                ", start=" + start +
                ", end=" + end +
                ", state=" + state +
                ", records=" + records.size() +
                '}';
    }
}

package com.retailsentinel.core.window;

import com.retailsentinel.core.model.SensorRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The live windows of one scope, keyed by window start.
 *
 * <p>
 * Slots are aligned to the first timestamp the track sees:
 * {@code start = origin + floor((t - origin) / W) * W}. Records earlier than
 * the origin fall into earlier slots of the same grid.
 * </p>
 */
final class WindowTrack {

    private final String scopeId;
    private final boolean storeScope;
    private final long windowMillis;
    private final long latenessMillis;
    private final TreeMap<Instant, CorrelationWindow> windows = new TreeMap<>();
    private Instant origin;
    private CorrelationWindow open;

    WindowTrack(String scopeId, boolean storeScope, Duration window, Duration lateness) {
        this.scopeId = scopeId;
        this.storeScope = storeScope;
        this.windowMillis = window.toMillis();
        this.latenessMillis = lateness.toMillis();
    }

    /**
     * Route a record to the window containing its timestamp, creating the
     * window if needed.
     *
     * @param record a valid record
     * @param clock  current logical clock, or {@code null} before the first record
     * @return the routing outcome
     */
    IngestOutcome route(SensorRecord record, Instant clock) {
        Instant timestamp = record.getTimestamp();
        if (origin == null) {
            origin = timestamp;
        }
        if (isClosedFor(timestamp, clock)) {
            return IngestOutcome.DROPPED_LATE;
        }
        Instant start = slotStart(timestamp);
        Instant end = start.plusMillis(windowMillis);

        CorrelationWindow window = windows.get(start);
        if (window == null) {
            window = create(start, end, clock);
        }
        return window.append(record) ? IngestOutcome.ACCEPTED : IngestOutcome.DUPLICATE;
    }

    /**
     * @param timestamp record time
     * @param clock     current logical clock, may be {@code null}
     * @return {@code true} if the slot holding {@code timestamp} has already closed
     */
    boolean isClosedFor(Instant timestamp, Instant clock) {
        if (origin == null || clock == null) {
            return false;
        }
        Instant end = slotStart(timestamp).plusMillis(windowMillis);
        return !end.plusMillis(latenessMillis).isAfter(clock);
    }

    /**
     * Apply the logical clock: an open window whose end is reached starts
     * closing, and every window whose grace period has expired is closed and
     * removed.
     *
     * @param clock current logical clock
     * @return windows closed by this call, in start order
     */
    List<CorrelationWindow> advance(Instant clock) {
        if (open != null && !open.getEnd().isAfter(clock)) {
            open.markClosing();
            open = null;
        }
        List<CorrelationWindow> closed = new ArrayList<>();
        Iterator<Map.Entry<Instant, CorrelationWindow>> it = windows.entrySet().iterator();
        while (it.hasNext()) {
            CorrelationWindow window = it.next().getValue();
            if (window.getEnd().plusMillis(latenessMillis).isAfter(clock)) {
                break;
            }
            window.markClosing();
            window.markClosed();
            closed.add(window);
            it.remove();
        }
        return closed;
    }

    /**
     * Close every remaining window regardless of the clock.
     *
     * @return windows closed by this call, in start order
     */
    List<CorrelationWindow> flush() {
        List<CorrelationWindow> closed = new ArrayList<>(windows.values());
        for (CorrelationWindow window : closed) {
            window.markClosing();
            window.markClosed();
        }
        windows.clear();
        open = null;
        return closed;
    }

    int liveWindows() {
        return windows.size();
    }

    CorrelationWindow openWindow() {
        return open;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Instant slotStart(Instant timestamp) {
        long offset = timestamp.toEpochMilli() - origin.toEpochMilli();
        return origin.plusMillis(Math.floorDiv(offset, windowMillis) * windowMillis);
    }

    private CorrelationWindow create(Instant start, Instant end, Instant clock) {
        boolean reached = clock != null && !end.isAfter(clock);
        boolean newest = windows.isEmpty() || windows.lastKey().isBefore(start);
        if (!reached && newest) {
            if (open != null) {
                open.markClosing();
            }
            CorrelationWindow window = new CorrelationWindow(scopeId, storeScope, start, end, WindowState.OPEN);
            open = window;
            windows.put(start, window);
            return window;
        }
        CorrelationWindow window = new CorrelationWindow(scopeId, storeScope, start, end, WindowState.CLOSING);
        windows.put(start, window);
        return window;
    }
}

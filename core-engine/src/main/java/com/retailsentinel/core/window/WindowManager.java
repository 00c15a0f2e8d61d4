package com.retailsentinel.core.window;

import com.retailsentinel.core.config.SentinelConfig;
import com.retailsentinel.core.model.QueueSample;
import com.retailsentinel.core.model.SensorRecord;
import com.retailsentinel.core.model.Station;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Buffers incoming records into per-station tumbling windows and decides when
 * each window closes.
 *
 * <h3>Tracks</h3>
 * <ul>
 * <li>One track per station, aligned to the first timestamp seen for that
 * station.</li>
 * <li>One store track ({@value #STORE_SCOPE}), aligned to the first record
 * overall, receiving every valid record including inventory snapshots.
 * Store-wide rules evaluate its slices.</li>
 * </ul>
 *
 * <h3>Lateness</h3>
 * <p>
 * The logical clock is the maximum time passed to {@link #advance(Instant)}.
 * A window closes once {@code end + allowedLateness <= clock}; a record that
 * maps to a window which has already closed is dropped, counted against its
 * station and never appears in any context. A station record is also dropped
 * when its store slice has closed, even if its station window is still open,
 * since the two grids are aligned independently.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. All calls must come from the single processing thread.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowManager {

    private static final Logger LOG = LoggerFactory.getLogger(WindowManager.class);

    /** Scope id of the store-wide slice track. */
    public static final String STORE_SCOPE = "STORE";

    /** Close order: window end, then station windows before the store slice, then scope id. */
    public static final Comparator<CorrelationWindow> CLOSE_ORDER =
            Comparator.comparing(CorrelationWindow::getEnd)
                    .thenComparing(CorrelationWindow::isStoreScope)
                    .thenComparing(CorrelationWindow::getScopeId);

    private final Duration windowSize;
    private final Duration allowedLateness;
    private final StationRegistry stations = new StationRegistry();
    private final Map<String, WindowTrack> stationTracks = new LinkedHashMap<>();
    private final WindowTrack storeTrack;
    private final Map<String, Long> droppedLateByScope = new LinkedHashMap<>();

    private Instant clock;
    private long accepted;
    private long rejected;
    private long droppedLate;
    private long duplicates;

    public WindowManager(SentinelConfig config) {
        this(Objects.requireNonNull(config, "config must not be null").windowDuration(),
                config.allowedLateness());
    }

    public WindowManager(Duration windowSize, Duration allowedLateness) {
        if (windowSize == null || windowSize.isZero() || windowSize.isNegative()) {
            throw new IllegalArgumentException("windowSize must be positive, got: " + windowSize);
        }
        if (allowedLateness == null || allowedLateness.isNegative()) {
            throw new IllegalArgumentException("allowedLateness must be >= 0, got: " + allowedLateness);
        }
        this.windowSize = windowSize;
        this.allowedLateness = allowedLateness;
        this.storeTrack = new WindowTrack(STORE_SCOPE, true, windowSize, allowedLateness);
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * Buffer a record in the window containing its timestamp. Never throws for
     * bad input: invalid records are counted as rejected.
     *
     * @param record the record, may be {@code null}
     * @return what happened to the record
     */
    public IngestOutcome ingest(SensorRecord record) {
        if (record == null || !record.isValid()) {
            rejected++;
            LOG.warn("Rejected invalid record: {}", record);
            return IngestOutcome.REJECTED;
        }

        IngestOutcome outcome;
        if (record.getKind().isStationScoped()) {
            String stationId = record.getStationId();
            WindowTrack track = stationTracks.computeIfAbsent(stationId,
                    id -> new WindowTrack(id, false, windowSize, allowedLateness));
            Station station = stations.getOrRegister(stationId);
            // Station and store grids differ; a record lands in both slices or in neither.
            outcome = storeTrack.isClosedFor(record.getTimestamp(), clock)
                    ? IngestOutcome.DROPPED_LATE
                    : track.route(record, clock);
            if (outcome == IngestOutcome.ACCEPTED) {
                storeTrack.route(record, clock);
                if (station.observe(record.getStatus(), record.getTimestamp())
                        && record instanceof QueueSample sample) {
                    station.updateCustomerCount(sample.getCustomerCount());
                }
            }
        } else {
            outcome = storeTrack.route(record, clock);
        }

        switch (outcome) {
            case ACCEPTED:
                accepted++;
                break;
            case DUPLICATE:
                duplicates++;
                break;
            case DROPPED_LATE:
                droppedLate++;
                String scope = record.getStationId() != null ? record.getStationId() : STORE_SCOPE;
                droppedLateByScope.merge(scope, 1L, Long::sum);
                LOG.debug("Dropped late record for scope '{}' at {} (clock={})",
                        scope, record.getTimestamp(), clock);
                break;
            default:
                break;
        }
        return outcome;
    }

    // ---------------------------------------------------------------
    // Clock
    // ---------------------------------------------------------------

    /**
     * Move the logical clock forward and close every window whose grace
     * period has expired.
     *
     * @param now candidate clock value; ignored if earlier than the current clock
     * @return windows closed by this call, in {@link #CLOSE_ORDER}
     */
    public List<CorrelationWindow> advance(Instant now) {
        if (now == null) {
            return Collections.emptyList();
        }
        if (clock == null || now.isAfter(clock)) {
            clock = now;
        }
        List<CorrelationWindow> closed = new ArrayList<>();
        for (WindowTrack track : stationTracks.values()) {
            closed.addAll(track.advance(clock));
        }
        closed.addAll(storeTrack.advance(clock));
        closed.sort(CLOSE_ORDER);
        return closed;
    }

    /**
     * Force-close every open and closing window. Used on shutdown so partial
     * windows are still evaluated.
     *
     * @return windows closed by this call, in {@link #CLOSE_ORDER}
     */
    public List<CorrelationWindow> flush() {
        List<CorrelationWindow> closed = new ArrayList<>();
        for (WindowTrack track : stationTracks.values()) {
            closed.addAll(track.flush());
        }
        closed.addAll(storeTrack.flush());
        closed.sort(CLOSE_ORDER);
        LOG.info("Flushed {} window(s)", closed.size());
        return closed;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public StationRegistry getStations() {
        return stations;
    }

    /**
     * @return current logical clock, or {@code null} before the first advance
     */
    public Instant getClock() {
        return clock;
    }

    /**
     * @param stationId station id
     * @return the station's open window, or {@code null} if it has none
     */
    public CorrelationWindow openWindow(String stationId) {
        WindowTrack track = stationTracks.get(stationId);
        return track != null ? track.openWindow() : null;
    }

    public int liveWindowCount() {
        int count = storeTrack.liveWindows();
        for (WindowTrack track : stationTracks.values()) {
            count += track.liveWindows();
        }
        return count;
    }

    public long getAccepted() {
        return accepted;
    }

    public long getRejected() {
        return rejected;
    }

    public long getDroppedLate() {
        return droppedLate;
    }

    public long getDuplicates() {
        return duplicates;
    }

    /**
     * @return unmodifiable map of dropped-late counts by station id
     *         ({@value #STORE_SCOPE} for inventory snapshots)
     */
    public Map<String, Long> getDroppedLateByScope() {
        return Collections.unmodifiableMap(droppedLateByScope);
    }
}

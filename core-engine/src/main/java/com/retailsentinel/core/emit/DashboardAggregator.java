package com.retailsentinel.core.emit;

import com.retailsentinel.core.model.SentinelEvent;
import com.retailsentinel.core.model.Station;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds emitted events and station state into a {@link DashboardSnapshot}.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * {@link #record(List)} and {@link #refresh} are called from the processing
 * thread only. The published snapshot is immutable and held in a volatile
 * field, so {@link #snapshot()} is safe from any thread.
 * </p>
 *
 * @since 1.0.0
 */
public class DashboardAggregator {

    private final int recentLimit;
    private final Deque<SentinelEvent> recent = new ArrayDeque<>();
    private final Map<String, Long> countsByName = new LinkedHashMap<>();
    private final Map<String, Long> countsByStation = new HashMap<>();
    private long totalEvents;

    private volatile DashboardSnapshot snapshot = DashboardSnapshot.empty();

    public DashboardAggregator(int recentLimit) {
        if (recentLimit < 1) {
            throw new IllegalArgumentException("recentLimit must be >= 1, got: " + recentLimit);
        }
        this.recentLimit = recentLimit;
    }

    /**
     * Count a batch of emitted events.
     *
     * @param events emitted events, in emission order
     */
    public void record(List<SentinelEvent> events) {
        for (SentinelEvent event : events) {
            totalEvents++;
            countsByName.merge(event.getType().getDisplayName(), 1L, Long::sum);
            String stationId = event.getPayload().getStationId();
            if (stationId != null) {
                countsByStation.merge(stationId, 1L, Long::sum);
            }
            recent.addLast(event);
            if (recent.size() > recentLimit) {
                recent.removeFirst();
            }
        }
    }

    /**
     * Publish a new snapshot.
     *
     * @param clock        current logical clock
     * @param stations     all known stations
     * @param droppedLate  records dropped as late so far
     * @param rejected     records rejected as invalid so far
     * @param ruleFailures rule evaluations that threw so far
     */
    public void refresh(Instant clock, Collection<Station> stations,
                        long droppedLate, long rejected, long ruleFailures) {
        Map<String, DashboardSnapshot.StationView> views = new LinkedHashMap<>();
        int active = 0;
        long customers = 0;
        for (Station station : stations) {
            if (station.getCurrentStatus().isOperational()) {
                active++;
            }
            customers += station.getLastCustomerCount();
            String status = station.getRawStatus() != null
                    ? station.getRawStatus()
                    : station.getCurrentStatus().name();
            views.put(station.getStationId(), new DashboardSnapshot.StationView(status,
                    station.getLastCustomerCount(),
                    countsByStation.getOrDefault(station.getStationId(), 0L),
                    station.getLastSeen()));
        }
        DashboardSnapshot.Summary summary = new DashboardSnapshot.Summary(stations.size(), active, customers,
                totalEvents, droppedLate, rejected, ruleFailures);
        this.snapshot = new DashboardSnapshot(clock, summary, views, List.copyOf(recent), countsByName);
    }

    /**
     * @return the latest published snapshot, never {@code null}
     */
    public DashboardSnapshot snapshot() {
        return snapshot;
    }
}

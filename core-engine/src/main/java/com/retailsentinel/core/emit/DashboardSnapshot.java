package com.retailsentinel.core.emit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.retailsentinel.core.model.SentinelEvent;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of the store published for dashboards. Serialized as the
 * {@code /api/data} response.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "timestamp", "summary", "stations", "recent_events", "event_summary" })
public final class DashboardSnapshot {

    private final Instant timestamp;
    private final Summary summary;
    private final Map<String, StationView> stations;
    private final List<SentinelEvent> recentEvents;
    private final Map<String, Long> eventSummary;

    DashboardSnapshot(Instant timestamp, Summary summary, Map<String, StationView> stations,
                      List<SentinelEvent> recentEvents, Map<String, Long> eventSummary) {
        this.timestamp = timestamp;
        this.summary = summary;
        this.stations = Collections.unmodifiableMap(new LinkedHashMap<>(stations));
        this.recentEvents = List.copyOf(recentEvents);
        this.eventSummary = Collections.unmodifiableMap(new LinkedHashMap<>(eventSummary));
    }

    /**
     * @return a snapshot with no stations and no events
     */
    public static DashboardSnapshot empty() {
        return new DashboardSnapshot(null, new Summary(0, 0, 0, 0, 0, 0, 0),
                Collections.emptyMap(), Collections.emptyList(), Collections.emptyMap());
    }

    /**
     * @return logical clock at publication, {@code null} before any record
     */
    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("summary")
    public Summary getSummary() {
        return summary;
    }

    @JsonProperty("stations")
    public Map<String, StationView> getStations() {
        return stations;
    }

    /** Most recent events, oldest first. */
    @JsonProperty("recent_events")
    public List<SentinelEvent> getRecentEvents() {
        return recentEvents;
    }

    /** Cumulative count per event name. */
    @JsonProperty("event_summary")
    public Map<String, Long> getEventSummary() {
        return eventSummary;
    }

    // ---------------------------------------------------------------
    // Nested views
    // ---------------------------------------------------------------

    /**
     * Store-wide totals.
     */
    public static final class Summary {
        private final int totalStations;
        private final int activeStations;
        private final long totalCustomers;
        private final long totalEvents;
        private final long droppedLate;
        private final long rejected;
        private final long ruleFailures;

        public Summary(int totalStations, int activeStations, long totalCustomers, long totalEvents,
                       long droppedLate, long rejected, long ruleFailures) {
            this.totalStations = totalStations;
            this.activeStations = activeStations;
            this.totalCustomers = totalCustomers;
            this.totalEvents = totalEvents;
            this.droppedLate = droppedLate;
            this.rejected = rejected;
            this.ruleFailures = ruleFailures;
        }

        @JsonProperty("total_stations")
        public int getTotalStations() {
            return totalStations;
        }

        @JsonProperty("active_stations")
        public int getActiveStations() {
            return activeStations;
        }

        @JsonProperty("total_customers")
        public long getTotalCustomers() {
            return totalCustomers;
        }

        @JsonProperty("total_events")
        public long getTotalEvents() {
            return totalEvents;
        }

        @JsonProperty("dropped_late")
        public long getDroppedLate() {
            return droppedLate;
        }

        @JsonProperty("rejected")
        public long getRejected() {
            return rejected;
        }

        @JsonProperty("rule_failures")
        public long getRuleFailures() {
            return ruleFailures;
        }
    }

    /**
     * One station as the dashboard shows it.
     */
    public static final class StationView {
        private final String status;
        private final int customerCount;
        private final long eventCount;
        private final Instant lastSeen;

        public StationView(String status, int customerCount, long eventCount, Instant lastSeen) {
            this.status = status;
            this.customerCount = customerCount;
            this.eventCount = eventCount;
            this.lastSeen = lastSeen;
        }

        @JsonProperty("status")
        public String getStatus() {
            return status;
        }

        @JsonProperty("customer_count")
        public int getCustomerCount() {
            return customerCount;
        }

        @JsonProperty("event_count")
        public long getEventCount() {
            return eventCount;
        }

        @JsonProperty("last_seen")
        public Instant getLastSeen() {
            return lastSeen;
        }
    }
}

package com.retailsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A physical checkout lane.
 *
 * <p>
 * Owned by the station registry of the window manager; mutated only on the
 * processing thread. The raw status string of the last health signal is kept
 * alongside the normalised {@link StationStatus} so events can report exactly
 * what the sensor said.
 * </p>
 *
 * @since 1.0.0
 */
public final class Station implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String stationId;
    private StationStatus currentStatus = StationStatus.UNKNOWN;
    private String rawStatus;
    private Instant lastSeen;
    private int lastCustomerCount;

    public Station(String stationId) {
        this.stationId = Objects.requireNonNull(stationId, "stationId must not be null");
    }

    /**
     * Apply a record's health signal and activity time. A {@code null} raw
     * status leaves the current status unchanged, and a record older than the
     * last one seen cannot overwrite a newer status.
     *
     * @param raw       raw status string, may be {@code null}
     * @param timestamp record time
     * @return {@code true} if the record was the newest seen for this station
     */
    public boolean observe(String raw, Instant timestamp) {
        if (timestamp == null || (lastSeen != null && timestamp.isBefore(lastSeen))) {
            return false;
        }
        this.lastSeen = timestamp;
        if (raw != null && !raw.isBlank()) {
            this.rawStatus = raw;
            this.currentStatus = StationStatus.parse(raw);
        }
        return true;
    }

    public void updateCustomerCount(int customerCount) {
        this.lastCustomerCount = customerCount;
    }

    public String getStationId() {
        return stationId;
    }

    public StationStatus getCurrentStatus() {
        return currentStatus;
    }

    /**
     * @return the last raw status string, or {@code null} if none was reported
     */
    public String getRawStatus() {
        return rawStatus;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public int getLastCustomerCount() {
        return lastCustomerCount;
    }

    @Override
    public String toString() {
        return "Station{" +
                "stationId='" + stationId + '\'' +
                ", currentStatus=" + currentStatus +
                ", lastSeen=" + lastSeen +
                ", lastCustomerCount=" + lastCustomerCount +
                '}';
    }
}

package com.retailsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Periodic occupancy reading taken by the queue camera of a station.
 *
 * @since 1.0.0
 */
public final class QueueSample implements SensorRecord {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final String stationId;
    private final int customerCount;
    private final double averageDwellSeconds;
    private final String status;

    public QueueSample(Instant timestamp, String stationId, int customerCount,
            double averageDwellSeconds, String status) {
        this.timestamp = timestamp;
        this.stationId = stationId;
        this.customerCount = customerCount;
        this.averageDwellSeconds = averageDwellSeconds;
        this.status = status;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String getStationId() {
        return stationId;
    }

    public int getCustomerCount() {
        return customerCount;
    }

    public double getAverageDwellSeconds() {
        return averageDwellSeconds;
    }

    @Override
    public String getStatus() {
        return status;
    }

    @Override
    public RecordKind getKind() {
        return RecordKind.QUEUE_SAMPLE;
    }

    @Override
    public boolean isValid() {
        return timestamp != null
                && stationId != null && !stationId.isBlank()
                && customerCount >= 0
                && Double.isFinite(averageDwellSeconds) && averageDwellSeconds >= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QueueSample that))
            return false;
        return customerCount == that.customerCount
                && Double.compare(averageDwellSeconds, that.averageDwellSeconds) == 0
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(stationId, that.stationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, stationId, customerCount, averageDwellSeconds);
    }

    @Override
    public String toString() {
        return "QueueSample{" +
                "timestamp=" + timestamp +
                ", stationId='" + stationId + '\'' +
                ", customerCount=" + customerCount +
                ", averageDwellSeconds=" + averageDwellSeconds +
                '}';
    }
}

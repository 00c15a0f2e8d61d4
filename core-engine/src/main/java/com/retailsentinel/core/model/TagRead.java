package com.retailsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A proximity-sensor detection of a tagged item near a station.
 *
 * <p>
 * A dwelling item produces several reads with the same {@code tagId}; a read is
 * unique per {@code (tagId, timestamp)}. The SKU may be absent when the tag
 * could not be resolved.
 * </p>
 *
 * @since 1.0.0
 */
public final class TagRead implements SensorRecord {

    private static final long serialVersionUID = 1L;

    /** Location value reported while the item sits inside the scan zone. */
    public static final String IN_SCAN_AREA = "IN_SCAN_AREA";

    private final Instant timestamp;
    private final String stationId;
    private final String tagId;
    private final String sku;
    private final String location;
    private final String status;

    private TagRead(Builder builder) {
        this.timestamp = builder.timestamp;
        this.stationId = builder.stationId;
        this.tagId = builder.tagId;
        this.sku = builder.sku;
        this.location = builder.location;
        this.status = builder.status;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link TagRead}. Validity is checked by
     * {@link TagRead#isValid()}, not at build time, so that malformed input
     * can be counted instead of thrown.
     */
    public static class Builder {
        private Instant timestamp;
        private String stationId;
        private String tagId;
        private String sku;
        private String location;
        private String status;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder stationId(String stationId) {
            this.stationId = stationId;
            return this;
        }

        public Builder tagId(String tagId) {
            this.tagId = tagId;
            return this;
        }

        public Builder sku(String sku) {
            this.sku = sku;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public TagRead build() {
            return new TagRead(this);
        }
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String getStationId() {
        return stationId;
    }

    public String getTagId() {
        return tagId;
    }

    /**
     * @return the resolved SKU, or {@code null} when the tag is unknown
     */
    public String getSku() {
        return sku;
    }

    public String getLocation() {
        return location;
    }

    @Override
    public String getStatus() {
        return status;
    }

    @Override
    public RecordKind getKind() {
        return RecordKind.TAG_READ;
    }

    /**
     * @return {@code true} if the read was taken inside the scan zone, or if the
     *         sensor does not report a location
     */
    public boolean isInScanArea() {
        return location == null || IN_SCAN_AREA.equals(location);
    }

    @Override
    public boolean isValid() {
        return timestamp != null
                && stationId != null && !stationId.isBlank()
                && tagId != null && !tagId.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TagRead that))
            return false;
        return Objects.equals(timestamp, that.timestamp)
                && Objects.equals(stationId, that.stationId)
                && Objects.equals(tagId, that.tagId)
                && Objects.equals(sku, that.sku);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, stationId, tagId, sku);
    }

    @Override
    public String toString() {
        return "TagRead{" +
                "timestamp=" + timestamp +
                ", stationId='" + stationId + '\'' +
                ", tagId='" + tagId + '\'' +
                ", sku='" + sku + '\'' +
                ", location='" + location + '\'' +
                '}';
    }
}

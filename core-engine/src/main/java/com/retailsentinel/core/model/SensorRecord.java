package com.retailsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Common contract for every typed record handed to the correlator.
 *
 * <p>
 * Records are immutable and {@link Serializable} because the Flink job ships
 * them between operators. Station-scope records carry a station id and may
 * carry the station's health signal in {@link #getStatus()}; store-scope
 * records (inventory snapshots) return {@code null} for both.
 * </p>
 *
 * @since 1.0.0
 */
public interface SensorRecord extends Serializable {

    /**
     * @return the instant the record was produced by its sensor; never
     *         {@code null} for a valid record
     */
    Instant getTimestamp();

    /**
     * @return the station the record belongs to, or {@code null} for
     *         store-scope records
     */
    String getStationId();

    /**
     * @return the raw station health signal carried by the record (for example
     *         {@code Active} or {@code System Crash}), or {@code null}
     */
    String getStatus();

    /**
     * @return the stream this record came from
     */
    RecordKind getKind();

    /**
     * Validation predicate applied at ingestion. Invalid records are counted
     * and rejected, never evaluated.
     *
     * @return {@code true} if all required fields are present and in range
     */
    boolean isValid();
}

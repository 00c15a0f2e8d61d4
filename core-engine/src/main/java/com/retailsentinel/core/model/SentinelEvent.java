package com.retailsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A detected condition, wrapped in the output envelope
 * {@code {"timestamp", "event_id", "event_data"}}.
 *
 * <p>
 * Rules build events without an id; the emitter assigns one with
 * {@link #withEventId(String)} at emission time. Once emitted an event is
 * immutable. {@code timestamp} is logical time (the close of the window that
 * triggered it), never wall-clock emission time.
 * </p>
 *
 * <p>
 * {@code scopeId} and {@code windowStart} are bookkeeping for deduplication
 * and are not serialized.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "timestamp", "event_id", "event_data" })
public final class SentinelEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final String eventId;
    private final EventPayload payload;
    private final String scopeId;
    private final Instant windowStart;

    public SentinelEvent(Instant timestamp, EventPayload payload, String scopeId, Instant windowStart) {
        this(timestamp, null, payload, scopeId, windowStart);
    }

    private SentinelEvent(Instant timestamp, String eventId, EventPayload payload,
            String scopeId, Instant windowStart) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.eventId = eventId;
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
        this.scopeId = Objects.requireNonNull(scopeId, "scopeId must not be null");
        this.windowStart = Objects.requireNonNull(windowStart, "windowStart must not be null");
    }

    /**
     * @param eventId identifier assigned by the emitter
     * @return a copy of this event carrying the identifier
     */
    public SentinelEvent withEventId(String eventId) {
        return new SentinelEvent(timestamp, Objects.requireNonNull(eventId, "eventId must not be null"),
                payload, scopeId, windowStart);
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return the emitter-assigned id, or {@code null} before emission
     */
    @JsonProperty("event_id")
    public String getEventId() {
        return eventId;
    }

    @JsonProperty("event_data")
    public EventPayload getPayload() {
        return payload;
    }

    @JsonIgnore
    public EventType getType() {
        return payload.getType();
    }

    /**
     * @return the station id for station windows, or the store scope id for
     *         store-wide slices
     */
    @JsonIgnore
    public String getScopeId() {
        return scopeId;
    }

    @JsonIgnore
    public Instant getWindowStart() {
        return windowStart;
    }

    /**
     * Equality ignores the event id, so replays of the same input compare equal.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SentinelEvent that))
            return false;
        return timestamp.equals(that.timestamp)
                && payload.equals(that.payload)
                && scopeId.equals(that.scopeId)
                && windowStart.equals(that.windowStart);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, payload, scopeId, windowStart);
    }

    @Override
    public String toString() {
        return "SentinelEvent{" +
                "eventId='" + eventId + '\'' +
                ", timestamp=" + timestamp +
                ", payload=" + payload +
                '}';
    }
}

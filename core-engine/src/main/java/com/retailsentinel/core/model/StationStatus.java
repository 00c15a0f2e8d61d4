package com.retailsentinel.core.model;

import java.util.Locale;

/**
 * Normalised station health derived from the raw status strings the sensors
 * report.
 *
 * @since 1.0.0
 */
public enum StationStatus {

    /** Station seen but no health signal received yet. */
    UNKNOWN,
    ACTIVE,
    INACTIVE,
    /** Crash, read error or any other failure signal. */
    FAULT;

    /**
     * Map a raw status string to a status. {@code null} or blank yields
     * {@link #UNKNOWN}; unrecognised values are treated as {@link #ACTIVE}
     * because sensors only report failures explicitly.
     *
     * @param raw raw status from a record
     * @return the normalised status
     */
    public static StationStatus parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        if (isFault(raw)) {
            return FAULT;
        }
        String s = raw.trim().toLowerCase(Locale.ROOT);
        return switch (s) {
            case "inactive", "idle", "closed" -> INACTIVE;
            default -> ACTIVE;
        };
    }

    /**
     * @param raw raw status from a record
     * @return {@code true} if the string signals an equipment fault
     */
    public static boolean isFault(String raw) {
        if (raw == null) {
            return false;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "system crash", "read error", "error", "failed", "crash" -> true;
            default -> false;
        };
    }

    /**
     * @return {@code true} if a station in this status can serve customers
     */
    public boolean isOperational() {
        return this == ACTIVE || this == UNKNOWN;
    }
}

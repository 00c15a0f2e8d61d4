package com.retailsentinel.core.model;

import java.util.Optional;

/**
 * The nine event kinds the detection engine can emit, in the fixed order used
 * when several fire for the same window.
 *
 * @since 1.0.0
 */
public enum EventType {

    SCANNER_AVOIDANCE("Scanner Avoidance", true),
    BARCODE_SWITCHING("Barcode Switching", true),
    WEIGHT_DISCREPANCY("Weight Discrepancies", true),
    SYSTEM_CRASH("Unexpected Systems Crash", true),
    QUEUE_LENGTH("Long Queue Length", true),
    WAIT_TIME("Long Wait Time", true),
    INVENTORY_DISCREPANCY("Inventory Discrepancy", true),
    STAFFING("Staffing Needs", true),
    /** Not an anomaly; feeds the dashboard's signal/noise ratio. */
    SUCCESS_OPERATION("Success Operation", false);

    private final String displayName;
    private final boolean anomaly;

    EventType(String displayName, boolean anomaly) {
        this.displayName = displayName;
        this.anomaly = anomaly;
    }

    /**
     * @return the {@code event_name} written on the wire
     */
    public String getDisplayName() {
        return displayName;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    /**
     * @param displayName wire name, e.g. {@code "Long Queue Length"}
     * @return the matching type, or empty if unknown
     */
    public static Optional<EventType> fromDisplayName(String displayName) {
        for (EventType type : values()) {
            if (type.displayName.equals(displayName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

package com.retailsentinel.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The record streams the correlator ingests, keyed by the dataset names used
 * on the wire.
 *
 * @since 1.0.0
 */
public enum RecordKind {

    TAG_READ("RFID_data", "rfid_readings"),
    TRANSACTION("POS_Transactions", "pos_transactions"),
    QUEUE_SAMPLE("Queue_monitor", "queue_monitoring"),
    RECOGNITION("Product_recognism", "product_recognition"),
    INVENTORY("Current_inventory_data", "inventory_snapshots");

    private final String datasetName;
    private final String fileStem;

    RecordKind(String datasetName, String fileStem) {
        this.datasetName = datasetName;
        this.fileStem = fileStem;
    }

    /**
     * @return the dataset name used by the live stream envelope
     */
    public String getDatasetName() {
        return datasetName;
    }

    /**
     * @return the JSON Lines file name (without extension) used in batch mode
     */
    public String getFileStem() {
        return fileStem;
    }

    /**
     * @return {@code true} if records of this kind belong to a station
     */
    public boolean isStationScoped() {
        return this != INVENTORY;
    }

    /**
     * Resolve a kind from either its dataset name or its batch file stem,
     * case-insensitively.
     *
     * @param name dataset name or file stem
     * @return the matching kind, or empty if unknown
     */
    public static Optional<RecordKind> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalised = name.trim().toLowerCase(Locale.ROOT);
        for (RecordKind kind : values()) {
            if (kind.datasetName.toLowerCase(Locale.ROOT).equals(normalised)
                    || kind.fileStem.equals(normalised)
                    || kind.name().toLowerCase(Locale.ROOT).equals(normalised)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}

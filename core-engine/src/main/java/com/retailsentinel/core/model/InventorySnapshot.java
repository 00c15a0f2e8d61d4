package com.retailsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Periodic stock count for one SKU. Store-scope: it has no station and no
 * health signal.
 *
 * @since 1.0.0
 */
public final class InventorySnapshot implements SensorRecord {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final String sku;
    private final long onHandQuantity;

    public InventorySnapshot(Instant timestamp, String sku, long onHandQuantity) {
        this.timestamp = timestamp;
        this.sku = sku;
        this.onHandQuantity = onHandQuantity;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    /** Always {@code null}: inventory is counted store-wide. */
    @Override
    public String getStationId() {
        return null;
    }

    @Override
    public String getStatus() {
        return null;
    }

    public String getSku() {
        return sku;
    }

    public long getOnHandQuantity() {
        return onHandQuantity;
    }

    @Override
    public RecordKind getKind() {
        return RecordKind.INVENTORY;
    }

    @Override
    public boolean isValid() {
        return timestamp != null && sku != null && !sku.isBlank() && onHandQuantity >= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof InventorySnapshot that))
            return false;
        return onHandQuantity == that.onHandQuantity
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(sku, that.sku);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, sku, onHandQuantity);
    }

    @Override
    public String toString() {
        return "InventorySnapshot{" +
                "timestamp=" + timestamp +
                ", sku='" + sku + '\'' +
                ", onHandQuantity=" + onHandQuantity +
                '}';
    }
}

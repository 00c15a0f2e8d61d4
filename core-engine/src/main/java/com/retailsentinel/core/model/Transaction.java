package com.retailsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A completed point-of-sale scan. One instance per physical scan event.
 *
 * <p>
 * {@code customerId} and {@code weightGrams} are optional: anonymous sales have
 * no customer, and only stations with a bagging scale report a weight.
 * </p>
 *
 * @since 1.0.0
 */
public final class Transaction implements SensorRecord {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final String stationId;
    private final String sku;
    private final double scannedPrice;
    private final String customerId;
    private final Double weightGrams;
    private final String status;

    private Transaction(Builder builder) {
        this.timestamp = builder.timestamp;
        this.stationId = builder.stationId;
        this.sku = builder.sku;
        this.scannedPrice = builder.scannedPrice;
        this.customerId = builder.customerId;
        this.weightGrams = builder.weightGrams;
        this.status = builder.status;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Transaction}.
     */
    public static class Builder {
        private Instant timestamp;
        private String stationId;
        private String sku;
        private double scannedPrice;
        private String customerId;
        private Double weightGrams;
        private String status;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder stationId(String stationId) {
            this.stationId = stationId;
            return this;
        }

        public Builder sku(String sku) {
            this.sku = sku;
            return this;
        }

        public Builder scannedPrice(double scannedPrice) {
            this.scannedPrice = scannedPrice;
            return this;
        }

        public Builder customerId(String customerId) {
            this.customerId = customerId;
            return this;
        }

        public Builder weightGrams(Double weightGrams) {
            this.weightGrams = weightGrams;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Transaction build() {
            return new Transaction(this);
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

    public String getSku() {
        return sku;
    }

    public double getScannedPrice() {
        return scannedPrice;
    }

    /**
     * @return the loyalty customer id, or {@code null} for anonymous sales
     */
    public String getCustomerId() {
        return customerId;
    }

    /**
     * @return the weight measured by the bagging scale, or {@code null} if the
     *         station has no scale
     */
    public Double getWeightGrams() {
        return weightGrams;
    }

    @Override
    public String getStatus() {
        return status;
    }

    @Override
    public RecordKind getKind() {
        return RecordKind.TRANSACTION;
    }

    @Override
    public boolean isValid() {
        return timestamp != null
                && stationId != null && !stationId.isBlank()
                && sku != null && !sku.isBlank()
                && Double.isFinite(scannedPrice) && scannedPrice >= 0
                && (weightGrams == null || (Double.isFinite(weightGrams) && weightGrams >= 0));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Transaction that))
            return false;
        return Double.compare(scannedPrice, that.scannedPrice) == 0
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(stationId, that.stationId)
                && Objects.equals(sku, that.sku)
                && Objects.equals(customerId, that.customerId)
                && Objects.equals(weightGrams, that.weightGrams);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, stationId, sku, scannedPrice, customerId, weightGrams);
    }

    @Override
    public String toString() {
        return "Transaction{" +
                "timestamp=" + timestamp +
                ", stationId='" + stationId + '\'' +
                ", sku='" + sku + '\'' +
                ", scannedPrice=" + scannedPrice +
                ", customerId='" + customerId + '\'' +
                ", weightGrams=" + weightGrams +
                '}';
    }
}

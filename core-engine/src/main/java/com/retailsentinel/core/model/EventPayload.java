package com.retailsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Rule-specific content of an event ({@code event_data} on the wire).
 *
 * <p>
 * The hierarchy is closed: the constructor is private, so the nested classes
 * below are the only variants, one per {@link EventType}. Each variant carries
 * only its own typed fields; {@link #getFields()} renders them, in wire order,
 * for serialization and equality.
 * </p>
 *
 * @since 1.0.0
 */
@JsonAutoDetect(getterVisibility = Visibility.NONE, isGetterVisibility = Visibility.NONE,
        fieldVisibility = Visibility.NONE)
public abstract class EventPayload implements Serializable {

    private static final long serialVersionUID = 1L;

    private final EventType type;
    private final String stationId;

    private EventPayload(EventType type, String stationId) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.stationId = stationId;
    }

    public EventType getType() {
        return type;
    }

    /**
     * @return the station the event concerns, or {@code null} for store-wide
     *         events
     */
    public String getStationId() {
        return stationId;
    }

    /**
     * Wire representation: {@code event_name}, {@code station_id} (when
     * present) and then the variant's own fields. Absent optional fields are
     * omitted.
     *
     * @return unmodifiable, ordered map of wire field names to values
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("event_name", type.getDisplayName());
        if (stationId != null) {
            fields.put("station_id", stationId);
        }
        describe(fields);
        fields.values().removeIf(Objects::isNull);
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Append the variant's fields, in wire order.
     *
     * @param out target map
     */
    protected abstract void describe(Map<String, Object> out);

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EventPayload that))
            return false;
        return getFields().equals(that.getFields());
    }

    @Override
    public int hashCode() {
        return getFields().hashCode();
    }

    @Override
    public String toString() {
        return getFields().toString();
    }

    // ---------------------------------------------------------------
    // Variants
    // ---------------------------------------------------------------

    /** A tagged item left the station without a matching sale. */
    public static final class ScannerAvoidance extends EventPayload {
        private static final long serialVersionUID = 1L;

        private final String productSku;
        private final String customerId;

        public ScannerAvoidance(String stationId, String productSku, String customerId) {
            super(EventType.SCANNER_AVOIDANCE, stationId);
            this.productSku = productSku;
            this.customerId = customerId;
        }

        public String getProductSku() {
            return productSku;
        }

        public String getCustomerId() {
            return customerId;
        }

        @Override
        protected void describe(Map<String, Object> out) {
            out.put("product_sku", productSku);
            out.put("customer_id", customerId);
        }
    }

    /** A SKU was sold for materially less than its catalog price. */
    public static final class BarcodeSwitching extends EventPayload {
        private static final long serialVersionUID = 1L;

        private final String sku;
        private final double scannedPrice;
        private final double catalogPrice;
        private final String customerId;
        private final String actualSku;

        public BarcodeSwitching(String stationId, String sku, double scannedPrice,
                double catalogPrice, String customerId, String actualSku) {
            super(EventType.BARCODE_SWITCHING, stationId);
            this.sku = sku;
            this.scannedPrice = scannedPrice;
            this.catalogPrice = catalogPrice;
            this.customerId = customerId;
            this.actualSku = actualSku;
        }

        public String getSku() {
            return sku;
        }

        public double getScannedPrice() {
            return scannedPrice;
        }

        public double getCatalogPrice() {
            return catalogPrice;
        }

        public String getCustomerId() {
            return customerId;
        }

        /**
         * @return the SKU the camera actually saw, or {@code null} when there
         *         was no confident, differing prediction
         */
        public String getActualSku() {
            return actualSku;
        }

        @Override
        protected void describe(Map<String, Object> out) {
            out.put("sku", sku);
            out.put("scanned_price", scannedPrice);
            out.put("catalog_price", catalogPrice);
            out.put("customer_id", customerId);
            out.put("actual_sku", actualSku);
        }
    }

    /** Bagging-scale weight disagrees with the catalog weight. */
    public static final class WeightDiscrepancy extends EventPayload {
        private static final long serialVersionUID = 1L;

        private final String sku;
        private final double actualWeight;
        private final double expectedWeight;
        private final String customerId;

        public WeightDiscrepancy(String stationId, String sku, double actualWeight, double expectedWeight,
                String customerId) {
            super(EventType.WEIGHT_DISCREPANCY, stationId);
            this.sku = sku;
            this.actualWeight = actualWeight;
            this.expectedWeight = expectedWeight;
            this.customerId = customerId;
        }

        public String getSku() {
            return sku;
        }

        public double getActualWeight() {
            return actualWeight;
        }

        public double getExpectedWeight() {
            return expectedWeight;
        }

        /**
         * @return customer of the weighed transaction, or {@code null} if anonymous
         */
        public String getCustomerId() {
            return customerId;
        }

        @Override
        protected void describe(Map<String, Object> out) {
            out.put("sku", sku);
            out.put("actual_weight", actualWeight);
            out.put("expected_weight", expectedWeight);
            out.put("customer_id", customerId);
        }
    }

    /** The station reported a fault status. */
    public static final class SystemCrash extends EventPayload {
        private static final long serialVersionUID = 1L;

        private final String status;

        public SystemCrash(String stationId, String status) {
            super(EventType.SYSTEM_CRASH, stationId);
            this.status = status;
        }

        public String getStatus() {
            return status;
        }

        @Override
        protected void describe(Map<String, Object> out) {
            out.put("status", status);
        }
    }

    public static final class QueueLength extends EventPayload {
        private static final long serialVersionUID = 1L;

        private final int customerCount;

        public QueueLength(String stationId, int customerCount) {
            super(EventType.QUEUE_LENGTH, stationId);
            this.customerCount = customerCount;
        }

        public int getCustomerCount() {
            return customerCount;
        }

        @Override
        protected void describe(Map<String, Object> out) {
            out.put("customer_count", customerCount);
        }
    }

    public static final class WaitTime extends EventPayload {
        private static final long serialVersionUID = 1L;

        private final double dwellSeconds;

        public WaitTime(String stationId, double dwellSeconds) {
            super(EventType.WAIT_TIME, stationId);
            this.dwellSeconds = dwellSeconds;
        }

        public double getDwellSeconds() {
            return dwellSeconds;
        }

        @Override
        protected void describe(Map<String, Object> out) {
            out.put("dwell_seconds", dwellSeconds);
        }
    }

    /** Store-wide: counted stock drifted from the expected level. */
    public static final class InventoryDiscrepancy extends EventPayload {
        private static final long serialVersionUID = 1L;

        private final String sku;
        private final long expectedQuantity;
        private final long actualQuantity;
        private final double variancePct;

        public InventoryDiscrepancy(String sku, long expectedQuantity, long actualQuantity, double variancePct) {
            super(EventType.INVENTORY_DISCREPANCY, null);
            this.sku = sku;
            this.expectedQuantity = expectedQuantity;
            this.actualQuantity = actualQuantity;
            this.variancePct = variancePct;
        }

        public String getSku() {
            return sku;
        }

        public long getExpectedQuantity() {
            return expectedQuantity;
        }

        public long getActualQuantity() {
            return actualQuantity;
        }

        /**
         * @return variance as a percentage of the expected quantity
         */
        public double getVariancePct() {
            return variancePct;
        }

        @Override
        protected void describe(Map<String, Object> out) {
            out.put("sku", sku);
            out.put("expected_quantity", expectedQuantity);
            out.put("actual_quantity", actualQuantity);
            out.put("variance_pct", round2(variancePct));
        }
    }

    /** Store-wide: most stations are busy. */
    public static final class Staffing extends EventPayload {
        private static final long serialVersionUID = 1L;

        private final double activeRatio;
        private final String recommendedAction;
        private final String staffType;
        private final int activeStations;
        private final int totalStations;

        public Staffing(double activeRatio, String recommendedAction, String staffType,
                int activeStations, int totalStations) {
            super(EventType.STAFFING, null);
            this.activeRatio = activeRatio;
            this.recommendedAction = recommendedAction;
            this.staffType = staffType;
            this.activeStations = activeStations;
            this.totalStations = totalStations;
        }

        public double getActiveRatio() {
            return activeRatio;
        }

        public String getRecommendedAction() {
            return recommendedAction;
        }

        public String getStaffType() {
            return staffType;
        }

        public int getActiveStations() {
            return activeStations;
        }

        public int getTotalStations() {
            return totalStations;
        }

        @Override
        protected void describe(Map<String, Object> out) {
            out.put("active_ratio", round2(activeRatio));
            out.put("recommended_action", recommendedAction);
            out.put("staff_type", staffType);
            out.put("active_stations", activeStations);
            out.put("total_stations", totalStations);
        }
    }

    /** A window whose transactions passed every check. */
    public static final class SuccessOperation extends EventPayload {
        private static final long serialVersionUID = 1L;

        private final String customerId;
        private final String productSku;
        private final int transactionCount;

        public SuccessOperation(String stationId, String customerId, String productSku, int transactionCount) {
            super(EventType.SUCCESS_OPERATION, stationId);
            this.customerId = customerId;
            this.productSku = productSku;
            this.transactionCount = transactionCount;
        }

        public String getCustomerId() {
            return customerId;
        }

        public String getProductSku() {
            return productSku;
        }

        public int getTransactionCount() {
            return transactionCount;
        }

        @Override
        protected void describe(Map<String, Object> out) {
            out.put("customer_id", customerId);
            out.put("product_sku", productSku);
            out.put("transaction_count", transactionCount);
        }
    }
}

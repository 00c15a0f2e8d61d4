package com.retailsentinel.core.context;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * All reads of one tag in a window that no transaction accounts for.
 *
 * <p>
 * {@code customerId} is taken from the transaction nearest the first sighting,
 * or {@value #UNKNOWN_CUSTOMER} when the window has none.
 * </p>
 *
 * @since 1.0.0
 */
public final class UnscannedItem implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String UNKNOWN_CUSTOMER = "Unknown";

    private final String tagId;
    private final String sku;
    private final Instant firstSeen;
    private final Instant lastSeen;
    private final int readCount;
    private final boolean inScanArea;
    private final String customerId;
    private final String loyaltyTier;

    public UnscannedItem(String tagId, String sku, Instant firstSeen, Instant lastSeen, int readCount,
                         boolean inScanArea, String customerId, String loyaltyTier) {
        this.tagId = Objects.requireNonNull(tagId, "tagId must not be null");
        this.sku = sku;
        this.firstSeen = Objects.requireNonNull(firstSeen, "firstSeen must not be null");
        this.lastSeen = Objects.requireNonNull(lastSeen, "lastSeen must not be null");
        this.readCount = readCount;
        this.inScanArea = inScanArea;
        this.customerId = customerId != null ? customerId : UNKNOWN_CUSTOMER;
        this.loyaltyTier = loyaltyTier;
    }

    public String getTagId() {
        return tagId;
    }

    /**
     * @return SKU carried by the tag, or {@code null} if the reader did not report one
     */
    public String getSku() {
        return sku;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    /**
     * @return time between the first and last sighting within the window
     */
    public Duration getDwell() {
        return Duration.between(firstSeen, lastSeen);
    }

    public int getReadCount() {
        return readCount;
    }

    public boolean isInScanArea() {
        return inScanArea;
    }

    public String getCustomerId() {
        return customerId;
    }

    /**
     * @return the customer's loyalty tier, or {@code null} if unknown
     */
    public String getLoyaltyTier() {
        return loyaltyTier;
    }

    @Override
    public String toString() {
        return "UnscannedItem{" +
                "tagId='" + tagId + '\'' +
                ", sku='" + sku + '\'' +
                ", firstSeen=" + firstSeen +
                ", dwell=" + getDwell() +
                ", customerId='" + customerId + '\'' +
                '}';
    }
}

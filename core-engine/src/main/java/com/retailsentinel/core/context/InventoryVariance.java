package com.retailsentinel.core.context;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;

/**
 * Latest on-hand quantity of one SKU in a store slice against the catalog
 * quantity.
 *
 * @since 1.0.0
 */
public final class InventoryVariance implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String sku;
    private final long expectedQuantity;
    private final long actualQuantity;

    public InventoryVariance(String sku, long expectedQuantity, long actualQuantity) {
        this.sku = Objects.requireNonNull(sku, "sku must not be null");
        if (expectedQuantity <= 0) {
            throw new IllegalArgumentException("expectedQuantity must be > 0, got: " + expectedQuantity);
        }
        this.expectedQuantity = expectedQuantity;
        this.actualQuantity = actualQuantity;
    }

    /**
     * @return {@code |actual - expected| / expected}
     */
    public BigDecimal getVariance() {
        return BigDecimal.valueOf(Math.abs(actualQuantity - expectedQuantity))
                .divide(BigDecimal.valueOf(expectedQuantity), MathContext.DECIMAL64);
    }

    /**
     * @param threshold variance fraction, e.g. {@code 0.10}
     * @return {@code true} if the variance is strictly greater than the threshold
     */
    public boolean exceeds(double threshold) {
        BigDecimal limit = BigDecimal.valueOf(expectedQuantity).multiply(BigDecimal.valueOf(threshold));
        return BigDecimal.valueOf(Math.abs(actualQuantity - expectedQuantity)).compareTo(limit) > 0;
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

    @Override
    public String toString() {
        return "InventoryVariance{" +
                "sku='" + sku + '\'' +
                ", expected=" + expectedQuantity +
                ", actual=" + actualQuantity +
                '}';
    }
}

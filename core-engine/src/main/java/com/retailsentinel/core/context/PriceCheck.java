package com.retailsentinel.core.context;

import com.retailsentinel.core.model.Transaction;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Scanned price of one transaction against its catalog price.
 *
 * @since 1.0.0
 */
public final class PriceCheck implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Transaction transaction;
    private final double catalogPrice;
    private final String observedSku;

    public PriceCheck(Transaction transaction, double catalogPrice, String observedSku) {
        this.transaction = Objects.requireNonNull(transaction, "transaction must not be null");
        this.catalogPrice = catalogPrice;
        this.observedSku = observedSku;
    }

    /**
     * @param ratio threshold ratio, e.g. {@code 0.5}
     * @return {@code true} if {@code scanned <= catalog * ratio}, compared in
     *         decimal so that boundary values are exact
     */
    public boolean isAtOrBelow(double ratio) {
        if (catalogPrice <= 0) {
            return false;
        }
        BigDecimal limit = BigDecimal.valueOf(catalogPrice).multiply(BigDecimal.valueOf(ratio));
        return BigDecimal.valueOf(transaction.getScannedPrice()).compareTo(limit) <= 0;
    }

    public Transaction getTransaction() {
        return transaction;
    }

    public double getScannedPrice() {
        return transaction.getScannedPrice();
    }

    public double getCatalogPrice() {
        return catalogPrice;
    }

    /**
     * @return the SKU a confident recognition saw near the transaction when it
     *         differs from the scanned SKU, else {@code null}
     */
    public String getObservedSku() {
        return observedSku;
    }

    @Override
    public String toString() {
        return "PriceCheck{" +
                "sku='" + transaction.getSku() + '\'' +
                ", scanned=" + transaction.getScannedPrice() +
                ", catalog=" + catalogPrice +
                ", observedSku='" + observedSku + '\'' +
                '}';
    }
}

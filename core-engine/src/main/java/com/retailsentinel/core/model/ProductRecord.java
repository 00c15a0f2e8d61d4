package com.retailsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Catalog entry: the reference truth for a SKU. Loaded once, never mutated.
 *
 * @since 1.0.0
 */
public final class ProductRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String sku;
    private final String name;
    private final double catalogPrice;
    private final double expectedWeightGrams;
    private final long expectedQuantity;

    public ProductRecord(String sku, String name, double catalogPrice,
            double expectedWeightGrams, long expectedQuantity) {
        this.sku = Objects.requireNonNull(sku, "sku must not be null");
        this.name = name;
        this.catalogPrice = catalogPrice;
        this.expectedWeightGrams = expectedWeightGrams;
        this.expectedQuantity = expectedQuantity;
    }

    public String getSku() {
        return sku;
    }

    public String getName() {
        return name;
    }

    public double getCatalogPrice() {
        return catalogPrice;
    }

    public double getExpectedWeightGrams() {
        return expectedWeightGrams;
    }

    /**
     * @return the stock level the store expects to hold for this SKU
     */
    public long getExpectedQuantity() {
        return expectedQuantity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ProductRecord that))
            return false;
        return Double.compare(catalogPrice, that.catalogPrice) == 0
                && Double.compare(expectedWeightGrams, that.expectedWeightGrams) == 0
                && expectedQuantity == that.expectedQuantity
                && sku.equals(that.sku)
                && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sku, name, catalogPrice, expectedWeightGrams, expectedQuantity);
    }

    @Override
    public String toString() {
        return "ProductRecord{" +
                "sku='" + sku + '\'' +
                ", name='" + name + '\'' +
                ", catalogPrice=" + catalogPrice +
                ", expectedWeightGrams=" + expectedWeightGrams +
                ", expectedQuantity=" + expectedQuantity +
                '}';
    }
}

package com.retailsentinel.core.context;

import com.retailsentinel.core.model.Transaction;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Measured weight of one transaction against the catalog weight.
 *
 * @since 1.0.0
 */
public final class WeightCheck implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Transaction transaction;
    private final double actualGrams;
    private final double expectedGrams;

    public WeightCheck(Transaction transaction, double actualGrams, double expectedGrams) {
        this.transaction = Objects.requireNonNull(transaction, "transaction must not be null");
        this.actualGrams = actualGrams;
        this.expectedGrams = expectedGrams;
    }

    /**
     * @return {@code |actual - expected|} in exact decimal
     */
    public BigDecimal getDeviation() {
        return BigDecimal.valueOf(actualGrams).subtract(BigDecimal.valueOf(expectedGrams)).abs();
    }

    /**
     * @param toleranceGrams allowed deviation
     * @return {@code true} if the deviation is strictly greater than the tolerance
     */
    public boolean exceeds(double toleranceGrams) {
        return getDeviation().compareTo(BigDecimal.valueOf(toleranceGrams)) > 0;
    }

    public Transaction getTransaction() {
        return transaction;
    }

    public double getActualGrams() {
        return actualGrams;
    }

    public double getExpectedGrams() {
        return expectedGrams;
    }

    @Override
    public String toString() {
        return "WeightCheck{" +
                "sku='" + transaction.getSku() + '\'' +
                ", actual=" + actualGrams +
                ", expected=" + expectedGrams +
                '}';
    }
}

package com.retailsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Customer registry entry. Used for event enrichment only.
 *
 * @since 1.0.0
 */
public final class CustomerRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String customerId;
    private final String name;
    private final String loyaltyTier;

    public CustomerRecord(String customerId, String name, String loyaltyTier) {
        this.customerId = Objects.requireNonNull(customerId, "customerId must not be null");
        this.name = name;
        this.loyaltyTier = loyaltyTier;
    }

    public String getCustomerId() {
        return customerId;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the loyalty tier, or {@code null} if the registry has none
     */
    public String getLoyaltyTier() {
        return loyaltyTier;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CustomerRecord that))
            return false;
        return customerId.equals(that.customerId)
                && Objects.equals(name, that.name)
                && Objects.equals(loyaltyTier, that.loyaltyTier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(customerId, name, loyaltyTier);
    }

    @Override
    public String toString() {
        return "CustomerRecord{customerId='" + customerId + "', loyaltyTier='" + loyaltyTier + "'}";
    }
}

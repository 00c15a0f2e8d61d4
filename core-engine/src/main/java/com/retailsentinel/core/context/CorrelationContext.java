package com.retailsentinel.core.context;

import com.retailsentinel.core.model.TagRead;
import com.retailsentinel.core.model.Transaction;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Joined, immutable view of one closed window, handed to every detection rule.
 *
 * <p>
 * A station context carries the tag/transaction matching, price and weight
 * checks, queue peaks and health signal of one station. A store context
 * carries inventory variances and occupancy of one store slice. Fields that do
 * not apply to the scope are empty.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}; {@code scopeId}, {@code windowStart} and
 * {@code windowEnd} are required. List fields are copied on build.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationContext implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String scopeId;
    private final boolean storeScope;
    private final Instant windowStart;
    private final Instant windowEnd;
    private final List<Transaction> transactions;
    private final List<TagRead> matchedReads;
    private final List<TagRead> unscannedReads;
    private final List<UnscannedItem> unscannedItems;
    private final List<PriceCheck> priceChecks;
    private final List<WeightCheck> weightChecks;
    private final List<Transaction> completedTransactions;
    private final QueueSummary queueSummary;
    private final String faultStatus;
    private final String lastStatus;
    private final List<InventoryVariance> inventoryVariances;
    private final Occupancy occupancy;

    private CorrelationContext(Builder builder) {
        this.scopeId = Objects.requireNonNull(builder.scopeId, "scopeId must not be null");
        this.storeScope = builder.storeScope;
        this.windowStart = Objects.requireNonNull(builder.windowStart, "windowStart must not be null");
        this.windowEnd = Objects.requireNonNull(builder.windowEnd, "windowEnd must not be null");
        this.transactions = List.copyOf(builder.transactions);
        this.matchedReads = List.copyOf(builder.matchedReads);
        this.unscannedReads = List.copyOf(builder.unscannedReads);
        this.unscannedItems = List.copyOf(builder.unscannedItems);
        this.priceChecks = List.copyOf(builder.priceChecks);
        this.weightChecks = List.copyOf(builder.weightChecks);
        this.completedTransactions = List.copyOf(builder.completedTransactions);
        this.queueSummary = builder.queueSummary;
        this.faultStatus = builder.faultStatus;
        this.lastStatus = builder.lastStatus;
        this.inventoryVariances = List.copyOf(builder.inventoryVariances);
        this.occupancy = builder.occupancy;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link CorrelationContext}.
     */
    public static class Builder {
        private String scopeId;
        private boolean storeScope;
        private Instant windowStart;
        private Instant windowEnd;
        private List<Transaction> transactions = Collections.emptyList();
        private List<TagRead> matchedReads = Collections.emptyList();
        private List<TagRead> unscannedReads = Collections.emptyList();
        private List<UnscannedItem> unscannedItems = Collections.emptyList();
        private List<PriceCheck> priceChecks = Collections.emptyList();
        private List<WeightCheck> weightChecks = Collections.emptyList();
        private List<Transaction> completedTransactions = Collections.emptyList();
        private QueueSummary queueSummary;
        private String faultStatus;
        private String lastStatus;
        private List<InventoryVariance> inventoryVariances = Collections.emptyList();
        private Occupancy occupancy;

        public Builder scopeId(String scopeId) {
            this.scopeId = scopeId;
            return this;
        }

        public Builder storeScope(boolean storeScope) {
            this.storeScope = storeScope;
            return this;
        }

        public Builder window(Instant start, Instant end) {
            this.windowStart = start;
            this.windowEnd = end;
            return this;
        }

        public Builder transactions(List<Transaction> transactions) {
            this.transactions = transactions;
            return this;
        }

        public Builder matchedReads(List<TagRead> matchedReads) {
            this.matchedReads = matchedReads;
            return this;
        }

        public Builder unscannedReads(List<TagRead> unscannedReads) {
            this.unscannedReads = unscannedReads;
            return this;
        }

        public Builder unscannedItems(List<UnscannedItem> unscannedItems) {
            this.unscannedItems = unscannedItems;
            return this;
        }

        public Builder priceChecks(List<PriceCheck> priceChecks) {
            this.priceChecks = priceChecks;
            return this;
        }

        public Builder weightChecks(List<WeightCheck> weightChecks) {
            this.weightChecks = weightChecks;
            return this;
        }

        public Builder completedTransactions(List<Transaction> completedTransactions) {
            this.completedTransactions = completedTransactions;
            return this;
        }

        public Builder queueSummary(QueueSummary queueSummary) {
            this.queueSummary = queueSummary;
            return this;
        }

        public Builder faultStatus(String faultStatus) {
            this.faultStatus = faultStatus;
            return this;
        }

        public Builder lastStatus(String lastStatus) {
            this.lastStatus = lastStatus;
            return this;
        }

        public Builder inventoryVariances(List<InventoryVariance> inventoryVariances) {
            this.inventoryVariances = inventoryVariances;
            return this;
        }

        public Builder occupancy(Occupancy occupancy) {
            this.occupancy = occupancy;
            return this;
        }

        public CorrelationContext build() {
            return new CorrelationContext(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getScopeId() {
        return scopeId;
    }

    public boolean isStoreScope() {
        return storeScope;
    }

    /**
     * @return the station id, or {@code null} for a store context
     */
    public String getStationId() {
        return storeScope ? null : scopeId;
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    /** Transactions in arrival order. */
    public List<Transaction> getTransactions() {
        return transactions;
    }

    public List<TagRead> getMatchedReads() {
        return matchedReads;
    }

    public List<TagRead> getUnscannedReads() {
        return unscannedReads;
    }

    /** Unscanned tags, one per tag id, ordered by first sighting. */
    public List<UnscannedItem> getUnscannedItems() {
        return unscannedItems;
    }

    /** One check per transaction with a catalog price, in time order. */
    public List<PriceCheck> getPriceChecks() {
        return priceChecks;
    }

    /** One check per weighed transaction with a catalog weight, in time order. */
    public List<WeightCheck> getWeightChecks() {
        return weightChecks;
    }

    /** Transactions that passed both the price and the weight check. */
    public List<Transaction> getCompletedTransactions() {
        return completedTransactions;
    }

    public Optional<QueueSummary> getQueueSummary() {
        return Optional.ofNullable(queueSummary);
    }

    /**
     * @return the first fault status reported in the window, if any
     */
    public Optional<String> getFaultStatus() {
        return Optional.ofNullable(faultStatus);
    }

    public Optional<String> getLastStatus() {
        return Optional.ofNullable(lastStatus);
    }

    public List<InventoryVariance> getInventoryVariances() {
        return inventoryVariances;
    }

    public Optional<Occupancy> getOccupancy() {
        return Optional.ofNullable(occupancy);
    }

    @Override
    public String toString() {
        return "CorrelationContext{" +
                "scopeId='" + scopeId + '\'' +
                ", window=[" + windowStart + ", " + windowEnd + ')' +
                ", transactions=" + transactions.size() +
                ", matchedReads=" + matchedReads.size() +
                ", unscannedReads=" + unscannedReads.size() +
                ", queue=" + queueSummary +
                ", faultStatus='" + faultStatus + '\'' +
                ", inventoryVariances=" + inventoryVariances.size() +
                ", occupancy=" + occupancy +
                '}';
    }
}

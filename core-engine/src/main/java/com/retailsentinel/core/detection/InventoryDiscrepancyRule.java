package com.retailsentinel.core.detection;

import com.retailsentinel.core.config.SentinelConfig;
import com.retailsentinel.core.context.CorrelationContext;
import com.retailsentinel.core.context.InventoryVariance;
import com.retailsentinel.core.model.EventPayload;
import com.retailsentinel.core.model.EventType;
import com.retailsentinel.core.model.SentinelEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Optional;

/**
 * Inventory discrepancy.
 *
 * <p>
 * Store-scope rule. Among SKUs whose latest on-hand quantity in the slice
 * differs from the catalog quantity by strictly more than the threshold, the
 * largest variance is reported; ties go to the lexically smallest SKU.
 * </p>
 *
 * @since 1.0.0
 */
public class InventoryDiscrepancyRule implements DetectionRule {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(InventoryDiscrepancyRule.class);

    private static final Comparator<InventoryVariance> LARGEST_FIRST =
            Comparator.comparing(InventoryVariance::getVariance).reversed()
                    .thenComparing(InventoryVariance::getSku);

    private final double varianceThreshold;

    public InventoryDiscrepancyRule(SentinelConfig config) {
        this(config.getInventoryVarianceThreshold());
    }

    public InventoryDiscrepancyRule(double varianceThreshold) {
        this.varianceThreshold = varianceThreshold;
    }

    @Override
    public Optional<SentinelEvent> evaluate(CorrelationContext context) {
        if (!context.isStoreScope()) {
            return Optional.empty();
        }
        return context.getInventoryVariances().stream()
                .filter(variance -> variance.exceeds(varianceThreshold))
                .min(LARGEST_FIRST)
                .map(variance -> {
                    double pct = variance.getVariance().multiply(BigDecimal.valueOf(100)).doubleValue();
                    LOG.debug("Inventory discrepancy for {}: expected {}, on hand {}",
                            variance.getSku(), variance.getExpectedQuantity(), variance.getActualQuantity());
                    return DetectionRule.eventFor(context, new EventPayload.InventoryDiscrepancy(
                            variance.getSku(), variance.getExpectedQuantity(),
                            variance.getActualQuantity(), pct));
                });
    }

    @Override
    public EventType type() {
        return EventType.INVENTORY_DISCREPANCY;
    }
}

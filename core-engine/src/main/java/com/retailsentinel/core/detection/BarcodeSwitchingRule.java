package com.retailsentinel.core.detection;

import com.retailsentinel.core.config.SentinelConfig;
import com.retailsentinel.core.context.CorrelationContext;
import com.retailsentinel.core.context.PriceCheck;
import com.retailsentinel.core.model.EventPayload;
import com.retailsentinel.core.model.EventType;
import com.retailsentinel.core.model.SentinelEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Barcode switching.
 *
 * <p>
 * Fires on the first transaction whose scanned price is at or below
 * {@code priceRatioThreshold} of the catalog price. When product recognition
 * saw a different SKU near the transaction, it is reported as
 * {@code actual_sku}.
 * </p>
 *
 * @since 1.0.0
 */
public class BarcodeSwitchingRule implements DetectionRule {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(BarcodeSwitchingRule.class);

    private final double ratioThreshold;

    public BarcodeSwitchingRule(SentinelConfig config) {
        this(config.getPriceRatioThreshold());
    }

    public BarcodeSwitchingRule(double ratioThreshold) {
        this.ratioThreshold = ratioThreshold;
    }

    @Override
    public Optional<SentinelEvent> evaluate(CorrelationContext context) {
        if (context.isStoreScope()) {
            return Optional.empty();
        }
        for (PriceCheck check : context.getPriceChecks()) {
            if (!check.isAtOrBelow(ratioThreshold)) {
                continue;
            }
            LOG.debug("Barcode switching at {}: {} scanned {} vs catalog {}",
                    context.getStationId(), check.getTransaction().getSku(),
                    check.getScannedPrice(), check.getCatalogPrice());
            return Optional.of(DetectionRule.eventFor(context, new EventPayload.BarcodeSwitching(
                    context.getStationId(),
                    check.getTransaction().getSku(),
                    check.getScannedPrice(),
                    check.getCatalogPrice(),
                    check.getTransaction().getCustomerId(),
                    check.getObservedSku())));
        }
        return Optional.empty();
    }

    @Override
    public EventType type() {
        return EventType.BARCODE_SWITCHING;
    }
}

package com.retailsentinel.core.detection;

import com.retailsentinel.core.config.SentinelConfig;
import com.retailsentinel.core.context.CorrelationContext;
import com.retailsentinel.core.context.WeightCheck;
import com.retailsentinel.core.model.EventPayload;
import com.retailsentinel.core.model.EventType;
import com.retailsentinel.core.model.SentinelEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Fires on the first weighed transaction whose weight deviates from the
 * catalog weight by strictly more than the tolerance.
 *
 * @since 1.0.0
 */
public class WeightDiscrepancyRule implements DetectionRule {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(WeightDiscrepancyRule.class);

    private final double toleranceGrams;

    public WeightDiscrepancyRule(SentinelConfig config) {
        this(config.getWeightToleranceGrams());
    }

    public WeightDiscrepancyRule(double toleranceGrams) {
        this.toleranceGrams = toleranceGrams;
    }

    @Override
    public Optional<SentinelEvent> evaluate(CorrelationContext context) {
        if (context.isStoreScope()) {
            return Optional.empty();
        }
        for (WeightCheck check : context.getWeightChecks()) {
            if (check.exceeds(toleranceGrams)) {
                LOG.debug("Weight discrepancy at {}: {} weighed {} g, expected {} g",
                        context.getStationId(), check.getTransaction().getSku(),
                        check.getActualGrams(), check.getExpectedGrams());
                return Optional.of(DetectionRule.eventFor(context, new EventPayload.WeightDiscrepancy(
                        context.getStationId(), check.getTransaction().getSku(),
                        check.getActualGrams(), check.getExpectedGrams(),
                        check.getTransaction().getCustomerId())));
            }
        }
        return Optional.empty();
    }

    @Override
    public EventType type() {
        return EventType.WEIGHT_DISCREPANCY;
    }
}

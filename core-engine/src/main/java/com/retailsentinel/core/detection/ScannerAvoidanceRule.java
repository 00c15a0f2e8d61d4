package com.retailsentinel.core.detection;

import com.retailsentinel.core.config.SentinelConfig;
import com.retailsentinel.core.context.CorrelationContext;
import com.retailsentinel.core.context.UnscannedItem;
import com.retailsentinel.core.model.EventPayload;
import com.retailsentinel.core.model.EventType;
import com.retailsentinel.core.model.SentinelEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Scanner avoidance.
 *
 * <p>
 * Fires when a tagged item was seen in the scan zone for at least the minimum
 * dwell but no transaction of its SKU was recorded in the window. Tags whose
 * SKU is unknown are ignored.
 * </p>
 *
 * @since 1.0.0
 */
public class ScannerAvoidanceRule implements DetectionRule {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ScannerAvoidanceRule.class);

    private final long minDwellMillis;

    public ScannerAvoidanceRule(SentinelConfig config) {
        this(config.minTagDwell());
    }

    public ScannerAvoidanceRule(Duration minDwell) {
        this.minDwellMillis = minDwell.toMillis();
    }

    @Override
    public Optional<SentinelEvent> evaluate(CorrelationContext context) {
        if (context.isStoreScope()) {
            return Optional.empty();
        }
        for (UnscannedItem item : context.getUnscannedItems()) {
            if (item.getSku() == null || !item.isInScanArea()
                    || item.getDwell().toMillis() < minDwellMillis) {
                continue;
            }
            LOG.debug("Scanner avoidance at {}: tag {} ({}) unscanned",
                    context.getStationId(), item.getTagId(), item.getSku());
            return Optional.of(DetectionRule.eventFor(context, new EventPayload.ScannerAvoidance(
                    context.getStationId(), item.getSku(), item.getCustomerId())));
        }
        return Optional.empty();
    }

    @Override
    public EventType type() {
        return EventType.SCANNER_AVOIDANCE;
    }
}

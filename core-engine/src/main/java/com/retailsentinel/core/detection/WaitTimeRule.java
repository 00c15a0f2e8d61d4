package com.retailsentinel.core.detection;

import com.retailsentinel.core.config.SentinelConfig;
import com.retailsentinel.core.context.CorrelationContext;
import com.retailsentinel.core.context.QueueSummary;
import com.retailsentinel.core.model.EventPayload;
import com.retailsentinel.core.model.EventType;
import com.retailsentinel.core.model.SentinelEvent;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Fires when the peak average dwell in a station window reaches the
 * threshold.
 *
 * @since 1.0.0
 */
public class WaitTimeRule implements DetectionRule {

    private static final long serialVersionUID = 1L;

    private final double thresholdSeconds;

    public WaitTimeRule(SentinelConfig config) {
        this(config.getWaitTimeThresholdSeconds());
    }

    public WaitTimeRule(double thresholdSeconds) {
        this.thresholdSeconds = thresholdSeconds;
    }

    @Override
    public Optional<SentinelEvent> evaluate(CorrelationContext context) {
        if (context.isStoreScope()) {
            return Optional.empty();
        }
        BigDecimal threshold = BigDecimal.valueOf(thresholdSeconds);
        return context.getQueueSummary()
                .map(QueueSummary::getMaxAverageDwellSeconds)
                .filter(dwell -> BigDecimal.valueOf(dwell).compareTo(threshold) >= 0)
                .map(dwell -> DetectionRule.eventFor(context,
                        new EventPayload.WaitTime(context.getStationId(), dwell)));
    }

    @Override
    public EventType type() {
        return EventType.WAIT_TIME;
    }
}

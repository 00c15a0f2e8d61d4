package com.retailsentinel.core.detection;

import com.retailsentinel.core.config.SentinelConfig;
import com.retailsentinel.core.context.CorrelationContext;
import com.retailsentinel.core.context.QueueSummary;
import com.retailsentinel.core.model.EventPayload;
import com.retailsentinel.core.model.EventType;
import com.retailsentinel.core.model.SentinelEvent;

import java.util.Optional;

/**
 * Fires when the peak queue count in a station window reaches the threshold.
 *
 * @since 1.0.0
 */
public class QueueLengthRule implements DetectionRule {

    private static final long serialVersionUID = 1L;

    private final int threshold;

    public QueueLengthRule(SentinelConfig config) {
        this(config.getQueueLengthThreshold());
    }

    public QueueLengthRule(int threshold) {
        this.threshold = threshold;
    }

    @Override
    public Optional<SentinelEvent> evaluate(CorrelationContext context) {
        if (context.isStoreScope()) {
            return Optional.empty();
        }
        return context.getQueueSummary()
                .map(QueueSummary::getMaxCustomerCount)
                .filter(count -> count >= threshold)
                .map(count -> DetectionRule.eventFor(context,
                        new EventPayload.QueueLength(context.getStationId(), count)));
    }

    @Override
    public EventType type() {
        return EventType.QUEUE_LENGTH;
    }
}

package com.retailsentinel.core.detection;

import com.retailsentinel.core.context.CorrelationContext;
import com.retailsentinel.core.model.EventPayload;
import com.retailsentinel.core.model.EventType;
import com.retailsentinel.core.model.SentinelEvent;
import com.retailsentinel.core.model.Transaction;

import java.util.List;
import java.util.Optional;

/**
 * Reports a station window in which at least one transaction passed its price
 * and weight checks. Evaluated after the anomaly rules.
 *
 * @since 1.0.0
 */
public class SuccessOperationRule implements DetectionRule {

    private static final long serialVersionUID = 1L;

    @Override
    public Optional<SentinelEvent> evaluate(CorrelationContext context) {
        if (context.isStoreScope()) {
            return Optional.empty();
        }
        List<Transaction> completed = context.getCompletedTransactions();
        if (completed.isEmpty()) {
            return Optional.empty();
        }
        Transaction first = completed.get(0);
        return Optional.of(DetectionRule.eventFor(context, new EventPayload.SuccessOperation(
                context.getStationId(), first.getCustomerId(), first.getSku(), completed.size())));
    }

    @Override
    public EventType type() {
        return EventType.SUCCESS_OPERATION;
    }
}

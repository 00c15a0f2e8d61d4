package com.retailsentinel.core.detection;

import com.retailsentinel.core.context.CorrelationContext;
import com.retailsentinel.core.model.EventPayload;
import com.retailsentinel.core.model.EventType;
import com.retailsentinel.core.model.SentinelEvent;

import java.util.Optional;

/**
 * Fires when any record in a station window reported a fault status. The
 * first fault seen is reported.
 *
 * @since 1.0.0
 */
public class SystemCrashRule implements DetectionRule {

    private static final long serialVersionUID = 1L;

    @Override
    public Optional<SentinelEvent> evaluate(CorrelationContext context) {
        if (context.isStoreScope()) {
            return Optional.empty();
        }
        return context.getFaultStatus()
                .map(status -> DetectionRule.eventFor(context,
                        new EventPayload.SystemCrash(context.getStationId(), status)));
    }

    @Override
    public EventType type() {
        return EventType.SYSTEM_CRASH;
    }
}

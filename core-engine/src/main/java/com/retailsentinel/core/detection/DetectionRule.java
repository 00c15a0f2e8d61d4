package com.retailsentinel.core.detection;

import com.retailsentinel.core.context.CorrelationContext;
import com.retailsentinel.core.model.EventPayload;
import com.retailsentinel.core.model.EventType;
import com.retailsentinel.core.model.SentinelEvent;

import java.io.Serializable;
import java.util.Optional;

/**
 * Contract for all detection rules.
 * <p>
 * Rules are <strong>stateless</strong>: each call sees one
 * {@link CorrelationContext} and returns at most one event for it. A rule
 * that needs reference data which is missing abstains.
 * </p>
 * <p>
 * Rules must be {@link Serializable} because the Flink operator ships them to
 * task managers.
 * </p>
 */
public interface DetectionRule extends Serializable {

    /**
     * Evaluate one closed window.
     *
     * @param context the joined view of the window
     * @return an event if the rule fires, empty otherwise
     */
    Optional<SentinelEvent> evaluate(CorrelationContext context);

    /**
     * @return the event type this rule produces
     */
    EventType type();

    /**
     * Return the name used to disable the rule in configuration.
     *
     * @return rule name, by default the event's wire name
     */
    default String getRuleName() {
        return type().getDisplayName();
    }

    /**
     * Stamp a payload with the window it was found in. The event time is the
     * window end, so events sort in window-close order.
     */
    static SentinelEvent eventFor(CorrelationContext context, EventPayload payload) {
        return new SentinelEvent(context.getWindowEnd(), payload, context.getScopeId(), context.getWindowStart());
    }
}

package com.retailsentinel.core.detection;

import com.retailsentinel.core.config.SentinelConfig;
import com.retailsentinel.core.context.CorrelationContext;
import com.retailsentinel.core.context.Occupancy;
import com.retailsentinel.core.model.EventPayload;
import com.retailsentinel.core.model.EventType;
import com.retailsentinel.core.model.SentinelEvent;

import java.util.Optional;

/**
 * Store-scope rule that recommends more staff when the share of stations
 * serving customers in the slice reaches the threshold.
 *
 * <p>
 * The recommendation is a cashier, unless at least
 * {@value #SUPPORT_STAFF_MIN_STATIONS} stations in the slice reported a wait
 * at or above the wait-time threshold; then support staff is asked for.
 * </p>
 *
 * @since 1.0.0
 */
public class StaffingRule implements DetectionRule {

    private static final long serialVersionUID = 1L;

    public static final String ADD_CASHIER = "ADD_CASHIER";
    public static final String ADD_SUPPORT_STAFF = "ADD_SUPPORT_STAFF";

    public static final String CASHIER = "Cashier";
    public static final String SUPPORT_STAFF = "Support Staff";

    /** High-wait stations needed before support staff is recommended. */
    public static final int SUPPORT_STAFF_MIN_STATIONS = 2;

    private final double ratioThreshold;

    public StaffingRule(SentinelConfig config) {
        this(config.getStaffingRatioThreshold());
    }

    public StaffingRule(double ratioThreshold) {
        this.ratioThreshold = ratioThreshold;
    }

    @Override
    public Optional<SentinelEvent> evaluate(CorrelationContext context) {
        if (!context.isStoreScope()) {
            return Optional.empty();
        }
        return context.getOccupancy()
                .filter(occupancy -> occupancy.reaches(ratioThreshold))
                .map(occupancy -> DetectionRule.eventFor(context, recommend(occupancy)));
    }

    private static EventPayload.Staffing recommend(Occupancy occupancy) {
        boolean support = occupancy.getHighWaitStations() >= SUPPORT_STAFF_MIN_STATIONS;
        return new EventPayload.Staffing(
                occupancy.getRatio().doubleValue(),
                support ? ADD_SUPPORT_STAFF : ADD_CASHIER,
                support ? SUPPORT_STAFF : CASHIER,
                occupancy.getActiveStations(), occupancy.getTotalStations());
    }

    @Override
    public EventType type() {
        return EventType.STAFFING;
    }
}

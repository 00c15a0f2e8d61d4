package com.retailsentinel.core.context;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Stations seen in a store slice, how many of them were serving customers and
 * how many reported a dwell time at or above the wait threshold.
 *
 * @since 1.0.0
 */
public final class Occupancy implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int totalStations;
    private final int activeStations;
    private final int highWaitStations;

    public Occupancy(int totalStations, int activeStations) {
        this(totalStations, activeStations, 0);
    }

    public Occupancy(int totalStations, int activeStations, int highWaitStations) {
        if (activeStations < 0 || activeStations > totalStations) {
            throw new IllegalArgumentException(
                    "activeStations must be in [0, " + totalStations + "], got: " + activeStations);
        }
        if (highWaitStations < 0 || highWaitStations > totalStations) {
            throw new IllegalArgumentException(
                    "highWaitStations must be in [0, " + totalStations + "], got: " + highWaitStations);
        }
        this.totalStations = totalStations;
        this.activeStations = activeStations;
        this.highWaitStations = highWaitStations;
    }

    public int getTotalStations() {
        return totalStations;
    }

    public int getActiveStations() {
        return activeStations;
    }

    /** Stations whose last queue sample in the slice waited at least the wait threshold. */
    public int getHighWaitStations() {
        return highWaitStations;
    }

    /**
     * @return active / total, or zero when no station was seen
     */
    public BigDecimal getRatio() {
        if (totalStations == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(activeStations).divide(BigDecimal.valueOf(totalStations), MathContext.DECIMAL64);
    }

    /**
     * @param threshold ratio threshold, e.g. {@code 0.70}
     * @return {@code true} if at least one station was seen and
     *         {@code active >= total * threshold}
     */
    public boolean reaches(double threshold) {
        if (totalStations == 0) {
            return false;
        }
        BigDecimal limit = BigDecimal.valueOf(totalStations).multiply(BigDecimal.valueOf(threshold));
        return BigDecimal.valueOf(activeStations).compareTo(limit) >= 0;
    }

    @Override
    public String toString() {
        return "Occupancy{" + activeStations + "/" + totalStations + ", highWait=" + highWaitStations + '}';
    }
}

package com.retailsentinel.core.context;

import java.io.Serializable;

/**
 * Peak queue figures over a window's queue samples.
 *
 * @since 1.0.0
 */
public final class QueueSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int sampleCount;
    private final int maxCustomerCount;
    private final double maxAverageDwellSeconds;

    public QueueSummary(int sampleCount, int maxCustomerCount, double maxAverageDwellSeconds) {
        this.sampleCount = sampleCount;
        this.maxCustomerCount = maxCustomerCount;
        this.maxAverageDwellSeconds = maxAverageDwellSeconds;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public int getMaxCustomerCount() {
        return maxCustomerCount;
    }

    public double getMaxAverageDwellSeconds() {
        return maxAverageDwellSeconds;
    }

    @Override
    public String toString() {
        return "QueueSummary{" +
                "samples=" + sampleCount +
                ", maxCustomerCount=" + maxCustomerCount +
                ", maxAverageDwellSeconds=" + maxAverageDwellSeconds +
                '}';
    }
}

package com.retailsentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Top-level POJO for the correlator YAML configuration.
 *
 * <p>
 * Every threshold the detection rules use lives here under a named field;
 * nothing is hard-coded in the rules. Expected YAML structure (all keys
 * optional, defaults shown):
 * </p>
 *
 * <pre>
 * windowPolicy: tumbling
 * windowSeconds: 30
 * allowedLatenessSeconds: 5
 * minTagDwellSeconds: 0
 * priceRatioThreshold: 0.5
 * weightToleranceGrams: 50.0
 * queueLengthThreshold: 4
 * waitTimeThresholdSeconds: 300.0
 * inventoryVarianceThreshold: 0.10
 * staffingRatioThreshold: 0.70
 * recognitionMinConfidence: 0.7
 * recentEventsLimit: 10
 * dedupCapacity: 10000
 * eventIdWidth: 3
 * disabledRules: []
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** The only window policy currently implemented. */
    public static final String POLICY_TUMBLING = "tumbling";

    // --- Windowing ---
    private String windowPolicy = POLICY_TUMBLING;
    private int windowSeconds = 30;
    private int allowedLatenessSeconds = 5;

    // --- Rule thresholds ---
    private int minTagDwellSeconds = 0;
    private double priceRatioThreshold = 0.5;
    private double weightToleranceGrams = 50.0;
    private int queueLengthThreshold = 4;
    private double waitTimeThresholdSeconds = 300.0;
    private double inventoryVarianceThreshold = 0.10;
    private double staffingRatioThreshold = 0.70;
    private double recognitionMinConfidence = 0.7;

    // --- Emission ---
    private int recentEventsLimit = 10;
    private int dedupCapacity = 10_000;
    private int eventIdWidth = 3;
    private List<String> disabledRules = new ArrayList<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that every field holds a legal value. All problems are
     * collected and reported together.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (windowPolicy == null || !POLICY_TUMBLING.equals(windowPolicy)) {
            errors.add("Unknown windowPolicy: '" + windowPolicy + "'. Supported: " + POLICY_TUMBLING);
        }
        if (windowSeconds <= 0) {
            errors.add("'windowSeconds' must be > 0, got: " + windowSeconds);
        }
        if (allowedLatenessSeconds < 0) {
            errors.add("'allowedLatenessSeconds' must be >= 0, got: " + allowedLatenessSeconds);
        }
        if (minTagDwellSeconds < 0) {
            errors.add("'minTagDwellSeconds' must be >= 0, got: " + minTagDwellSeconds);
        }
        if (priceRatioThreshold <= 0 || priceRatioThreshold > 1) {
            errors.add("'priceRatioThreshold' must be in (0, 1], got: " + priceRatioThreshold);
        }
        if (weightToleranceGrams < 0) {
            errors.add("'weightToleranceGrams' must be >= 0, got: " + weightToleranceGrams);
        }
        if (queueLengthThreshold < 1) {
            errors.add("'queueLengthThreshold' must be >= 1, got: " + queueLengthThreshold);
        }
        if (waitTimeThresholdSeconds <= 0) {
            errors.add("'waitTimeThresholdSeconds' must be > 0, got: " + waitTimeThresholdSeconds);
        }
        if (inventoryVarianceThreshold < 0) {
            errors.add("'inventoryVarianceThreshold' must be >= 0, got: " + inventoryVarianceThreshold);
        }
        if (staffingRatioThreshold <= 0 || staffingRatioThreshold > 1) {
            errors.add("'staffingRatioThreshold' must be in (0, 1], got: " + staffingRatioThreshold);
        }
        if (recognitionMinConfidence < 0 || recognitionMinConfidence > 1) {
            errors.add("'recognitionMinConfidence' must be in [0, 1], got: " + recognitionMinConfidence);
        }
        if (recentEventsLimit < 1) {
            errors.add("'recentEventsLimit' must be >= 1, got: " + recentEventsLimit);
        }
        if (dedupCapacity < 1) {
            errors.add("'dedupCapacity' must be >= 1, got: " + dedupCapacity);
        }
        if (eventIdWidth < 1 || eventIdWidth > 18) {
            errors.add("'eventIdWidth' must be in [1, 18], got: " + eventIdWidth);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Sentinel configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    public Duration windowDuration() {
        return Duration.ofSeconds(windowSeconds);
    }

    public Duration allowedLateness() {
        return Duration.ofSeconds(allowedLatenessSeconds);
    }

    public Duration minTagDwell() {
        return Duration.ofSeconds(minTagDwellSeconds);
    }

    /**
     * @param ruleName rule name as reported by the rule
     * @return {@code true} if the rule is listed in {@code disabledRules}
     */
    public boolean isRuleDisabled(String ruleName) {
        for (String disabled : disabledRules) {
            if (disabled.equalsIgnoreCase(ruleName)) {
                return true;
            }
        }
        return false;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getWindowPolicy() {
        return windowPolicy;
    }

    /**
     * Set the window policy, normalised to lowercase.
     *
     * @param windowPolicy policy name
     */
    public void setWindowPolicy(String windowPolicy) {
        this.windowPolicy = windowPolicy != null ? windowPolicy.trim().toLowerCase(Locale.ROOT) : null;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public int getAllowedLatenessSeconds() {
        return allowedLatenessSeconds;
    }

    public void setAllowedLatenessSeconds(int allowedLatenessSeconds) {
        this.allowedLatenessSeconds = allowedLatenessSeconds;
    }

    public int getMinTagDwellSeconds() {
        return minTagDwellSeconds;
    }

    public void setMinTagDwellSeconds(int minTagDwellSeconds) {
        this.minTagDwellSeconds = minTagDwellSeconds;
    }

    public double getPriceRatioThreshold() {
        return priceRatioThreshold;
    }

    public void setPriceRatioThreshold(double priceRatioThreshold) {
        this.priceRatioThreshold = priceRatioThreshold;
    }

    public double getWeightToleranceGrams() {
        return weightToleranceGrams;
    }

    public void setWeightToleranceGrams(double weightToleranceGrams) {
        this.weightToleranceGrams = weightToleranceGrams;
    }

    public int getQueueLengthThreshold() {
        return queueLengthThreshold;
    }

    public void setQueueLengthThreshold(int queueLengthThreshold) {
        this.queueLengthThreshold = queueLengthThreshold;
    }

    public double getWaitTimeThresholdSeconds() {
        return waitTimeThresholdSeconds;
    }

    public void setWaitTimeThresholdSeconds(double waitTimeThresholdSeconds) {
        this.waitTimeThresholdSeconds = waitTimeThresholdSeconds;
    }

    public double getInventoryVarianceThreshold() {
        return inventoryVarianceThreshold;
    }

    public void setInventoryVarianceThreshold(double inventoryVarianceThreshold) {
        this.inventoryVarianceThreshold = inventoryVarianceThreshold;
    }

    public double getStaffingRatioThreshold() {
        return staffingRatioThreshold;
    }

    public void setStaffingRatioThreshold(double staffingRatioThreshold) {
        this.staffingRatioThreshold = staffingRatioThreshold;
    }

    public double getRecognitionMinConfidence() {
        return recognitionMinConfidence;
    }

    public void setRecognitionMinConfidence(double recognitionMinConfidence) {
        this.recognitionMinConfidence = recognitionMinConfidence;
    }

    public int getRecentEventsLimit() {
        return recentEventsLimit;
    }

    public void setRecentEventsLimit(int recentEventsLimit) {
        this.recentEventsLimit = recentEventsLimit;
    }

    public int getDedupCapacity() {
        return dedupCapacity;
    }

    public void setDedupCapacity(int dedupCapacity) {
        this.dedupCapacity = dedupCapacity;
    }

    public int getEventIdWidth() {
        return eventIdWidth;
    }

    public void setEventIdWidth(int eventIdWidth) {
        this.eventIdWidth = eventIdWidth;
    }

    /**
     * @return unmodifiable list of disabled rule names
     */
    public List<String> getDisabledRules() {
        return Collections.unmodifiableList(disabledRules);
    }

    public void setDisabledRules(List<String> disabledRules) {
        this.disabledRules = disabledRules != null ? new ArrayList<>(disabledRules) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "SentinelConfig{" +
                "windowPolicy='" + windowPolicy + '\'' +
                ", windowSeconds=" + windowSeconds +
                ", allowedLatenessSeconds=" + allowedLatenessSeconds +
                ", minTagDwellSeconds=" + minTagDwellSeconds +
                ", priceRatioThreshold=" + priceRatioThreshold +
                ", weightToleranceGrams=" + weightToleranceGrams +
                ", queueLengthThreshold=" + queueLengthThreshold +
                ", waitTimeThresholdSeconds=" + waitTimeThresholdSeconds +
                ", inventoryVarianceThreshold=" + inventoryVarianceThreshold +
                ", staffingRatioThreshold=" + staffingRatioThreshold +
                ", recognitionMinConfidence=" + recognitionMinConfidence +
                ", disabledRules=" + disabledRules +
                '}';
    }
}

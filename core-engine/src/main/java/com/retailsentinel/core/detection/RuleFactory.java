package com.retailsentinel.core.detection;

import com.retailsentinel.core.config.SentinelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Factory that builds the rule set from a {@link SentinelConfig}.
 *
 * <p>
 * Rules are returned in evaluation order: the eight anomaly rules, from tag
 * matching through staffing, then the success-operation report. This is
 * the single point of extension when adding a rule.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleFactory {

    private static final Logger LOG = LoggerFactory.getLogger(RuleFactory.class);

    private RuleFactory() {
        // utility class
    }

    /**
     * Create every rule, in evaluation order.
     *
     * @param config validated configuration; must not be {@code null}
     * @return unmodifiable list of rules
     */
    public static List<DetectionRule> createAll(SentinelConfig config) {
        Objects.requireNonNull(config, "SentinelConfig must not be null");
        return List.of(
                new ScannerAvoidanceRule(config),
                new BarcodeSwitchingRule(config),
                new WeightDiscrepancyRule(config),
                new SystemCrashRule(),
                new QueueLengthRule(config),
                new WaitTimeRule(config),
                new InventoryDiscrepancyRule(config),
                new StaffingRule(config),
                new SuccessOperationRule());
    }

    /**
     * Create the rules not listed in {@code disabledRules}. A rule can be
     * disabled by its wire name ("Long Queue Length") or its type name
     * ("QUEUE_LENGTH").
     *
     * @param config validated configuration; must not be {@code null}
     * @return unmodifiable list of enabled rules
     */
    public static List<DetectionRule> createEnabled(SentinelConfig config) {
        List<DetectionRule> enabled = new ArrayList<>();
        for (DetectionRule rule : createAll(config)) {
            if (config.isRuleDisabled(rule.getRuleName()) || config.isRuleDisabled(rule.type().name())) {
                LOG.info("Rule [{}] disabled by configuration", rule.getRuleName());
                continue;
            }
            enabled.add(rule);
        }
        LOG.info("Created {} detection rule(s)", enabled.size());
        return Collections.unmodifiableList(enabled);
    }
}

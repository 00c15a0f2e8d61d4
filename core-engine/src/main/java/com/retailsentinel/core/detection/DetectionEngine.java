package com.retailsentinel.core.detection;

import com.retailsentinel.core.context.CorrelationContext;
import com.retailsentinel.core.model.SentinelEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs every rule against a context, in a fixed order.
 *
 * <h3>Fault Isolation</h3>
 * <p>
 * A rule that throws is logged with the rule name and window, counted in
 * {@link #getRuleFailures()}, and skipped; the remaining rules still run.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionEngine.class);

    private final List<DetectionRule> rules;
    private long ruleFailures;

    public DetectionEngine(List<DetectionRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
    }

    /**
     * @param context joined view of one closed window
     * @return events in rule order, at most one per rule
     */
    public List<SentinelEvent> evaluate(CorrelationContext context) {
        List<SentinelEvent> events = new ArrayList<>();
        for (DetectionRule rule : rules) {
            try {
                Optional<SentinelEvent> event = rule.evaluate(context);
                event.ifPresent(events::add);
            } catch (Exception e) {
                ruleFailures++;
                LOG.error("Rule [{}] failed on window {} [{}, {}): {}",
                        rule.getRuleName(), context.getScopeId(),
                        context.getWindowStart(), context.getWindowEnd(), e.getMessage(), e);
            }
        }
        return events;
    }

    public List<DetectionRule> getRules() {
        return rules;
    }

    public long getRuleFailures() {
        return ruleFailures;
    }
}

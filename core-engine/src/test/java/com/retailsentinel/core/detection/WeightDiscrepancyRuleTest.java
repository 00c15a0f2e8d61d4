package com.retailsentinel.core.detection;

import com.retailsentinel.core.context.CorrelationContext;
import com.retailsentinel.core.context.WeightCheck;
import com.retailsentinel.core.model.EventPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.retailsentinel.core.RecordFixtures.MILK;
import static com.retailsentinel.core.RecordFixtures.at;
import static com.retailsentinel.core.RecordFixtures.tx;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link WeightDiscrepancyRule}.
 */
class WeightDiscrepancyRuleTest {

    private WeightDiscrepancyRule rule;

    @BeforeEach
    void setUp() {
        rule = new WeightDiscrepancyRule(50.0);
    }

    @Test
    @DisplayName("Should not fire at exactly the tolerance")
    void silentAtTolerance() {
        assertThat(rule.evaluate(contextWith(check(1050.0)))).isEmpty();
        assertThat(rule.evaluate(contextWith(check(950.0)))).isEmpty();
    }

    @Test
    @DisplayName("Should fire just beyond the tolerance")
    void firesBeyondTolerance() {
        EventPayload.WeightDiscrepancy payload = (EventPayload.WeightDiscrepancy)
                rule.evaluate(contextWith(check(1050.01))).orElseThrow().getPayload();

        assertThat(payload.getSku()).isEqualTo(MILK);
        assertThat(payload.getActualWeight()).isEqualTo(1050.01);
        assertThat(payload.getExpectedWeight()).isEqualTo(1000.0);
        assertThat(payload.getStationId()).isEqualTo("SCC1");
        assertThat(payload.getCustomerId()).isEqualTo("C001");
    }

    @Test
    @DisplayName("Should ignore store slices")
    void ignoresStoreScope() {
        CorrelationContext store = CorrelationContext.builder()
                .scopeId("STORE")
                .storeScope(true)
                .window(at(0), at(30))
                .weightChecks(List.of(check(2000.0)))
                .build();

        assertThat(rule.evaluate(store)).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static WeightCheck check(double actual) {
        return new WeightCheck(tx("SCC1", 1, MILK, 2.50, "C001", actual), actual, 1000.0);
    }

    private static CorrelationContext contextWith(WeightCheck... checks) {
        return CorrelationContext.builder()
                .scopeId("SCC1")
                .window(at(0), at(30))
                .weightChecks(List.of(checks))
                .build();
    }
}

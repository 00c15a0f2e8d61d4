package com.retailsentinel.core.detection;

import com.retailsentinel.core.context.CorrelationContext;
import com.retailsentinel.core.context.UnscannedItem;
import com.retailsentinel.core.model.EventPayload;
import com.retailsentinel.core.model.EventType;
import com.retailsentinel.core.model.SentinelEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.retailsentinel.core.RecordFixtures.MILK;
import static com.retailsentinel.core.RecordFixtures.at;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ScannerAvoidanceRule}.
 */
class ScannerAvoidanceRuleTest {

    private ScannerAvoidanceRule rule;

    @BeforeEach
    void setUp() {
        rule = new ScannerAvoidanceRule(Duration.ZERO);
    }

    @Test
    @DisplayName("Should fire for an unscanned item seen in the scan area")
    void firesForUnscannedItem() {
        Optional<SentinelEvent> event = rule.evaluate(contextWith(item("E1", MILK, 5, 5, true)));

        assertThat(event).isPresent();
        assertThat(event.get().getType()).isEqualTo(EventType.SCANNER_AVOIDANCE);
        assertThat(event.get().getTimestamp()).isEqualTo(at(30));
        assertThat(event.get().getScopeId()).isEqualTo("SCC1");
        EventPayload.ScannerAvoidance payload = (EventPayload.ScannerAvoidance) event.get().getPayload();
        assertThat(payload.getProductSku()).isEqualTo(MILK);
        assertThat(payload.getCustomerId()).isEqualTo("C001");
    }

    @Test
    @DisplayName("Should not fire when every read was matched")
    void silentWhenAllMatched() {
        assertThat(rule.evaluate(contextWith())).isEmpty();
    }

    @Test
    @DisplayName("Should ignore tags with an unknown SKU or outside the scan area")
    void ignoresUnknownSkuAndOtherLocations() {
        CorrelationContext context = contextWith(
                item("E1", null, 1, 2, true),
                item("E2", MILK, 1, 2, false));

        assertThat(rule.evaluate(context)).isEmpty();
    }

    @Test
    @DisplayName("Should require the configured minimum dwell")
    void requiresMinimumDwell() {
        ScannerAvoidanceRule strict = new ScannerAvoidanceRule(Duration.ofSeconds(3));

        assertThat(strict.evaluate(contextWith(item("E1", MILK, 1, 3, true)))).isEmpty();
        assertThat(strict.evaluate(contextWith(item("E1", MILK, 1, 4, true)))).isPresent();
    }

    @Test
    @DisplayName("Should emit at most one event per window")
    void onePerWindow() {
        Optional<SentinelEvent> event = rule.evaluate(contextWith(
                item("E1", MILK, 1, 1, true),
                item("E2", "PRD_F_02", 2, 2, true)));

        assertThat(((EventPayload.ScannerAvoidance) event.orElseThrow().getPayload()).getProductSku())
                .isEqualTo(MILK);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static UnscannedItem item(String tagId, String sku, double first, double last, boolean inScanArea) {
        return new UnscannedItem(tagId, sku, at(first), at(last), 1, inScanArea, "C001", null);
    }

    private static CorrelationContext contextWith(UnscannedItem... items) {
        return CorrelationContext.builder()
                .scopeId("SCC1")
                .storeScope(false)
                .window(at(0), at(30))
                .unscannedItems(List.of(items))
                .build();
    }
}

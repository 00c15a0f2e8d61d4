package com.retailsentinel.core.detection;

import com.retailsentinel.core.context.CorrelationContext;
import com.retailsentinel.core.model.EventPayload;
import com.retailsentinel.core.model.EventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.retailsentinel.core.RecordFixtures.at;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SystemCrashRule}.
 */
class SystemCrashRuleTest {

    private final SystemCrashRule rule = new SystemCrashRule();

    @Test
    @DisplayName("Should report the raw fault status seen in the window")
    void reportsFaultStatus() {
        CorrelationContext context = CorrelationContext.builder()
                .scopeId("SCC3")
                .window(at(0), at(30))
                .faultStatus("Read Error")
                .lastStatus("Active")
                .build();

        EventPayload.SystemCrash payload =
                (EventPayload.SystemCrash) rule.evaluate(context).orElseThrow().getPayload();

        assertThat(payload.getStatus()).isEqualTo("Read Error");
        assertThat(payload.getFields())
                .containsEntry("event_name", EventType.SYSTEM_CRASH.getDisplayName())
                .containsEntry("station_id", "SCC3");
    }

    @Test
    @DisplayName("Should stay silent for a healthy station")
    void silentWhenHealthy() {
        CorrelationContext context = CorrelationContext.builder()
                .scopeId("SCC3")
                .window(at(0), at(30))
                .lastStatus("Active")
                .build();

        assertThat(rule.evaluate(context)).isEmpty();
    }
}

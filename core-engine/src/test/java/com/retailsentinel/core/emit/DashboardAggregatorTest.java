package com.retailsentinel.core.emit;

import com.retailsentinel.core.model.EventPayload;
import com.retailsentinel.core.model.SentinelEvent;
import com.retailsentinel.core.model.Station;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.retailsentinel.core.RecordFixtures.at;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DashboardAggregator}.
 */
class DashboardAggregatorTest {

    private DashboardAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new DashboardAggregator(2);
    }

    @Test
    @DisplayName("Should start from an empty snapshot")
    void startsEmpty() {
        DashboardSnapshot snapshot = aggregator.snapshot();

        assertThat(snapshot.getTimestamp()).isNull();
        assertThat(snapshot.getSummary().getTotalStations()).isZero();
        assertThat(snapshot.getRecentEvents()).isEmpty();
    }

    @Test
    @DisplayName("Should summarise stations and events")
    void summarises() {
        Station busy = new Station("SCC1");
        busy.observe("Active", at(10));
        busy.updateCustomerCount(4);
        Station crashed = new Station("SCC2");
        crashed.observe("System Crash", at(12));

        aggregator.record(List.of(
                event(new EventPayload.QueueLength("SCC1", 4)),
                event(new EventPayload.SystemCrash("SCC2", "System Crash")),
                event(new EventPayload.QueueLength("SCC1", 5))));
        aggregator.refresh(at(40), List.of(busy, crashed), 3, 1, 0);

        DashboardSnapshot snapshot = aggregator.snapshot();
        assertThat(snapshot.getTimestamp()).isEqualTo(at(40));
        assertThat(snapshot.getSummary().getTotalStations()).isEqualTo(2);
        assertThat(snapshot.getSummary().getActiveStations()).isEqualTo(1);
        assertThat(snapshot.getSummary().getTotalCustomers()).isEqualTo(4);
        assertThat(snapshot.getSummary().getTotalEvents()).isEqualTo(3);
        assertThat(snapshot.getSummary().getDroppedLate()).isEqualTo(3);
        assertThat(snapshot.getSummary().getRejected()).isEqualTo(1);
        assertThat(snapshot.getStations().get("SCC1").getEventCount()).isEqualTo(2);
        assertThat(snapshot.getStations().get("SCC2").getStatus()).isEqualTo("System Crash");
        assertThat(snapshot.getEventSummary())
                .containsEntry("Long Queue Length", 2L)
                .containsEntry("Unexpected Systems Crash", 1L);
    }

    @Test
    @DisplayName("Should keep only the most recent events")
    void boundsRecentEvents() {
        aggregator.record(List.of(
                event(new EventPayload.QueueLength("SCC1", 4)),
                event(new EventPayload.QueueLength("SCC1", 5)),
                event(new EventPayload.QueueLength("SCC1", 6))));
        aggregator.refresh(at(40), List.of(), 0, 0, 0);

        assertThat(aggregator.snapshot().getRecentEvents())
                .extracting(e -> ((EventPayload.QueueLength) e.getPayload()).getCustomerCount())
                .containsExactly(5, 6);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static SentinelEvent event(EventPayload payload) {
        return new SentinelEvent(at(30), payload, payload.getStationId(), at(0));
    }
}

package com.retailsentinel.core.window;

import com.retailsentinel.core.model.SensorRecord;
import com.retailsentinel.core.model.StationStatus;
import com.retailsentinel.core.model.TagRead;
import com.retailsentinel.core.model.Transaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.retailsentinel.core.RecordFixtures.BREAD;
import static com.retailsentinel.core.RecordFixtures.MILK;
import static com.retailsentinel.core.RecordFixtures.at;
import static com.retailsentinel.core.RecordFixtures.inventory;
import static com.retailsentinel.core.RecordFixtures.queue;
import static com.retailsentinel.core.RecordFixtures.tag;
import static com.retailsentinel.core.RecordFixtures.tx;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link WindowManager}.
 */
class WindowManagerTest {

    private WindowManager manager;

    @BeforeEach
    void setUp() {
        manager = new WindowManager(Duration.ofSeconds(30), Duration.ofSeconds(5));
    }

    // ---------------------------------------------------------------
    // Alignment
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should align the first window of a station to its first record")
    void alignsToFirstRecord() {
        manager.ingest(tag("SCC1", 7, "E1", MILK));

        CorrelationWindow open = manager.openWindow("SCC1");
        assertThat(open.getStart()).isEqualTo(at(7));
        assertThat(open.getEnd()).isEqualTo(at(37));
        assertThat(open.getState()).isEqualTo(WindowState.OPEN);
    }

    @Test
    @DisplayName("Should place records on a grid anchored at the station origin")
    void placesRecordsOnGrid() {
        manager.ingest(tag("SCC1", 0, "E1", MILK));
        manager.ingest(tag("SCC1", 29.9, "E2", MILK));
        manager.ingest(tag("SCC1", 30, "E3", MILK));

        List<CorrelationWindow> closed = manager.flush().stream()
                .filter(w -> !w.isStoreScope())
                .toList();

        assertThat(closed).hasSize(2);
        assertThat(closed.get(0).getRecords()).hasSize(2);
        assertThat(closed.get(1).getStart()).isEqualTo(at(30));
        assertThat(closed.get(1).getRecords()).hasSize(1);
    }

    @Test
    @DisplayName("Should keep independent grids per station")
    void keepsIndependentGrids() {
        manager.ingest(tag("SCC1", 0, "E1", MILK));
        manager.ingest(tag("SCC2", 10, "E2", MILK));

        assertThat(manager.openWindow("SCC1").getStart()).isEqualTo(at(0));
        assertThat(manager.openWindow("SCC2").getStart()).isEqualTo(at(10));
        assertThat(manager.openWindow("UNKNOWN")).isNull();
    }

    // ---------------------------------------------------------------
    // Closing and lateness
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should close a window only once end plus lateness is reached")
    void closesAfterGracePeriod() {
        manager.ingest(tag("SCC1", 0, "E1", MILK));

        assertThat(manager.advance(at(30))).isEmpty();
        assertThat(manager.openWindow("SCC1")).isNull();
        assertThat(manager.advance(at(34.999))).isEmpty();

        List<CorrelationWindow> closed = manager.advance(at(35));
        assertThat(closed).extracting(CorrelationWindow::getScopeId)
                .containsExactly("SCC1", WindowManager.STORE_SCOPE);
        assertThat(closed).allMatch(w -> w.getState() == WindowState.CLOSED);
        assertThat(manager.liveWindowCount()).isZero();
    }

    @Test
    @DisplayName("Should accept a late record while its window is still closing")
    void acceptsWithinGracePeriod() {
        manager.ingest(tag("SCC1", 0, "E1", MILK));
        manager.advance(at(32));

        IngestOutcome outcome = manager.ingest(tag("SCC1", 20, "E2", MILK));

        assertThat(outcome).isEqualTo(IngestOutcome.ACCEPTED);
        CorrelationWindow window = manager.advance(at(35)).get(0);
        assertThat(window.getRecords()).hasSize(2);
    }

    @Test
    @DisplayName("Should drop a record whose window already closed")
    void dropsLateRecord() {
        manager.ingest(tag("SCC1", 0, "E1", MILK));
        manager.advance(at(40));

        IngestOutcome outcome = manager.ingest(tag("SCC1", 10, "E2", MILK));

        assertThat(outcome).isEqualTo(IngestOutcome.DROPPED_LATE);
        assertThat(manager.getDroppedLate()).isEqualTo(1);
        assertThat(manager.getDroppedLateByScope()).containsEntry("SCC1", 1L);
        assertThat(manager.flush()).isEmpty();
    }

    @Test
    @DisplayName("Should drop a record one second past end plus lateness")
    void dropsRecordJustPastGracePeriod() {
        manager.ingest(tag("SCC1", 0, "E1", MILK));
        manager.advance(at(34));

        assertThat(manager.ingest(tag("SCC1", 29, "E2", MILK))).isEqualTo(IngestOutcome.ACCEPTED);

        manager.advance(at(36));

        assertThat(manager.ingest(tag("SCC1", 29.5, "E3", MILK))).isEqualTo(IngestOutcome.DROPPED_LATE);
        assertThat(manager.getDroppedLate()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should drop a station record whose store slice has closed")
    void dropsRecordWhenStoreSliceClosed() {
        manager.ingest(queue("SCC1", 0, 1, 10));
        manager.ingest(queue("SCC2", 40, 1, 10));
        manager.ingest(queue("SCC1", 70, 1, 10));
        manager.advance(at(70));

        IngestOutcome outcome = manager.ingest(queue("SCC2", 50, 5, 10));

        assertThat(outcome).isEqualTo(IngestOutcome.DROPPED_LATE);
        assertThat(manager.getDroppedLate()).isEqualTo(1);
        assertThat(manager.getDroppedLateByScope()).containsEntry("SCC2", 1L);
        List<SensorRecord> buffered = manager.flush().stream()
                .flatMap(w -> w.getRecords().stream())
                .toList();
        assertThat(buffered).extracting(SensorRecord::getTimestamp).doesNotContain(at(50));
    }

    @Test
    @DisplayName("Should count late inventory snapshots against the store scope")
    void countsLateInventoryAgainstStore() {
        manager.ingest(inventory(0, MILK, 90));
        manager.advance(at(100));

        assertThat(manager.ingest(inventory(1, MILK, 80))).isEqualTo(IngestOutcome.DROPPED_LATE);
        assertThat(manager.getDroppedLateByScope()).containsEntry(WindowManager.STORE_SCOPE, 1L);
    }

    @Test
    @DisplayName("Should ignore a clock moving backwards")
    void ignoresBackwardsClock() {
        manager.advance(at(50));
        manager.advance(at(10));

        assertThat(manager.getClock()).isEqualTo(at(50));
        assertThat(manager.advance(null)).isEmpty();
    }

    @Test
    @DisplayName("Should order closed windows by end, stations before store, then scope id")
    void ordersClosedWindows() {
        manager.ingest(tag("SCC2", 0, "E1", MILK));
        manager.ingest(tag("SCC1", 0, "E2", MILK));

        List<CorrelationWindow> closed = manager.flush();

        assertThat(closed).extracting(CorrelationWindow::getScopeId)
                .containsExactly("SCC1", "SCC2", WindowManager.STORE_SCOPE);
    }

    // ---------------------------------------------------------------
    // Store track
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should route station records and inventory to the store slice")
    void routesToStoreSlice() {
        manager.ingest(tx("SCC1", 1, MILK, 2.5, "C001", 1000.0));
        manager.ingest(inventory(2, BREAD, 40));

        CorrelationWindow store = manager.flush().stream()
                .filter(CorrelationWindow::isStoreScope)
                .findFirst()
                .orElseThrow();

        assertThat(store.getRecords()).hasSize(2);
        assertThat(store.recordsOf(Transaction.class)).hasSize(1);
        assertThat(manager.openWindow(WindowManager.STORE_SCOPE)).isNull();
    }

    // ---------------------------------------------------------------
    // Rejection and duplicates
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should reject null and incomplete records")
    void rejectsInvalidRecords() {
        TagRead noTimestamp = TagRead.builder().stationId("SCC1").tagId("E1").sku(MILK).build();

        assertThat(manager.ingest(null)).isEqualTo(IngestOutcome.REJECTED);
        assertThat(manager.ingest(noTimestamp)).isEqualTo(IngestOutcome.REJECTED);
        assertThat(manager.getRejected()).isEqualTo(2);
        assertThat(manager.liveWindowCount()).isZero();
    }

    @Test
    @DisplayName("Should collapse repeated tag reads with the same tag and timestamp")
    void collapsesDuplicateReads() {
        assertThat(manager.ingest(tag("SCC1", 1, "E1", MILK))).isEqualTo(IngestOutcome.ACCEPTED);
        assertThat(manager.ingest(tag("SCC1", 1, "E1", MILK))).isEqualTo(IngestOutcome.DUPLICATE);
        assertThat(manager.ingest(tag("SCC1", 2, "E1", MILK))).isEqualTo(IngestOutcome.ACCEPTED);

        assertThat(manager.getDuplicates()).isEqualTo(1);
        assertThat(manager.getAccepted()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should refuse appends to a closed window")
    void refusesAppendAfterClose() {
        manager.ingest(tag("SCC1", 1, "E1", MILK));
        CorrelationWindow window = manager.flush().get(0);

        assertThatThrownBy(() -> window.append(tag("SCC1", 2, "E2", MILK)))
                .isInstanceOf(IllegalStateException.class);
    }

    // ---------------------------------------------------------------
    // Station registry
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should track station status and customer count from queue samples")
    void tracksStationState() {
        manager.ingest(queue("SCC1", 1, 3, 40));
        manager.ingest(queue("SCC1", 5, 6, 80, "Read Error"));

        var station = manager.getStations().get("SCC1").orElseThrow();
        assertThat(station.getLastCustomerCount()).isEqualTo(6);
        assertThat(station.getCurrentStatus()).isEqualTo(StationStatus.FAULT);
        assertThat(station.getRawStatus()).isEqualTo("Read Error");
        assertThat(station.getLastSeen()).isEqualTo(at(5));
    }

    @Test
    @DisplayName("Should reject non-positive window sizes")
    void rejectsBadWindowSize() {
        assertThatThrownBy(() -> new WindowManager(Duration.ZERO, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WindowManager(Duration.ofSeconds(1), Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

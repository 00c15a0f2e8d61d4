package com.retailsentinel.core.emit;

import com.retailsentinel.core.model.EventPayload;
import com.retailsentinel.core.model.SentinelEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static com.retailsentinel.core.RecordFixtures.at;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EventEmitter}.
 */
class EventEmitterTest {

    private CollectingEventSink sink;
    private EventEmitter emitter;

    @BeforeEach
    void setUp() {
        sink = new CollectingEventSink();
        emitter = new EventEmitter(100, 3, sink);
    }

    @Test
    @DisplayName("Should assign sequential zero-padded ids starting at E000")
    void assignsSequentialIds() {
        emitter.emit(List.of(queueEvent("SCC1", 0, 30)));
        List<SentinelEvent> second = emitter.emit(List.of(queueEvent("SCC1", 30, 60), queueEvent("SCC2", 30, 60)));

        assertThat(sink.getEvents()).extracting(SentinelEvent::getEventId)
                .containsExactly("E000", "E001", "E002");
        assertThat(second).hasSize(2);
        assertThat(emitter.getEmittedCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should order a batch by timestamp and keep the input order for ties")
    void ordersByTimestamp() {
        List<SentinelEvent> emitted = emitter.emit(List.of(
                queueEvent("SCC2", 30, 60),
                queueEvent("SCC1", 0, 30),
                crashEvent("SCC1", 0, 30)));

        assertThat(emitted).extracting(e -> e.getType().name())
                .containsExactly("QUEUE_LENGTH", "SYSTEM_CRASH", "QUEUE_LENGTH");
        assertThat(emitted.get(2).getScopeId()).isEqualTo("SCC2");
    }

    @Test
    @DisplayName("Should drop an event repeating scope, type and window")
    void dropsDuplicates() {
        emitter.emit(List.of(queueEvent("SCC1", 0, 30)));
        List<SentinelEvent> again = emitter.emit(List.of(queueEvent("SCC1", 0, 30), crashEvent("SCC1", 0, 30)));

        assertThat(again).hasSize(1);
        assertThat(emitter.getDuplicatesDropped()).isEqualTo(1);
        assertThat(sink.getEvents()).hasSize(2);
    }

    @Test
    @DisplayName("Should forget the oldest dedup key beyond capacity")
    void boundsDedupMemory() {
        EventEmitter small = new EventEmitter(1, 3, sink);
        small.emit(List.of(queueEvent("SCC1", 0, 30)));
        small.emit(List.of(queueEvent("SCC2", 0, 30)));

        assertThat(small.emit(List.of(queueEvent("SCC1", 0, 30)))).hasSize(1);
    }

    @Test
    @DisplayName("Should count sink failures and still return the batch")
    void survivesSinkFailure() {
        EventEmitter failing = new EventEmitter(100, 3, batch -> {
            throw new IOException("disk full");
        });

        List<SentinelEvent> emitted = failing.emit(List.of(queueEvent("SCC1", 0, 30)));

        assertThat(emitted).hasSize(1);
        assertThat(failing.getSinkFailures()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should restart numbering after reset")
    void resetsNumbering() {
        emitter.emit(List.of(queueEvent("SCC1", 0, 30)));
        emitter.reset();

        List<SentinelEvent> emitted = emitter.emit(List.of(queueEvent("SCC1", 0, 30)));

        assertThat(emitted.get(0).getEventId()).isEqualTo("E000");
    }

    @Test
    @DisplayName("Should widen ids past the configured width")
    void widensIds() {
        EventEmitter narrow = new EventEmitter(100, 1, sink);
        for (int i = 0; i < 11; i++) {
            narrow.emit(List.of(queueEvent("SCC1", i * 30, i * 30 + 30)));
        }

        assertThat(sink.getEvents().get(10).getEventId()).isEqualTo("E10");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static SentinelEvent queueEvent(String station, double start, double end) {
        return new SentinelEvent(at(end), new EventPayload.QueueLength(station, 5), station, at(start));
    }

    private static SentinelEvent crashEvent(String station, double start, double end) {
        return new SentinelEvent(at(end), new EventPayload.SystemCrash(station, "System Crash"), station, at(start));
    }
}

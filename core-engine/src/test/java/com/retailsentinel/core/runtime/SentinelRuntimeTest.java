package com.retailsentinel.core.runtime;

import com.retailsentinel.core.config.SentinelConfig;
import com.retailsentinel.core.emit.CollectingEventSink;
import com.retailsentinel.core.ingest.RecordParser;
import com.retailsentinel.core.model.EventType;
import com.retailsentinel.core.model.SensorRecord;
import com.retailsentinel.core.model.SentinelEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.retailsentinel.core.RecordFixtures.catalog;
import static com.retailsentinel.core.RecordFixtures.queue;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SentinelRuntime} together with its feeders,
 * {@link BatchReplay} and {@link StreamClient}.
 */
class SentinelRuntimeTest {

    private ClosingSink sink;
    private SentinelRuntime runtime;

    @BeforeEach
    void setUp() {
        sink = new ClosingSink();
        runtime = new SentinelRuntime(new Correlator(new SentinelConfig(), catalog(), sink),
                new RecordQueue(100, OverflowPolicy.BLOCK), sink);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should drain, flush and close the sink on shutdown")
    void drainsOnShutdown() throws Exception {
        runtime.start();
        runtime.submit(queue("SCC1", 1, 7, 10));

        assertThat(runtime.shutdown(Duration.ofSeconds(5))).isTrue();

        assertThat(sink.getEvents()).extracting(SentinelEvent::getType).contains(EventType.QUEUE_LENGTH);
        assertThat(sink.closed.get()).isTrue();
        assertThat(runtime.submit(queue("SCC1", 2, 7, 10))).isFalse();
    }

    @Test
    @DisplayName("Should skip a record that fails to process and keep draining")
    void survivesFailingRecord() throws Exception {
        Correlator failing = new Correlator(new SentinelConfig(), catalog(), sink) {
            @Override
            public List<SentinelEvent> accept(SensorRecord record) {
                if ("BAD".equals(record.getStationId())) {
                    throw new IllegalStateException("boom");
                }
                return super.accept(record);
            }
        };
        SentinelRuntime guarded = new SentinelRuntime(failing, new RecordQueue(100, OverflowPolicy.BLOCK), sink);
        guarded.start();
        guarded.submit(queue("BAD", 1, 7, 10));
        guarded.submit(queue("SCC1", 2, 7, 10));

        assertThat(guarded.shutdown(Duration.ofSeconds(5))).isTrue();

        assertThat(guarded.getProcessingFailures()).isEqualTo(1);
        assertThat(sink.getEvents()).extracting(SentinelEvent::getType).contains(EventType.QUEUE_LENGTH);
        assertThat(sink.closed.get()).isTrue();
    }

    @Test
    @DisplayName("Should refuse a second start")
    void refusesDoubleStart() throws Exception {
        runtime.start();
        try {
            assertThatThrownBy(runtime::start).isInstanceOf(IllegalStateException.class);
        } finally {
            runtime.shutdown(Duration.ofSeconds(5));
        }
    }

    @Test
    @DisplayName("Should close the sink even when never started")
    void shutdownWithoutStart() throws Exception {
        assertThat(runtime.shutdown(Duration.ofSeconds(1))).isTrue();
        assertThat(sink.closed.get()).isTrue();
    }

    // ---------------------------------------------------------------
    // Batch replay
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should replay dataset files in timestamp order")
    void replaysBatch(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("queue_monitoring.jsonl"),
                "{\"timestamp\":\"2025-08-13T16:00:10\",\"station_id\":\"SCC1\",\"status\":\"Active\","
                        + "\"data\":{\"customer_count\":6,\"average_dwell_time\":30}}\n"
                        + "not json\n\n", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve("inventory_snapshots.jsonl"),
                "{\"timestamp\":\"2025-08-13T16:00:00\",\"data\":{\"PRD_F_01\":100,\"PRD_F_02\":50}}\n",
                StandardCharsets.UTF_8);
        BatchReplay replay = new BatchReplay(new RecordParser());

        List<?> loaded = replay.load(dir);
        assertThat(loaded).hasSize(3);
        assertThat(replay.getMalformedLines()).isEqualTo(1);

        runtime.start();
        assertThat(new BatchReplay(new RecordParser()).replay(dir, runtime)).isEqualTo(3);
        runtime.shutdown(Duration.ofSeconds(5));

        assertThat(sink.getEvents()).extracting(SentinelEvent::getType)
                .containsExactly(EventType.STAFFING, EventType.QUEUE_LENGTH);
    }

    // ---------------------------------------------------------------
    // Stream client
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should submit stream envelopes and count malformed lines")
    void consumesStream() throws Exception {
        StreamClient client = new StreamClient("localhost", 0, new RecordParser(), runtime);
        String input = "{\"dataset\":\"Queue_monitor\",\"event\":{\"timestamp\":\"2025-08-13T16:00:01\","
                + "\"station_id\":\"SCC2\",\"status\":\"Active\",\"data\":{\"customer_count\":4,"
                + "\"average_dwell_time\":12}}}\n"
                + "{\"dataset\":\"Unknown\"}\n";

        client.consume(new StringReader(input));

        assertThat(client.getLines()).isEqualTo(2);
        assertThat(client.getMalformed()).isEqualTo(1);
        assertThat(runtime.getQueue().size()).isEqualTo(1);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static final class ClosingSink extends CollectingEventSink {
        private final AtomicBoolean closed = new AtomicBoolean();

        @Override
        public void close() throws IOException {
            closed.set(true);
        }
    }
}

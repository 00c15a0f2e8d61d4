package com.retailsentinel.core.emit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailsentinel.core.model.EventPayload;
import com.retailsentinel.core.model.SentinelEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static com.retailsentinel.core.RecordFixtures.BREAD;
import static com.retailsentinel.core.RecordFixtures.CHEESE;
import static com.retailsentinel.core.RecordFixtures.at;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link JsonLinesEventSink}.
 */
class JsonLinesEventSinkTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should write one envelope per line with fields in wire order")
    void writesEnvelope() throws Exception {
        StringWriter out = new StringWriter();
        JsonLinesEventSink sink = new JsonLinesEventSink(out);
        SentinelEvent event = new SentinelEvent(at(30),
                new EventPayload.BarcodeSwitching("SCC1", CHEESE, 4.0, 8.0, null, BREAD), "SCC1", at(0))
                .withEventId("E007");

        sink.publish(List.of(event));

        String line = out.toString();
        assertThat(line).endsWith("\n").doesNotContain("customer_id");
        JsonNode node = mapper.readTree(line);
        assertThat(fieldNames(node)).containsExactly("timestamp", "event_id", "event_data");
        assertThat(node.get("timestamp").asText()).isEqualTo("2025-08-13T16:00:30Z");
        assertThat(node.get("event_id").asText()).isEqualTo("E007");
        JsonNode data = node.get("event_data");
        assertThat(fieldNames(data)).containsExactly(
                "event_name", "station_id", "sku", "scanned_price", "catalog_price", "actual_sku");
        assertThat(data.get("event_name").asText()).isEqualTo("Barcode Switching");
        assertThat(data.get("scanned_price").asDouble()).isEqualTo(4.0);
        assertThat(sink.getWritten()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should omit station_id for store-wide events")
    void omitsStationForStoreEvents() throws Exception {
        StringWriter out = new StringWriter();
        JsonLinesEventSink sink = new JsonLinesEventSink(out);

        sink.publish(List.of(new SentinelEvent(at(30),
                new EventPayload.InventoryDiscrepancy(BREAD, 50, 30, 40.0), "STORE", at(0)).withEventId("E000")));

        JsonNode data = mapper.readTree(out.toString()).get("event_data");
        assertThat(data.has("station_id")).isFalse();
        assertThat(data.get("variance_pct").asDouble()).isEqualTo(40.0);
    }

    @Test
    @DisplayName("Should create parent directories for a file sink")
    void writesToFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("out").resolve("events.jsonl");

        try (JsonLinesEventSink sink = JsonLinesEventSink.toFile(file)) {
            sink.publish(List.of(
                    new SentinelEvent(at(30), new EventPayload.QueueLength("SCC1", 6), "SCC1", at(0)).withEventId("E000"),
                    new SentinelEvent(at(60), new EventPayload.QueueLength("SCC1", 7), "SCC1", at(30)).withEventId("E001")));
        }

        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8)).hasSize(2);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        Iterator<String> it = node.fieldNames();
        it.forEachRemaining(names::add);
        return names;
    }
}

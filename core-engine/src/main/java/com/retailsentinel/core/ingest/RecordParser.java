package com.retailsentinel.core.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailsentinel.core.emit.EventJson;
import com.retailsentinel.core.model.InventorySnapshot;
import com.retailsentinel.core.model.QueueSample;
import com.retailsentinel.core.model.RecognitionResult;
import com.retailsentinel.core.model.RecordKind;
import com.retailsentinel.core.model.SensorRecord;
import com.retailsentinel.core.model.TagRead;
import com.retailsentinel.core.model.Transaction;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts raw JSON into {@link SensorRecord}s.
 *
 * <h3>Accepted Shapes</h3>
 * <ul>
 * <li>Stream envelope:
 * {@code {"dataset": "RFID_data", "event": {"timestamp", "station_id", "status", "data": {...}}}}</li>
 * <li>Bare payload ({@code {"timestamp", "station_id", "status", "data"}}),
 * optionally wrapped as {@code {"payload": {...}}}, with the kind supplied by
 * the caller, as in the per-dataset batch files.</li>
 * </ul>
 *
 * <p>
 * An inventory payload ({@code "data": {"SKU": qty, ...}}) expands to one
 * {@link InventorySnapshot} per SKU. Missing or non-numeric fields yield
 * records that fail validation rather than exceptions. Timestamps are ISO-8601;
 * values without an offset are read as UTC.
 * </p>
 *
 * <p>
 * Thread-safe once constructed.
 * </p>
 *
 * @since 1.0.0
 */
public class RecordParser {

    private final ObjectMapper mapper;

    public RecordParser() {
        this(EventJson.newMapper());
    }

    public RecordParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Parse one stream envelope line.
     *
     * @param line JSON text
     * @return the records it carries, possibly several for inventory
     * @throws MalformedRecordException if the line is not a usable envelope
     */
    public List<SensorRecord> parseEnvelope(String line) {
        JsonNode root = readTree(line);
        JsonNode dataset = root.get("dataset");
        if (dataset == null || !dataset.isTextual()) {
            throw new MalformedRecordException("Envelope has no 'dataset' field");
        }
        RecordKind kind = RecordKind.fromName(dataset.asText())
                .orElseThrow(() -> new MalformedRecordException("Unknown dataset: " + dataset.asText()));
        JsonNode event = root.has("event") ? root.get("event") : root.get("payload");
        return parsePayload(kind, event);
    }

    /**
     * Parse one bare payload line of a known kind.
     *
     * @param kind record kind
     * @param line JSON text
     * @return the records it carries
     * @throws MalformedRecordException if the line is not a JSON object
     */
    public List<SensorRecord> parsePayload(RecordKind kind, String line) {
        JsonNode node = readTree(line);
        if (!node.has("timestamp") && node.path("payload").isObject()) {
            node = node.get("payload");
        }
        return parsePayload(kind, node);
    }

    /**
     * @param kind    record kind
     * @param payload parsed payload object
     * @return the records it carries
     * @throws MalformedRecordException if the payload is not a JSON object
     */
    public List<SensorRecord> parsePayload(RecordKind kind, JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new MalformedRecordException("Payload for " + kind.getDatasetName() + " is not an object");
        }
        Instant timestamp = timestamp(payload.get("timestamp"));
        String stationId = text(payload, "station_id");
        String status = text(payload, "status");
        JsonNode data = payload.path("data");

        switch (kind) {
            case TAG_READ:
                return List.of(TagRead.builder()
                        .timestamp(timestamp)
                        .stationId(stationId)
                        .tagId(text(data, "epc"))
                        .sku(text(data, "sku"))
                        .location(text(data, "location"))
                        .status(status)
                        .build());
            case TRANSACTION:
                return List.of(Transaction.builder()
                        .timestamp(timestamp)
                        .stationId(stationId)
                        .sku(text(data, "sku"))
                        .scannedPrice(number(data, "price"))
                        .customerId(text(data, "customer_id"))
                        .weightGrams(data.hasNonNull("weight_g") ? number(data, "weight_g") : null)
                        .status(status)
                        .build());
            case QUEUE_SAMPLE:
                return List.of(new QueueSample(timestamp, stationId,
                        integer(data, "customer_count"), number(data, "average_dwell_time"), status));
            case RECOGNITION:
                return List.of(new RecognitionResult(timestamp, stationId,
                        text(data, "predicted_product"), number(data, "accuracy"), status));
            case INVENTORY:
                return inventory(timestamp, data);
            default:
                throw new MalformedRecordException("Unsupported kind: " + kind);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private JsonNode readTree(String line) {
        if (line == null || line.isBlank()) {
            throw new MalformedRecordException("Empty input line");
        }
        try {
            return mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException("Unreadable JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static List<SensorRecord> inventory(Instant timestamp, JsonNode data) {
        if (!data.isObject()) {
            return Collections.emptyList();
        }
        List<SensorRecord> snapshots = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            long quantity = field.getValue().canConvertToLong() ? field.getValue().asLong() : -1;
            snapshots.add(new InventorySnapshot(timestamp, field.getKey(), quantity));
        }
        return snapshots;
    }

    static Instant timestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return Instant.ofEpochMilli(Math.round(node.asDouble() * 1000));
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(node.asText().trim(),
                    OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return offset.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Double.NaN;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        try {
            return Double.parseDouble(value.asText().trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private static int integer(JsonNode node, String field) {
        double value = number(node, field);
        return Double.isFinite(value) ? (int) value : -1;
    }
}

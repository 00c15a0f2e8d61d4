package com.retailsentinel.core.ingest;

import com.retailsentinel.core.model.InventorySnapshot;
import com.retailsentinel.core.model.QueueSample;
import com.retailsentinel.core.model.RecognitionResult;
import com.retailsentinel.core.model.RecordKind;
import com.retailsentinel.core.model.SensorRecord;
import com.retailsentinel.core.model.TagRead;
import com.retailsentinel.core.model.Transaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RecordParser}.
 */
class RecordParserTest {

    private RecordParser parser;

    @BeforeEach
    void setUp() {
        parser = new RecordParser();
    }

    // ---------------------------------------------------------------
    // Envelopes
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should parse an RFID envelope into a tag read")
    void parsesRfidEnvelope() {
        List<SensorRecord> records = parser.parseEnvelope("{\"dataset\":\"RFID_data\",\"event\":{"
                + "\"timestamp\":\"2025-08-13T16:00:01\",\"station_id\":\"SCC1\",\"status\":\"Active\","
                + "\"data\":{\"epc\":\"E280\",\"location\":\"IN_SCAN_AREA\",\"sku\":\"PRD_F_01\"}}}");

        TagRead read = (TagRead) records.get(0);
        assertThat(read.getTimestamp()).isEqualTo(Instant.parse("2025-08-13T16:00:01Z"));
        assertThat(read.getStationId()).isEqualTo("SCC1");
        assertThat(read.getTagId()).isEqualTo("E280");
        assertThat(read.getSku()).isEqualTo("PRD_F_01");
        assertThat(read.isInScanArea()).isTrue();
        assertThat(read.isValid()).isTrue();
    }

    @Test
    @DisplayName("Should parse a POS envelope with weight and customer")
    void parsesPosEnvelope() {
        List<SensorRecord> records = parser.parseEnvelope("{\"dataset\":\"POS_Transactions\",\"event\":{"
                + "\"timestamp\":\"2025-08-13T16:00:02+00:00\",\"station_id\":\"SCC1\",\"status\":\"Active\","
                + "\"data\":{\"customer_id\":\"C004\",\"sku\":\"PRD_F_01\",\"product_name\":\"Milk\","
                + "\"barcode\":\"123\",\"price\":2.5,\"weight_g\":1000}}}");

        Transaction tx = (Transaction) records.get(0);
        assertThat(tx.getCustomerId()).isEqualTo("C004");
        assertThat(tx.getScannedPrice()).isEqualTo(2.5);
        assertThat(tx.getWeightGrams()).isEqualTo(1000.0);
    }

    @Test
    @DisplayName("Should expand an inventory envelope to one snapshot per SKU")
    void expandsInventory() {
        List<SensorRecord> records = parser.parseEnvelope("{\"dataset\":\"Current_inventory_data\",\"event\":{"
                + "\"timestamp\":\"2025-08-13T16:00:00\",\"data\":{\"PRD_F_01\":90,\"PRD_F_02\":\"x\"}}}");

        assertThat(records).hasSize(2);
        InventorySnapshot milk = (InventorySnapshot) records.get(0);
        assertThat(milk.getOnHandQuantity()).isEqualTo(90);
        assertThat(milk.isValid()).isTrue();
        assertThat(records.get(1).isValid()).isFalse();
    }

    @Test
    @DisplayName("Should reject an envelope with an unknown or missing dataset")
    void rejectsBadDataset() {
        assertThatThrownBy(() -> parser.parseEnvelope("{\"dataset\":\"Weather\",\"event\":{}}"))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("Weather");
        assertThatThrownBy(() -> parser.parseEnvelope("{\"event\":{}}"))
                .isInstanceOf(MalformedRecordException.class);
    }

    @Test
    @DisplayName("Should reject unreadable JSON and blank lines")
    void rejectsBadJson() {
        assertThatThrownBy(() -> parser.parseEnvelope("{not json"))
                .isInstanceOf(MalformedRecordException.class);
        assertThatThrownBy(() -> parser.parseEnvelope("  "))
                .isInstanceOf(MalformedRecordException.class);
        assertThatThrownBy(() -> parser.parsePayload(RecordKind.TAG_READ, "[1,2]"))
                .isInstanceOf(MalformedRecordException.class);
    }

    // ---------------------------------------------------------------
    // Bare payloads
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should parse bare and wrapped queue payloads")
    void parsesQueuePayloads() {
        String bare = "{\"timestamp\":\"2025-08-13T16:00:05\",\"station_id\":\"SCC2\",\"status\":\"Active\","
                + "\"data\":{\"customer_count\":5,\"average_dwell_time\":312.5}}";

        QueueSample direct = (QueueSample) parser.parsePayload(RecordKind.QUEUE_SAMPLE, bare).get(0);
        QueueSample wrapped = (QueueSample) parser.parsePayload(RecordKind.QUEUE_SAMPLE,
                "{\"payload\":" + bare + "}").get(0);

        assertThat(direct.getCustomerCount()).isEqualTo(5);
        assertThat(direct.getAverageDwellSeconds()).isEqualTo(312.5);
        assertThat(wrapped).isEqualTo(direct);
    }

    @Test
    @DisplayName("Should parse a recognition payload")
    void parsesRecognition() {
        RecognitionResult result = (RecognitionResult) parser.parsePayload(RecordKind.RECOGNITION,
                "{\"timestamp\":\"2025-08-13T16:00:05\",\"station_id\":\"SCC1\",\"status\":\"Active\","
                        + "\"data\":{\"predicted_product\":\"PRD_F_03\",\"accuracy\":0.91}}").get(0);

        assertThat(result.getPredictedSku()).isEqualTo("PRD_F_03");
        assertThat(result.getConfidence()).isEqualTo(0.91);
    }

    @Test
    @DisplayName("Should yield an invalid record for a bad timestamp or price")
    void invalidFieldsYieldInvalidRecords() {
        SensorRecord badTime = parser.parsePayload(RecordKind.TAG_READ,
                "{\"timestamp\":\"yesterday\",\"station_id\":\"SCC1\",\"data\":{\"epc\":\"E1\"}}").get(0);
        SensorRecord badPrice = parser.parsePayload(RecordKind.TRANSACTION,
                "{\"timestamp\":\"2025-08-13T16:00:05\",\"station_id\":\"SCC1\","
                        + "\"data\":{\"sku\":\"PRD_F_01\",\"price\":\"free\"}}").get(0);

        assertThat(badTime.getTimestamp()).isNull();
        assertThat(badTime.isValid()).isFalse();
        assertThat(badPrice.isValid()).isFalse();
    }

    @Test
    @DisplayName("Should read numeric timestamps as epoch seconds")
    void readsEpochSeconds() {
        SensorRecord record = parser.parsePayload(RecordKind.TAG_READ,
                "{\"timestamp\":1755100800.5,\"station_id\":\"SCC1\",\"data\":{\"epc\":\"E1\"}}").get(0);

        assertThat(record.getTimestamp()).isEqualTo(Instant.ofEpochMilli(1_755_100_800_500L));
    }
}

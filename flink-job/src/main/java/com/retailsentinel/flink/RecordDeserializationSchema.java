package com.retailsentinel.flink;

import com.retailsentinel.core.ingest.MalformedRecordException;
import com.retailsentinel.core.ingest.RecordParser;
import com.retailsentinel.core.model.SensorRecord;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Flink {@link DeserializationSchema} that converts a raw Kafka stream
 * envelope into {@link SensorRecord}s.
 * <p>
 * An inventory envelope yields one record per SKU, so the collector variant
 * of {@code deserialize} is the one the Kafka source uses. Malformed messages
 * are logged and dropped, ensuring that a single bad record does not crash
 * the pipeline.
 * </p>
 */
public class RecordDeserializationSchema implements DeserializationSchema<SensorRecord> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RecordDeserializationSchema.class);

    private transient RecordParser parser;

    @Override
    public SensorRecord deserialize(byte[] message) {
        List<SensorRecord> records = parse(message);
        return records.isEmpty() ? null : records.get(0);
    }

    @Override
    public void deserialize(byte[] message, Collector<SensorRecord> out) {
        for (SensorRecord record : parse(message)) {
            out.collect(record);
        }
    }

    @Override
    public boolean isEndOfStream(SensorRecord nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<SensorRecord> getProducedType() {
        return TypeInformation.of(SensorRecord.class);
    }

    List<SensorRecord> parse(byte[] message) {
        if (message == null || message.length == 0) {
            return List.of();
        }
        try {
            return parser().parseEnvelope(new String(message, StandardCharsets.UTF_8));
        } catch (MalformedRecordException e) {
            LOG.warn("Failed to deserialize record, skipping: {}", e.getMessage());
            return List.of();
        }
    }

    private RecordParser parser() {
        if (parser == null) {
            parser = new RecordParser();
        }
        return parser;
    }
}

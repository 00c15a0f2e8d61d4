package com.retailsentinel.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailsentinel.core.emit.EventJson;
import com.retailsentinel.core.model.SentinelEvent;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link SerializationSchema} that converts {@link SentinelEvent} to
 * JSON bytes for publishing to the Kafka events topic. The layout matches
 * the JSON Lines output of the standalone runtime.
 */
public class SentinelEventSerializationSchema implements SerializationSchema<SentinelEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SentinelEventSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(SentinelEvent event) {
        try {
            return objectMapper().writeValueAsBytes(event);
        } catch (Exception e) {
            LOG.error("Failed to serialize event {}: {}", event.getEventId(), e.getMessage(), e);
            return new byte[0];
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = EventJson.newMapper();
        }
        return mapper;
    }
}

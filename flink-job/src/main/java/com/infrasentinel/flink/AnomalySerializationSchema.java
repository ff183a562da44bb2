package com.infrasentinel.flink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.infrasentinel.core.model.Anomaly;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link SerializationSchema} that converts an {@link Anomaly} into JSON
 * bytes, with ISO-8601 timestamps, for the Kafka anomalies topic.
 */
public class AnomalySerializationSchema implements SerializationSchema<Anomaly> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnomalySerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(Anomaly anomaly) {
        try {
            return objectMapper().writeValueAsBytes(anomaly);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize anomaly {}: {}", anomaly, e.getMessage(), e);
            throw new IllegalStateException("Failed to serialize anomaly", e);
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}

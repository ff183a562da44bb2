package com.infrasentinel.flink;

import com.infrasentinel.core.ingest.TelemetryReader;
import com.infrasentinel.core.model.RecordFormatException;
import com.infrasentinel.core.model.TelemetryRecord;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes into a
 * {@link TelemetryRecord}.
 * <p>
 * Malformed messages are logged and dropped (returns {@code null}), so a
 * single bad record does not crash the pipeline.
 * </p>
 */
public class TelemetryDeserializationSchema implements DeserializationSchema<TelemetryRecord> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(TelemetryDeserializationSchema.class);

    @Override
    public TelemetryRecord deserialize(byte[] message) {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return TelemetryReader.readRecord(message);
        } catch (RecordFormatException e) {
            LOG.warn("Failed to deserialize telemetry record, skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(TelemetryRecord nextElement) {
        return false;
    }

    @Override
    public TypeInformation<TelemetryRecord> getProducedType() {
        return TypeInformation.of(TelemetryRecord.class);
    }
}

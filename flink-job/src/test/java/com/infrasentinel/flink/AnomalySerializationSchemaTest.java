package com.infrasentinel.flink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infrasentinel.core.model.Anomaly;
import com.infrasentinel.core.model.AnomalyKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnomalySerializationSchema}.
 */
class AnomalySerializationSchemaTest {

    @Test
    @DisplayName("Should write anomalies as JSON with ISO timestamps and without null fields")
    void shouldSerialize() throws Exception {
        Anomaly anomaly = Anomaly.builder()
                .kind(AnomalyKind.STATIC_THRESHOLD)
                .subject("cpu_usage")
                .observedValue(95.0)
                .referenceValue(90.0)
                .limit(90.0)
                .timestamp(Instant.parse("2024-05-01T10:00:00Z"))
                .details("Threshold exceeded: cpu_usage=95.00 (threshold: 90.00)")
                .build();
        anomaly.setSource("web-01");

        JsonNode json = new ObjectMapper().readTree(new AnomalySerializationSchema().serialize(anomaly));

        assertThat(json.get("kind").asText()).isEqualTo("STATIC_THRESHOLD");
        assertThat(json.get("severity").asText()).isEqualTo("CRITICAL");
        assertThat(json.get("subject").asText()).isEqualTo("cpu_usage");
        assertThat(json.get("observedValue").asDouble()).isEqualTo(95.0);
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(json.get("source").asText()).isEqualTo("web-01");
        assertThat(json.has("observedStatus")).isFalse();
    }
}

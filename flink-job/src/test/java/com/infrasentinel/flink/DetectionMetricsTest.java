package com.infrasentinel.flink;

import com.infrasentinel.core.model.AnomalyKind;
import org.apache.flink.metrics.groups.UnregisteredMetricsGroup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DetectionMetrics}.
 */
class DetectionMetricsTest {

    private DetectionMetrics metrics;

    @BeforeEach
    void setUp() {
        metrics = new DetectionMetrics(new UnregisteredMetricsGroup());
    }

    @Test
    @DisplayName("Should count anomalies in total and per kind")
    void shouldCountAnomalies() {
        metrics.recordAnomaly(AnomalyKind.DELTA_SPIKE);
        metrics.recordAnomaly(AnomalyKind.DELTA_SPIKE);
        metrics.recordAnomaly(AnomalyKind.SERVICE_STATUS);

        assertThat(metrics.getAnomaliesDetected()).isEqualTo(3);
        assertThat(metrics.getAnomalies(AnomalyKind.DELTA_SPIKE)).isEqualTo(2);
        assertThat(metrics.getAnomalies(AnomalyKind.SERVICE_STATUS)).isEqualTo(1);
        assertThat(metrics.getAnomalies(AnomalyKind.STATIC_THRESHOLD)).isZero();
    }

    @Test
    @DisplayName("Should count processed and rejected records and latency samples")
    void shouldCountRecords() {
        metrics.incrementRecordsProcessed();
        metrics.incrementRecordsProcessed();
        metrics.incrementRecordsRejected();
        metrics.recordLatency(3);

        assertThat(metrics.getRecordsProcessed()).isEqualTo(2);
        assertThat(metrics.getRecordsRejected()).isEqualTo(1);
        assertThat(metrics.getLatencySamples()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should name per-kind counters after the kind")
    void shouldNameCounters() {
        assertThat(DetectionMetrics.counterName(AnomalyKind.GLOBAL_DEVIATION))
                .isEqualTo("anomalies_global_deviation_total");
    }
}

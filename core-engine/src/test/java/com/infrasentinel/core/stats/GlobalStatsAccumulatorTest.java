package com.infrasentinel.core.stats;

import com.infrasentinel.core.model.TelemetryRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link GlobalStatsAccumulator}.
 */
class GlobalStatsAccumulatorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    @DisplayName("Should reject an empty baseline")
    void shouldRejectEmptyBaseline() {
        assertThatThrownBy(() -> GlobalStatsAccumulator.fit(List.of()))
                .isInstanceOf(BaselineEmptyException.class);
    }

    @Test
    @DisplayName("Should compute mean and sample standard deviation per metric")
    void shouldComputeMeanAndStd() {
        GlobalStats stats = GlobalStatsAccumulator.fit(List.of(
                cpu(0, 40.0), cpu(1, 50.0), cpu(2, 60.0)));

        MetricStats cpu = stats.get("cpu_usage").orElseThrow();
        assertThat(cpu.getCount()).isEqualTo(3);
        assertThat(cpu.getMean()).isEqualTo(50.0);
        assertThat(cpu.getStd()).isEqualTo(10.0);
        assertThat(cpu.hasSpread()).isTrue();
        assertThat(stats.getRecordCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should report zero spread for a constant metric")
    void shouldReportZeroSpreadForConstantMetric() {
        List<TelemetryRecord> baseline = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            baseline.add(cpu(i, 50.0));
        }

        MetricStats cpu = GlobalStatsAccumulator.fit(baseline).get("cpu_usage").orElseThrow();
        assertThat(cpu.getStd()).isZero();
        assertThat(cpu.hasSpread()).isFalse();
    }

    @Test
    @DisplayName("Should report zero spread for a single observation")
    void shouldHandleSingleObservation() {
        MetricStats cpu = GlobalStatsAccumulator.fit(List.of(cpu(0, 73.0))).get("cpu_usage").orElseThrow();

        assertThat(cpu.getCount()).isEqualTo(1);
        assertThat(cpu.getMean()).isEqualTo(73.0);
        assertThat(cpu.getStd()).isZero();
    }

    @Test
    @DisplayName("Should ignore missing values and keep metrics that only appear in some records")
    void shouldIgnoreMissingValues() {
        GlobalStats stats = GlobalStatsAccumulator.fit(List.of(
                TelemetryRecord.builder(T0).metric("cpu_usage", 40.0).metric("error_rate", null).build(),
                TelemetryRecord.builder(T0.plusSeconds(60)).metric("cpu_usage", 60.0)
                        .metric("error_rate", 0.02).build()));

        assertThat(stats.get("cpu_usage").orElseThrow().getCount()).isEqualTo(2);
        assertThat(stats.get("error_rate").orElseThrow().getCount()).isEqualTo(1);
        assertThat(stats.contains("latency_ms")).isFalse();
        assertThat(stats.get("latency_ms")).isEmpty();
    }

    @Test
    @DisplayName("Should leave out metrics that never have a value")
    void shouldLeaveOutAllNullMetrics() {
        GlobalStats stats = GlobalStatsAccumulator.fit(List.of(
                TelemetryRecord.builder(T0).metric("cpu_usage", 40.0).metric("error_rate", null).build()));

        assertThat(stats.asMap()).containsOnlyKeys("cpu_usage");
    }

    private static TelemetryRecord cpu(int minute, double value) {
        return TelemetryRecord.builder(T0.plusSeconds(60L * minute)).metric("cpu_usage", value).build();
    }
}

package com.infrasentinel.flink;

import com.infrasentinel.core.config.DetectionConfig;
import com.infrasentinel.core.config.MetricRule;
import com.infrasentinel.core.detection.AnomalyDetector;
import com.infrasentinel.core.model.Anomaly;
import com.infrasentinel.core.model.AnomalyKind;
import com.infrasentinel.core.model.TelemetryRecord;
import com.infrasentinel.core.stats.GlobalStats;
import com.infrasentinel.core.stats.GlobalStatsAccumulator;
import com.infrasentinel.core.stats.RollingWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for how {@link AnomalyProcessFunction} rebuilds a key's detector
 * from its window state.
 */
class AnomalyProcessFunctionTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static final GlobalStats BASELINE = GlobalStatsAccumulator.fit(List.of(
            record(-3, 40.0), record(-2, 50.0), record(-1, 60.0)));

    @Test
    @DisplayName("Should start a key with no stored windows")
    void shouldStartFreshKey() {
        DetectionConfig config = config(90.0, 20);

        AnomalyDetector detector = AnomalyProcessFunction.restoreDetector(config, BASELINE, null);

        assertThat(detector.isReady()).isTrue();
        assertThat(detector.getWindows()).isEmpty();
        assertThat(detector.process(record(0, 50.0))).isEmpty();
        assertThat(detector.windowValues("cpu_usage")).containsExactly(50.0);
    }

    @Test
    @DisplayName("Should apply the current rules to windows stored under older rules")
    void shouldApplyCurrentRulesToStoredWindows() {
        AnomalyDetector before = AnomalyProcessFunction.restoreDetector(config(90.0, 5), BASELINE, null);
        before.process(record(0, 50.0));
        before.process(record(1, 52.0));
        before.process(record(2, 51.0));
        Map<String, RollingWindow> stored = new LinkedHashMap<>(before.getWindows());

        AnomalyDetector after = AnomalyProcessFunction.restoreDetector(
                config(70.0, 2), BASELINE, stored.entrySet());
        List<Anomaly> anomalies = after.process(record(3, 75.0));

        assertThat(anomalies).extracting(Anomaly::getKind).containsExactly(AnomalyKind.STATIC_THRESHOLD);
        assertThat(anomalies.get(0).getLimit()).isEqualTo(70.0);
        assertThat(after.windowValues("cpu_usage")).containsExactly(51.0, 75.0);
    }

    @Test
    @DisplayName("Should use the current baseline for keys restored from state")
    void shouldUseCurrentBaseline() {
        AnomalyDetector before = AnomalyProcessFunction.restoreDetector(config(null, 20), BASELINE, null);
        before.process(record(0, 50.0));
        GlobalStats shifted = GlobalStatsAccumulator.fit(List.of(
                record(-3, 10.0), record(-2, 12.0), record(-1, 14.0)));

        AnomalyDetector after = AnomalyProcessFunction.restoreDetector(
                config(null, 20), shifted, before.getWindows().entrySet());

        assertThat(after.getBaseline()).contains(shifted);
        assertThat(after.process(record(1, 50.0)))
                .extracting(Anomaly::getKind)
                .contains(AnomalyKind.GLOBAL_DEVIATION);
    }

    private static DetectionConfig config(Double threshold, int windowSize) {
        return DetectionConfig.builder()
                .rollingWindowSize(windowSize)
                .metric("cpu_usage", MetricRule.builder().threshold(threshold).globalStdFactor(3.0).build())
                .build();
    }

    private static TelemetryRecord record(int minute, double cpu) {
        return TelemetryRecord.builder(T0.plusSeconds(60L * minute)).metric("cpu_usage", cpu).build();
    }
}

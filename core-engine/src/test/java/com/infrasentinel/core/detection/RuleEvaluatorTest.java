package com.infrasentinel.core.detection;

import com.infrasentinel.core.config.MetricRule;
import com.infrasentinel.core.model.Anomaly;
import com.infrasentinel.core.model.AnomalyKind;
import com.infrasentinel.core.stats.MetricStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.infrasentinel.core.detection.CheckFixtures.TS;
import static com.infrasentinel.core.detection.CheckFixtures.observe;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RuleEvaluator}.
 */
class RuleEvaluatorTest {

    @Test
    @DisplayName("Should report every firing check in a fixed order")
    void shouldReportChecksInOrder() {
        MetricRule rule = MetricRule.builder()
                .threshold(90.0)
                .globalStdFactor(3.0)
                .rollingStdFactor(1.0)
                .deltaThreshold(20.0)
                .build();

        List<Anomaly> anomalies = RuleEvaluator.evaluateMetric(
                observe(rule, new MetricStats(3, 50.0, 10.0), 50, 50, 50, 95));

        assertThat(anomalies).extracting(Anomaly::getKind).containsExactly(
                AnomalyKind.STATIC_THRESHOLD,
                AnomalyKind.GLOBAL_DEVIATION,
                AnomalyKind.ROLLING_DEVIATION,
                AnomalyKind.DELTA_SPIKE);
        assertThat(anomalies).allSatisfy(a -> {
            assertThat(a.getSubject()).isEqualTo("cpu_usage");
            assertThat(a.getObservedValue()).isEqualTo(95.0);
            assertThat(a.getTimestamp()).isEqualTo(TS);
        });
    }

    @Test
    @DisplayName("Should return an empty list for a normal value")
    void shouldReturnEmptyForNormalValue() {
        MetricRule rule = MetricRule.builder().threshold(90.0).deltaThreshold(20.0).build();

        assertThat(RuleEvaluator.evaluateMetric(
                observe(rule, new MetricStats(3, 50.0, 10.0), 50, 52, 55))).isEmpty();
    }

    @Test
    @DisplayName("Should evaluate service statuses")
    void shouldEvaluateStatus() {
        assertThat(RuleEvaluator.evaluateStatus("database", "degraded", TS))
                .map(Anomaly::getKind)
                .contains(AnomalyKind.SERVICE_STATUS);
        assertThat(RuleEvaluator.evaluateStatus("database", "online", TS)).isEmpty();
    }
}

package com.infrasentinel.core.detection;

import com.infrasentinel.core.config.MetricRule;
import com.infrasentinel.core.model.Anomaly;
import com.infrasentinel.core.model.AnomalyKind;
import com.infrasentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.infrasentinel.core.detection.CheckFixtures.observe;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DeltaSpikeCheck}.
 */
class DeltaSpikeCheckTest {

    private final DeltaSpikeCheck check = new DeltaSpikeCheck();
    private final MetricRule rule = MetricRule.builder().deltaThreshold(20.0).build();

    @Test
    @DisplayName("Should fire on a rise larger than the delta threshold")
    void shouldFireOnSharpRise() {
        Optional<Anomaly> anomaly = check.evaluate(observe(rule, null, 50, 80));

        assertThat(anomaly).isPresent();
        assertThat(anomaly.get().getKind()).isEqualTo(AnomalyKind.DELTA_SPIKE);
        assertThat(anomaly.get().getSeverity()).isEqualTo(Severity.INFO);
        assertThat(anomaly.get().getReferenceValue()).isEqualTo(50.0);
        assertThat(anomaly.get().getLimit()).isEqualTo(20.0);
        assertThat(anomaly.get().getDetails()).contains("by 30.00");
    }

    @Test
    @DisplayName("Should NOT fire on a smaller rise")
    void shouldNotFireOnSmallRise() {
        assertThat(check.evaluate(observe(rule, null, 50, 65))).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire when the rise equals the delta threshold")
    void shouldNotFireAtBoundary() {
        assertThat(check.evaluate(observe(rule, null, 50, 70))).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire on a sharp drop")
    void shouldNotFireOnDrop() {
        assertThat(check.evaluate(observe(rule, null, 80, 20))).isEmpty();
    }

    @Test
    @DisplayName("Should compare against the immediately preceding value only")
    void shouldUsePreviousValue() {
        assertThat(check.evaluate(observe(rule, null, 10, 60, 75))).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire without a previous value")
    void shouldNotFireOnFirstObservation() {
        assertThat(check.evaluate(observe(rule, null, 1e9))).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire when no delta threshold is configured")
    void shouldNotFireWithoutDeltaThreshold() {
        assertThat(check.evaluate(observe(MetricRule.defaults(), null, 0, 1e9))).isEmpty();
    }
}

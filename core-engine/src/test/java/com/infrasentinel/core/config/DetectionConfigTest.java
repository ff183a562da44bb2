package com.infrasentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Unit tests for {@link DetectionConfig} and {@link MetricRule}.
 */
class DetectionConfigTest {

    @Test
    @DisplayName("Should apply defaults when nothing is set")
    void shouldApplyDefaults() {
        DetectionConfig config = DetectionConfig.builder().build();

        assertThat(config.getRollingWindowSize()).isEqualTo(DetectionConfig.DEFAULT_ROLLING_WINDOW_SIZE);
        assertThat(config.getMetrics()).isEmpty();

        MetricRule rule = MetricRule.defaults();
        assertThat(rule.getThreshold()).isEmpty();
        assertThat(rule.getDeltaThreshold()).isEmpty();
        assertThat(rule.getGlobalStdFactor()).isEqualTo(3.0);
        assertThat(rule.getRollingStdFactor()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should keep metrics in declaration order")
    void shouldKeepDeclarationOrder() {
        DetectionConfig config = DetectionConfig.builder()
                .metric("latency_ms", MetricRule.builder().threshold(300.0).build())
                .metric("cpu_usage", MetricRule.builder().threshold(90.0).build())
                .metric("memory_usage", MetricRule.defaults())
                .build();

        assertThat(config.getMetrics().keySet()).containsExactly("latency_ms", "cpu_usage", "memory_usage");
        assertThat(config.thresholds()).containsExactly(
                entry("latency_ms", 300.0), entry("cpu_usage", 90.0), entry("memory_usage", null));
        assertThat(config.isMonitored("cpu_usage")).isTrue();
        assertThat(config.isMonitored("disk_usage")).isFalse();
        assertThat(config.getRule("disk_usage")).isEmpty();
    }

    @Test
    @DisplayName("Should report every invalid value in one exception")
    void shouldReportAllViolations() {
        DetectionConfig.Builder builder = DetectionConfig.builder()
                .rollingWindowSize(0)
                .metric("cpu_usage", MetricRule.builder().globalStdFactor(0).build())
                .metric("latency_ms", MetricRule.builder().rollingStdFactor(-1).threshold(Double.NaN).build());

        assertThatThrownBy(builder::build)
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("rolling_window_size")
                .hasMessageContaining("'cpu_usage' requires 'global_std_factor' > 0")
                .hasMessageContaining("'latency_ms' requires 'rolling_std_factor' > 0")
                .hasMessageContaining("non-finite 'threshold'");
    }

    @Test
    @DisplayName("Should reject a blank metric name")
    void shouldRejectBlankMetricName() {
        assertThatThrownBy(() -> DetectionConfig.builder().metric(" ", MetricRule.defaults()).build())
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("blank");
    }

    @Test
    @DisplayName("Should expose an unmodifiable metric map")
    void shouldExposeUnmodifiableMetrics() {
        DetectionConfig config = DetectionConfig.builder().metric("cpu_usage", MetricRule.defaults()).build();

        assertThatThrownBy(() -> config.getMetrics().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}

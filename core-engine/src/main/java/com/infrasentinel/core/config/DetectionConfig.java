package com.infrasentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable detection configuration: rolling window capacity plus one
 * {@link MetricRule} per monitored metric.
 *
 * <p>
 * Expected YAML structure (see {@link DetectionConfigLoader}):
 * </p>
 *
 * <pre>
 * rolling_window_size: 20
 * metrics:
 *   cpu_usage:
 *     threshold: 90
 *     global_std_factor: 3
 *     rolling_std_factor: 2
 *     delta_threshold: 20
 *   temperature_celsius:
 *     threshold: 80
 * </pre>
 *
 * <p>
 * Metric iteration order is the declaration order; the detector reports
 * numeric findings in that order.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_ROLLING_WINDOW_SIZE = 20;

    private final int rollingWindowSize;
    private final LinkedHashMap<String, MetricRule> metrics;

    private DetectionConfig(Builder b) {
        this.rollingWindowSize = b.rollingWindowSize;
        this.metrics = new LinkedHashMap<>(b.metrics);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getRollingWindowSize() {
        return rollingWindowSize;
    }

    /**
     * @return unmodifiable map of metric name to rule, in declaration order
     */
    public Map<String, MetricRule> getMetrics() {
        return Collections.unmodifiableMap(metrics);
    }

    public Optional<MetricRule> getRule(String metric) {
        return Optional.ofNullable(metrics.get(metric));
    }

    public boolean isMonitored(String metric) {
        return metrics.containsKey(metric);
    }

    /**
     * Static thresholds per monitored metric, {@code null} where unset.
     *
     * @return unmodifiable map in declaration order
     */
    public Map<String, Double> thresholds() {
        Map<String, Double> result = new LinkedHashMap<>();
        metrics.forEach((name, rule) -> result.put(name, rule.getThreshold().orElse(null)));
        return Collections.unmodifiableMap(result);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link DetectionConfig}.
     *
     * <p>
     * {@link #build()} validates the window size and every metric rule, and
     * reports all violations in a single {@link ConfigException}.
     * </p>
     */
    public static class Builder {
        private int rollingWindowSize = DEFAULT_ROLLING_WINDOW_SIZE;
        private final Map<String, MetricRule> metrics = new LinkedHashMap<>();

        public Builder rollingWindowSize(int v) {
            this.rollingWindowSize = v;
            return this;
        }

        public Builder metric(String name, MetricRule rule) {
            Objects.requireNonNull(rule, "Rule for metric '" + name + "' must not be null");
            metrics.put(name, rule);
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link DetectionConfig}
         * @throws ConfigException if any value is invalid
         */
        public DetectionConfig build() {
            List<String> errors = new ArrayList<>();

            if (rollingWindowSize < 1) {
                errors.add("'rolling_window_size' must be a positive integer, got: " + rollingWindowSize);
            }
            metrics.forEach((name, rule) -> {
                if (name == null || name.isBlank()) {
                    errors.add("Metric names must not be null or blank");
                } else {
                    errors.addAll(rule.validate(name));
                }
            });

            if (!errors.isEmpty()) {
                throw new ConfigException(
                        "Detection configuration validation failed:\n  - "
                                + String.join("\n  - ", errors));
            }
            return new DetectionConfig(this);
        }
    }

    @Override
    public String toString() {
        return "DetectionConfig{" +
                "rollingWindowSize=" + rollingWindowSize +
                ", metrics=" + metrics +
                '}';
    }
}

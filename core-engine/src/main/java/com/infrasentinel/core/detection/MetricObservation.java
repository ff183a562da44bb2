package com.infrasentinel.core.detection;

import com.infrasentinel.core.config.MetricRule;
import com.infrasentinel.core.stats.MetricStats;
import com.infrasentinel.core.stats.RollingWindow;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One metric value together with everything a {@link MetricCheck} may compare
 * it against.
 *
 * <p>
 * The rolling window already contains {@code value} as its latest entry.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricObservation {

    private final String metric;
    private final double value;
    private final MetricRule rule;
    private final MetricStats globalStats;
    private final RollingWindow window;
    private final Instant timestamp;

    /**
     * @param metric      metric name
     * @param value       observed value
     * @param rule        detection settings for the metric
     * @param globalStats baseline statistics, {@code null} when the metric was
     *                    absent from the baseline
     * @param window      the metric's rolling window, {@code null} when the
     *                    metric has no history
     * @param timestamp   timestamp of the record
     */
    public MetricObservation(String metric, double value, MetricRule rule,
            MetricStats globalStats, RollingWindow window, Instant timestamp) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.value = value;
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
        this.globalStats = globalStats;
        this.window = window;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public String getMetric() {
        return metric;
    }

    public double getValue() {
        return value;
    }

    public MetricRule getRule() {
        return rule;
    }

    public Optional<MetricStats> getGlobalStats() {
        return Optional.ofNullable(globalStats);
    }

    /**
     * @return number of observations in the rolling window, {@code 0} without
     *         one
     */
    public int historySize() {
        return window == null ? 0 : window.size();
    }

    public Optional<Double> rollingMean() {
        return window == null ? Optional.empty() : window.mean();
    }

    public Optional<Double> rollingStd() {
        return window == null ? Optional.empty() : window.std();
    }

    public Optional<Double> previousValue() {
        return window == null ? Optional.empty() : window.previous();
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}

package com.infrasentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Detection settings for one monitored metric.
 *
 * <p>
 * An unset {@code threshold} disables the static-threshold check and an unset
 * {@code deltaThreshold} disables the delta-spike check for the metric. The
 * deviation factors always have a value and default to
 * {@value #DEFAULT_GLOBAL_STD_FACTOR} and {@value #DEFAULT_ROLLING_STD_FACTOR}.
 * </p>
 *
 * <p>
 * Rules are checked by {@link DetectionConfig} when it is built, see
 * {@link #validate(String)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricRule implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_GLOBAL_STD_FACTOR = 3.0;
    public static final double DEFAULT_ROLLING_STD_FACTOR = 2.0;

    private final Double threshold;
    private final double globalStdFactor;
    private final double rollingStdFactor;
    private final Double deltaThreshold;

    private MetricRule(Builder b) {
        this.threshold = b.threshold;
        this.globalStdFactor = b.globalStdFactor;
        this.rollingStdFactor = b.rollingStdFactor;
        this.deltaThreshold = b.deltaThreshold;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a rule with both deviation checks at their default factors and no
     *         threshold or delta check
     */
    public static MetricRule defaults() {
        return new Builder().build();
    }

    public Optional<Double> getThreshold() {
        return Optional.ofNullable(threshold);
    }

    public double getGlobalStdFactor() {
        return globalStdFactor;
    }

    public double getRollingStdFactor() {
        return rollingStdFactor;
    }

    public Optional<Double> getDeltaThreshold() {
        return Optional.ofNullable(deltaThreshold);
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Check every value of this rule.
     *
     * @param metric metric the rule belongs to, used in messages
     * @return the violations found; empty when the rule is valid
     */
    public List<String> validate(String metric) {
        List<String> errors = new ArrayList<>();
        if (threshold != null && !Double.isFinite(threshold)) {
            errors.add("Metric '" + metric + "' has a non-finite 'threshold': " + threshold);
        }
        if (deltaThreshold != null && !Double.isFinite(deltaThreshold)) {
            errors.add("Metric '" + metric + "' has a non-finite 'delta_threshold': " + deltaThreshold);
        }
        if (!isPositive(globalStdFactor)) {
            errors.add("Metric '" + metric + "' requires 'global_std_factor' > 0, got: " + globalStdFactor);
        }
        if (!isPositive(rollingStdFactor)) {
            errors.add("Metric '" + metric + "' requires 'rolling_std_factor' > 0, got: " + rollingStdFactor);
        }
        return errors;
    }

    private static boolean isPositive(double factor) {
        return Double.isFinite(factor) && factor > 0;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private Double threshold;
        private double globalStdFactor = DEFAULT_GLOBAL_STD_FACTOR;
        private double rollingStdFactor = DEFAULT_ROLLING_STD_FACTOR;
        private Double deltaThreshold;

        public Builder threshold(Double v) {
            this.threshold = v;
            return this;
        }

        public Builder globalStdFactor(double v) {
            this.globalStdFactor = v;
            return this;
        }

        public Builder rollingStdFactor(double v) {
            this.rollingStdFactor = v;
            return this;
        }

        public Builder deltaThreshold(Double v) {
            this.deltaThreshold = v;
            return this;
        }

        public MetricRule build() {
            return new MetricRule(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricRule that))
            return false;
        return Double.compare(globalStdFactor, that.globalStdFactor) == 0
                && Double.compare(rollingStdFactor, that.rollingStdFactor) == 0
                && Objects.equals(threshold, that.threshold)
                && Objects.equals(deltaThreshold, that.deltaThreshold);
    }

    @Override
    public int hashCode() {
        return Objects.hash(threshold, globalStdFactor, rollingStdFactor, deltaThreshold);
    }

    @Override
    public String toString() {
        return "MetricRule{" +
                "threshold=" + threshold +
                ", globalStdFactor=" + globalStdFactor +
                ", rollingStdFactor=" + rollingStdFactor +
                ", deltaThreshold=" + deltaThreshold +
                '}';
    }
}

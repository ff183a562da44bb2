package com.infrasentinel.core.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Snapshot of one monitored metric over a batch, with the reference values a
 * reader needs to judge it.
 *
 * <p>
 * {@code current} is the mean of the batch values. {@code threshold},
 * {@code globalMean} and {@code globalStd} are {@code null} when unset or
 * absent from the baseline.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class MetricSummary {

    private final double current;
    private final double min;
    private final double max;
    private final int count;
    private final Double threshold;
    private final Double globalMean;
    private final Double globalStd;

    MetricSummary(double current, double min, double max, int count,
            Double threshold, Double globalMean, Double globalStd) {
        this.current = current;
        this.min = min;
        this.max = max;
        this.count = count;
        this.threshold = threshold;
        this.globalMean = globalMean;
        this.globalStd = globalStd;
    }

    public double getCurrent() {
        return current;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public int getCount() {
        return count;
    }

    public Double getThreshold() {
        return threshold;
    }

    public Double getGlobalMean() {
        return globalMean;
    }

    public Double getGlobalStd() {
        return globalStd;
    }

    @Override
    public String toString() {
        return "MetricSummary{" +
                "current=" + current +
                ", min=" + min +
                ", max=" + max +
                ", count=" + count +
                ", threshold=" + threshold +
                '}';
    }
}

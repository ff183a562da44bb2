package com.infrasentinel.core.stats;

import java.io.Serializable;
import java.util.Objects;

/**
 * Baseline mean and sample standard deviation of one metric.
 *
 * <p>
 * {@code std} is {@code 0} when the baseline holds fewer than two
 * observations of the metric or when all observations are equal. A zero
 * {@code std} disables the global-deviation check for the metric.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricStats implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long count;
    private final double mean;
    private final double std;

    public MetricStats(long count, double mean, double std) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1, got: " + count);
        }
        this.count = count;
        this.mean = mean;
        this.std = std;
    }

    public long getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getStd() {
        return std;
    }

    /**
     * @return {@code true} when the standard deviation can be used as a
     *         deviation scale
     */
    public boolean hasSpread() {
        return std > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricStats that))
            return false;
        return count == that.count
                && Double.compare(mean, that.mean) == 0
                && Double.compare(std, that.std) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, mean, std);
    }

    @Override
    public String toString() {
        return "MetricStats{count=" + count + ", mean=" + mean + ", std=" + std + '}';
    }
}

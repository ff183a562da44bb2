package com.infrasentinel.core.stats;

import com.infrasentinel.core.model.TelemetryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes {@link GlobalStats} from a baseline dataset.
 *
 * <p>
 * Every numeric metric present in at least one baseline record gets a sample
 * mean and a sample standard deviation (ddof = 1). Missing and {@code null}
 * values are ignored. The computation is single-pass (Welford), so the
 * baseline is only iterated once.
 * </p>
 *
 * @since 1.0.0
 */
public final class GlobalStatsAccumulator {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalStatsAccumulator.class);

    private GlobalStatsAccumulator() {
        // utility class; not instantiable
    }

    /**
     * Fit baseline statistics.
     *
     * @param baseline baseline records; must not be {@code null}
     * @return the fitted statistics
     * @throws BaselineEmptyException if {@code baseline} holds no records
     */
    public static GlobalStats fit(List<TelemetryRecord> baseline) {
        Objects.requireNonNull(baseline, "Baseline must not be null");
        if (baseline.isEmpty()) {
            throw new BaselineEmptyException("Cannot fit baseline statistics: the baseline has no records");
        }

        Map<String, Welford> accumulators = new LinkedHashMap<>();
        for (TelemetryRecord record : baseline) {
            record.getMetrics().forEach((metric, value) -> {
                if (value != null) {
                    accumulators.computeIfAbsent(metric, k -> new Welford()).add(value);
                }
            });
        }

        Map<String, MetricStats> stats = new LinkedHashMap<>();
        accumulators.forEach((metric, acc) -> {
            MetricStats s = acc.toStats();
            stats.put(metric, s);
            if (!s.hasSpread()) {
                LOG.debug("Baseline metric '{}' has no spread (n={}); global deviation disabled for it",
                        metric, s.getCount());
            }
        });

        LOG.info("Fitted baseline statistics for {} metric(s) from {} record(s)",
                stats.size(), baseline.size());
        return new GlobalStats(stats, baseline.size());
    }

    // ---------------------------------------------------------------
    // Running mean / M2
    // ---------------------------------------------------------------

    private static final class Welford {
        private long count;
        private double mean;
        private double m2;

        void add(double value) {
            count++;
            double delta = value - mean;
            mean += delta / count;
            m2 += delta * (value - mean);
        }

        MetricStats toStats() {
            double std = count > 1 ? Math.sqrt(m2 / (count - 1)) : 0.0;
            return new MetricStats(count, mean, std);
        }
    }
}

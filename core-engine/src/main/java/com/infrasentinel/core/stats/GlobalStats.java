package com.infrasentinel.core.stats;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable per-metric baseline statistics produced by
 * {@link GlobalStatsAccumulator#fit(java.util.List)}.
 *
 * <p>
 * A metric that never appeared in the baseline has no entry, and the
 * global-deviation check is skipped for it.
 * </p>
 *
 * @since 1.0.0
 */
public final class GlobalStats implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LinkedHashMap<String, MetricStats> byMetric;
    private final long recordCount;

    GlobalStats(Map<String, MetricStats> byMetric, long recordCount) {
        this.byMetric = new LinkedHashMap<>(byMetric);
        this.recordCount = recordCount;
    }

    public Optional<MetricStats> get(String metric) {
        return Optional.ofNullable(byMetric.get(metric));
    }

    public boolean contains(String metric) {
        return byMetric.containsKey(metric);
    }

    /**
     * @return unmodifiable map of metric name to statistics, in order of first
     *         appearance in the baseline
     */
    public Map<String, MetricStats> asMap() {
        return Collections.unmodifiableMap(byMetric);
    }

    /**
     * @return number of baseline records the statistics were computed from
     */
    public long getRecordCount() {
        return recordCount;
    }

    @Override
    public String toString() {
        return "GlobalStats{records=" + recordCount + ", metrics=" + byMetric + '}';
    }
}

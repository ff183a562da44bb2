package com.infrasentinel.core.detection;

import com.infrasentinel.core.model.Anomaly;
import com.infrasentinel.core.model.AnomalyKind;
import com.infrasentinel.core.stats.MetricStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires when a value is further from the baseline mean than
 * {@code globalStdFactor × σ} of the baseline.
 *
 * <p>
 * Skipped when the metric was absent from the baseline or its baseline
 * standard deviation is zero; a zero spread is never replaced by a default.
 * </p>
 *
 * @since 1.0.0
 */
public class GlobalDeviationCheck implements MetricCheck {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalDeviationCheck.class);

    @Override
    public Optional<Anomaly> evaluate(MetricObservation observation) {
        Objects.requireNonNull(observation, "Observation must not be null");

        Optional<MetricStats> baseline = observation.getGlobalStats();
        if (baseline.isEmpty() || !baseline.get().hasSpread()) {
            LOG.trace("[{}] {}: no baseline spread, skipping", getKind(), observation.getMetric());
            return Optional.empty();
        }

        String metric = observation.getMetric();
        double value = observation.getValue();
        double mean = baseline.get().getMean();
        double std = baseline.get().getStd();
        double factor = observation.getRule().getGlobalStdFactor();
        double allowed = factor * std;
        double deviation = Math.abs(value - mean);

        if (deviation > allowed) {
            LOG.debug("[{}] fired: {}={} mean={} std={} deviation={}",
                    getKind(), metric, value, mean, std, deviation);
            return Optional.of(Anomaly.builder()
                    .kind(getKind())
                    .subject(metric)
                    .observedValue(value)
                    .referenceValue(mean)
                    .limit(allowed)
                    .timestamp(observation.getTimestamp())
                    .details(String.format(Locale.ROOT,
                            "Global deviation: %s=%.2f (baseline mean=%.2f, std=%.2f, factor=%.1f)",
                            metric, value, mean, std, factor))
                    .build());
        }
        return Optional.empty();
    }

    @Override
    public AnomalyKind getKind() {
        return AnomalyKind.GLOBAL_DEVIATION;
    }
}

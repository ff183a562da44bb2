package com.infrasentinel.core.detection;

import com.infrasentinel.core.model.Anomaly;
import com.infrasentinel.core.model.AnomalyKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires when a value is strictly above the metric's configured threshold.
 * Skipped for metrics without a threshold.
 *
 * @since 1.0.0
 */
public class StaticThresholdCheck implements MetricCheck {

    private static final Logger LOG = LoggerFactory.getLogger(StaticThresholdCheck.class);

    @Override
    public Optional<Anomaly> evaluate(MetricObservation observation) {
        Objects.requireNonNull(observation, "Observation must not be null");

        Optional<Double> configured = observation.getRule().getThreshold();
        if (configured.isEmpty()) {
            return Optional.empty();
        }

        String metric = observation.getMetric();
        double value = observation.getValue();
        double threshold = configured.get();

        if (value > threshold) {
            LOG.debug("[{}] fired: {}={} > threshold={}", getKind(), metric, value, threshold);
            return Optional.of(Anomaly.builder()
                    .kind(getKind())
                    .subject(metric)
                    .observedValue(value)
                    .referenceValue(threshold)
                    .limit(threshold)
                    .timestamp(observation.getTimestamp())
                    .details(String.format(Locale.ROOT,
                            "Threshold exceeded: %s=%.2f (threshold: %.2f)", metric, value, threshold))
                    .build());
        }
        return Optional.empty();
    }

    @Override
    public AnomalyKind getKind() {
        return AnomalyKind.STATIC_THRESHOLD;
    }
}

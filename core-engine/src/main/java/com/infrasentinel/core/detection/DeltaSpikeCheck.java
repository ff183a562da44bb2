package com.infrasentinel.core.detection;

import com.infrasentinel.core.model.Anomaly;
import com.infrasentinel.core.model.AnomalyKind;
import com.infrasentinel.core.stats.RollingWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires when a value rose above the previous observation of the same metric
 * by more than the configured delta threshold.
 *
 * <p>
 * Only rises are reported; drops never fire. Skipped for metrics without a
 * delta threshold and until the window holds
 * {@value RollingWindow#MIN_SAMPLES} observations.
 * </p>
 *
 * @since 1.0.0
 */
public class DeltaSpikeCheck implements MetricCheck {

    private static final Logger LOG = LoggerFactory.getLogger(DeltaSpikeCheck.class);

    @Override
    public Optional<Anomaly> evaluate(MetricObservation observation) {
        Objects.requireNonNull(observation, "Observation must not be null");

        Optional<Double> configured = observation.getRule().getDeltaThreshold();
        if (configured.isEmpty() || observation.historySize() < RollingWindow.MIN_SAMPLES) {
            return Optional.empty();
        }
        Optional<Double> previous = observation.previousValue();
        if (previous.isEmpty()) {
            return Optional.empty();
        }

        String metric = observation.getMetric();
        double value = observation.getValue();
        double deltaThreshold = configured.get();
        double delta = value - previous.get();

        if (delta > deltaThreshold) {
            LOG.debug("[{}] fired: {} rose by {} (from {} to {}) > {}",
                    getKind(), metric, delta, previous.get(), value, deltaThreshold);
            return Optional.of(Anomaly.builder()
                    .kind(getKind())
                    .subject(metric)
                    .observedValue(value)
                    .referenceValue(previous.get())
                    .limit(deltaThreshold)
                    .timestamp(observation.getTimestamp())
                    .details(String.format(Locale.ROOT,
                            "Sudden rise of %s by %.2f (from %.2f to %.2f, delta threshold: %.2f)",
                            metric, delta, previous.get(), value, deltaThreshold))
                    .build());
        }
        return Optional.empty();
    }

    @Override
    public AnomalyKind getKind() {
        return AnomalyKind.DELTA_SPIKE;
    }
}

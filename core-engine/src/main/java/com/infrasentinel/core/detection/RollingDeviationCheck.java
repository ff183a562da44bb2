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
 * Fires when a value is further from the rolling mean than
 * {@code rollingStdFactor × σ} of the rolling window.
 *
 * <h3>Window state</h3>
 * <p>
 * The window statistics include the value under evaluation, which is pushed
 * before the checks run. The check needs at least
 * {@value RollingWindow#MIN_SAMPLES} observations and a non-zero rolling
 * standard deviation.
 * </p>
 *
 * @since 1.0.0
 */
public class RollingDeviationCheck implements MetricCheck {

    private static final Logger LOG = LoggerFactory.getLogger(RollingDeviationCheck.class);

    @Override
    public Optional<Anomaly> evaluate(MetricObservation observation) {
        Objects.requireNonNull(observation, "Observation must not be null");

        if (observation.historySize() < RollingWindow.MIN_SAMPLES) {
            LOG.trace("[{}] {}: insufficient history, skipping", getKind(), observation.getMetric());
            return Optional.empty();
        }
        Optional<Double> mean = observation.rollingMean();
        Optional<Double> std = observation.rollingStd();
        if (mean.isEmpty() || std.isEmpty() || std.get() <= 0) {
            return Optional.empty();
        }

        String metric = observation.getMetric();
        double value = observation.getValue();
        double factor = observation.getRule().getRollingStdFactor();
        double allowed = factor * std.get();
        double deviation = Math.abs(value - mean.get());

        if (deviation > allowed) {
            LOG.debug("[{}] fired: {}={} rollingMean={} rollingStd={} deviation={}",
                    getKind(), metric, value, mean.get(), std.get(), deviation);
            return Optional.of(Anomaly.builder()
                    .kind(getKind())
                    .subject(metric)
                    .observedValue(value)
                    .referenceValue(mean.get())
                    .limit(allowed)
                    .timestamp(observation.getTimestamp())
                    .details(String.format(Locale.ROOT,
                            "Rolling deviation: %s=%.2f (rolling mean=%.2f, std=%.2f, factor=%.1f, samples=%d)",
                            metric, value, mean.get(), std.get(), factor, observation.historySize()))
                    .build());
        }
        return Optional.empty();
    }

    @Override
    public AnomalyKind getKind() {
        return AnomalyKind.ROLLING_DEVIATION;
    }
}

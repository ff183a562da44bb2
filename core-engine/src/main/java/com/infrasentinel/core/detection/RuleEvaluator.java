package com.infrasentinel.core.detection;

import com.infrasentinel.core.model.Anomaly;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs the detection strategies for one field of one record.
 *
 * <p>
 * Numeric checks always run in the same order, and every one of them is
 * attempted even when an earlier one fired:
 * </p>
 * <ol>
 * <li>{@link StaticThresholdCheck}</li>
 * <li>{@link GlobalDeviationCheck}</li>
 * <li>{@link RollingDeviationCheck}</li>
 * <li>{@link DeltaSpikeCheck}</li>
 * </ol>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a numeric strategy, implement {@link MetricCheck} and append it to
 * {@link #NUMERIC_CHECKS}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleEvaluator {

    static final List<MetricCheck> NUMERIC_CHECKS = List.of(
            new StaticThresholdCheck(),
            new GlobalDeviationCheck(),
            new RollingDeviationCheck(),
            new DeltaSpikeCheck());

    private static final ServiceStatusCheck STATUS_CHECK = new ServiceStatusCheck();

    private RuleEvaluator() {
        // utility class; not instantiable
    }

    /**
     * Evaluate a categorical service-status field.
     *
     * @param service   service name
     * @param status    reported status
     * @param timestamp record timestamp
     * @return an anomaly for a degraded or offline service, empty otherwise
     */
    public static Optional<Anomaly> evaluateStatus(String service, String status, Instant timestamp) {
        return STATUS_CHECK.evaluate(service, status, timestamp);
    }

    /**
     * Evaluate every numeric check against one metric value.
     *
     * @param observation the value and its context; must not be {@code null}
     * @return findings in check order; empty when nothing fired
     */
    public static List<Anomaly> evaluateMetric(MetricObservation observation) {
        Objects.requireNonNull(observation, "Observation must not be null");
        List<Anomaly> findings = new ArrayList<>(NUMERIC_CHECKS.size());
        for (MetricCheck check : NUMERIC_CHECKS) {
            check.evaluate(observation).ifPresent(findings::add);
        }
        return findings;
    }
}

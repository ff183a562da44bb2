package com.infrasentinel.core.detection;

import com.infrasentinel.core.model.Anomaly;
import com.infrasentinel.core.model.AnomalyKind;

import java.util.Optional;

/**
 * Contract for the numeric detection strategies.
 *
 * <p>
 * Checks are <strong>stateless</strong>: everything they need, including the
 * metric's rolling window, arrives in the {@link MetricObservation}. A check
 * that lacks the data it needs (no threshold configured, no baseline spread,
 * too little history) returns empty rather than failing.
 * </p>
 *
 * @since 1.0.0
 */
public interface MetricCheck {

    /**
     * Evaluate one metric value.
     *
     * @param observation the value and its context
     * @return an {@link Anomaly} if the check fires, empty otherwise
     */
    Optional<Anomaly> evaluate(MetricObservation observation);

    /**
     * @return the kind of anomaly this check reports
     */
    AnomalyKind getKind();
}

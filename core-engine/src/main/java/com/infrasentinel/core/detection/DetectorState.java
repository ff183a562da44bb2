package com.infrasentinel.core.detection;

/**
 * Lifecycle of an {@link AnomalyDetector}. The only transition is
 * {@code UNINITIALIZED -> READY}, taken by a successful fit.
 *
 * @since 1.0.0
 */
public enum DetectorState {
    UNINITIALIZED,
    READY
}

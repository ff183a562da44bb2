package com.infrasentinel.core.model;

/**
 * The detection strategy that produced an {@link Anomaly}.
 *
 * <p>
 * Each kind carries the severity its findings are reported with.
 * </p>
 *
 * @since 1.0.0
 */
public enum AnomalyKind {

    SERVICE_STATUS(Severity.ALERT),
    STATIC_THRESHOLD(Severity.CRITICAL),
    GLOBAL_DEVIATION(Severity.WARNING),
    ROLLING_DEVIATION(Severity.WARNING),
    DELTA_SPIKE(Severity.INFO);

    private final Severity severity;

    AnomalyKind(Severity severity) {
        this.severity = severity;
    }

    /**
     * @return the severity findings of this kind are reported with
     */
    public Severity severity() {
        return severity;
    }
}

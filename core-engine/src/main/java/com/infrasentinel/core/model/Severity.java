package com.infrasentinel.core.model;

/**
 * Severity attached to every {@link Anomaly}.
 *
 * @since 1.0.0
 */
public enum Severity {

    /** Notable change that is not yet a problem (e.g. a sudden rise). */
    INFO,

    /** Statistically unusual value. */
    WARNING,

    /** Hard limit breached. */
    CRITICAL,

    /** A monitored service reports itself as degraded or offline. */
    ALERT
}

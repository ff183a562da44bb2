package com.infrasentinel.core.analysis;

/**
 * Overall outcome of a batch analysis.
 *
 * @since 1.0.0
 */
public enum BatchStatus {
    OK,
    ANOMALIES_DETECTED
}

/**
 * Domain model classes for Infra Sentinel.
 *
 * <ul>
 * <li>{@link com.infrasentinel.core.model.TelemetryRecord}: typed view of one
 * telemetry record</li>
 * <li>{@link com.infrasentinel.core.model.Anomaly}: finding emitted by the
 * detection engine</li>
 * <li>{@link com.infrasentinel.core.model.AnomalyKind} and
 * {@link com.infrasentinel.core.model.Severity}: what fired and how bad it
 * is</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.infrasentinel.core.model;

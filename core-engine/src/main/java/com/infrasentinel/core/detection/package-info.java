/**
 * Streaming anomaly detection engine.
 *
 * <p>
 * {@link com.infrasentinel.core.detection.AnomalyDetector} owns the baseline
 * statistics and the per-metric rolling windows of one stream, and hands each
 * field of each record to
 * {@link com.infrasentinel.core.detection.RuleEvaluator}. Built-in strategies:
 * </p>
 * <ul>
 * <li>{@link com.infrasentinel.core.detection.ServiceStatusCheck}: service
 * reported degraded or offline</li>
 * <li>{@link com.infrasentinel.core.detection.StaticThresholdCheck}: value
 * above a fixed threshold</li>
 * <li>{@link com.infrasentinel.core.detection.GlobalDeviationCheck}: baseline
 * mean ± N × σ</li>
 * <li>{@link com.infrasentinel.core.detection.RollingDeviationCheck}: rolling
 * mean ± N × σ</li>
 * <li>{@link com.infrasentinel.core.detection.DeltaSpikeCheck}: sudden rise
 * since the previous observation</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.infrasentinel.core.detection;

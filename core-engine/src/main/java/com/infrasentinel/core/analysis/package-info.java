/**
 * Batch analysis on top of a shared detector.
 *
 * <p>
 * {@link com.infrasentinel.core.analysis.BatchAnalyzer} is the entry point for
 * callers that submit groups of records concurrently: it serialises access to
 * the detector and returns a {@link com.infrasentinel.core.analysis.BatchReport}
 * with findings, per-metric summaries and thresholds.
 * </p>
 *
 * @since 1.0.0
 */
package com.infrasentinel.core.analysis;

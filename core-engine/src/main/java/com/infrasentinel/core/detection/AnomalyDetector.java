package com.infrasentinel.core.detection;

import com.infrasentinel.core.config.DetectionConfig;
import com.infrasentinel.core.model.Anomaly;
import com.infrasentinel.core.model.RecordFormatException;
import com.infrasentinel.core.model.TelemetryRecord;
import com.infrasentinel.core.stats.GlobalStats;
import com.infrasentinel.core.stats.GlobalStatsAccumulator;
import com.infrasentinel.core.stats.MetricStats;
import com.infrasentinel.core.stats.RollingWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Stateful anomaly detector for one telemetry stream.
 *
 * <h3>Lifecycle</h3>
 * <p>
 * A new detector is {@link DetectorState#UNINITIALIZED}. {@link #fit(List)}
 * computes the baseline statistics and moves it to
 * {@link DetectorState#READY}; {@link #process(TelemetryRecord)} before that
 * throws {@link NotFittedException}. Fitting again replaces the baseline but
 * must not happen once live records have been processed.
 * </p>
 *
 * <h3>Processing</h3>
 * <ol>
 * <li>Every non-null numeric field that is monitored or present in the
 * baseline is pushed into its metric's {@link RollingWindow}; windows are
 * created on first observation.</li>
 * <li>Every service-status field is checked, in field order.</li>
 * <li>Every monitored metric present in the record goes through the numeric
 * checks, in configuration order.</li>
 * </ol>
 * <p>
 * The result lists status findings first, then numeric findings.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. Records must be processed
 * one at a time and in timestamp order; a caller that shares one detector
 * between threads must serialise access (see
 * {@link com.infrasentinel.core.analysis.BatchAnalyzer}). Independent streams
 * should use independent detectors.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    private final DetectionConfig config;

    /** Per-metric recent history, in order of first observation. */
    private final LinkedHashMap<String, RollingWindow> windows = new LinkedHashMap<>();

    private GlobalStats baseline;
    private DetectorState state = DetectorState.UNINITIALIZED;

    /**
     * @param config validated detection configuration; must not be
     *               {@code null}
     */
    public AnomalyDetector(DetectionConfig config) {
        this.config = Objects.requireNonNull(config, "DetectionConfig must not be null");
    }

    /**
     * Create a ready detector from statistics that were already fitted, so a
     * baseline shared by many streams is only processed once.
     *
     * @param config   validated detection configuration
     * @param baseline fitted baseline statistics
     * @return a detector in state {@link DetectorState#READY}
     */
    public static AnomalyDetector fromStats(DetectionConfig config, GlobalStats baseline) {
        AnomalyDetector detector = new AnomalyDetector(config);
        detector.baseline = Objects.requireNonNull(baseline, "GlobalStats must not be null");
        detector.state = DetectorState.READY;
        return detector;
    }

    /**
     * Create a ready detector that continues from previously held windows,
     * for callers that keep the windows outside the detector (e.g. in
     * checkpointed state) and rebuild it with the current configuration.
     * Windows whose capacity differs from the configured window size are
     * resized, keeping their most recent observations.
     *
     * @param config   validated detection configuration
     * @param baseline fitted baseline statistics
     * @param windows  windows per metric; adopted, not copied, when their
     *                 capacity already matches
     * @return a detector in state {@link DetectorState#READY}
     */
    public static AnomalyDetector fromStats(DetectionConfig config, GlobalStats baseline,
            Map<String, RollingWindow> windows) {
        Objects.requireNonNull(windows, "Windows must not be null");
        AnomalyDetector detector = fromStats(config, baseline);
        int capacity = config.getRollingWindowSize();
        windows.forEach((metric, window) -> detector.windows.put(metric, window.withCapacity(capacity)));
        return detector;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Fit the baseline statistics.
     *
     * @param baselineRecords historical records; must not be {@code null}
     * @throws com.infrasentinel.core.stats.BaselineEmptyException if there are
     *                                                             no records
     */
    public void fit(List<TelemetryRecord> baselineRecords) {
        GlobalStats fitted = GlobalStatsAccumulator.fit(baselineRecords);
        if (!windows.isEmpty()) {
            LOG.warn("Replacing baseline statistics after {} metric window(s) already received live data",
                    windows.size());
        }
        this.baseline = fitted;
        this.state = DetectorState.READY;
        LOG.info("Detector ready: {} baseline metric(s), {} monitored metric(s)",
                fitted.asMap().size(), config.getMetrics().size());
    }

    public DetectorState getState() {
        return state;
    }

    public boolean isReady() {
        return state == DetectorState.READY;
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    /**
     * Update the rolling windows with one record and evaluate every check.
     *
     * @param record the record; must not be {@code null}
     * @return detected anomalies, status findings first; empty when the record
     *         is normal
     * @throws NotFittedException    if the detector has not been fitted
     * @throws RecordFormatException if a monitored metric holds a non-numeric
     *                               value
     */
    public List<Anomaly> process(TelemetryRecord record) {
        if (state != DetectorState.READY) {
            throw new NotFittedException("Detector must be fitted on a baseline before processing records");
        }
        validate(record);

        Instant timestamp = record.getTimestamp();
        record.getMetrics().forEach((metric, value) -> {
            if (value != null && (config.isMonitored(metric) || baseline.contains(metric))) {
                windows.computeIfAbsent(metric, k -> new RollingWindow(config.getRollingWindowSize()))
                        .push(value);
            }
        });

        List<Anomaly> anomalies = new ArrayList<>();

        record.getStatuses().forEach((service, status) ->
                RuleEvaluator.evaluateStatus(service, status, timestamp).ifPresent(anomalies::add));

        config.getMetrics().forEach((metric, rule) -> {
            Double value = record.getMetrics().get(metric);
            if (value == null) {
                LOG.trace("Metric '{}' not present at {}, skipping", metric, timestamp);
                return;
            }
            MetricStats stats = baseline.get(metric).orElse(null);
            anomalies.addAll(RuleEvaluator.evaluateMetric(
                    new MetricObservation(metric, value, rule, stats, windows.get(metric), timestamp)));
        });

        if (!anomalies.isEmpty()) {
            LOG.debug("{} anomaly(ies) detected at {}", anomalies.size(), timestamp);
        }
        return anomalies;
    }

    /**
     * Check that a record can be processed without touching any state.
     *
     * @param record the record; must not be {@code null}
     * @throws RecordFormatException if a monitored metric holds a non-numeric
     *                               value
     */
    public void validate(TelemetryRecord record) {
        Objects.requireNonNull(record, "Record must not be null");
        for (Map.Entry<String, String> attribute : record.getAttributes().entrySet()) {
            if (config.isMonitored(attribute.getKey())) {
                throw new RecordFormatException("Monitored metric '" + attribute.getKey()
                        + "' must be numeric, got: '" + attribute.getValue() + "'");
            }
        }
    }

    // ---------------------------------------------------------------
    // Read-only views
    // ---------------------------------------------------------------

    public DetectionConfig getConfig() {
        return config;
    }

    /**
     * @return the fitted baseline statistics, empty before fitting
     */
    public Optional<GlobalStats> getBaseline() {
        return Optional.ofNullable(baseline);
    }

    /**
     * @param metric metric name
     * @return number of observations currently held for the metric
     */
    public int windowSize(String metric) {
        RollingWindow window = windows.get(metric);
        return window == null ? 0 : window.size();
    }

    /**
     * @param metric metric name
     * @return copy of the metric's window, oldest first; empty array when the
     *         metric has not been observed
     */
    public double[] windowValues(String metric) {
        RollingWindow window = windows.get(metric);
        return window == null ? new double[0] : window.toArray();
    }

    /**
     * @return live per-metric windows, in order of first observation
     */
    public Map<String, RollingWindow> getWindows() {
        return Collections.unmodifiableMap(windows);
    }

    @Override
    public String toString() {
        return "AnomalyDetector{state=" + state + ", windows=" + windows.keySet() + '}';
    }
}

package com.infrasentinel.core.analysis;

import com.infrasentinel.core.config.DetectionConfig;
import com.infrasentinel.core.config.MetricRule;
import com.infrasentinel.core.detection.AnomalyDetector;
import com.infrasentinel.core.model.Anomaly;
import com.infrasentinel.core.model.RecordFormatException;
import com.infrasentinel.core.model.TelemetryRecord;
import com.infrasentinel.core.stats.GlobalStats;
import com.infrasentinel.core.stats.MetricStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serving boundary that analyses batches of records against one shared
 * {@link AnomalyDetector}.
 *
 * <h3>Concurrency</h3>
 * <p>
 * Batches may arrive from several threads. The whole sequence of
 * {@code process} calls for one batch runs under a single lock, so batches
 * never interleave. A batch is sorted by timestamp first, and a batch that
 * starts before the last record of a previous batch is rejected, because the
 * rolling and delta checks depend on arrival order.
 * </p>
 *
 * <h3>Atomicity</h3>
 * <p>
 * Every record is validated before the first one is processed, so a rejected
 * batch leaves the detector untouched.
 * </p>
 *
 * @since 1.0.0
 */
public class BatchAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(BatchAnalyzer.class);

    private final AnomalyDetector detector;
    private final ReentrantLock lock = new ReentrantLock();

    /** Timestamp of the last processed record; guarded by {@link #lock}. */
    private Instant lastProcessed;

    /**
     * @param detector the shared detector; must not be {@code null}
     */
    public BatchAnalyzer(AnomalyDetector detector) {
        this.detector = Objects.requireNonNull(detector, "AnomalyDetector must not be null");
    }

    /**
     * Analyse one batch.
     *
     * @param batch records of the batch, in any order; must not be
     *              {@code null}
     * @return the batch report
     * @throws com.infrasentinel.core.detection.NotFittedException if the
     *                                                             detector is
     *                                                             not fitted
     * @throws RecordFormatException if a record is invalid or the batch starts
     *                               before an already processed record
     */
    public BatchReport analyze(List<TelemetryRecord> batch) {
        Objects.requireNonNull(batch, "Batch must not be null");
        List<TelemetryRecord> ordered = new ArrayList<>(batch);
        ordered.sort(Comparator.comparing(TelemetryRecord::getTimestamp));

        DetectionConfig config = detector.getConfig();
        Map<String, SummaryAccumulator> summaries = new LinkedHashMap<>();
        List<RecordFindings> findings = new ArrayList<>();

        lock.lock();
        try {
            LOG.info("Analysing batch of {} record(s)", ordered.size());
            ordered.forEach(detector::validate);
            if (!ordered.isEmpty() && lastProcessed != null
                    && ordered.get(0).getTimestamp().isBefore(lastProcessed)) {
                throw new RecordFormatException("Batch starts at " + ordered.get(0).getTimestamp()
                        + ", before the last processed record at " + lastProcessed);
            }

            for (TelemetryRecord record : ordered) {
                List<Anomaly> anomalies = detector.process(record);
                if (!anomalies.isEmpty()) {
                    findings.add(new RecordFindings(record.getTimestamp(), anomalies));
                }
                for (String metric : config.getMetrics().keySet()) {
                    record.getMetric(metric).ifPresent(value ->
                            summaries.computeIfAbsent(metric, k -> new SummaryAccumulator()).add(value));
                }
                lastProcessed = record.getTimestamp();
            }
        } finally {
            lock.unlock();
        }

        if (findings.isEmpty()) {
            LOG.info("No anomalies detected in batch");
        } else {
            LOG.info("{} record(s) with anomalies in batch of {}", findings.size(), ordered.size());
        }

        Optional<GlobalStats> baseline = detector.getBaseline();
        Map<String, MetricSummary> metricsSummary = new LinkedHashMap<>();
        summaries.forEach((metric, acc) -> {
            Optional<MetricStats> stats = baseline.flatMap(b -> b.get(metric));
            metricsSummary.put(metric, acc.toSummary(
                    config.getRule(metric).flatMap(MetricRule::getThreshold).orElse(null),
                    stats.map(MetricStats::getMean).orElse(null),
                    stats.map(MetricStats::getStd).orElse(null)));
        });

        Instant start = ordered.isEmpty() ? null : ordered.get(0).getTimestamp();
        Instant end = ordered.isEmpty() ? null : ordered.get(ordered.size() - 1).getTimestamp();
        return new BatchReport(findings, metricsSummary, ordered.size(), start, end, config.thresholds());
    }

    // ---------------------------------------------------------------
    // Per-metric batch accumulator
    // ---------------------------------------------------------------

    private static final class SummaryAccumulator {
        private int count;
        private double sum;
        private double min = Double.POSITIVE_INFINITY;
        private double max = Double.NEGATIVE_INFINITY;

        void add(double value) {
            count++;
            sum += value;
            min = Math.min(min, value);
            max = Math.max(max, value);
        }

        MetricSummary toSummary(Double threshold, Double globalMean, Double globalStd) {
            return new MetricSummary(sum / count, min, max, count, threshold, globalMean, globalStd);
        }
    }
}

package com.infrasentinel.core.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consolidated result of analysing one batch of records.
 *
 * <p>
 * Designed to be serialised to JSON and handed to a downstream report
 * generator: it lists the findings per anomalous record, a per-metric summary
 * of the batch and the configured thresholds.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class BatchReport {

    private final BatchStatus status;
    private final List<RecordFindings> findings;
    private final Map<String, MetricSummary> metricsSummary;
    private final int totalRecords;
    private final Instant start;
    private final Instant end;
    private final Map<String, Double> thresholds;

    BatchReport(List<RecordFindings> findings, Map<String, MetricSummary> metricsSummary,
            int totalRecords, Instant start, Instant end, Map<String, Double> thresholds) {
        this.status = findings.isEmpty() ? BatchStatus.OK : BatchStatus.ANOMALIES_DETECTED;
        this.findings = List.copyOf(findings);
        this.metricsSummary = Collections.unmodifiableMap(new LinkedHashMap<>(metricsSummary));
        this.totalRecords = totalRecords;
        this.start = start;
        this.end = end;
        this.thresholds = Collections.unmodifiableMap(new LinkedHashMap<>(thresholds));
    }

    public BatchStatus getStatus() {
        return status;
    }

    /**
     * @return findings of the records that had at least one anomaly, in
     *         processing order
     */
    public List<RecordFindings> getFindings() {
        return findings;
    }

    /**
     * @return summary per monitored metric that appeared in the batch, in
     *         configuration order
     */
    public Map<String, MetricSummary> getMetricsSummary() {
        return metricsSummary;
    }

    public int getTotalRecords() {
        return totalRecords;
    }

    public int getAnomalousRecords() {
        return findings.size();
    }

    /**
     * @return timestamp of the earliest record, {@code null} for an empty batch
     */
    public Instant getStart() {
        return start;
    }

    /**
     * @return timestamp of the latest record, {@code null} for an empty batch
     */
    public Instant getEnd() {
        return end;
    }

    /**
     * @return static threshold per monitored metric, {@code null} where unset
     */
    public Map<String, Double> getThresholds() {
        return thresholds;
    }

    @Override
    public String toString() {
        return "BatchReport{" +
                "status=" + status +
                ", totalRecords=" + totalRecords +
                ", anomalousRecords=" + findings.size() +
                ", start=" + start +
                ", end=" + end +
                '}';
    }
}

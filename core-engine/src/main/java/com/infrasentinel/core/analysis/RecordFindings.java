package com.infrasentinel.core.analysis;

import com.infrasentinel.core.model.Anomaly;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Anomalies detected in one record of a batch.
 *
 * @since 1.0.0
 */
public final class RecordFindings {

    private final Instant timestamp;
    private final List<Anomaly> anomalies;

    public RecordFindings(Instant timestamp, List<Anomaly> anomalies) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.anomalies = Collections.unmodifiableList(new ArrayList<>(anomalies));
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    @Override
    public String toString() {
        return "RecordFindings{timestamp=" + timestamp + ", anomalies=" + anomalies + '}';
    }
}

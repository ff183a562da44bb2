package com.infrasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single finding produced while processing one telemetry record.
 *
 * <p>
 * Numeric findings carry {@code observedValue}; service-status findings carry
 * {@code observedStatus} instead. {@code referenceValue} is what the value was
 * compared against (threshold, global or rolling mean, previous value) and
 * {@code limit} is the bound that was exceeded (threshold, allowed deviation,
 * delta threshold).
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code kind}, {@code subject} and {@code timestamp}
 * are required; the severity defaults to the one implied by the kind.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Anomaly implements Serializable {

    private static final long serialVersionUID = 1L;

    private AnomalyKind kind;

    private Severity severity;

    /** Metric name or service name. */
    private String subject;

    private Double observedValue;

    private String observedStatus;

    private Double referenceValue;

    private Double limit;

    /** Timestamp of the record the finding belongs to. */
    private Instant timestamp;

    /** Human-readable description. */
    private String details;

    /** Stream the record came from; set by the streaming job. */
    private String source;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public Anomaly() {
    }

    private Anomaly(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "kind must not be null");
        this.subject = Objects.requireNonNull(builder.subject, "subject must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.severity = builder.severity != null ? builder.severity : kind.severity();
        this.observedValue = builder.observedValue;
        this.observedStatus = builder.observedStatus;
        this.referenceValue = builder.referenceValue;
        this.limit = builder.limit;
        this.details = builder.details;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Anomaly} instances.
     */
    public static class Builder {
        private AnomalyKind kind;
        private Severity severity;
        private String subject;
        private Double observedValue;
        private String observedStatus;
        private Double referenceValue;
        private Double limit;
        private Instant timestamp;
        private String details;

        public Builder kind(AnomalyKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder observedValue(Double observedValue) {
            this.observedValue = observedValue;
            return this;
        }

        public Builder observedStatus(String observedStatus) {
            this.observedStatus = observedStatus;
            return this;
        }

        public Builder referenceValue(Double referenceValue) {
            this.referenceValue = referenceValue;
            return this;
        }

        public Builder limit(Double limit) {
            this.limit = limit;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        /**
         * Build the anomaly.
         *
         * @return a new {@link Anomaly}
         * @throws NullPointerException if {@code kind}, {@code subject} or
         *                              {@code timestamp} is {@code null}
         */
        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public AnomalyKind getKind() {
        return kind;
    }

    public void setKind(AnomalyKind kind) {
        this.kind = kind;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject;
    }

    public Double getObservedValue() {
        return observedValue;
    }

    public void setObservedValue(Double observedValue) {
        this.observedValue = observedValue;
    }

    public String getObservedStatus() {
        return observedStatus;
    }

    public void setObservedStatus(String observedStatus) {
        this.observedStatus = observedStatus;
    }

    public Double getReferenceValue() {
        return referenceValue;
    }

    public void setReferenceValue(Double referenceValue) {
        this.referenceValue = referenceValue;
    }

    public Double getLimit() {
        return limit;
    }

    public void setLimit(Double limit) {
        this.limit = limit;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return kind == that.kind
                && severity == that.severity
                && Objects.equals(subject, that.subject)
                && Objects.equals(observedValue, that.observedValue)
                && Objects.equals(observedStatus, that.observedStatus)
                && Objects.equals(referenceValue, that.referenceValue)
                && Objects.equals(limit, that.limit)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(details, that.details)
                && Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, severity, subject, observedValue, observedStatus,
                referenceValue, limit, timestamp);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "kind=" + kind +
                ", severity=" + severity +
                ", subject='" + subject + '\'' +
                (source != null ? ", source='" + source + '\'' : "") +
                ", timestamp=" + timestamp +
                ", details='" + details + '\'' +
                '}';
    }
}

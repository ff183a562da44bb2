package com.infrasentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed view of one telemetry record.
 *
 * <p>
 * Raw records are free-form JSON objects. At the ingestion boundary they are
 * split into three ordered groups so the detection engine never has to guess
 * at a field's type:
 * </p>
 * <ul>
 * <li><b>metrics</b>: numeric fields such as {@code cpu_usage}; a
 * {@code null} value means the metric was not reported</li>
 * <li><b>statuses</b>: categorical fields named
 * {@value #STATUS_PREFIX}{@code <service>}, keyed by service name</li>
 * <li><b>attributes</b>: every other string field (e.g. {@code host})</li>
 * </ul>
 *
 * <p>
 * Instances are immutable; accessors return unmodifiable views. Insertion
 * order of each group is preserved.
 * </p>
 *
 * @since 1.0.0
 */
public final class TelemetryRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Field-name prefix that marks a categorical service-status field. */
    public static final String STATUS_PREFIX = "service_status_";

    /** Name of the ordering field. */
    public static final String TIMESTAMP_FIELD = "timestamp";

    private final Instant timestamp;
    private final LinkedHashMap<String, Double> metrics;
    private final LinkedHashMap<String, String> statuses;
    private final LinkedHashMap<String, String> attributes;

    private TelemetryRecord(Builder builder) {
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.metrics = new LinkedHashMap<>(builder.metrics);
        this.statuses = new LinkedHashMap<>(builder.statuses);
        this.attributes = new LinkedHashMap<>(builder.attributes);
    }

    /**
     * Start a record at the given timestamp.
     *
     * @param timestamp record timestamp; must not be {@code null}
     * @return a new builder
     */
    public static Builder builder(Instant timestamp) {
        return new Builder(timestamp);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return unmodifiable map of metric name to value; values may be
     *         {@code null}
     */
    public Map<String, Double> getMetrics() {
        return Collections.unmodifiableMap(metrics);
    }

    /**
     * @return unmodifiable map of service name to reported status
     */
    public Map<String, String> getStatuses() {
        return Collections.unmodifiableMap(statuses);
    }

    /**
     * @return unmodifiable map of the remaining string fields
     */
    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * Value of a metric, if reported and not {@code null}.
     *
     * @param name metric name
     * @return the value, or empty
     */
    public Optional<Double> getMetric(String name) {
        return Optional.ofNullable(metrics.get(name));
    }

    /**
     * @param name attribute name
     * @return the attribute value, or empty
     */
    public Optional<String> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link TelemetryRecord}.
     */
    public static class Builder {
        private final Instant timestamp;
        private final Map<String, Double> metrics = new LinkedHashMap<>();
        private final Map<String, String> statuses = new LinkedHashMap<>();
        private final Map<String, String> attributes = new LinkedHashMap<>();

        private Builder(Instant timestamp) {
            this.timestamp = timestamp;
        }

        /**
         * Add a numeric metric.
         *
         * @param name  metric name; must not be {@code null} nor carry the status
         *              prefix
         * @param value the value, or {@code null} when not reported
         * @return this builder
         * @throws RecordFormatException if the value is NaN or infinite
         */
        public Builder metric(String name, Double value) {
            Objects.requireNonNull(name, "Metric name must not be null");
            if (name.startsWith(STATUS_PREFIX)) {
                throw new RecordFormatException(
                        "Field '" + name + "' is a service-status field and cannot hold a number");
            }
            if (value != null && !Double.isFinite(value)) {
                throw new RecordFormatException("Metric '" + name + "' is not finite: " + value);
            }
            metrics.put(name, value);
            return this;
        }

        /**
         * Add a service status.
         *
         * @param service service name, without the status prefix
         * @param status  reported status
         * @return this builder
         */
        public Builder status(String service, String status) {
            Objects.requireNonNull(service, "Service name must not be null");
            Objects.requireNonNull(status, "Status of service '" + service + "' must not be null");
            statuses.put(service, status);
            return this;
        }

        public Builder attribute(String name, String value) {
            Objects.requireNonNull(name, "Attribute name must not be null");
            Objects.requireNonNull(value, "Attribute '" + name + "' must not be null");
            attributes.put(name, value);
            return this;
        }

        public TelemetryRecord build() {
            return new TelemetryRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TelemetryRecord that))
            return false;
        return timestamp.equals(that.timestamp)
                && metrics.equals(that.metrics)
                && statuses.equals(that.statuses)
                && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, metrics, statuses, attributes);
    }

    @Override
    public String toString() {
        return "TelemetryRecord{" +
                "timestamp=" + timestamp +
                ", metrics=" + metrics +
                ", statuses=" + statuses +
                ", attributes=" + attributes +
                '}';
    }
}

package com.infrasentinel.core.ingest;

import com.infrasentinel.core.model.RecordFormatException;
import com.infrasentinel.core.model.TelemetryRecord;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Map;
import java.util.Objects;

/**
 * Converts a raw record (field name to JSON value) into a
 * {@link TelemetryRecord}.
 *
 * <h3>Field mapping</h3>
 * <ul>
 * <li>{@code timestamp}: required; ISO-8601 instant, offset date-time, local
 * date-time (read as UTC, {@code T} or a space between date and time) or epoch
 * milliseconds</li>
 * <li>{@code service_status} holding an object: flattened, one status per
 * entry</li>
 * <li>{@code service_status_<name>}: status of service {@code <name>}</li>
 * <li>numbers: metrics; {@code null}: metric not reported</li>
 * <li>other strings: attributes</li>
 * </ul>
 * <p>
 * Booleans, arrays and nested objects anywhere else are rejected.
 * </p>
 *
 * @since 1.0.0
 */
public final class RecordParser {

    /** Nested status object flattened into {@code service_status_<name>} fields. */
    public static final String NESTED_STATUS_FIELD = "service_status";

    private RecordParser() {
        // utility class; not instantiable
    }

    /**
     * @param fields raw record; must not be {@code null}
     * @return the typed record
     * @throws RecordFormatException if the record violates the field mapping
     */
    public static TelemetryRecord parse(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "Record fields must not be null");

        TelemetryRecord.Builder builder = TelemetryRecord.builder(
                parseTimestamp(fields.get(TelemetryRecord.TIMESTAMP_FIELD)));

        for (Map.Entry<String, ?> entry : fields.entrySet()) {
            String name = entry.getKey();
            Object value = entry.getValue();

            if (TelemetryRecord.TIMESTAMP_FIELD.equals(name)) {
                continue;
            }
            if (NESTED_STATUS_FIELD.equals(name) && value instanceof Map<?, ?> nested) {
                nested.forEach((service, status) -> addStatus(builder, String.valueOf(service), status));
            } else if (name.startsWith(TelemetryRecord.STATUS_PREFIX)) {
                addStatus(builder, name.substring(TelemetryRecord.STATUS_PREFIX.length()), value);
            } else if (value == null) {
                builder.metric(name, null);
            } else if (value instanceof Number n) {
                builder.metric(name, n.doubleValue());
            } else if (value instanceof String s) {
                builder.attribute(name, s);
            } else {
                throw new RecordFormatException("Field '" + name + "' has unsupported type "
                        + value.getClass().getSimpleName());
            }
        }
        return builder.build();
    }

    /**
     * @param raw timestamp value as found in the record
     * @return the parsed instant
     * @throws RecordFormatException if the value is missing or unparseable
     */
    public static Instant parseTimestamp(Object raw) {
        if (raw == null) {
            throw new RecordFormatException("Record has no '" + TelemetryRecord.TIMESTAMP_FIELD + "' field");
        }
        if (raw instanceof Number n) {
            return Instant.ofEpochMilli(n.longValue());
        }
        if (!(raw instanceof String text) || text.isBlank()) {
            throw new RecordFormatException("Unsupported timestamp: " + raw);
        }

        String iso = text.trim().replaceFirst(" ", "T");
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                    iso, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new RecordFormatException("Unparseable timestamp: '" + text + "'", e);
        }
    }

    private static void addStatus(TelemetryRecord.Builder builder, String service, Object status) {
        if (status == null) {
            return;
        }
        if (!(status instanceof String s)) {
            throw new RecordFormatException("Status of service '" + service + "' must be a string, got: "
                    + status);
        }
        builder.status(service, s);
    }
}

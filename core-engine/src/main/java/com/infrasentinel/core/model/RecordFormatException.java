package com.infrasentinel.core.model;

/**
 * Thrown when a telemetry record violates its typing contract: a missing or
 * unparseable timestamp, a non-numeric value in a numeric metric field, or a
 * field whose JSON type has no place in a record.
 *
 * @since 1.0.0
 */
public class RecordFormatException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public RecordFormatException(String message) {
        super(message);
    }

    public RecordFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

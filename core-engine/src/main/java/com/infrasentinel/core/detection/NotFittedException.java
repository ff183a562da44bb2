package com.infrasentinel.core.detection;

/**
 * Thrown when a record is processed by a detector that has not been fitted on
 * a baseline.
 *
 * @since 1.0.0
 */
public class NotFittedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public NotFittedException(String message) {
        super(message);
    }
}

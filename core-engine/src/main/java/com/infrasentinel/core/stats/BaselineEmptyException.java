package com.infrasentinel.core.stats;

/**
 * Thrown when baseline statistics are requested from an empty baseline.
 *
 * <p>
 * A detector that cannot be fitted never becomes ready, so this is fatal at
 * startup.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineEmptyException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public BaselineEmptyException(String message) {
        super(message);
    }
}

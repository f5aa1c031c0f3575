package com.mlab.telescope.exception;

/**
 * A retrieved result row could not be turned into a measurement.
 * Fails the whole batch the row came from.
 */
public class MeasurementFormatException extends TelescopeException {

    public MeasurementFormatException(String message) {
        super(message);
    }

    public MeasurementFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

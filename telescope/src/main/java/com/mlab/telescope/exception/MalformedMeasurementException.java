package com.mlab.telescope.exception;

public class MalformedMeasurementException extends MeasurementFormatException {

    public MalformedMeasurementException(String message) {
        super(message);
    }

    public MalformedMeasurementException(String message, Throwable cause) {
        super(message, cause);
    }
}

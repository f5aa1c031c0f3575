package com.mlab.telescope.exception;

public class MissingFieldException extends MeasurementFormatException {

    private final String field;

    public MissingFieldException(String field) {
        super("MissingField: " + field);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}

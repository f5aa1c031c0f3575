package com.mlab.telescope.exception;

/**
 * The warehouse could not be reached or answered with something unusable.
 *
 * Says nothing about the job itself; the outcome is indeterminate and the
 * operation may be retried.
 */
public class WarehouseCommunicationException extends WarehouseException {

    public WarehouseCommunicationException(String message) {
        super(message);
    }

    public WarehouseCommunicationException(String message, Throwable cause) {
        super(message + " (" + cause.getMessage() + ")", cause);
    }
}

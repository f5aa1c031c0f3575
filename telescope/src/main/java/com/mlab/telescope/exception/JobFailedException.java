package com.mlab.telescope.exception;

/**
 * The warehouse rejected the query or reported the job as failed.
 * Asking again will not change the answer.
 */
public class JobFailedException extends WarehouseException {

    private final int httpStatus;

    public JobFailedException(int httpStatus, String message) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public JobFailedException(int httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    /** HTTP status of the rejecting response, or 0 when reported through job status. */
    public int getHttpStatus() {
        return httpStatus;
    }
}

package com.mlab.telescope.exception;

public class UnknownJobStateException extends WarehouseException {

    public UnknownJobStateException(String jobId, String state) {
        super("Unknown state '" + state + "' reported for job " + jobId);
    }
}

package com.mlab.telescope.exception;

public class TableDoesNotExistException extends WarehouseException {

    public TableDoesNotExistException(String jobId, Throwable cause) {
        super("Requested tables do not exist for job " + jobId, cause);
    }
}

package com.mlab.telescope.exception;

/**
 * Failure while talking to the data warehouse or reported by it.
 */
public class WarehouseException extends TelescopeException {

    public WarehouseException(String message) {
        super(message);
    }

    public WarehouseException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.mlab.telescope.exception;

/**
 * Base class of every failure Telescope raises on purpose.
 */
public class TelescopeException extends RuntimeException {

    public TelescopeException(String message) {
        super(message);
    }

    public TelescopeException(String message, Throwable cause) {
        super(message, cause);
    }
}

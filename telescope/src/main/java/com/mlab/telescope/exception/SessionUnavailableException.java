package com.mlab.telescope.exception;

/**
 * No authenticated warehouse session could be established. Stops the run.
 */
public class SessionUnavailableException extends TelescopeException {

    public SessionUnavailableException(String message) {
        super(message);
    }

    public SessionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.mlab.telescope.exception;

public class SelectorParseException extends TelescopeException {

    public SelectorParseException(String message) {
        super(message);
    }

    public SelectorParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

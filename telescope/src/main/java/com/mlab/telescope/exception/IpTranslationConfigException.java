package com.mlab.telescope.exception;

public class IpTranslationConfigException extends TelescopeException {

    public IpTranslationConfigException(String message) {
        super(message);
    }
}

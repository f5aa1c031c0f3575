package com.mlab.telescope.exception;

public class SiteResolutionException extends TelescopeException {

    public SiteResolutionException(String hostname, Throwable cause) {
        super("Failed to resolve hostname `" + hostname + "'", cause);
    }
}

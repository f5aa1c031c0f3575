package com.mlab.telescope.exception;

public class NoClientNetworkBlocksFoundException extends TelescopeException {

    public NoClientNetworkBlocksFoundException(String providerName) {
        super("Could not find IP blocks associated with client provider " + providerName + ".");
    }
}

package com.mlab.telescope.exception;

public class UnsupportedMetricException extends TelescopeException {

    public UnsupportedMetricException(String metric) {
        super("UnsupportedMetric: " + metric);
    }
}

package com.mlab.telescope.model;

/**
 * One reduced measurement: unix timestamp in seconds and the metric value.
 */
public record ResultRow(long timestamp, double value) {
}

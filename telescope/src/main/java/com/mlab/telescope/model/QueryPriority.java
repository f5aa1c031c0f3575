package com.mlab.telescope.model;

/**
 * Execution tier a query job is submitted with.
 */
public enum QueryPriority {
    INTERACTIVE,
    BATCH
}

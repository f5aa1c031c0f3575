package com.mlab.telescope.model;

/**
 * Counts of how the work items of one scheduler run were resolved.
 * Indeterminate outcomes are requeued, so they only show up as {@code retried}.
 */
public record RunSummary(int succeeded, int failed, int retried, int abandoned) {
}

package com.mlab.telescope.model;

/**
 * How a dispatched work item ended.
 */
public enum TaskOutcome {
    /** Results retrieved and written. */
    SUCCEEDED,
    /** Fatal classification; the item must not be requeued. */
    FAILED,
    /** Neither; the item goes back on the queue. */
    INDETERMINATE
}

package com.mlab.telescope.model;

/**
 * States a warehouse job moves through. PENDING is the submitted-but-queued state.
 */
public enum JobState {
    PENDING,
    RUNNING,
    DONE,
    FAILED
}

package com.mlab.telescope.model;

/**
 * One observation of a job's state.
 *
 * @param rawState state string exactly as reported, kept for error messages
 * @param state parsed state, or null if the warehouse reported something unknown
 * @param errorMessage error result of a failed job, otherwise null
 */
public record JobStatus(String jobId, String rawState, JobState state, String errorMessage) {
}

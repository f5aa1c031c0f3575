package com.mlab.telescope.service;

import com.mlab.telescope.model.JobStatus;
import com.mlab.telescope.model.QueryPriority;
import com.mlab.telescope.model.ResultPage;

/**
 * The three warehouse calls a query job needs. Implementations classify
 * failures into the {@link com.mlab.telescope.exception.WarehouseException}
 * family and never retry on their own.
 */
public interface WarehouseClient {

    /**
     * Start an asynchronous query job.
     *
     * @return the job id assigned by the warehouse
     * @throws com.mlab.telescope.exception.WarehouseCommunicationException on any failure
     */
    String insertQueryJob(String queryText, QueryPriority priority);

    /**
     * @throws com.mlab.telescope.exception.WarehouseCommunicationException when the status cannot be read
     */
    JobStatus getJobStatus(String jobId);

    /**
     * Fetch one page of a completed job's results.
     *
     * @param pageToken null for the first page
     * @throws com.mlab.telescope.exception.TableDoesNotExistException on 404
     * @throws com.mlab.telescope.exception.JobFailedException on 400
     * @throws com.mlab.telescope.exception.WarehouseCommunicationException on anything else
     */
    ResultPage getQueryResults(String jobId, String pageToken, int maxResults);
}

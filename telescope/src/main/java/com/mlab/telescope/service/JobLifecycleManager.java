package com.mlab.telescope.service;

import com.mlab.telescope.config.TelescopeProperties;
import com.mlab.telescope.exception.JobFailedException;
import com.mlab.telescope.exception.UnknownJobStateException;
import com.mlab.telescope.exception.WarehouseCommunicationException;
import com.mlab.telescope.model.JobStatus;
import com.mlab.telescope.model.QueryPriority;
import com.mlab.telescope.model.ResultPage;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Drives one warehouse job from submission to retrieved rows.
 *
 * Job state lives on the warehouse side and is only ever observed:
 * PENDING and RUNNING are waited out, DONE hands over to the caller, FAILED
 * and anything unrecognised end the job. A failed status read says nothing
 * about the job, so polling carries on after it.
 */
@Slf4j
public class JobLifecycleManager {

    private final WarehouseClient client;
    private final TelescopeProperties.Polling polling;
    private final int pageSize;
    private final Retry pageRetry;

    public JobLifecycleManager(WarehouseClient client, TelescopeProperties.Polling polling, int pageSize,
                               Retry pageRetry) {
        this.client = client;
        this.polling = polling;
        this.pageSize = pageSize;
        this.pageRetry = pageRetry;
    }

    /**
     * Submit a query job. Nothing is tracked locally if this fails.
     *
     * @throws WarehouseCommunicationException when the job could not be created
     */
    public String submit(String queryText, QueryPriority priority) {
        return client.insertQueryJob(queryText, priority);
    }

    /**
     * Block until the job is DONE, then run {@code onDone}.
     *
     * @param label human readable description of the job for log lines
     * @throws JobFailedException       if the warehouse reports the job failed
     * @throws UnknownJobStateException if the warehouse reports a state we do not know
     * @throws WarehouseCommunicationException if the waiting thread is interrupted
     */
    public void awaitCompletion(String jobId, String label, Runnable onDone) {
        Instant startedChecking = Instant.now();
        log.info("Queued request for {}, received job id: {}", label, jobId);

        while (true) {
            JobStatus status;
            try {
                status = client.getJobStatus(jobId);
            } catch (WarehouseCommunicationException e) {
                log.warn("Encountered error ({}) monitoring for {}, could be temporary, not bailing out.",
                        e.getMessage(), label);
                pause(polling.getRunningInterval(), jobId);
                continue;
            }

            if (status.state() == null) {
                throw new UnknownJobStateException(jobId, status.rawState());
            }

            long waited = Duration.between(startedChecking, Instant.now()).toSeconds();
            switch (status.state()) {
                case RUNNING -> {
                    log.info("Waiting for {} to complete, spent {} seconds so far.", label, waited);
                    pause(polling.getRunningInterval(), jobId);
                }
                case PENDING -> {
                    log.info("Waiting for {} to submit, spent {} seconds so far.", label, waited);
                    pause(polling.getPendingInterval(), jobId);
                }
                case DONE -> {
                    log.info("Found completion status for {}.", label);
                    onDone.run();
                    return;
                }
                case FAILED -> throw new JobFailedException(0, "Job " + jobId + " failed: " + status.errorMessage());
            }
        }
    }

    /**
     * Fetch every result row of a completed job, one page at a time.
     * Each page is retried on communication failures; a table that does not
     * exist or a rejected query fails immediately.
     */
    public List<Map<String, String>> retrieveResults(String jobId) {
        List<Map<String, String>> collected = new ArrayList<>();
        String pageToken = null;

        do {
            String token = pageToken;
            ResultPage page = pageRetry.executeSupplier(() -> client.getQueryResults(jobId, token, pageSize));

            if (page.totalRows() == 0) {
                log.warn("Query completed successfully, but result contained no rows.");
                return collected;
            }

            collected.addAll(page.rows());
            pageToken = page.hasNextPage() ? page.pageToken() : null;
            if (pageToken != null) {
                log.debug("Query contains additional results (found {} rows so far). "
                        + "Fetching additional rows with new page token.", collected.size());
            }
        } while (pageToken != null);

        return collected;
    }

    private void pause(Duration interval, String jobId) {
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new WarehouseCommunicationException("Interrupted while waiting on job " + jobId);
        }
    }
}

package com.mlab.telescope.scheduler;

import com.mlab.telescope.config.TelescopeProperties;
import com.mlab.telescope.exception.JobFailedException;
import com.mlab.telescope.exception.MeasurementFormatException;
import com.mlab.telescope.exception.TableDoesNotExistException;
import com.mlab.telescope.exception.UnknownJobStateException;
import com.mlab.telescope.exception.UnsupportedMetricException;
import com.mlab.telescope.exception.WarehouseCommunicationException;
import com.mlab.telescope.exception.WarehouseException;
import com.mlab.telescope.model.QueryPriority;
import com.mlab.telescope.model.ResultRow;
import com.mlab.telescope.model.RunSummary;
import com.mlab.telescope.model.TaskOutcome;
import com.mlab.telescope.model.WorkItem;
import com.mlab.telescope.output.ResultSink;
import com.mlab.telescope.service.JobLifecycleManager;
import com.mlab.telescope.service.JobLifecycleManagerFactory;
import com.mlab.telescope.service.MeasurementPipeline;
import com.mlab.telescope.service.SessionProvider;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs work items against the warehouse with at most N jobs in flight.
 *
 * One coordinating thread drains the queue: it takes a permit, submits the
 * job, and hands the rest of the job's life (polling, retrieval, reduction,
 * output) to a worker. Items whose submission failed go straight back on the
 * queue after a cooldown. Once the queue is drained every dispatched task is
 * joined, items with an indeterminate outcome are requeued, and the cycle
 * repeats until nothing is left or shutdown is requested.
 *
 * Items are only ever taken off the queue by resolving them. Dispatched tasks
 * always run to completion, even after shutdown is requested. Anything still
 * queued at shutdown is logged as abandoned.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QueryWorkScheduler {

    private final SessionProvider sessionProvider;
    private final JobLifecycleManagerFactory managerFactory;
    private final MeasurementPipeline pipeline;
    private final ResultSink resultSink;
    private final TelescopeProperties properties;

    private final AtomicBoolean shutdownRequested = new AtomicBoolean();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxObservedInFlight = new AtomicInteger();

    /**
     * Process every item, blocking until all are resolved or shutdown is requested.
     *
     * @throws com.mlab.telescope.exception.SessionUnavailableException if no
     *         authenticated session can be obtained; nothing is submitted then
     */
    public RunSummary run(List<WorkItem> items, int maxConcurrentJobs) {
        if (maxConcurrentJobs < 1) {
            throw new IllegalArgumentException("maxConcurrentJobs must be at least 1, got " + maxConcurrentJobs);
        }
        LinkedBlockingQueue<WorkItem> queue = new LinkedBlockingQueue<>(items);
        if (queue.isEmpty()) {
            log.info("No work items to run.");
            return new RunSummary(0, 0, 0, 0);
        }

        Semaphore permits = new Semaphore(maxConcurrentJobs);
        ExecutorService workers = Executors.newFixedThreadPool(maxConcurrentJobs);
        int succeeded = 0;
        int failed = 0;
        int retried = 0;

        try {
            JobLifecycleManager manager = managerFactory.forSession(sessionProvider.getSession());

            while (!queue.isEmpty() && !shutdownRequested.get()) {
                List<Dispatched> dispatched = dispatchAll(queue, permits, manager, workers);

                for (Dispatched task : dispatched) {
                    TaskOutcome outcome = join(task);
                    switch (outcome) {
                        case SUCCEEDED -> succeeded++;
                        case FAILED -> failed++;
                        case INDETERMINATE -> {
                            retried++;
                            log.info("Requeueing {} after an indeterminate outcome.", task.item().getMetadata().describe());
                            queue.add(task.item().withRetry(true));
                        }
                    }
                }
            }
        } finally {
            workers.shutdown();
        }

        int abandoned = queue.size();
        if (abandoned > 0) {
            log.warn("Shutdown requested, abandoning {} queued work items.", abandoned);
            queue.forEach(item -> log.warn("Abandoned: {}", item.getMetadata().describe()));
        }
        log.info("Scheduler finished: {} succeeded, {} failed, {} retried, {} abandoned.",
                succeeded, failed, retried, abandoned);
        return new RunSummary(succeeded, failed, retried, abandoned);
    }

    /**
     * Stop dispatching new jobs. Jobs already running on the warehouse are not cancelled.
     */
    @PreDestroy
    public void requestShutdown() {
        if (shutdownRequested.compareAndSet(false, true)) {
            log.info("Shutdown requested, no further jobs will be dispatched.");
        }
    }

    public int maxObservedInFlight() {
        return maxObservedInFlight.get();
    }

    QueryPriority priorityFor(WorkItem item) {
        return item.getQuery().tableSpan() > properties.getWarehouse().getBatchTableThreshold()
                ? QueryPriority.BATCH
                : QueryPriority.INTERACTIVE;
    }

    // ── Dispatch ─────────────────────────────────────────────────────────────

    private List<Dispatched> dispatchAll(LinkedBlockingQueue<WorkItem> queue, Semaphore permits,
                                         JobLifecycleManager manager, ExecutorService workers) {
        List<Dispatched> dispatched = new ArrayList<>();
        WorkItem item;

        while (!shutdownRequested.get() && (item = queue.poll()) != null) {
            if (!acquire(permits)) {
                queue.add(item);
                break;
            }

            String jobId;
            try {
                jobId = manager.submit(item.getQuery().getText(), priorityFor(item));
            } catch (WarehouseException e) {
                permits.release();
                log.warn("Failed to submit job for {}: {}. Requeueing.", item.getMetadata().describe(), e.getMessage());
                queue.add(item.withRetry(true));
                if (!pause(properties.getScheduler().getSubmitCooldown())) {
                    break;
                }
                continue;
            }

            int running = inFlight.incrementAndGet();
            maxObservedInFlight.accumulateAndGet(running, Math::max);

            WorkItem submitted = item;
            Future<TaskOutcome> future = workers.submit(() -> {
                try {
                    return execute(manager, jobId, submitted);
                } finally {
                    inFlight.decrementAndGet();
                    permits.release();
                }
            });
            dispatched.add(new Dispatched(submitted, future));
        }
        return dispatched;
    }

    /**
     * Wait for a free slot, logging periodically while at the ceiling.
     *
     * @return false if interrupted, in which case shutdown has been requested
     */
    private boolean acquire(Semaphore permits) {
        Duration pollInterval = properties.getScheduler().getCapacityPollInterval();
        try {
            while (!permits.tryAcquire(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                log.debug("Reached maximum number of concurrent queries ({} in flight), waiting.", inFlight.get());
                if (shutdownRequested.get()) {
                    return false;
                }
            }
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            requestShutdown();
            return false;
        }
    }

    /**
     * Wait for a dispatched task to finish. An interrupt requests shutdown but
     * does not stop the wait: the task is already running and its real outcome
     * is what gets counted. The interrupt flag is restored afterwards.
     */
    private TaskOutcome join(Dispatched task) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return task.future().get();
                } catch (InterruptedException ie) {
                    interrupted = true;
                    requestShutdown();
                }
            }
        } catch (ExecutionException e) {
            log.error("Task for {} ended unexpectedly: {}", task.item().getMetadata().describe(),
                    e.getCause() == null ? e.getMessage() : e.getCause().getMessage(), e.getCause());
            return TaskOutcome.INDETERMINATE;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // ── Task ─────────────────────────────────────────────────────────────────

    private TaskOutcome execute(JobLifecycleManager manager, String jobId, WorkItem item) {
        String label = item.getMetadata().describe();
        try {
            manager.awaitCompletion(jobId, label, () -> log.debug("Retrieving results of job {}.", jobId));
            List<Map<String, String>> rows = manager.retrieveResults(jobId);
            List<ResultRow> results = pipeline.process(item.getMetadata().getMetric(), rows);

            if (!resultSink.write(item.getOutputPath(), results)) {
                log.error("Could not write results for {} to {}.", label, item.getOutputPath());
                return TaskOutcome.FAILED;
            }
            return TaskOutcome.SUCCEEDED;

        } catch (TableDoesNotExistException | JobFailedException | UnknownJobStateException e) {
            log.error("Job {} for {} failed: {}", jobId, label, e.getMessage());
            return TaskOutcome.FAILED;
        } catch (MeasurementFormatException | UnsupportedMetricException e) {
            log.error("Results of {} could not be processed: {}", label, e.getMessage());
            return TaskOutcome.FAILED;
        } catch (WarehouseCommunicationException e) {
            log.warn("Lost contact with job {} for {}: {}", jobId, label, e.getMessage());
            return TaskOutcome.INDETERMINATE;
        } catch (RuntimeException e) {
            log.error("Unexpected error processing {}: {}", label, e.getMessage(), e);
            return TaskOutcome.INDETERMINATE;
        }
    }

    private boolean pause(Duration interval) {
        try {
            Thread.sleep(interval.toMillis());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            requestShutdown();
            return false;
        }
    }

    private record Dispatched(WorkItem item, Future<TaskOutcome> future) {
    }
}

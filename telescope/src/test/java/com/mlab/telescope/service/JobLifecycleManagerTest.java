package com.mlab.telescope.service;

import com.mlab.telescope.config.TelescopeProperties;
import com.mlab.telescope.config.WarehouseConfig;
import com.mlab.telescope.exception.JobFailedException;
import com.mlab.telescope.exception.TableDoesNotExistException;
import com.mlab.telescope.exception.UnknownJobStateException;
import com.mlab.telescope.exception.WarehouseCommunicationException;
import com.mlab.telescope.model.JobState;
import com.mlab.telescope.model.JobStatus;
import com.mlab.telescope.model.ResultPage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobLifecycleManagerTest {

    private static final int PAGE_SIZE = 100;

    @Mock
    WarehouseClient client;

    private JobLifecycleManager manager;

    @BeforeEach
    void setUp() {
        TelescopeProperties.Polling polling = new TelescopeProperties.Polling();
        polling.setRunningInterval(Duration.ofMillis(1));
        polling.setPendingInterval(Duration.ofMillis(1));

        TelescopeProperties.Retrieval retrieval = new TelescopeProperties.Retrieval();
        retrieval.setRetryBackoff(Duration.ofMillis(1));

        manager = new JobLifecycleManager(client, polling, PAGE_SIZE, WarehouseConfig.resultPageRetry(retrieval));
    }

    private static JobStatus status(JobState state) {
        return new JobStatus("job_1", state == null ? "BOGUS" : state.name(), state, null);
    }

    @SafeVarargs
    private static ResultPage page(long totalRows, String pageToken, Map<String, String>... rows) {
        return new ResultPage(totalRows, List.of(rows), pageToken);
    }

    @Nested
    class awaitCompletion {

        @Test
        void waitsThroughPendingAndRunning() {
            when(client.getJobStatus("job_1")).thenReturn(
                    status(JobState.PENDING), status(JobState.RUNNING), status(JobState.DONE));
            AtomicInteger callbacks = new AtomicInteger();

            manager.awaitCompletion("job_1", "test job", callbacks::incrementAndGet);

            assertThat(callbacks).hasValue(1);
            verify(client, times(3)).getJobStatus("job_1");
        }

        @Test
        void keepsPollingThroughCommunicationErrors() {
            when(client.getJobStatus("job_1"))
                    .thenThrow(new WarehouseCommunicationException("connection reset"))
                    .thenReturn(status(JobState.DONE));
            AtomicInteger callbacks = new AtomicInteger();

            manager.awaitCompletion("job_1", "test job", callbacks::incrementAndGet);

            assertThat(callbacks).hasValue(1);
        }

        @Test
        void failedJob() {
            when(client.getJobStatus("job_1")).thenReturn(status(JobState.FAILED));

            assertThatThrownBy(() -> manager.awaitCompletion("job_1", "test job", () -> { }))
                    .isInstanceOf(JobFailedException.class);
        }

        @Test
        void unknownState() {
            when(client.getJobStatus("job_1")).thenReturn(status(null));

            assertThatThrownBy(() -> manager.awaitCompletion("job_1", "test job", () -> { }))
                    .isInstanceOf(UnknownJobStateException.class);
        }

        @Test
        void interruptedWaitIsCommunicationError() {
            when(client.getJobStatus("job_1")).thenReturn(status(JobState.RUNNING));
            Thread.currentThread().interrupt();

            try {
                assertThatThrownBy(() -> manager.awaitCompletion("job_1", "test job", () -> { }))
                        .isInstanceOf(WarehouseCommunicationException.class);
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
            } finally {
                Thread.interrupted();
            }
        }
    }

    @Nested
    class retrieveResults {

        @Test
        void followsPageTokens() {
            when(client.getQueryResults("job_1", null, PAGE_SIZE))
                    .thenReturn(page(3, "page-2", Map.of("a", "1"), Map.of("a", "2")));
            when(client.getQueryResults("job_1", "page-2", PAGE_SIZE))
                    .thenReturn(page(3, null, Map.of("a", "3")));

            assertThat(manager.retrieveResults("job_1"))
                    .containsExactly(Map.of("a", "1"), Map.of("a", "2"), Map.of("a", "3"));
        }

        @Test
        void noRows() {
            when(client.getQueryResults("job_1", null, PAGE_SIZE)).thenReturn(page(0, null));

            assertThat(manager.retrieveResults("job_1")).isEmpty();
        }

        @Test
        void retriesCommunicationErrors() {
            when(client.getQueryResults("job_1", null, PAGE_SIZE))
                    .thenThrow(new WarehouseCommunicationException("timeout"))
                    .thenThrow(new WarehouseCommunicationException("timeout"))
                    .thenReturn(page(1, null, Map.of("a", "1")));

            assertThat(manager.retrieveResults("job_1")).containsExactly(Map.of("a", "1"));
            verify(client, times(3)).getQueryResults("job_1", null, PAGE_SIZE);
        }

        @Test
        void givesUpAfterFiveAttempts() {
            when(client.getQueryResults("job_1", null, PAGE_SIZE))
                    .thenThrow(new WarehouseCommunicationException("timeout"));

            assertThatThrownBy(() -> manager.retrieveResults("job_1"))
                    .isInstanceOf(WarehouseCommunicationException.class);
            verify(client, times(5)).getQueryResults("job_1", null, PAGE_SIZE);
        }

        @Test
        void missingTableIsNotRetried() {
            when(client.getQueryResults(eq("job_1"), isNull(), any(Integer.class)))
                    .thenThrow(new TableDoesNotExistException("job_1", null));

            assertThatThrownBy(() -> manager.retrieveResults("job_1"))
                    .isInstanceOf(TableDoesNotExistException.class);
            verify(client, times(1)).getQueryResults("job_1", null, PAGE_SIZE);
        }

        @Test
        void rejectedQueryIsNotRetried() {
            when(client.getQueryResults("job_1", null, PAGE_SIZE))
                    .thenThrow(new JobFailedException(400, "Invalid query"));

            assertThatThrownBy(() -> manager.retrieveResults("job_1"))
                    .isInstanceOf(JobFailedException.class);
            verify(client, times(1)).getQueryResults("job_1", null, PAGE_SIZE);
        }
    }
}

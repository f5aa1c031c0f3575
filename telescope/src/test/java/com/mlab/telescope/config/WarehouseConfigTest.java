package com.mlab.telescope.config;

import com.mlab.telescope.exception.TableDoesNotExistException;
import com.mlab.telescope.exception.WarehouseCommunicationException;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WarehouseConfigTest {

    @Test
    void allowsOneAttemptMoreThanConfiguredRetries() {
        TelescopeProperties.Retrieval retrieval = new TelescopeProperties.Retrieval();

        Retry retry = WarehouseConfig.resultPageRetry(retrieval);

        assertThat(retry.getRetryConfig().getMaxAttempts()).isEqualTo(5);
    }

    @Test
    void onlyCommunicationFailuresAreRetried() {
        Retry retry = WarehouseConfig.resultPageRetry(new TelescopeProperties.Retrieval());

        assertThat(retry.getRetryConfig().getExceptionPredicate()
                .test(new WarehouseCommunicationException("timeout"))).isTrue();
        assertThat(retry.getRetryConfig().getExceptionPredicate()
                .test(new TableDoesNotExistException("job_1", null))).isFalse();
    }
}

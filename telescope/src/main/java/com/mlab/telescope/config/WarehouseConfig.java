package com.mlab.telescope.config;

import com.mlab.telescope.exception.WarehouseCommunicationException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@Slf4j
public class WarehouseConfig {

    @Bean
    public RestTemplate warehouseRestTemplate(RestTemplateBuilder builder, TelescopeProperties properties) {
        return builder
                .setConnectTimeout(properties.getWarehouse().getConnectTimeout())
                .setReadTimeout(properties.getWarehouse().getReadTimeout())
                .build();
    }

    @Bean
    public Retry resultPageRetry(TelescopeProperties properties) {
        return resultPageRetry(properties.getRetrieval());
    }

    /**
     * Retry policy for fetching one page of job results: only communication
     * failures are retried, with a fixed wait between attempts.
     */
    public static Retry resultPageRetry(TelescopeProperties.Retrieval retrieval) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(retrieval.getMaxRetries() + 1)
                .waitDuration(retrieval.getRetryBackoff())
                .retryExceptions(WarehouseCommunicationException.class)
                .build();

        Retry retry = Retry.of("resultPage", config);
        retry.getEventPublisher().onRetry(event -> log.warn(
                "Failed to communicate with the warehouse to retrieve results ({}). "
                        + "Retrying in {} seconds... ({} attempts remaining)",
                event.getLastThrowable().getMessage(),
                event.getWaitInterval().toSeconds(),
                retrieval.getMaxRetries() - event.getNumberOfRetryAttempts() + 1));
        return retry;
    }
}

package com.mlab.telescope.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mlab.telescope.config.TelescopeProperties;
import com.mlab.telescope.model.WarehouseSession;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Builds {@link JobLifecycleManager}s bound to an authenticated session.
 */
@Component
@RequiredArgsConstructor
public class JobLifecycleManagerFactory {

    private final RestTemplate warehouseRestTemplate;
    private final ObjectMapper objectMapper;
    private final TelescopeProperties properties;
    private final Retry resultPageRetry;

    public JobLifecycleManager forSession(WarehouseSession session) {
        WarehouseClient client = new BigQueryRestClient(
                warehouseRestTemplate, objectMapper, properties.getWarehouse().getBaseUrl(), session);
        return new JobLifecycleManager(
                client, properties.getPolling(), properties.getRetrieval().getPageSize(), resultPageRetry);
    }
}

package com.mlab.telescope;

import com.mlab.telescope.config.TelescopeProperties;
import com.mlab.telescope.scheduler.QueryWorkScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "telescope.polling.pending-interval=30s",
        "telescope.scheduler.max-concurrent-jobs=8"
})
class TelescopeApplicationTest {

    @Autowired
    TelescopeProperties properties;

    @Autowired
    QueryWorkScheduler scheduler;

    @Test
    void contextLoadsWithConfiguredProperties() {
        assertThat(scheduler).isNotNull();
        assertThat(properties.getPolling().getPendingInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(properties.getPolling().getRunningInterval()).isEqualTo(Duration.ofSeconds(10));
        assertThat(properties.getScheduler().getMaxConcurrentJobs()).isEqualTo(8);
        assertThat(properties.getWarehouse().getDataset()).isEqualTo("plx.google:m_lab");
    }
}

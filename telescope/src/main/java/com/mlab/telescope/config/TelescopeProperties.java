package com.mlab.telescope.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "telescope")
@Data
public class TelescopeProperties {

    private Warehouse warehouse = new Warehouse();
    private Polling polling = new Polling();
    private Retrieval retrieval = new Retrieval();
    private Scheduler scheduler = new Scheduler();
    private Output output = new Output();
    private Translation translation = new Translation();
    private Auth auth = new Auth();

    @Data
    public static class Warehouse {
        private String baseUrl = "https://www.googleapis.com/bigquery/v2";
        /** Prefix of the monthly NDT tables, rendered as [dataset.YYYY_MM.all]. */
        private String dataset = "plx.google:m_lab";
        /** Queries spanning more monthly tables than this run at BATCH priority. */
        private int batchTableThreshold = 6;
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration readTimeout = Duration.ofMinutes(5);
    }

    @Data
    public static class Polling {
        private Duration runningInterval = Duration.ofSeconds(10);
        private Duration pendingInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class Retrieval {
        private int pageSize = 100_000;
        private int maxRetries = 4;
        private Duration retryBackoff = Duration.ofSeconds(10);
    }

    @Data
    public static class Scheduler {
        private int maxConcurrentJobs = 100;
        private Duration submitCooldown = Duration.ofSeconds(60);
        private Duration capacityPollInterval = Duration.ofSeconds(20);
        /** Selectors tend to arrive in table order; shuffling spreads load across tables. */
        private boolean shuffleSelectors = true;
    }

    @Data
    public static class Output {
        private String outputDir = "processed/";
        private boolean includeHeader = false;
        private int writeAttempts = 3;
        private Duration writeRetryDelay = Duration.ofSeconds(20);
    }

    @Data
    public static class Translation {
        private String maxmindDir = "resources/";
    }

    @Data
    public static class Auth {
        private String credentialsPath = "bigquery_credentials.json";
        /** Overrides the project id found in the credentials file. */
        private String projectId;
    }
}

package com.eyelevel.textextraction.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Binds the {@code app.extraction} properties: ingestion limits and reconciliation behaviour.
 */
@Data
@ConfigurationProperties(prefix = "app.extraction")
public class ExtractionProperties {

    /**
     * Maximum time a record may spend in an attempt cycle before the reconciler times it out.
     */
    private Duration timeoutThreshold = Duration.ofHours(1);

    private Duration reconciliationInterval = Duration.ofSeconds(60);

    /**
     * Failed polls within one attempt cycle after which the record is failed.
     */
    private int maxPollAttempts = 30;

    /**
     * How long a job may stay invisible to the status API before each pass logs a warning.
     */
    private Duration notFoundGracePeriod = Duration.ofMinutes(5);

    private DataSize maxFileSize = DataSize.ofMegabytes(10);

    private RetryConfig submissionRetry = new RetryConfig();

    @Data
    public static class RetryConfig {
        private int attempts = 2;
        private long delayMs = 1000;
    }
}

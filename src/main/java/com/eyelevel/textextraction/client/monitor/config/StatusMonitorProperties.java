package com.eyelevel.textextraction.client.monitor.config;

import com.eyelevel.textextraction.client.monitor.StatusMonitorSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds the {@code app.monitor} properties.
 */
@Data
@ConfigurationProperties(prefix = "app.monitor")
public class StatusMonitorProperties {

    /**
     * Base URL of the text extraction API whose documents are monitored.
     */
    private String baseUrl;

    private Duration fastPollInterval = Duration.ofSeconds(3);

    private Duration slowPollInterval = Duration.ofSeconds(8);

    private Duration slowPollSwitchThreshold = Duration.ofSeconds(60);

    private Duration maxSessionDuration = Duration.ofMinutes(15);

    private Duration requestTimeout = Duration.ofSeconds(10);

    public StatusMonitorSettings toSettings() {
        return new StatusMonitorSettings(fastPollInterval, slowPollInterval, slowPollSwitchThreshold,
                                         maxSessionDuration);
    }
}

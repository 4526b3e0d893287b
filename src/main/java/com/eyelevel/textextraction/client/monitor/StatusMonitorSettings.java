package com.eyelevel.textextraction.client.monitor;

import java.time.Duration;

/**
 * Polling schedule shared by all sessions of a {@link DocumentStatusMonitor}.
 *
 * @param slowPollSwitchThreshold elapsed time after which a session polls at {@code slowPollInterval}
 * @param maxSessionDuration      after this a session stops and reports a client-side timeout
 */
public record StatusMonitorSettings(Duration fastPollInterval, Duration slowPollInterval,
                                    Duration slowPollSwitchThreshold, Duration maxSessionDuration) {

    public static StatusMonitorSettings defaults() {
        return new StatusMonitorSettings(Duration.ofSeconds(3), Duration.ofSeconds(8), Duration.ofSeconds(60),
                                         Duration.ofMinutes(15));
    }
}

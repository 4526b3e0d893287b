package com.eyelevel.textextraction.client.monitor;

import java.time.Duration;

/**
 * Fast interval at first, slow interval once the switch threshold has passed. The switch happens at most
 * once per session and is never reverted.
 */
public class AdaptivePollInterval {

    private final StatusMonitorSettings settings;
    private boolean switched;

    public AdaptivePollInterval(final StatusMonitorSettings settings) {
        this.settings = settings;
    }

    public synchronized Duration next(final Duration elapsed) {
        if (!switched && elapsed.compareTo(settings.slowPollSwitchThreshold()) > 0) {
            switched = true;
        }
        return switched ? settings.slowPollInterval() : settings.fastPollInterval();
    }

    public synchronized boolean isSwitched() {
        return switched;
    }
}

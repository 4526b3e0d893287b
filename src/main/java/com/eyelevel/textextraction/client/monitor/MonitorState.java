package com.eyelevel.textextraction.client.monitor;

/**
 * Lifecycle of one monitoring session. Lives only in the client and is never persisted.
 */
public enum MonitorState {
    NOT_STARTED,
    POLLING,
    /** The document completed. */
    DONE,
    /** The document failed, or the session timed out before it finished. */
    ERRORED,
    CANCELLED;

    public boolean isFinished() {
        return this == DONE || this == ERRORED || this == CANCELLED;
    }
}

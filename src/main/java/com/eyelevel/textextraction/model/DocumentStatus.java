package com.eyelevel.textextraction.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a {@link DocumentRecord}.
 */
public enum DocumentStatus {
    /**
     * Created, or reset by a retry, and not yet dispatched to a backend.
     */
    PENDING,
    /**
     * An external job has been submitted and is being tracked by the reconciler.
     */
    PROCESSING,
    /**
     * Extracted text is available.
     */
    COMPLETED,
    /**
     * Processing ended with a structured error.
     */
    FAILED,
    /**
     * The record did not reach another terminal state within the configured timeout window.
     */
    TIMED_OUT;

    public static final Set<DocumentStatus> ACTIVE_STATUSES = EnumSet.of(PENDING, PROCESSING);
    public static final Set<DocumentStatus> TERMINAL_STATUSES = EnumSet.of(COMPLETED, FAILED, TIMED_OUT);

    public boolean isTerminal() {
        return TERMINAL_STATUSES.contains(this);
    }

    /**
     * Whether a transition from this status to {@code target} follows the forward-only lifecycle.
     * Staying in an active status is allowed so that attempt counters can advance. Leaving a terminal
     * status is only possible through a retry, which is checked separately.
     *
     * @param target the status being written
     * @return true if the transition is a forward move
     */
    public boolean canAdvanceTo(DocumentStatus target) {
        return switch (this) {
            case PENDING -> true;
            case PROCESSING -> target != PENDING;
            case COMPLETED, FAILED, TIMED_OUT -> false;
        };
    }
}

package com.aporkolab.broker.deadletter;

/**
 * Lifecycle of one logical work item in the retry protocol.
 */
public enum WorkState {

    /** Published, not yet picked up. Attempt 0. */
    PENDING,

    PROCESSING,

    SUCCEEDED,

    /** Failed with attempts left; a copy with attempt + 1 waits in the delay queue. */
    RETRY_SCHEDULED,

    /** Out of attempts; parked in the dead-letter queue until resubmitted. */
    DEAD;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == DEAD;
    }
}

package com.aporkolab.broker.deadletter;

import java.time.Duration;

/**
 * Observes retry protocol transitions. Implementations must not throw.
 */
public interface RetryListener {

    RetryListener NOOP = new RetryListener() {
    };

    default void onSucceeded(String workId, int attempt) {
    }

    default void onRetryScheduled(String workId, int nextAttempt, Duration delay) {
    }

    default void onDeadLettered(FailedWork failedWork) {
    }

    default void onResubmitted(String workId) {
    }
}

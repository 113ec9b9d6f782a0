package com.aporkolab.broker.exception;

/**
 * Signals that a work item exhausted its retry budget and must be rejected
 * without requeue so the broker routes it to the dead-letter queue.
 */
public class DeadLetterException extends BrokerException {

    public static final String CODE = "DEAD_LETTERED";

    public DeadLetterException(String workId, int retryCount, Throwable cause) {
        super(
            CODE,
            String.format("Work item '%s' dead-lettered after %d retries: %s", workId, retryCount, cause.getMessage()),
            cause
        );
        with("workId", workId);
        with("retryCount", retryCount);
    }
}

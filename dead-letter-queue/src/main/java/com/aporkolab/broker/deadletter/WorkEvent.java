package com.aporkolab.broker.deadletter;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome notification published to the event exchange.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkEvent(
        String eventType,
        String workId,
        int retryCount,
        String error,
        Object result,
        Instant timestamp) {

    public static WorkEvent success(String eventType, String workId, int retryCount, Object result, Instant timestamp) {
        return new WorkEvent(eventType, workId, retryCount, null, result, timestamp);
    }

    public static WorkEvent failure(String eventType, String workId, int retryCount, String error, Instant timestamp) {
        return new WorkEvent(eventType, workId, retryCount, error, null, timestamp);
    }
}

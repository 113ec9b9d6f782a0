package com.aporkolab.broker.deadletter;

import java.time.Instant;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A work item that exhausted its attempts, kept for inspection and manual resubmission.
 */
public class FailedWork {

    private static final int MAX_STACK_TRACE_LENGTH = 2000;

    private String workId;
    private String sourceQueue;
    private String messageId;
    private JsonNode payload;
    /** Body text when it could not be parsed as JSON; {@code payload} is null then. */
    private String rawBody;
    private int retryCount;
    private String failureReason;
    private FailureType failureType;
    private Instant failedAt;
    private String hostname;
    private String stackTrace;
    private String deadLetterReason;

    private FailedWork() {}

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .workId(workId)
                .sourceQueue(sourceQueue)
                .messageId(messageId)
                .payload(payload)
                .rawBody(rawBody)
                .retryCount(retryCount)
                .failureReason(failureReason)
                .failureType(failureType)
                .failedAt(failedAt)
                .hostname(hostname)
                .stackTrace(stackTrace)
                .deadLetterReason(deadLetterReason);
    }

    public String getWorkId() { return workId; }
    public String getSourceQueue() { return sourceQueue; }
    public String getMessageId() { return messageId; }
    public JsonNode getPayload() { return payload; }
    public String getRawBody() { return rawBody; }
    public int getRetryCount() { return retryCount; }
    public String getFailureReason() { return failureReason; }
    public FailureType getFailureType() { return failureType; }
    public Instant getFailedAt() { return failedAt; }
    public String getHostname() { return hostname; }
    public String getStackTrace() { return stackTrace; }
    public String getDeadLetterReason() { return deadLetterReason; }

    static String describe(Throwable error) {
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    static String stackTraceOf(Throwable error) {
        StringBuilder sb = new StringBuilder();
        for (StackTraceElement element : error.getStackTrace()) {
            if (sb.length() > MAX_STACK_TRACE_LENGTH) {
                sb.append("...(truncated)");
                break;
            }
            sb.append(element).append('\n');
        }
        return sb.toString();
    }

    public static class Builder {
        private final FailedWork work = new FailedWork();

        public Builder workId(String workId) {
            work.workId = workId;
            return this;
        }

        public Builder sourceQueue(String sourceQueue) {
            work.sourceQueue = sourceQueue;
            return this;
        }

        public Builder messageId(String messageId) {
            work.messageId = messageId;
            return this;
        }

        public Builder payload(JsonNode payload) {
            work.payload = payload;
            return this;
        }

        public Builder rawBody(String rawBody) {
            work.rawBody = rawBody;
            return this;
        }

        public Builder retryCount(int retryCount) {
            work.retryCount = retryCount;
            return this;
        }

        public Builder failureReason(String failureReason) {
            work.failureReason = failureReason;
            return this;
        }

        public Builder failureType(FailureType failureType) {
            work.failureType = failureType;
            return this;
        }

        public Builder failedAt(Instant failedAt) {
            work.failedAt = failedAt;
            return this;
        }

        public Builder hostname(String hostname) {
            work.hostname = hostname;
            return this;
        }

        public Builder stackTrace(String stackTrace) {
            work.stackTrace = stackTrace;
            return this;
        }

        public Builder deadLetterReason(String deadLetterReason) {
            work.deadLetterReason = deadLetterReason;
            return this;
        }

        public FailedWork build() {
            if (work.workId == null) {
                throw new IllegalStateException("workId is required");
            }
            return work;
        }
    }
}

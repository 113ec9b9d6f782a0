package com.aporkolab.broker.deadletter;

import java.time.Duration;

/**
 * Bounds retries per work item.
 *
 * An attempt below {@code maxAttempts} that fails is retried after {@code retryDelay};
 * a failing attempt at or above the limit is dead.
 */
public class RetryPolicy {

    public static final String DEFAULT_RETRY_COUNT_HEADER = "x-retry-count";

    private final int maxAttempts;
    private final Duration retryDelay;
    private final String retryCountHeader;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.retryDelay = builder.retryDelay;
        this.retryCountHeader = builder.retryCountHeader;
    }

    public static RetryPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * State after a failed attempt.
     */
    public WorkState onFailure(int attempt) {
        return attempt < maxAttempts ? WorkState.RETRY_SCHEDULED : WorkState.DEAD;
    }

    public int getMaxAttempts() { return maxAttempts; }
    public Duration getRetryDelay() { return retryDelay; }
    public String getRetryCountHeader() { return retryCountHeader; }

    public static class Builder {
        private int maxAttempts = 3;
        private Duration retryDelay = Duration.ofSeconds(5);
        private String retryCountHeader = DEFAULT_RETRY_COUNT_HEADER;

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 0) {
                throw new IllegalArgumentException("maxAttempts must be >= 0");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            if (retryDelay == null || retryDelay.isNegative()) {
                throw new IllegalArgumentException("retryDelay must be >= 0");
            }
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder retryCountHeader(String retryCountHeader) {
            if (retryCountHeader == null || retryCountHeader.isBlank()) {
                throw new IllegalArgumentException("retryCountHeader must not be blank");
            }
            this.retryCountHeader = retryCountHeader;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}

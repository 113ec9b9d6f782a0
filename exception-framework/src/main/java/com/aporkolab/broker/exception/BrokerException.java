package com.aporkolab.broker.exception;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Base class for all broker client exceptions.
 * 
 * Provides:
 * - Error code for programmatic handling
 * - Structured context (queue, exchange, messageId...) for logging
 * - Timestamp for correlation
 */
public abstract class BrokerException extends RuntimeException {

    private final String code;
    private final Map<String, Object> context;
    private final Instant timestamp;

    protected BrokerException(String code, String message) {
        super(message);
        this.code = code;
        this.context = new HashMap<>();
        this.timestamp = Instant.now();
    }

    protected BrokerException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = new HashMap<>();
        this.timestamp = Instant.now();
    }

    /**
     * Add contextual information for debugging.
     * Fluent API for chaining; null values are skipped.
     */
    public BrokerException with(String key, Object value) {
        if (value != null) {
            this.context.put(key, value);
        }
        return this;
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return Map.copyOf(context);
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}

package com.aporkolab.broker.client;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-message overrides of the publisher's default metadata.
 * Unset fields fall back to: persistent, {@code application/json}, current time, generated id.
 */
public final class PublishOptions {

    private static final PublishOptions DEFAULTS = builder().build();

    private final boolean persistent;
    private final String contentType;
    private final Instant timestamp;
    private final String messageId;
    private final String correlationId;
    private final Duration expiration;
    private final Integer priority;
    private final String type;
    private final Map<String, Object> headers;

    private PublishOptions(Builder builder) {
        this.persistent = builder.persistent;
        this.contentType = builder.contentType;
        this.timestamp = builder.timestamp;
        this.messageId = builder.messageId;
        this.correlationId = builder.correlationId;
        this.expiration = builder.expiration;
        this.priority = builder.priority;
        this.type = builder.type;
        this.headers = Map.copyOf(builder.headers);
    }

    public static PublishOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .persistent(persistent)
                .contentType(contentType)
                .timestamp(timestamp)
                .messageId(messageId)
                .correlationId(correlationId)
                .expiration(expiration)
                .priority(priority)
                .type(type);
        builder.headers.putAll(headers);
        return builder;
    }

    public boolean isPersistent() { return persistent; }
    public String getContentType() { return contentType; }
    public Instant getTimestamp() { return timestamp; }
    public String getMessageId() { return messageId; }
    public String getCorrelationId() { return correlationId; }
    public Duration getExpiration() { return expiration; }
    public Integer getPriority() { return priority; }
    public String getType() { return type; }
    public Map<String, Object> getHeaders() { return headers; }

    public static class Builder {
        private boolean persistent = true;
        private String contentType;
        private Instant timestamp;
        private String messageId;
        private String correlationId;
        private Duration expiration;
        private Integer priority;
        private String type;
        private final Map<String, Object> headers = new HashMap<>();

        public Builder persistent(boolean persistent) {
            this.persistent = persistent;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder expiration(Duration expiration) {
            if (expiration != null && expiration.isNegative()) {
                throw new IllegalArgumentException("expiration must not be negative");
            }
            this.expiration = expiration;
            return this;
        }

        public Builder priority(Integer priority) {
            if (priority != null && (priority < 0 || priority > 255)) {
                throw new IllegalArgumentException("priority must be between 0 and 255");
            }
            this.priority = priority;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder header(String name, Object value) {
            if (value != null) {
                this.headers.put(name, value);
            }
            return this;
        }

        public Builder headers(Map<String, Object> headers) {
            if (headers != null) {
                headers.forEach(this::header);
            }
            return this;
        }

        public PublishOptions build() {
            return new PublishOptions(this);
        }
    }
}

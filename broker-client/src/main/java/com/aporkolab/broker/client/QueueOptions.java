package com.aporkolab.broker.client;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Queue declaration flags and arguments. Durable, non-exclusive and non-auto-delete unless overridden.
 */
public final class QueueOptions {

    public static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
    public static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";
    public static final String MESSAGE_TTL = "x-message-ttl";
    public static final String MAX_LENGTH = "x-max-length";

    private static final QueueOptions DEFAULTS = builder().build();

    private final boolean durable;
    private final boolean exclusive;
    private final boolean autoDelete;
    private final Map<String, Object> arguments;

    private QueueOptions(Builder builder) {
        this.durable = builder.durable;
        this.exclusive = builder.exclusive;
        this.autoDelete = builder.autoDelete;
        this.arguments = Map.copyOf(builder.arguments);
    }

    public static QueueOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isDurable() { return durable; }
    public boolean isExclusive() { return exclusive; }
    public boolean isAutoDelete() { return autoDelete; }
    public Map<String, Object> getArguments() { return arguments; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueueOptions other)) return false;
        return durable == other.durable && exclusive == other.exclusive
                && autoDelete == other.autoDelete && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(durable, exclusive, autoDelete, arguments);
    }

    public static class Builder {
        private boolean durable = true;
        private boolean exclusive = false;
        private boolean autoDelete = false;
        private final Map<String, Object> arguments = new HashMap<>();

        public Builder durable(boolean durable) {
            this.durable = durable;
            return this;
        }

        public Builder exclusive(boolean exclusive) {
            this.exclusive = exclusive;
            return this;
        }

        public Builder autoDelete(boolean autoDelete) {
            this.autoDelete = autoDelete;
            return this;
        }

        public Builder argument(String key, Object value) {
            this.arguments.put(key, value);
            return this;
        }

        public Builder deadLetterExchange(String exchange) {
            return argument(DEAD_LETTER_EXCHANGE, exchange);
        }

        public Builder deadLetterRoutingKey(String routingKey) {
            return argument(DEAD_LETTER_ROUTING_KEY, routingKey);
        }

        public Builder messageTtl(Duration ttl) {
            if (ttl.isNegative()) {
                throw new IllegalArgumentException("messageTtl must not be negative");
            }
            return argument(MESSAGE_TTL, (int) Math.min(ttl.toMillis(), Integer.MAX_VALUE));
        }

        public Builder maxLength(int maxLength) {
            if (maxLength < 1) {
                throw new IllegalArgumentException("maxLength must be at least 1");
            }
            return argument(MAX_LENGTH, maxLength);
        }

        public QueueOptions build() {
            return new QueueOptions(this);
        }
    }
}

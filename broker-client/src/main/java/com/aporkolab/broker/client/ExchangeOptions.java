package com.aporkolab.broker.client;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Exchange declaration flags. Durable and non-auto-delete unless overridden.
 */
public final class ExchangeOptions {

    private static final ExchangeOptions DEFAULTS = builder().build();

    private final boolean durable;
    private final boolean autoDelete;
    private final boolean internal;
    private final Map<String, Object> arguments;

    private ExchangeOptions(Builder builder) {
        this.durable = builder.durable;
        this.autoDelete = builder.autoDelete;
        this.internal = builder.internal;
        this.arguments = Map.copyOf(builder.arguments);
    }

    public static ExchangeOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isDurable() { return durable; }
    public boolean isAutoDelete() { return autoDelete; }
    public boolean isInternal() { return internal; }
    public Map<String, Object> getArguments() { return arguments; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExchangeOptions other)) return false;
        return durable == other.durable && autoDelete == other.autoDelete
                && internal == other.internal && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(durable, autoDelete, internal, arguments);
    }

    public static class Builder {
        private boolean durable = true;
        private boolean autoDelete = false;
        private boolean internal = false;
        private final Map<String, Object> arguments = new HashMap<>();

        public Builder durable(boolean durable) {
            this.durable = durable;
            return this;
        }

        public Builder autoDelete(boolean autoDelete) {
            this.autoDelete = autoDelete;
            return this;
        }

        public Builder internal(boolean internal) {
            this.internal = internal;
            return this;
        }

        public Builder argument(String key, Object value) {
            this.arguments.put(key, value);
            return this;
        }

        public ExchangeOptions build() {
            return new ExchangeOptions(this);
        }
    }
}

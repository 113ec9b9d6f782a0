package com.aporkolab.broker.client;

import java.util.HashMap;
import java.util.Map;

public final class ConsumeOptions {

    private static final ConsumeOptions DEFAULTS = builder().build();

    private final boolean noAck;
    private final boolean exclusive;
    private final String consumerTag;
    private final Map<String, Object> arguments;
    private final RedeliveryPolicy redeliveryPolicy;

    private ConsumeOptions(Builder builder) {
        this.noAck = builder.noAck;
        this.exclusive = builder.exclusive;
        this.consumerTag = builder.consumerTag;
        this.arguments = Map.copyOf(builder.arguments);
        this.redeliveryPolicy = builder.redeliveryPolicy;
    }

    public static ConsumeOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isNoAck() { return noAck; }
    public boolean isExclusive() { return exclusive; }
    public String getConsumerTag() { return consumerTag; }
    public Map<String, Object> getArguments() { return arguments; }
    public RedeliveryPolicy getRedeliveryPolicy() { return redeliveryPolicy; }

    public static class Builder {
        private boolean noAck = false;
        private boolean exclusive = false;
        private String consumerTag = "";
        private final Map<String, Object> arguments = new HashMap<>();
        private RedeliveryPolicy redeliveryPolicy = RedeliveryPolicy.REQUEUE_ONCE;

        public Builder noAck(boolean noAck) {
            this.noAck = noAck;
            return this;
        }

        public Builder exclusive(boolean exclusive) {
            this.exclusive = exclusive;
            return this;
        }

        /**
         * Empty lets the broker generate a tag.
         */
        public Builder consumerTag(String consumerTag) {
            this.consumerTag = consumerTag == null ? "" : consumerTag;
            return this;
        }

        public Builder argument(String key, Object value) {
            this.arguments.put(key, value);
            return this;
        }

        public Builder redeliveryPolicy(RedeliveryPolicy redeliveryPolicy) {
            if (redeliveryPolicy == null) {
                throw new IllegalArgumentException("redeliveryPolicy must not be null");
            }
            this.redeliveryPolicy = redeliveryPolicy;
            return this;
        }

        public ConsumeOptions build() {
            return new ConsumeOptions(this);
        }
    }
}

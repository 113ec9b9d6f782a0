package com.aporkolab.broker.deadletter;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.broker.client.BrokerClient;
import com.aporkolab.broker.client.ExchangeOptions;
import com.aporkolab.broker.client.QueueOptions;
import com.rabbitmq.client.BuiltinExchangeType;

/**
 * Names and declaration of the retry protocol's broker entities.
 *
 * <pre>
 *                 reject (no requeue)                       dead key
 *  process queue ─────────────────────► dead-letter exchange ────────► dead queue
 *       ▲                                  │          ▲
 *       │ process key                      │ retry key│ TTL expired, process key
 *       └──────────────────────────────────┘          │
 *                                  retry queue ────────┘
 * </pre>
 */
public class RetryTopology {

    private static final Logger log = LoggerFactory.getLogger(RetryTopology.class);

    private final String deadLetterExchange;
    private final String eventExchange;
    private final String processQueue;
    private final String retryQueue;
    private final String deadQueue;
    private final String processRoutingKey;
    private final String retryRoutingKey;
    private final String deadRoutingKey;

    private RetryTopology(Builder builder) {
        this.deadLetterExchange = builder.deadLetterExchange;
        this.eventExchange = builder.eventExchange;
        this.processQueue = builder.processQueue;
        this.retryQueue = builder.retryQueue;
        this.deadQueue = builder.deadQueue;
        this.processRoutingKey = builder.processRoutingKey;
        this.retryRoutingKey = builder.retryRoutingKey;
        this.deadRoutingKey = builder.deadRoutingKey;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Declares exchanges, queues and bindings. Safe to call repeatedly.
     *
     * @param retryDelay TTL of the retry queue
     */
    public void declare(BrokerClient client, Duration retryDelay) {
        client.assertExchange(deadLetterExchange, BuiltinExchangeType.DIRECT, ExchangeOptions.defaults());

        client.assertQueue(processQueue, QueueOptions.builder()
                .deadLetterExchange(deadLetterExchange)
                .deadLetterRoutingKey(deadRoutingKey)
                .build());
        client.assertQueue(deadQueue, QueueOptions.defaults());
        client.bindQueue(deadQueue, deadLetterExchange, deadRoutingKey);

        client.assertQueue(retryQueue, QueueOptions.builder()
                .messageTtl(retryDelay)
                .deadLetterExchange(deadLetterExchange)
                .deadLetterRoutingKey(processRoutingKey)
                .build());
        client.bindQueue(retryQueue, deadLetterExchange, retryRoutingKey);
        client.bindQueue(processQueue, deadLetterExchange, processRoutingKey);

        client.assertExchange(eventExchange, BuiltinExchangeType.FANOUT, ExchangeOptions.defaults());

        log.info("Retry topology declared: process={}, retry={} (ttl={} ms), dead={}, dlx={}",
                processQueue, retryQueue, retryDelay.toMillis(), deadQueue, deadLetterExchange);
    }

    public String getDeadLetterExchange() { return deadLetterExchange; }
    public String getEventExchange() { return eventExchange; }
    public String getProcessQueue() { return processQueue; }
    public String getRetryQueue() { return retryQueue; }
    public String getDeadQueue() { return deadQueue; }
    public String getProcessRoutingKey() { return processRoutingKey; }
    public String getRetryRoutingKey() { return retryRoutingKey; }
    public String getDeadRoutingKey() { return deadRoutingKey; }

    public static class Builder {
        private String deadLetterExchange = "payments.dlx";
        private String eventExchange = "orders.fanout";
        private String processQueue = "payments.process";
        private String retryQueue = "payments.retry";
        private String deadQueue = "payments.dead";
        private String processRoutingKey = "payment.process";
        private String retryRoutingKey = "payment.retry";
        private String deadRoutingKey = "payment.failed";

        public Builder deadLetterExchange(String deadLetterExchange) {
            this.deadLetterExchange = requireName("deadLetterExchange", deadLetterExchange);
            return this;
        }

        public Builder eventExchange(String eventExchange) {
            this.eventExchange = requireName("eventExchange", eventExchange);
            return this;
        }

        public Builder processQueue(String processQueue) {
            this.processQueue = requireName("processQueue", processQueue);
            return this;
        }

        public Builder retryQueue(String retryQueue) {
            this.retryQueue = requireName("retryQueue", retryQueue);
            return this;
        }

        public Builder deadQueue(String deadQueue) {
            this.deadQueue = requireName("deadQueue", deadQueue);
            return this;
        }

        public Builder processRoutingKey(String processRoutingKey) {
            this.processRoutingKey = requireName("processRoutingKey", processRoutingKey);
            return this;
        }

        public Builder retryRoutingKey(String retryRoutingKey) {
            this.retryRoutingKey = requireName("retryRoutingKey", retryRoutingKey);
            return this;
        }

        public Builder deadRoutingKey(String deadRoutingKey) {
            this.deadRoutingKey = requireName("deadRoutingKey", deadRoutingKey);
            return this;
        }

        public RetryTopology build() {
            if (processRoutingKey.equals(deadRoutingKey) || retryRoutingKey.equals(deadRoutingKey)
                    || processRoutingKey.equals(retryRoutingKey)) {
                throw new IllegalArgumentException("process, retry and dead routing keys must differ");
            }
            return new RetryTopology(this);
        }

        private static String requireName(String field, String value) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(field + " must not be blank");
            }
            return value;
        }
    }
}

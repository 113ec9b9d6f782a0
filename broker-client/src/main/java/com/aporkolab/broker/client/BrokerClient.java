package com.aporkolab.broker.client;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.ConnectionFactory;

/**
 * One broker client instance: a supervised connection with a single channel,
 * topology declaration, publishing and consuming.
 *
 * Usage:
 * <pre>
 * BrokerClient client = BrokerClient.builder()
 *     .settings(BrokerSettings.builder().host("rabbitmq").serviceName("payment-service").build())
 *     .build();
 *
 * client.connect();
 * client.assertQueue("payments.process", QueueOptions.defaults());
 * client.consume("payments.process", PaymentRequest.class, (payment, delivery) -> process(payment),
 *         ConsumeOptions.defaults());
 * client.sendToQueue("payments.process", payment);
 * </pre>
 *
 * Handlers run sequentially on one dispatcher thread; reconnects and deferred publishes
 * run on one scheduler thread.
 */
public class BrokerClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BrokerClient.class);

    private final BrokerSettings settings;
    private final ConnectionSupervisor supervisor;
    private final TopologyManager topology;
    private final MessagePublisher publisher;
    private final ConsumerRegistry consumers;
    private final MessageCodec codec;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService dispatcher;

    private BrokerClient(Builder builder) {
        this.settings = builder.settings;
        this.codec = new MessageCodec(builder.objectMapper != null
                ? builder.objectMapper
                : MessageCodec.defaultObjectMapper());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(
                daemonThreads(settings.getServiceName() + "-broker-scheduler"));
        this.dispatcher = Executors.newSingleThreadExecutor(
                daemonThreads(settings.getServiceName() + "-broker-dispatcher"));

        BrokerClientListener events = BrokerClientListener.composite(builder.listeners);
        FlowControl flowControl = new FlowControl();
        ConnectionFactory factory = builder.connectionFactory != null
                ? builder.connectionFactory
                : new ConnectionFactory();

        this.supervisor = new ConnectionSupervisor(settings, factory, scheduler, flowControl, events);
        this.topology = new TopologyManager(supervisor);
        this.publisher = new MessagePublisher(supervisor, flowControl, codec,
                new MessageIdGenerator(settings.getServiceName(), builder.clock), scheduler, events, builder.clock);
        this.consumers = new ConsumerRegistry(supervisor, codec, dispatcher, events);

        // topology must be back before consumers re-subscribe
        supervisor.addListener(topology);
        supervisor.addListener(consumers);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Connects to the broker. Returns false on failure, in which case a reconnect is already scheduled.
     */
    public boolean connect() {
        return supervisor.connect();
    }

    public boolean isHealthy() {
        return supervisor.isHealthy();
    }

    /**
     * True once {@link #close()} ran; a closed client never connects again.
     */
    public boolean isClosed() {
        return supervisor.isClosed();
    }

    public void assertExchange(String name, BuiltinExchangeType type) {
        topology.assertExchange(name, type, ExchangeOptions.defaults());
    }

    public void assertExchange(String name, BuiltinExchangeType type, ExchangeOptions options) {
        topology.assertExchange(name, type, options);
    }

    public QueueInfo assertQueue(String name) {
        return topology.assertQueue(name, QueueOptions.defaults());
    }

    public QueueInfo assertQueue(String name, QueueOptions options) {
        return topology.assertQueue(name, options);
    }

    public void bindQueue(String queue, String exchange, String routingKey) {
        topology.bindQueue(queue, exchange, routingKey, Map.of());
    }

    public void bindQueue(String queue, String exchange, String routingKey, Map<String, Object> arguments) {
        topology.bindQueue(queue, exchange, routingKey, arguments);
    }

    public CompletableFuture<String> publish(String exchange, String routingKey, Object message) {
        return publisher.publish(exchange, routingKey, message, PublishOptions.defaults());
    }

    public CompletableFuture<String> publish(String exchange, String routingKey, Object message, PublishOptions options) {
        return publisher.publish(exchange, routingKey, message, options);
    }

    public CompletableFuture<String> sendToQueue(String queue, Object message) {
        return publisher.sendToQueue(queue, message, PublishOptions.defaults());
    }

    public CompletableFuture<String> sendToQueue(String queue, Object message, PublishOptions options) {
        return publisher.sendToQueue(queue, message, options);
    }

    public CompletableFuture<String> publishWithHeaders(String exchange, Object message, Map<String, Object> headers) {
        return publisher.publishWithHeaders(exchange, message, headers, PublishOptions.defaults());
    }

    public CompletableFuture<String> publishWithHeaders(String exchange, Object message,
                                                        Map<String, Object> headers, PublishOptions options) {
        return publisher.publishWithHeaders(exchange, message, headers, options);
    }

    /**
     * Consumes raw JSON trees with default options.
     */
    public String consume(String queue, MessageHandler<JsonNode> handler) {
        return consumers.consume(queue, JsonNode.class, handler, ConsumeOptions.defaults());
    }

    public String consume(String queue, MessageHandler<JsonNode> handler, ConsumeOptions options) {
        return consumers.consume(queue, JsonNode.class, handler, options);
    }

    public <T> String consume(String queue, Class<T> type, MessageHandler<T> handler, ConsumeOptions options) {
        return consumers.consume(queue, type, handler, options);
    }

    public CompletableFuture<Void> cancelConsumer(String queue) {
        return consumers.cancelConsumer(queue);
    }

    public BrokerSettings getSettings() {
        return settings;
    }

    public MessageCodec getCodec() {
        return codec;
    }

    public ConnectionSupervisor getSupervisor() {
        return supervisor;
    }

    public TopologyManager getTopology() {
        return topology;
    }

    public ConsumerRegistry getConsumers() {
        return consumers;
    }

    /**
     * Cancels consumers and the pending reconnect, closes channel and connection.
     * Never throws.
     */
    @Override
    public void close() {
        supervisor.close();
        dispatcher.shutdown();
        scheduler.shutdownNow();
        log.info("Broker client {} closed", settings.getServiceName());
    }

    private static ThreadFactory daemonThreads(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static class Builder {
        private BrokerSettings settings = BrokerSettings.builder().build();
        private ObjectMapper objectMapper;
        private ConnectionFactory connectionFactory;
        private Clock clock = Clock.systemUTC();
        private final List<BrokerClientListener> listeners = new ArrayList<>();

        public Builder settings(BrokerSettings settings) {
            if (settings == null) {
                throw new IllegalArgumentException("settings must not be null");
            }
            this.settings = settings;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder connectionFactory(ConnectionFactory connectionFactory) {
            this.connectionFactory = connectionFactory;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder listener(BrokerClientListener listener) {
            if (listener != null) {
                this.listeners.add(listener);
            }
            return this;
        }

        public BrokerClient build() {
            return new BrokerClient(this);
        }
    }
}

package com.aporkolab.broker.metrics;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import com.aporkolab.broker.client.BrokerClientListener;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Micrometer metrics for the broker client.
 *
 * Provides the following metrics:
 * - broker_connection_up: 1 while a connection and channel are usable
 * - broker_connection_events_total: connects, failures and losses by event
 * - broker_reconnects_scheduled_total: reconnect timers armed
 * - broker_published_total: messages handed to the broker, by exchange
 * - broker_publish_blocked_total: publishes deferred by backpressure, by exchange
 * - broker_deliveries_total: acks and rejections, by queue and outcome
 * - broker_handler_duration: handler execution time, by queue and result
 *
 * Register it with {@code BrokerClient.builder().listener(metrics)}.
 */
public class BrokerClientMetrics implements BrokerClientListener {

    private static final String METRIC_PREFIX = "broker";

    private final MeterRegistry registry;
    private final Tags baseTags;
    private final AtomicInteger connectionUp = new AtomicInteger(0);
    private final Counter reconnectsScheduled;

    public BrokerClientMetrics(MeterRegistry registry, String serviceName) {
        this(registry, Tags.of("service", serviceName));
    }

    public BrokerClientMetrics(MeterRegistry registry, Tags tags) {
        this.registry = registry;
        this.baseTags = tags;

        Gauge.builder(METRIC_PREFIX + "_connection_up", connectionUp, AtomicInteger::get)
                .description("1 when the broker connection is usable, 0 otherwise")
                .tags(baseTags)
                .register(registry);

        this.reconnectsScheduled = Counter.builder(METRIC_PREFIX + "_reconnects_scheduled_total")
                .description("Reconnect attempts scheduled after a failure or loss")
                .tags(baseTags)
                .register(registry);
    }

    @Override
    public void onConnected() {
        connectionUp.set(1);
        connectionEvent("connected");
    }

    @Override
    public void onConnectionFailed(Throwable cause) {
        connectionUp.set(0);
        connectionEvent("failed");
    }

    @Override
    public void onConnectionLost(Throwable cause) {
        connectionUp.set(0);
        connectionEvent("lost");
    }

    @Override
    public void onReconnectScheduled(Duration delay) {
        reconnectsScheduled.increment();
    }

    @Override
    public void onPublished(String exchange, String routingKey) {
        Counter.builder(METRIC_PREFIX + "_published_total")
                .description("Messages handed to the broker")
                .tags(baseTags.and("exchange", exchangeTag(exchange)))
                .register(registry)
                .increment();
    }

    @Override
    public void onPublishBlocked(String exchange, String routingKey) {
        Counter.builder(METRIC_PREFIX + "_publish_blocked_total")
                .description("Publishes deferred until the broker accepted more data")
                .tags(baseTags.and("exchange", exchangeTag(exchange)))
                .register(registry)
                .increment();
    }

    @Override
    public void onAcknowledged(String queue) {
        delivery(queue, "ack");
    }

    @Override
    public void onRejected(String queue, boolean requeued) {
        delivery(queue, requeued ? "requeue" : "reject");
    }

    @Override
    public void onHandlerCompleted(String queue, Duration duration, boolean success) {
        Timer.builder(METRIC_PREFIX + "_handler_duration")
                .description("Message handler execution time")
                .tags(baseTags.and("queue", queue, "result", success ? "success" : "failure"))
                .register(registry)
                .record(duration);
    }

    public boolean isConnectionUp() {
        return connectionUp.get() == 1;
    }

    private void connectionEvent(String event) {
        Counter.builder(METRIC_PREFIX + "_connection_events_total")
                .description("Connection lifecycle events")
                .tags(baseTags.and("event", event))
                .register(registry)
                .increment();
    }

    private void delivery(String queue, String outcome) {
        Counter.builder(METRIC_PREFIX + "_deliveries_total")
                .description("Settled deliveries by outcome")
                .tags(baseTags.and("queue", queue, "outcome", outcome))
                .register(registry)
                .increment();
    }

    // the default exchange has an empty name
    private static String exchangeTag(String exchange) {
        return exchange == null || exchange.isEmpty() ? "(default)" : exchange;
    }
}

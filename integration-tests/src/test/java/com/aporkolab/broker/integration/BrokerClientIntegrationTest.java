package com.aporkolab.broker.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import com.aporkolab.broker.client.BrokerClient;
import com.aporkolab.broker.client.ConsumeOptions;
import com.aporkolab.broker.client.InboundDelivery;
import com.aporkolab.broker.client.QueueInfo;
import com.aporkolab.broker.client.RedeliveryPolicy;
import com.aporkolab.broker.logging.CorrelationHeaders;
import com.fasterxml.jackson.databind.JsonNode;
import com.rabbitmq.client.BuiltinExchangeType;

/**
 * Broker client against a real RabbitMQ.
 */
@Testcontainers(disabledWithoutDocker = true)
class BrokerClientIntegrationTest {

    private final List<BrokerClient> clients = new ArrayList<>();
    private String queue;

    @BeforeEach
    void setUp() {
        queue = "it." + UUID.randomUUID();
    }

    @AfterEach
    void tearDown() {
        clients.forEach(BrokerClient::close);
    }

    private BrokerClient connectedClient(String serviceName, int prefetch) {
        BrokerClient client = RabbitContainerSupport.newClient(serviceName, prefetch);
        clients.add(client);
        assertThat(client.connect()).isTrue();
        return client;
    }

    @Test
    @DisplayName("should deliver a published message once and ack it")
    void shouldDeliverAndAck() {
        BrokerClient client = connectedClient("order-service", 1);
        client.assertQueue(queue);
        List<JsonNode> received = new CopyOnWriteArrayList<>();
        List<String> sources = new CopyOnWriteArrayList<>();

        client.consume(queue, (JsonNode payload, InboundDelivery delivery) -> {
            received.add(payload);
            sources.add(delivery.getHeader(CorrelationHeaders.SOURCE_SERVICE_HEADER));
        });
        client.sendToQueue(queue, Map.of("orderId", "o-1", "amount", 100)).join();

        await().atMost(Duration.ofSeconds(10)).until(() -> received.size() == 1);
        assertThat(received.get(0).get("orderId").asText()).isEqualTo("o-1");
        assertThat(sources).containsExactly("order-service");
        await().atMost(Duration.ofSeconds(10))
                .untilAsserted(() -> assertThat(client.assertQueue(queue).messageCount()).isZero());
    }

    @Test
    @DisplayName("should accept repeated identical declarations")
    void shouldDeclareIdempotently() {
        BrokerClient client = connectedClient("order-service", 1);
        String exchange = queue + ".fanout";

        for (int i = 0; i < 2; i++) {
            client.assertExchange(exchange, BuiltinExchangeType.FANOUT);
            client.assertQueue(queue);
            client.bindQueue(queue, exchange, "");
        }
        client.publish(exchange, "", Map.of("event", "created")).join();

        await().atMost(Duration.ofSeconds(10))
                .untilAsserted(() -> assertThat(client.assertQueue(queue).messageCount()).isEqualTo(1));
        assertThat(client.getTopology().declaredQueueCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should requeue a failed delivery once and drop it on the second failure")
    void shouldRequeueOnce() {
        BrokerClient client = connectedClient("order-service", 1);
        client.assertQueue(queue);
        AtomicInteger attempts = new AtomicInteger();
        List<Boolean> redelivered = new CopyOnWriteArrayList<>();

        client.consume(queue, JsonNode.class, (payload, delivery) -> {
            attempts.incrementAndGet();
            redelivered.add(delivery.isRedelivered());
            throw new IllegalStateException("always failing");
        }, ConsumeOptions.builder().redeliveryPolicy(RedeliveryPolicy.REQUEUE_ONCE).build());
        client.sendToQueue(queue, Map.of("orderId", "o-2")).join();

        await().atMost(Duration.ofSeconds(10)).until(() -> attempts.get() == 2);
        await().pollDelay(Duration.ofMillis(500)).atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(client.assertQueue(queue).messageCount()).isZero());
        assertThat(attempts).hasValue(2);
        assertThat(redelivered).containsExactly(false, true);
    }

    @Test
    @DisplayName("should spread deliveries across competing consumers")
    void shouldShareWorkBetweenConsumers() {
        BrokerClient first = connectedClient("worker-a", 1);
        BrokerClient second = connectedClient("worker-b", 1);
        first.assertQueue(queue);
        AtomicInteger firstCount = new AtomicInteger();
        AtomicInteger secondCount = new AtomicInteger();

        first.consume(queue, (JsonNode payload, InboundDelivery delivery) -> {
            firstCount.incrementAndGet();
            Thread.sleep(50);
        });
        second.consume(queue, (JsonNode payload, InboundDelivery delivery) -> {
            secondCount.incrementAndGet();
            Thread.sleep(50);
        });
        for (int i = 0; i < 10; i++) {
            first.sendToQueue(queue, Map.of("seq", i)).join();
        }

        await().atMost(Duration.ofSeconds(15)).until(() -> firstCount.get() + secondCount.get() == 10);
        assertThat(firstCount.get()).isPositive();
        assertThat(secondCount.get()).isPositive();
    }

    @Test
    @DisplayName("should report queue depth and consumer count")
    void shouldReportQueueInfo() {
        BrokerClient client = connectedClient("order-service", 1);
        client.assertQueue(queue);
        client.sendToQueue(queue, Map.of("orderId", "o-3")).join();

        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
            QueueInfo info = client.assertQueue(queue);
            assertThat(info.queue()).isEqualTo(queue);
            assertThat(info.messageCount()).isEqualTo(1);
            assertThat(info.consumerCount()).isZero();
        });
    }
}

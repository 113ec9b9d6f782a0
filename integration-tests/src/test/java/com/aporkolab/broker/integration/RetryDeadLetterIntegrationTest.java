package com.aporkolab.broker.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import com.aporkolab.broker.client.BrokerClient;
import com.aporkolab.broker.deadletter.FailedWork;
import com.aporkolab.broker.deadletter.FailureType;
import com.aporkolab.broker.deadletter.InMemoryFailedWorkStore;
import com.aporkolab.broker.deadletter.RetryDeadLetterEngine;
import com.aporkolab.broker.deadletter.RetryListener;
import com.aporkolab.broker.deadletter.RetryPolicy;
import com.aporkolab.broker.deadletter.RetryTopology;

/**
 * Retry protocol end to end: TTL delay queue, dead-letter routing and manual resubmission.
 */
@Testcontainers(disabledWithoutDocker = true)
class RetryDeadLetterIntegrationTest {

    public record PaymentRequest(String orderId, String userId, int amount) {
    }

    private final List<Integer> attempts = new CopyOnWriteArrayList<>();
    private final List<String> succeeded = new CopyOnWriteArrayList<>();
    private final AtomicBoolean gatewayUp = new AtomicBoolean(false);
    private final InMemoryFailedWorkStore store = new InMemoryFailedWorkStore();

    private BrokerClient client;
    private RetryDeadLetterEngine<PaymentRequest> engine;

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        client = RabbitContainerSupport.newClient("payment-service", 1);
        assertThat(client.connect()).isTrue();

        RetryTopology topology = RetryTopology.builder()
                .deadLetterExchange("payments.dlx." + suffix)
                .eventExchange("orders.fanout." + suffix)
                .processQueue("payments.process." + suffix)
                .retryQueue("payments.retry." + suffix)
                .deadQueue("payments.dead." + suffix)
                .build();

        engine = RetryDeadLetterEngine.builder(PaymentRequest.class)
                .client(client)
                .topology(topology)
                .policy(RetryPolicy.builder().maxAttempts(3).retryDelay(Duration.ofMillis(200)).build())
                .handler((payment, context) -> {
                    attempts.add(context.attempt());
                    if (!gatewayUp.get()) {
                        throw new IllegalStateException("Payment gateway timeout");
                    }
                    return "TXN-" + payment.orderId();
                })
                .workId(PaymentRequest::orderId)
                .store(store)
                .listener(new RetryListener() {
                    @Override
                    public void onSucceeded(String workId, int attempt) {
                        succeeded.add(workId);
                    }
                })
                .eventTypes("payment.success", "payment.failed")
                .build();
        engine.declareTopology();
        engine.start();
        engine.startDeadLetterMonitor();
    }

    @AfterEach
    void tearDown() {
        engine.stop().join();
        client.close();
    }

    @Test
    @DisplayName("should succeed on the first attempt without touching the retry queue")
    void shouldSucceedFirstTime() {
        gatewayUp.set(true);

        engine.submit(new PaymentRequest("o-1", "u-1", 100)).join();

        await().atMost(Duration.ofSeconds(10)).until(() -> succeeded.contains("o-1"));
        assertThat(attempts).containsExactly(0);
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("should retry through the delay queue and park the payment as dead with retryCount 3")
    void shouldDeadLetterAfterRetries() {
        engine.submit(new PaymentRequest("o-2", "u-1", 100)).join();

        await().atMost(Duration.ofSeconds(20))
                .untilAsserted(() -> assertThat(store.find("o-2"))
                        .get()
                        .extracting(FailedWork::getDeadLetterReason)
                        .isEqualTo("rejected"));

        FailedWork failed = store.find("o-2").orElseThrow();
        assertThat(failed.getRetryCount()).isEqualTo(3);
        assertThat(failed.getFailureType()).isEqualTo(FailureType.MAX_RETRIES_EXCEEDED);
        assertThat(attempts).containsExactly(0, 1, 2, 3);
        assertThat(client.assertQueue(engine.getTopology().getDeadQueue()).messageCount()).isZero();
    }

    @Test
    @DisplayName("should process a resubmitted payment from attempt 0")
    void shouldResubmitDeadPayment() {
        engine.submit(new PaymentRequest("o-3", "u-1", 100)).join();
        // wait for the monitor as well, it updates the record once the broker has routed it
        await().atMost(Duration.ofSeconds(20)).until(() -> store.find("o-3")
                .map(FailedWork::getDeadLetterReason)
                .isPresent());

        gatewayUp.set(true);
        attempts.clear();
        engine.resubmit("o-3").join();

        await().atMost(Duration.ofSeconds(10)).until(() -> succeeded.contains("o-3"));
        assertThat(attempts).containsExactly(0);
        assertThat(engine.findFailed("o-3")).isEmpty();
    }
}

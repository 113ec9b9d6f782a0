package com.aporkolab.broker.logging;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;


class MessageLogContextTest {

    @BeforeEach
    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("should generate correlation ID when creating context")
    void shouldGenerateCorrelationId() {
        try (MessageLogContext ctx = MessageLogContext.create()) {
            assertThat(MessageLogContext.getCurrentCorrelationId()).hasSize(16);
        }
    }

    @Test
    @DisplayName("should continue correlation ID carried by a message")
    void shouldContinueCorrelationId() {
        try (MessageLogContext ctx = MessageLogContext.continueOrCreate("corr-123")) {
            assertThat(MessageLogContext.getCurrentCorrelationId()).isEqualTo("corr-123");
        }
    }

    @Test
    @DisplayName("should create new correlation ID when header is blank")
    void shouldCreateWhenBlank() {
        try (MessageLogContext ctx = MessageLogContext.continueOrCreate("  ")) {
            assertThat(MessageLogContext.getCurrentCorrelationId()).isNotBlank().isNotEqualTo("  ");
        }
    }

    @Test
    @DisplayName("should put delivery keys into MDC")
    void shouldPutDeliveryKeys() {
        try (MessageLogContext ctx = MessageLogContext.create("c-1")
                .withQueue("payments.process")
                .withMessageId("payment-service-1-abc")
                .withDeliveryTag(7L)
                .withAttempt(2)) {
            assertThat(MDC.get(MessageLogContext.QUEUE_KEY)).isEqualTo("payments.process");
            assertThat(MDC.get(MessageLogContext.MESSAGE_ID_KEY)).isEqualTo("payment-service-1-abc");
            assertThat(MDC.get(MessageLogContext.DELIVERY_TAG_KEY)).isEqualTo("7");
            assertThat(MDC.get(MessageLogContext.ATTEMPT_KEY)).isEqualTo("2");
        }
    }

    @Test
    @DisplayName("should restore previous context on close")
    void shouldRestorePreviousContext() {
        MDC.put(MessageLogContext.CORRELATION_ID_KEY, "outer");

        try (MessageLogContext ctx = MessageLogContext.create("inner").withQueue("q")) {
            assertThat(MessageLogContext.getCurrentCorrelationId()).isEqualTo("inner");
        }

        assertThat(MessageLogContext.getCurrentCorrelationId()).isEqualTo("outer");
        assertThat(MDC.get(MessageLogContext.QUEUE_KEY)).isNull();
    }

    @Test
    @DisplayName("should keep caller correlation ID when enriching")
    void shouldKeepCorrelationWhenEnriching() {
        MDC.put(MessageLogContext.CORRELATION_ID_KEY, "caller");

        try (MessageLogContext ctx = MessageLogContext.enrich().withExchange("orders.fanout")) {
            assertThat(MessageLogContext.getCurrentCorrelationId()).isEqualTo("caller");
            assertThat(MDC.get(MessageLogContext.EXCHANGE_KEY)).isEqualTo("orders.fanout");
        }

        assertThat(MDC.get(MessageLogContext.EXCHANGE_KEY)).isNull();
    }

    @Test
    @DisplayName("should propagate context to another thread")
    void shouldPropagateToAnotherThread() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (MessageLogContext ctx = MessageLogContext.create("propagated")) {
            Future<String> seen = executor.submit(
                    MessageLogContext.wrap(MessageLogContext::getCurrentCorrelationId));

            assertThat(seen.get()).isEqualTo("propagated");
        } finally {
            executor.shutdownNow();
        }
    }
}

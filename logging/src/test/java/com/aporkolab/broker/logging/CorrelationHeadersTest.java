package com.aporkolab.broker.logging;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class CorrelationHeadersTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("should add correlation and service headers from MDC")
    void shouldInjectFromMdc() {
        try (MessageLogContext ctx = MessageLogContext.create("corr-1").withService("payment-service")) {
            Map<String, Object> headers = CorrelationHeaders.inject(Map.of("x-retry-count", 1));

            assertThat(headers)
                    .containsEntry(CorrelationHeaders.CORRELATION_ID_HEADER, "corr-1")
                    .containsEntry(CorrelationHeaders.SOURCE_SERVICE_HEADER, "payment-service")
                    .containsEntry("x-retry-count", 1);
        }
    }

    @Test
    @DisplayName("should not override correlation header set by publisher")
    void shouldNotOverrideExplicitHeader() {
        try (MessageLogContext ctx = MessageLogContext.create("from-mdc")) {
            Map<String, Object> headers = CorrelationHeaders.inject(
                    Map.of(CorrelationHeaders.CORRELATION_ID_HEADER, "explicit"));

            assertThat(headers).containsEntry(CorrelationHeaders.CORRELATION_ID_HEADER, "explicit");
        }
    }

    @Test
    @DisplayName("should return empty mutable map without MDC or headers")
    void shouldHandleNullHeaders() {
        Map<String, Object> headers = CorrelationHeaders.inject(null);

        assertThat(headers).isEmpty();
        headers.put("k", "v");
    }

    @Test
    @DisplayName("should extract correlation id from received headers")
    void shouldExtractCorrelationId() {
        assertThat(CorrelationHeaders.extractCorrelationId(
                Map.of(CorrelationHeaders.CORRELATION_ID_HEADER, new StringBuilder("corr-9")))).isEqualTo("corr-9");
        assertThat(CorrelationHeaders.extractCorrelationId(null)).isNull();
        assertThat(CorrelationHeaders.extractSourceService(Map.of())).isNull();
    }
}

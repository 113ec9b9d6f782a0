package com.aporkolab.broker.logging;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.MDC;

/**
 * Correlation id propagation through AMQP message headers.
 * 
 * Outgoing: copies the correlation id and service name from MDC into the header map
 * unless the publisher already set them.
 * Incoming: reads the correlation id back so the consumer can continue the context.
 */
public final class CorrelationHeaders {

    public static final String CORRELATION_ID_HEADER = "x-correlation-id";
    public static final String SOURCE_SERVICE_HEADER = "x-source-service";

    private CorrelationHeaders() {
    }

    /**
     * Returns a copy of {@code headers} enriched with correlation headers from MDC.
     */
    public static Map<String, Object> inject(Map<String, Object> headers) {
        Map<String, Object> enriched = headers == null ? new HashMap<>() : new HashMap<>(headers);

        String correlationId = MDC.get(MessageLogContext.CORRELATION_ID_KEY);
        if (correlationId != null) {
            enriched.putIfAbsent(CORRELATION_ID_HEADER, correlationId);
        }

        String serviceName = MDC.get(MessageLogContext.SERVICE_NAME_KEY);
        if (serviceName != null) {
            enriched.putIfAbsent(SOURCE_SERVICE_HEADER, serviceName);
        }

        return enriched;
    }

    /**
     * Extracts the correlation id from received headers. AMQP string headers arrive as
     * LongString instances, so values are read through {@code toString()}.
     */
    public static String extractCorrelationId(Map<String, Object> headers) {
        return headerAsString(headers, CORRELATION_ID_HEADER);
    }

    public static String extractSourceService(Map<String, Object> headers) {
        return headerAsString(headers, SOURCE_SERVICE_HEADER);
    }

    private static String headerAsString(Map<String, Object> headers, String name) {
        if (headers == null) {
            return null;
        }
        Object value = headers.get(name);
        return value != null ? value.toString() : null;
    }
}

package com.aporkolab.broker.logging;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

import org.slf4j.MDC;

/**
 * Structured logging context for broker operations via MDC (Mapped Diagnostic Context).
 * 
 * Every log line written while a context is open carries the queue, exchange,
 * message id, delivery tag and retry attempt it relates to, plus the correlation id
 * propagated through message headers.
 * 
 * Usage:
 * <pre>
 * try (var ctx = MessageLogContext.continueOrCreate(incomingCorrelationId)
 *         .withQueue("payments.process")
 *         .withMessageId(messageId)) {
 *     log.info("Message received");
 * }
 * </pre>
 */
public class MessageLogContext implements AutoCloseable {

    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String SERVICE_NAME_KEY = "service";
    public static final String QUEUE_KEY = "queue";
    public static final String EXCHANGE_KEY = "exchange";
    public static final String ROUTING_KEY_KEY = "routingKey";
    public static final String MESSAGE_ID_KEY = "messageId";
    public static final String DELIVERY_TAG_KEY = "deliveryTag";
    public static final String ATTEMPT_KEY = "attempt";

    private final Map<String, String> previousContext;

    private MessageLogContext(Map<String, String> previousContext) {
        this.previousContext = previousContext;
    }

    /**
     * Opens a context with a freshly generated correlation id.
     */
    public static MessageLogContext create() {
        return create(generateId());
    }

    /**
     * Opens a context with the given correlation id.
     */
    public static MessageLogContext create(String correlationId) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        MDC.put(CORRELATION_ID_KEY, correlationId);
        return new MessageLogContext(previous);
    }

    /**
     * Continues the correlation id carried by a message, or starts a new one if absent.
     */
    public static MessageLogContext continueOrCreate(String correlationId) {
        if (correlationId == null || correlationId.isBlank()) {
            return create();
        }
        return create(correlationId);
    }

    /**
     * Opens a context that keeps the caller's correlation id (if any) and only adds keys.
     */
    public static MessageLogContext enrich() {
        return new MessageLogContext(MDC.getCopyOfContextMap());
    }

    public static String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY);
    }

    public MessageLogContext with(String key, Object value) {
        if (value != null) {
            MDC.put(key, String.valueOf(value));
        }
        return this;
    }

    public MessageLogContext withService(String serviceName) {
        return with(SERVICE_NAME_KEY, serviceName);
    }

    public MessageLogContext withQueue(String queue) {
        return with(QUEUE_KEY, queue);
    }

    public MessageLogContext withExchange(String exchange) {
        return with(EXCHANGE_KEY, exchange);
    }

    public MessageLogContext withRoutingKey(String routingKey) {
        return with(ROUTING_KEY_KEY, routingKey);
    }

    public MessageLogContext withMessageId(String messageId) {
        return with(MESSAGE_ID_KEY, messageId);
    }

    public MessageLogContext withDeliveryTag(long deliveryTag) {
        return with(DELIVERY_TAG_KEY, deliveryTag);
    }

    public MessageLogContext withAttempt(int attempt) {
        return with(ATTEMPT_KEY, attempt);
    }

    /**
     * Wraps a Callable so it runs with the MDC of the submitting thread.
     */
    public static <T> Callable<T> wrap(Callable<T> callable) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            try {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                return callable.call();
            } finally {
                restore(previous);
            }
        };
    }

    @Override
    public void close() {
        restore(previousContext);
    }

    private static void restore(Map<String, String> previous) {
        if (previous != null) {
            MDC.setContextMap(previous);
        } else {
            MDC.clear();
        }
    }

    private static String generateId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}

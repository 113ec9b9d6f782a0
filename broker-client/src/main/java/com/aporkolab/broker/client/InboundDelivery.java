package com.aporkolab.broker.client;

import java.util.Collections;
import java.util.Map;

import com.aporkolab.broker.logging.CorrelationHeaders;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;

/**
 * Metadata of a received message as handed to a {@link MessageHandler}.
 */
public class InboundDelivery {

    private final String queue;
    private final Envelope envelope;
    private final AMQP.BasicProperties properties;
    private final byte[] body;

    public InboundDelivery(String queue, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        this.queue = queue;
        this.envelope = envelope;
        this.properties = properties != null ? properties : new AMQP.BasicProperties();
        this.body = body != null ? body : new byte[0];
    }

    public String getQueue() {
        return queue;
    }

    public long getDeliveryTag() {
        return envelope.getDeliveryTag();
    }

    public boolean isRedelivered() {
        return envelope.isRedeliver();
    }

    public String getExchange() {
        return envelope.getExchange();
    }

    public String getRoutingKey() {
        return envelope.getRoutingKey();
    }

    public String getMessageId() {
        return properties.getMessageId();
    }

    /**
     * The AMQP correlation-id property, falling back to the {@code x-correlation-id} header.
     */
    public String getCorrelationId() {
        String correlationId = properties.getCorrelationId();
        return correlationId != null ? correlationId : CorrelationHeaders.extractCorrelationId(getHeaders());
    }

    public Map<String, Object> getHeaders() {
        Map<String, Object> headers = properties.getHeaders();
        return headers != null ? Collections.unmodifiableMap(headers) : Map.of();
    }

    /**
     * Header value as a string; AMQP long strings are converted.
     */
    public String getHeader(String name) {
        Object value = getHeaders().get(name);
        return value != null ? value.toString() : null;
    }

    /**
     * Header value as a non-negative int. Missing, non-numeric or negative values yield {@code defaultValue}.
     */
    public int getIntHeader(String name, int defaultValue) {
        Object value = getHeaders().get(name);
        int parsed;
        if (value instanceof Number number) {
            parsed = number.intValue();
        } else if (value != null) {
            try {
                parsed = Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        } else {
            return defaultValue;
        }
        return parsed < 0 ? defaultValue : parsed;
    }

    public AMQP.BasicProperties getProperties() {
        return properties;
    }

    public byte[] getBody() {
        return body;
    }
}

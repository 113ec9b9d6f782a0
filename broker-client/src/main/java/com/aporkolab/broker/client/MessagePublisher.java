package com.aporkolab.broker.client;

import java.io.IOException;
import java.time.Clock;
import java.util.Date;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.broker.exception.BrokerOperationException;
import com.aporkolab.broker.logging.CorrelationHeaders;
import com.aporkolab.broker.logging.MessageLogContext;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;

/**
 * Serializes and publishes messages over the supervised channel.
 *
 * While the broker has the connection blocked, publishes are parked until the drain
 * signal and then sent in submission order. The returned future completes with the
 * message id once the channel accepted the frame; broker confirms are not awaited.
 */
public class MessagePublisher {

    private static final Logger log = LoggerFactory.getLogger(MessagePublisher.class);

    static final String DEFAULT_EXCHANGE = "";

    private final ConnectionSupervisor supervisor;
    private final FlowControl flowControl;
    private final MessageCodec codec;
    private final MessageIdGenerator idGenerator;
    private final Executor deferredExecutor;
    private final BrokerClientListener events;
    private final Clock clock;
    private final String serviceName;

    private final Object orderLock = new Object();
    private CompletableFuture<?> backlog = CompletableFuture.completedFuture(null);

    public MessagePublisher(ConnectionSupervisor supervisor,
                            FlowControl flowControl,
                            MessageCodec codec,
                            MessageIdGenerator idGenerator,
                            Executor deferredExecutor,
                            BrokerClientListener events,
                            Clock clock) {
        this.supervisor = supervisor;
        this.flowControl = flowControl;
        this.codec = codec;
        this.idGenerator = idGenerator;
        this.deferredExecutor = deferredExecutor;
        this.events = events;
        this.clock = clock;
        this.serviceName = supervisor.getSettings().getServiceName();
    }

    /**
     * Publishes {@code message} as JSON to an exchange.
     *
     * @throws com.aporkolab.broker.exception.ChannelNotInitializedException when disconnected
     * @throws com.aporkolab.broker.exception.MessageSerializationException when the message cannot be encoded
     */
    public CompletableFuture<String> publish(String exchange, String routingKey, Object message, PublishOptions options) {
        supervisor.requireChannel("publish");
        byte[] body = codec.encode(message);
        AMQP.BasicProperties properties = buildProperties(options == null ? PublishOptions.defaults() : options);
        return dispatch(exchange, routingKey == null ? "" : routingKey, properties, body);
    }

    /**
     * Publishes through the default exchange using the queue name as routing key.
     */
    public CompletableFuture<String> sendToQueue(String queue, Object message, PublishOptions options) {
        return publish(DEFAULT_EXCHANGE, queue, message, options);
    }

    /**
     * Publishes with an empty routing key and the given headers, for headers exchanges.
     */
    public CompletableFuture<String> publishWithHeaders(String exchange, Object message,
                                                        Map<String, Object> headers, PublishOptions options) {
        PublishOptions base = options == null ? PublishOptions.defaults() : options;
        PublishOptions merged = base.toBuilder().headers(headers).build();
        return publish(exchange, "", message, merged);
    }

    public boolean isBacklogged() {
        synchronized (orderLock) {
            return !backlog.isDone();
        }
    }

    private CompletableFuture<String> dispatch(String exchange, String routingKey,
                                               AMQP.BasicProperties properties, byte[] body) {
        String messageId = properties.getMessageId();
        synchronized (orderLock) {
            if (backlog.isDone() && !flowControl.isBlocked()) {
                try {
                    send(exchange, routingKey, properties, body);
                    return CompletableFuture.completedFuture(messageId);
                } catch (RuntimeException e) {
                    return CompletableFuture.failedFuture(e);
                }
            }

            log.warn("Message not published (buffer full), waiting for drain: exchange='{}', routingKey='{}', messageId={}",
                    exchange, routingKey, messageId);
            events.onPublishBlocked(exchange, routingKey);

            CompletableFuture<String> deferred = backlog
                    .handle((ignored, error) -> null)
                    .thenCompose(ignored -> flowControl.awaitDrain())
                    .thenApplyAsync(ignored -> {
                        synchronized (orderLock) {
                            send(exchange, routingKey, properties, body);
                        }
                        return messageId;
                    }, deferredExecutor);
            backlog = deferred;
            return deferred;
        }
    }

    private void send(String exchange, String routingKey, AMQP.BasicProperties properties, byte[] body) {
        Channel channel = supervisor.requireChannel("publish");
        try (MessageLogContext ignored = MessageLogContext.enrich()
                .withExchange(exchange)
                .withRoutingKey(routingKey)
                .withMessageId(properties.getMessageId())) {
            channel.basicPublish(exchange, routingKey, properties, body);
            log.debug("Published message {} to exchange='{}' routingKey='{}'",
                    properties.getMessageId(), exchange, routingKey);
        } catch (IOException e) {
            throw BrokerOperationException.publish(exchange.isEmpty() ? routingKey : exchange, e);
        }
        events.onPublished(exchange, routingKey);
    }

    private AMQP.BasicProperties buildProperties(PublishOptions options) {
        Map<String, Object> headers = CorrelationHeaders.inject(options.getHeaders());
        headers.putIfAbsent(CorrelationHeaders.SOURCE_SERVICE_HEADER, serviceName);

        String correlationId = options.getCorrelationId() != null
                ? options.getCorrelationId()
                : MessageLogContext.getCurrentCorrelationId();

        return new AMQP.BasicProperties.Builder()
                .contentType(options.getContentType() != null ? options.getContentType() : MessageCodec.CONTENT_TYPE)
                .deliveryMode(options.isPersistent() ? 2 : 1)
                .timestamp(Date.from(options.getTimestamp() != null ? options.getTimestamp() : clock.instant()))
                .messageId(options.getMessageId() != null ? options.getMessageId() : idGenerator.next())
                .correlationId(correlationId)
                .expiration(options.getExpiration() != null ? String.valueOf(options.getExpiration().toMillis()) : null)
                .priority(options.getPriority())
                .type(options.getType())
                .appId(serviceName)
                .headers(headers)
                .build();
    }
}

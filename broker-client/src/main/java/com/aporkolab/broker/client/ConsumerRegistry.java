package com.aporkolab.broker.client;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.broker.exception.BrokerOperationException;
import com.aporkolab.broker.logging.MessageLogContext;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Subscribes handlers to queues and settles every delivery.
 *
 * Each delivery becomes a task on the dispatcher executor. On success the message is
 * acknowledged; on failure it is rejected and the {@link RedeliveryPolicy} of the
 * registration decides whether it is requeued. One registration per queue.
 */
public class ConsumerRegistry implements ConnectionListener {

    private static final Logger log = LoggerFactory.getLogger(ConsumerRegistry.class);

    private final ConnectionSupervisor supervisor;
    private final MessageCodec codec;
    private final Executor dispatcher;
    private final BrokerClientListener events;
    private final String serviceName;

    private final Map<String, Registration<?>> registrations = new ConcurrentHashMap<>();

    public ConsumerRegistry(ConnectionSupervisor supervisor, MessageCodec codec,
                            Executor dispatcher, BrokerClientListener events) {
        this.supervisor = supervisor;
        this.codec = codec;
        this.dispatcher = dispatcher;
        this.events = events;
        this.serviceName = supervisor.getSettings().getServiceName();
    }

    /**
     * Starts consuming {@code queue}, decoding bodies as {@code type}.
     *
     * @throws IllegalStateException if the queue already has a registration
     * @throws com.aporkolab.broker.exception.ChannelNotInitializedException when disconnected
     */
    public <T> String consume(String queue, Class<T> type, MessageHandler<T> handler, ConsumeOptions options) {
        Channel channel = supervisor.requireChannel("consume");
        Registration<T> registration = new Registration<>(queue, type, handler,
                options == null ? ConsumeOptions.defaults() : options);

        if (registrations.putIfAbsent(queue, registration) != null) {
            throw new IllegalStateException("Queue '" + queue + "' already has an active consumer; cancel it first");
        }
        try {
            String tag = subscribe(channel, registration);
            log.info("Consuming from queue {} (consumerTag={}, noAck={})", queue, tag, registration.options.isNoAck());
            return tag;
        } catch (RuntimeException e) {
            registrations.remove(queue, registration);
            throw e;
        }
    }

    /**
     * Cancels the consumer of {@code queue} and forgets the registration.
     *
     * @return completes once the deliveries already handed to the dispatcher have finished
     */
    public CompletableFuture<Void> cancelConsumer(String queue) {
        Registration<?> registration = registrations.remove(queue);
        if (registration == null) {
            log.debug("No consumer registered for queue {}", queue);
            return CompletableFuture.completedFuture(null);
        }

        String tag = registration.consumerTag;
        registration.consumerTag = null;
        Channel channel = supervisor.getChannel();
        if (tag != null && channel != null) {
            try {
                channel.basicCancel(tag);
                log.info("Cancelled consumer {} on queue {}", tag, queue);
            } catch (IOException e) {
                throw BrokerOperationException.cancel(queue, e);
            } catch (ShutdownSignalException e) {
                log.warn("Channel already closed while cancelling consumer on queue {}: {}", queue, e.getMessage());
            }
        }
        return registration.inFlight();
    }

    public boolean hasConsumer(String queue) {
        return registrations.containsKey(queue);
    }

    public String getConsumerTag(String queue) {
        Registration<?> registration = registrations.get(queue);
        return registration != null ? registration.consumerTag : null;
    }

    public Set<String> getActiveQueues() {
        return Set.copyOf(registrations.keySet());
    }

    @Override
    public void onConnected(Channel channel) {
        for (Registration<?> registration : registrations.values()) {
            try {
                subscribe(channel, registration);
                log.info("Re-subscribed consumer on queue {}", registration.queue);
            } catch (RuntimeException e) {
                log.error("Failed to re-subscribe consumer on queue {}: {}", registration.queue, e.getMessage(), e);
            }
        }
    }

    @Override
    public void onDisconnected(Throwable cause) {
        registrations.values().forEach(registration -> registration.consumerTag = null);
    }

    @Override
    public void onClosing(Channel channel) {
        for (String queue : Set.copyOf(registrations.keySet())) {
            try {
                cancelConsumer(queue);
            } catch (RuntimeException e) {
                log.warn("Failed to cancel consumer on queue {} during close: {}", queue, e.getMessage());
            }
        }
    }

    private <T> String subscribe(Channel channel, Registration<T> registration) {
        ConsumeOptions options = registration.options;
        try {
            String tag = channel.basicConsume(registration.queue, options.isNoAck(), options.getConsumerTag(),
                    false, options.isExclusive(), options.getArguments(),
                    new DeliveryConsumer<>(channel, registration));
            registration.consumerTag = tag;
            return tag;
        } catch (IOException e) {
            throw BrokerOperationException.consume(registration.queue, e);
        }
    }

    private <T> void process(Channel channel, Registration<T> registration, InboundDelivery delivery) {
        try (MessageLogContext ignored = MessageLogContext.continueOrCreate(delivery.getCorrelationId())
                .withService(serviceName)
                .withQueue(registration.queue)
                .withMessageId(delivery.getMessageId())
                .withDeliveryTag(delivery.getDeliveryTag())) {

            long started = System.nanoTime();
            boolean success = false;
            try {
                T content = codec.decode(delivery.getBody(), registration.type);
                registration.handler.handle(content, delivery);
                success = true;
            } catch (Exception e) {
                log.error("Error processing message {} from queue {}: {}",
                        delivery.getMessageId(), registration.queue, e.getMessage(), e);
            }
            events.onHandlerCompleted(registration.queue, Duration.ofNanos(System.nanoTime() - started), success);

            if (registration.options.isNoAck()) {
                return;
            }
            if (success) {
                ack(channel, registration.queue, delivery);
            } else {
                boolean requeue = registration.options.getRedeliveryPolicy().shouldRequeue(delivery.isRedelivered());
                reject(channel, registration.queue, delivery, requeue);
            }
        }
    }

    private void ack(Channel channel, String queue, InboundDelivery delivery) {
        try {
            channel.basicAck(delivery.getDeliveryTag(), false);
            events.onAcknowledged(queue);
        } catch (IOException | ShutdownSignalException e) {
            log.warn("Could not acknowledge message {} on queue {}: {}", delivery.getMessageId(), queue, e.getMessage());
        }
    }

    private void reject(Channel channel, String queue, InboundDelivery delivery, boolean requeue) {
        try {
            channel.basicNack(delivery.getDeliveryTag(), false, requeue);
            events.onRejected(queue, requeue);
            if (requeue) {
                log.info("Message {} requeued for one more attempt", delivery.getMessageId());
            } else {
                log.warn("Message {} rejected without requeue, routed to dead-letter target of {}",
                        delivery.getMessageId(), queue);
            }
        } catch (IOException | ShutdownSignalException e) {
            log.warn("Could not reject message {} on queue {}: {}", delivery.getMessageId(), queue, e.getMessage());
        }
    }

    private static final class Registration<T> {
        private final String queue;
        private final Class<T> type;
        private final MessageHandler<T> handler;
        private final ConsumeOptions options;
        private final Set<CompletableFuture<Void>> tasks = ConcurrentHashMap.newKeySet();
        private volatile String consumerTag;

        private Registration(String queue, Class<T> type, MessageHandler<T> handler, ConsumeOptions options) {
            this.queue = queue;
            this.type = type;
            this.handler = handler;
            this.options = options;
        }

        private void track(CompletableFuture<Void> task) {
            tasks.add(task);
            task.whenComplete((ignored, error) -> tasks.remove(task));
        }

        private CompletableFuture<Void> inFlight() {
            return CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0]));
        }
    }

    private final class DeliveryConsumer<T> extends DefaultConsumer {

        private final Registration<T> registration;

        private DeliveryConsumer(Channel channel, Registration<T> registration) {
            super(channel);
            this.registration = registration;
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope,
                                   AMQP.BasicProperties properties, byte[] body) {
            Channel channel = getChannel();
            InboundDelivery delivery = new InboundDelivery(registration.queue, envelope, properties, body);
            CompletableFuture<Void> task = CompletableFuture.runAsync(
                    () -> process(channel, registration, delivery), dispatcher);
            registration.track(task);
        }

        @Override
        public void handleCancel(String consumerTag) {
            // registration stays so the next reconnect subscribes again
            log.warn("Consumer {} on queue {} was cancelled by the broker", consumerTag, registration.queue);
            registration.consumerTag = null;
        }
    }
}

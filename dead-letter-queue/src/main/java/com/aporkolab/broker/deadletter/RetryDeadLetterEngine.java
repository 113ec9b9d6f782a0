package com.aporkolab.broker.deadletter;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.broker.client.BrokerClient;
import com.aporkolab.broker.client.ConsumeOptions;
import com.aporkolab.broker.client.InboundDelivery;
import com.aporkolab.broker.client.PublishOptions;
import com.aporkolab.broker.client.RedeliveryPolicy;
import com.aporkolab.broker.exception.DeadLetterException;
import com.aporkolab.broker.exception.FailedWorkNotFoundException;
import com.aporkolab.broker.exception.MessageSerializationException;
import com.aporkolab.broker.logging.MessageLogContext;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Bounded retry for work items consumed from the process queue.
 *
 * The attempt counter travels in a message header. A failed attempt below the limit is
 * re-published to the retry queue with the counter incremented and the original is acked;
 * the retry queue's TTL routes the copy back to the process queue. A failed attempt at the
 * limit is recorded in the {@link FailedWorkStore}, announced with a failure event and
 * rejected without requeue, so the broker moves it to the dead queue.
 *
 * The process queue is consumed with {@link RedeliveryPolicy#NEVER_REQUEUE}: the header
 * counter is the only retry mechanism. Bodies are taken raw and decoded inside the attempt,
 * so a body that is not valid JSON is retried and dead-lettered like any other failure.
 *
 * @param <T> work item type, converted from the JSON payload
 */
public class RetryDeadLetterEngine<T> {

    private static final Logger log = LoggerFactory.getLogger(RetryDeadLetterEngine.class);

    public static final String WORK_ID_HEADER = "x-work-id";
    public static final String FIRST_DEATH_REASON_HEADER = "x-first-death-reason";

    private final BrokerClient client;
    private final RetryTopology topology;
    private final RetryPolicy policy;
    private final Class<T> workType;
    private final WorkHandler<T> handler;
    private final Function<T, String> workIdExtractor;
    private final FailedWorkStore store;
    private final RetryListener listener;
    private final String successEventType;
    private final String failureEventType;
    private final Clock clock;
    private final String hostname;

    private volatile boolean running;
    private volatile boolean monitoring;

    private RetryDeadLetterEngine(Builder<T> builder) {
        this.client = builder.client;
        this.topology = builder.topology;
        this.policy = builder.policy;
        this.workType = builder.workType;
        this.handler = builder.handler;
        this.workIdExtractor = builder.workIdExtractor;
        this.store = builder.store;
        this.listener = builder.listener;
        this.successEventType = builder.successEventType;
        this.failureEventType = builder.failureEventType;
        this.clock = builder.clock;
        this.hostname = resolveHostname();
    }

    public static <T> Builder<T> builder(Class<T> workType) {
        return new Builder<>(workType);
    }

    public void declareTopology() {
        topology.declare(client, policy.getRetryDelay());
    }

    /**
     * Starts consuming the process queue.
     */
    public void start() {
        client.consume(topology.getProcessQueue(), byte[].class, this::handleDelivery,
                ConsumeOptions.builder().redeliveryPolicy(RedeliveryPolicy.NEVER_REQUEUE).build());
        running = true;
        log.info("Retry engine started on {} (maxAttempts={}, retryDelay={} ms)",
                topology.getProcessQueue(), policy.getMaxAttempts(), policy.getRetryDelay().toMillis());
    }

    /**
     * Consumes the dead queue and records items the engine has not recorded itself,
     * keeping the broker's dead-letter reason. Consumed dead messages are acked, including
     * bodies that are not valid JSON.
     */
    public void startDeadLetterMonitor() {
        client.consume(topology.getDeadQueue(), byte[].class, this::handleDeadLetter, ConsumeOptions.defaults());
        monitoring = true;
        log.info("Dead-letter monitor started on {}", topology.getDeadQueue());
    }

    public CompletableFuture<Void> stop() {
        running = false;
        monitoring = false;
        return CompletableFuture.allOf(
                client.cancelConsumer(topology.getProcessQueue()),
                client.cancelConsumer(topology.getDeadQueue()));
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isMonitoring() {
        return monitoring;
    }

    /**
     * Publishes a new work item with attempt 0.
     *
     * @return the work id
     */
    public CompletableFuture<String> submit(T work) {
        JsonNode payload = client.getCodec().getObjectMapper().valueToTree(work);
        String workId = workIdExtractor != null ? workIdExtractor.apply(work) : null;
        return publishAttempt(payload, workId, 0)
                .thenApply(messageId -> {
                    String id = workId != null ? workId : messageId;
                    log.info("Work {} submitted ({})", id, WorkState.PENDING);
                    return id;
                });
    }

    /**
     * Manual recovery of a dead item: publishes its payload again with the attempt counter
     * reset to 0 and removes it from the failure store once the publish is accepted.
     * A failed publish leaves the record in place.
     *
     * @throws FailedWorkNotFoundException if no failed record exists for {@code workId}
     */
    public CompletableFuture<String> resubmit(String workId) {
        FailedWork failed = store.find(workId)
                .orElseThrow(() -> new FailedWorkNotFoundException(workId));

        return publishAttempt(bodyOf(failed), workId, 0)
                .thenApply(messageId -> {
                    store.remove(workId);
                    listener.onResubmitted(workId);
                    log.info("Work {} resubmitted after {} failed attempts", workId, failed.getRetryCount());
                    return workId;
                });
    }

    public Optional<FailedWork> findFailed(String workId) {
        return store.find(workId);
    }

    public List<FailedWork> listFailed() {
        return store.findAll();
    }

    public RetryTopology getTopology() {
        return topology;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    void handleDelivery(byte[] body, InboundDelivery delivery) {
        int attempt = delivery.getIntHeader(policy.getRetryCountHeader(), 0);
        String workId = resolveWorkId(delivery);

        try (MessageLogContext ignored = MessageLogContext.enrich().withAttempt(attempt).with("workId", workId)) {
            log.debug("Work {} {} (attempt {}/{})", workId, WorkState.PROCESSING, attempt, policy.getMaxAttempts());

            Object result;
            try {
                JsonNode payload = client.getCodec().decode(body, JsonNode.class);
                T work = client.getCodec().convert(payload, workType);
                result = handler.process(work, new RetryContext(workId, attempt, policy.getMaxAttempts(), delivery));
            } catch (Exception e) {
                onFailure(workId, attempt, body, delivery, e);
                return;
            }
            onSuccess(workId, attempt, result);
        }
    }

    private void onSuccess(String workId, int attempt, Object result) {
        log.info("Work {} {} on attempt {}", workId, WorkState.SUCCEEDED, attempt);
        listener.onSucceeded(workId, attempt);
        publishEvent(WorkEvent.success(successEventType, workId, attempt, result, clock.instant()));
    }

    private void onFailure(String workId, int attempt, byte[] body, InboundDelivery delivery, Exception error) {
        WorkState next = policy.onFailure(attempt);
        log.warn("Work {} failed on attempt {}/{}: {} -> {}",
                workId, attempt, policy.getMaxAttempts(), error.getMessage(), next);

        if (next == WorkState.RETRY_SCHEDULED) {
            int nextAttempt = attempt + 1;
            // the original is acked only once the copy is accepted
            join(publishAttempt(body, workId, nextAttempt, topology.getDeadLetterExchange(),
                    topology.getRetryRoutingKey()));
            listener.onRetryScheduled(workId, nextAttempt, policy.getRetryDelay());
            log.info("Work {} {}: attempt {} in {} ms", workId, WorkState.RETRY_SCHEDULED,
                    nextAttempt, policy.getRetryDelay().toMillis());
            return;
        }

        JsonNode payload = parseOrNull(body);
        FailedWork failedWork = FailedWork.builder()
                .workId(workId)
                .sourceQueue(delivery.getQueue())
                .messageId(delivery.getMessageId())
                .payload(payload)
                .rawBody(rawTextOf(body, payload))
                .retryCount(attempt)
                .failureReason(FailedWork.describe(error))
                .failureType(error instanceof MessageSerializationException
                        ? FailureType.DESERIALIZATION_ERROR
                        : FailureType.MAX_RETRIES_EXCEEDED)
                .failedAt(clock.instant())
                .hostname(hostname)
                .stackTrace(FailedWork.stackTraceOf(error))
                .build();
        store.save(failedWork);
        listener.onDeadLettered(failedWork);
        log.error("Work {} {} after {} attempts: {}", workId, WorkState.DEAD, attempt, failedWork.getFailureReason());

        publishEvent(WorkEvent.failure(failureEventType, workId, attempt, error.getMessage(), clock.instant()));

        throw new DeadLetterException(workId, attempt, error);
    }

    void handleDeadLetter(byte[] body, InboundDelivery delivery) {
        String workId = resolveWorkId(delivery);
        String reason = delivery.getHeader(FIRST_DEATH_REASON_HEADER);

        Optional<FailedWork> existing = store.find(workId);
        if (existing.isPresent()) {
            store.save(existing.get().toBuilder().deadLetterReason(reason).build());
            log.info("Work {} confirmed in dead queue (reason={})", workId, reason);
            return;
        }

        JsonNode payload = parseOrNull(body);
        String rawBody = rawTextOf(body, payload);
        boolean undecodable = rawBody != null;
        FailedWork failedWork = FailedWork.builder()
                .workId(workId)
                .sourceQueue(topology.getProcessQueue())
                .messageId(delivery.getMessageId())
                .payload(payload)
                .rawBody(rawBody)
                .retryCount(delivery.getIntHeader(policy.getRetryCountHeader(), 0))
                .failureReason(undecodable
                        ? "Body is not valid JSON"
                        : "Max retries exceeded or permanent failure")
                .failureType(undecodable ? FailureType.DESERIALIZATION_ERROR : FailureType.DEAD_LETTERED)
                .failedAt(clock.instant())
                .hostname(hostname)
                .deadLetterReason(reason)
                .build();
        store.save(failedWork);
        listener.onDeadLettered(failedWork);
        log.warn("Work {} found in dead queue (reason={}), manual intervention required; {} failed items",
                workId, reason, store.size());
    }

    private CompletableFuture<String> publishAttempt(Object payload, String workId, int attempt) {
        return publishAttempt(payload, workId, attempt, "", topology.getProcessQueue());
    }

    private CompletableFuture<String> publishAttempt(Object payload, String workId, int attempt,
                                                     String exchange, String routingKey) {
        PublishOptions options = PublishOptions.builder()
                .header(policy.getRetryCountHeader(), attempt)
                .header(WORK_ID_HEADER, workId)
                .build();
        return client.publish(exchange, routingKey, payload, options);
    }

    private void publishEvent(WorkEvent event) {
        try {
            client.publish(topology.getEventExchange(), "", event)
                    .whenComplete((messageId, error) -> {
                        if (error != null) {
                            log.error("Failed to publish {} event for work {}: {}",
                                    event.eventType(), event.workId(), error.getMessage());
                        }
                    });
        } catch (RuntimeException e) {
            log.error("Failed to publish {} event for work {}: {}", event.eventType(), event.workId(), e.getMessage());
        }
    }

    private JsonNode parseOrNull(byte[] body) {
        if (body == null || body.length == 0) {
            return null;
        }
        try {
            return client.getCodec().decode(body, JsonNode.class);
        } catch (MessageSerializationException e) {
            return null;
        }
    }

    private static String rawTextOf(byte[] body, JsonNode parsed) {
        if (parsed != null || body == null || body.length == 0) {
            return null;
        }
        return new String(body, StandardCharsets.UTF_8);
    }

    // undecodable bodies go back out as the original bytes
    private static Object bodyOf(FailedWork failed) {
        if (failed.getPayload() == null && failed.getRawBody() != null) {
            return failed.getRawBody().getBytes(StandardCharsets.UTF_8);
        }
        return failed.getPayload();
    }

    private static String resolveWorkId(InboundDelivery delivery) {
        String workId = delivery.getHeader(WORK_ID_HEADER);
        if (workId != null && !workId.isBlank()) {
            return workId;
        }
        if (delivery.getMessageId() != null) {
            return delivery.getMessageId();
        }
        return delivery.getQueue() + "#" + delivery.getDeliveryTag();
    }

    private static <R> R join(CompletableFuture<R> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static String resolveHostname() {
        String fromEnv = System.getenv("HOSTNAME");
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown";
        }
    }

    public static class Builder<T> {
        private final Class<T> workType;
        private BrokerClient client;
        private RetryTopology topology = RetryTopology.builder().build();
        private RetryPolicy policy = RetryPolicy.defaults();
        private WorkHandler<T> handler;
        private Function<T, String> workIdExtractor;
        private FailedWorkStore store = new InMemoryFailedWorkStore();
        private RetryListener listener = RetryListener.NOOP;
        private String successEventType = "work.success";
        private String failureEventType = "work.failed";
        private Clock clock = Clock.systemUTC();

        private Builder(Class<T> workType) {
            this.workType = workType;
        }

        public Builder<T> client(BrokerClient client) {
            this.client = client;
            return this;
        }

        public Builder<T> topology(RetryTopology topology) {
            this.topology = topology;
            return this;
        }

        public Builder<T> policy(RetryPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder<T> handler(WorkHandler<T> handler) {
            this.handler = handler;
            return this;
        }

        /**
         * Derives the work id from the item at submit time; defaults to the message id.
         */
        public Builder<T> workId(Function<T, String> workIdExtractor) {
            this.workIdExtractor = workIdExtractor;
            return this;
        }

        public Builder<T> store(FailedWorkStore store) {
            this.store = store;
            return this;
        }

        public Builder<T> listener(RetryListener listener) {
            this.listener = listener != null ? listener : RetryListener.NOOP;
            return this;
        }

        public Builder<T> eventTypes(String successEventType, String failureEventType) {
            this.successEventType = successEventType;
            this.failureEventType = failureEventType;
            return this;
        }

        public Builder<T> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public RetryDeadLetterEngine<T> build() {
            if (client == null) {
                throw new IllegalStateException("client is required");
            }
            if (handler == null) {
                throw new IllegalStateException("handler is required");
            }
            return new RetryDeadLetterEngine<>(this);
        }
    }
}

package com.aporkolab.broker.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.junit.jupiter.MockitoExtension;

import com.aporkolab.broker.exception.BrokerOperationException;
import com.aporkolab.broker.exception.ChannelNotInitializedException;
import com.aporkolab.broker.exception.MessageSerializationException;
import com.aporkolab.broker.logging.MessageLogContext;
import com.rabbitmq.client.AMQP;

@ExtendWith(MockitoExtension.class)
class MessagePublisherTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private BrokerMocks mocks;
    private BrokerClientListener events;
    private MessagePublisher publisher;

    record Payment(String orderId, int amount) {
    }

    @BeforeEach
    void setUp() throws Exception {
        mocks = new BrokerMocks();
        events = mock(BrokerClientListener.class);
        publisher = createPublisher(mocks.connectedSupervisor());
    }

    private MessagePublisher createPublisher(ConnectionSupervisor supervisor) {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        return new MessagePublisher(supervisor, mocks.flowControl,
                new MessageCodec(MessageCodec.defaultObjectMapper()),
                new MessageIdGenerator("test-service", clock),
                Runnable::run, events, clock);
    }

    private AMQP.BasicProperties capturePublished(String exchange, String routingKey) throws IOException {
        ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(mocks.channel).basicPublish(eq(exchange), eq(routingKey), props.capture(), any(byte[].class));
        return props.getValue();
    }

    @Nested
    @DisplayName("Default Metadata")
    class DefaultMetadata {

        @Test
        @DisplayName("should publish persistent JSON with timestamp and generated id")
        void shouldAttachDefaults() throws Exception {
            String messageId = publisher.publish("orders.fanout", "", new Payment("o-1", 100), null).join();

            AMQP.BasicProperties props = capturePublished("orders.fanout", "");
            assertThat(props.getDeliveryMode()).isEqualTo(2);
            assertThat(props.getContentType()).isEqualTo("application/json");
            assertThat(props.getTimestamp().toInstant()).isEqualTo(NOW);
            assertThat(props.getMessageId()).isEqualTo(messageId);
            assertThat(messageId).matches("test-service-" + NOW.toEpochMilli() + "-[0-9a-z]{9}");
            assertThat(props.getAppId()).isEqualTo("test-service");
            assertThat(props.getHeaders()).containsEntry("x-source-service", "test-service");
        }

        @Test
        @DisplayName("should serialize the message body as JSON")
        void shouldSerializeBody() throws Exception {
            publisher.publish("orders.fanout", "", new Payment("o-1", 100), null).join();

            ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
            verify(mocks.channel).basicPublish(eq("orders.fanout"), eq(""), any(AMQP.BasicProperties.class), body.capture());
            assertThat(new String(body.getValue(), StandardCharsets.UTF_8))
                    .contains("\"orderId\":\"o-1\"")
                    .contains("\"amount\":100");
        }

        @Test
        @DisplayName("should let options override defaults")
        void shouldApplyOverrides() throws Exception {
            PublishOptions options = PublishOptions.builder()
                    .persistent(false)
                    .messageId("fixed-id")
                    .correlationId("corr-7")
                    .expiration(Duration.ofSeconds(1))
                    .priority(5)
                    .type("payment.requested")
                    .header("x-retry-count", 2)
                    .build();

            String messageId = publisher.publish("orders.fanout", "", new Payment("o-1", 100), options).join();

            AMQP.BasicProperties props = capturePublished("orders.fanout", "");
            assertThat(messageId).isEqualTo("fixed-id");
            assertThat(props.getDeliveryMode()).isEqualTo(1);
            assertThat(props.getCorrelationId()).isEqualTo("corr-7");
            assertThat(props.getExpiration()).isEqualTo("1000");
            assertThat(props.getPriority()).isEqualTo(5);
            assertThat(props.getType()).isEqualTo("payment.requested");
            assertThat(props.getHeaders()).containsEntry("x-retry-count", 2);
        }

        @Test
        @DisplayName("should propagate the current correlation id")
        void shouldPropagateCorrelationId() throws Exception {
            try (MessageLogContext ignored = MessageLogContext.create("req-42")) {
                publisher.publish("orders.fanout", "", new Payment("o-1", 100), null).join();
            }

            AMQP.BasicProperties props = capturePublished("orders.fanout", "");
            assertThat(props.getCorrelationId()).isEqualTo("req-42");
            assertThat(props.getHeaders()).containsEntry("x-correlation-id", "req-42");
        }
    }

    @Nested
    @DisplayName("Destinations")
    class Destinations {

        @Test
        @DisplayName("should send to a queue through the default exchange")
        void shouldSendToQueue() throws Exception {
            publisher.sendToQueue("payments.process", new Payment("o-1", 100), null).join();

            capturePublished("", "payments.process");
            verify(events).onPublished("", "payments.process");
        }

        @Test
        @DisplayName("should publish with headers and an empty routing key")
        void shouldPublishWithHeaders() throws Exception {
            publisher.publishWithHeaders("orders.headers", new Payment("o-1", 100),
                    Map.of("region", "eu"), null).join();

            AMQP.BasicProperties props = capturePublished("orders.headers", "");
            assertThat(props.getHeaders()).containsEntry("region", "eu");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should fail fast when no channel exists")
        void shouldFailWithoutChannel() throws Exception {
            BrokerMocks disconnected = new BrokerMocks();
            MessagePublisher offline = createPublisher(disconnected.supervisor());

            assertThatThrownBy(() -> offline.publish("orders.fanout", "", new Payment("o-1", 1), null))
                    .isInstanceOf(ChannelNotInitializedException.class);
        }

        @Test
        @DisplayName("should throw serialization errors synchronously")
        void shouldThrowSerializationErrors() throws Exception {
            assertThatThrownBy(() -> publisher.publish("orders.fanout", "", new Object(), null))
                    .isInstanceOf(MessageSerializationException.class);

            verify(mocks.channel, never()).basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));
        }

        @Test
        @DisplayName("should complete exceptionally when the channel rejects the frame")
        void shouldFailFutureOnIoError() throws Exception {
            doThrow(new IOException("channel closed")).when(mocks.channel)
                    .basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));

            CompletableFuture<String> result = publisher.sendToQueue("payments.process", new Payment("o-1", 1), null);

            assertThatThrownBy(result::join)
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(BrokerOperationException.class);
        }
    }

    @Nested
    @DisplayName("Backpressure")
    class Backpressure {

        @Test
        @DisplayName("should hold publishes while blocked and send them in order after drain")
        void shouldWaitForDrain() throws Exception {
            mocks.flowControl.handleBlocked("low on memory");

            CompletableFuture<String> first = publisher.sendToQueue("payments.process", new Payment("o-1", 1),
                    PublishOptions.builder().messageId("m-1").build());
            CompletableFuture<String> second = publisher.sendToQueue("payments.process", new Payment("o-2", 2),
                    PublishOptions.builder().messageId("m-2").build());

            assertThat(first).isNotDone();
            assertThat(second).isNotDone();
            assertThat(publisher.isBacklogged()).isTrue();
            verify(mocks.channel, never()).basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));
            verify(events, times(2)).onPublishBlocked("", "payments.process");

            mocks.flowControl.handleUnblocked();

            assertThat(first.join()).isEqualTo("m-1");
            assertThat(second.join()).isEqualTo("m-2");
            ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
            verify(mocks.channel, times(2))
                    .basicPublish(eq(""), eq("payments.process"), props.capture(), any(byte[].class));
            assertThat(props.getAllValues()).extracting(AMQP.BasicProperties::getMessageId)
                    .containsExactly("m-1", "m-2");
        }

        @Test
        @DisplayName("should publish directly again once the backlog drained")
        void shouldResumeDirectPublishing() throws Exception {
            mocks.flowControl.handleBlocked("low on memory");
            CompletableFuture<String> parked = publisher.sendToQueue("payments.process", new Payment("o-1", 1), null);
            mocks.flowControl.handleUnblocked();
            parked.join();

            CompletableFuture<String> direct = publisher.sendToQueue("payments.process", new Payment("o-2", 2), null);

            assertThat(direct).isDone();
            assertThat(publisher.isBacklogged()).isFalse();
        }
    }
}

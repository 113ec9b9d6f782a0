package com.aporkolab.broker.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.aporkolab.broker.exception.MessageSerializationException;
import com.fasterxml.jackson.databind.JsonNode;

class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec(MessageCodec.defaultObjectMapper());

    @Test
    @DisplayName("should hand raw bodies through without parsing them")
    void shouldPassRawBodiesThrough() {
        byte[] body = "{not json".getBytes(StandardCharsets.UTF_8);

        assertThat(codec.decode(body, byte[].class)).isSameAs(body);
        assertThat(codec.encode(body)).isSameAs(body);
    }

    @Test
    @DisplayName("should reject bodies that are not JSON when a type is requested")
    void shouldRejectMalformedJson() {
        byte[] body = "{not json".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> codec.decode(body, JsonNode.class))
                .isInstanceOf(MessageSerializationException.class);
    }

    @Test
    @DisplayName("should decode empty bodies to null")
    void shouldDecodeEmptyToNull() {
        assertThat(codec.decode(new byte[0], JsonNode.class)).isNull();
        assertThat(codec.encode(null)).isEmpty();
    }

    @Test
    @DisplayName("should encode objects as JSON")
    void shouldEncodeJson() {
        JsonNode decoded = codec.decode(codec.encode(Map.of("orderId", "o-1")), JsonNode.class);

        assertThat(decoded.get("orderId").asText()).isEqualTo("o-1");
    }
}

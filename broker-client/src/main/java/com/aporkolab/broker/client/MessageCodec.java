package com.aporkolab.broker.client;

import java.io.IOException;

import com.aporkolab.broker.exception.MessageSerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON encoding of message bodies. {@code byte[]} bodies pass through untouched in both
 * directions, so a consumer can take the raw body and decode it itself.
 */
public class MessageCodec {

    public static final String CONTENT_TYPE = "application/json";

    private static final byte[] EMPTY = new byte[0];

    private final ObjectMapper objectMapper;

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public byte[] encode(Object message) {
        if (message == null) {
            return EMPTY;
        }
        if (message instanceof byte[] raw) {
            return raw;
        }
        try {
            return objectMapper.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw MessageSerializationException.serialize(message.getClass(), e);
        }
    }

    /**
     * Decodes a body; an empty body decodes to null.
     */
    public <T> T decode(byte[] body, Class<T> type) {
        if (type == byte[].class) {
            return type.cast(body);
        }
        if (body == null || body.length == 0) {
            return null;
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (IOException e) {
            throw MessageSerializationException.deserialize(type, e);
        }
    }

    public <T> T convert(Object value, Class<T> type) {
        try {
            return objectMapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw MessageSerializationException.deserialize(type, e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}

package com.aporkolab.broker.exception;

/**
 * Message body could not be written to or read from JSON.
 */
public class MessageSerializationException extends BrokerException {

    public static final String CODE = "MESSAGE_SERIALIZATION_FAILED";

    public MessageSerializationException(String message, Class<?> type, Throwable cause) {
        super(CODE, message, cause);
        with("type", type.getName());
    }

    public static MessageSerializationException serialize(Class<?> type, Throwable cause) {
        return new MessageSerializationException("Failed to serialize message of type " + type.getName(), type, cause);
    }

    public static MessageSerializationException deserialize(Class<?> type, Throwable cause) {
        return new MessageSerializationException("Failed to deserialize message body to " + type.getName(), type, cause);
    }
}

package com.aporkolab.broker.exception;

/**
 * Raised synchronously when a topology, publish or consume operation is attempted
 * before a live channel exists. Callers must await a successful connect first.
 */
public class ChannelNotInitializedException extends BrokerException {

    public static final String CODE = "CHANNEL_NOT_INITIALIZED";

    public ChannelNotInitializedException(String operation) {
        super(CODE, String.format("Channel not initialized (operation '%s')", operation));
        with("operation", operation);
    }
}

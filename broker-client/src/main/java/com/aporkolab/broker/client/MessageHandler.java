package com.aporkolab.broker.client;

/**
 * Processes one delivery. Returning normally acknowledges it; throwing rejects it.
 */
@FunctionalInterface
public interface MessageHandler<T> {

    void handle(T content, InboundDelivery delivery) throws Exception;
}

package com.aporkolab.broker.exception;

/**
 * A broker operation failed at the transport level (I/O error, channel closed by the broker).
 */
public class BrokerOperationException extends BrokerException {

    public static final String CODE = "BROKER_OPERATION_FAILED";

    public BrokerOperationException(String operation, String target, Throwable cause) {
        super(
            CODE,
            String.format("Broker operation '%s' on '%s' failed: %s", operation, target, cause.getMessage()),
            cause
        );
        with("operation", operation);
        with("target", target);
    }

    public static BrokerOperationException declare(String entity, Throwable cause) {
        return new BrokerOperationException("declare", entity, cause);
    }

    public static BrokerOperationException bind(String queue, String exchange, Throwable cause) {
        return new BrokerOperationException("bind", queue + "<-" + exchange, cause);
    }

    public static BrokerOperationException publish(String destination, Throwable cause) {
        return new BrokerOperationException("publish", destination, cause);
    }

    public static BrokerOperationException consume(String queue, Throwable cause) {
        return new BrokerOperationException("consume", queue, cause);
    }

    public static BrokerOperationException cancel(String queue, Throwable cause) {
        return new BrokerOperationException("cancel", queue, cause);
    }
}

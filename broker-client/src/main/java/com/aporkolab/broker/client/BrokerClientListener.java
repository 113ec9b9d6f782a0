package com.aporkolab.broker.client;

import java.time.Duration;
import java.util.List;

/**
 * Observes broker client activity. Used for metrics; all methods are no-ops by default.
 * Implementations must be fast and must not throw.
 */
public interface BrokerClientListener {

    BrokerClientListener NOOP = new BrokerClientListener() {
    };

    default void onConnected() {
    }

    default void onConnectionFailed(Throwable cause) {
    }

    default void onConnectionLost(Throwable cause) {
    }

    default void onReconnectScheduled(Duration delay) {
    }

    default void onPublished(String exchange, String routingKey) {
    }

    default void onPublishBlocked(String exchange, String routingKey) {
    }

    default void onAcknowledged(String queue) {
    }

    default void onRejected(String queue, boolean requeued) {
    }

    default void onHandlerCompleted(String queue, Duration duration, boolean success) {
    }

    /**
     * Fans events out to several listeners in order.
     */
    static BrokerClientListener composite(List<BrokerClientListener> listeners) {
        if (listeners.isEmpty()) {
            return NOOP;
        }
        if (listeners.size() == 1) {
            return listeners.get(0);
        }
        List<BrokerClientListener> copy = List.copyOf(listeners);
        return new BrokerClientListener() {
            @Override
            public void onConnected() {
                copy.forEach(BrokerClientListener::onConnected);
            }

            @Override
            public void onConnectionFailed(Throwable cause) {
                copy.forEach(l -> l.onConnectionFailed(cause));
            }

            @Override
            public void onConnectionLost(Throwable cause) {
                copy.forEach(l -> l.onConnectionLost(cause));
            }

            @Override
            public void onReconnectScheduled(Duration delay) {
                copy.forEach(l -> l.onReconnectScheduled(delay));
            }

            @Override
            public void onPublished(String exchange, String routingKey) {
                copy.forEach(l -> l.onPublished(exchange, routingKey));
            }

            @Override
            public void onPublishBlocked(String exchange, String routingKey) {
                copy.forEach(l -> l.onPublishBlocked(exchange, routingKey));
            }

            @Override
            public void onAcknowledged(String queue) {
                copy.forEach(l -> l.onAcknowledged(queue));
            }

            @Override
            public void onRejected(String queue, boolean requeued) {
                copy.forEach(l -> l.onRejected(queue, requeued));
            }

            @Override
            public void onHandlerCompleted(String queue, Duration duration, boolean success) {
                copy.forEach(l -> l.onHandlerCompleted(queue, duration, success));
            }
        };
    }
}

package com.aporkolab.broker.client;

import com.rabbitmq.client.Channel;

/**
 * Callbacks for connection lifecycle events raised by the {@link ConnectionSupervisor}.
 */
public interface ConnectionListener {

    /**
     * Called after every successful connect, including reconnects, with the new channel.
     * Topology replay and consumer re-subscription hook in here.
     */
    default void onConnected(Channel channel) {
    }

    /**
     * Called when the connection or channel was lost unexpectedly.
     */
    default void onDisconnected(Throwable cause) {
    }

    /**
     * Called by an explicit close, before the channel and connection are closed.
     */
    default void onClosing(Channel channel) {
    }
}

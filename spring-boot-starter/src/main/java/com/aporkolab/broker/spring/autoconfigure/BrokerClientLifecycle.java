package com.aporkolab.broker.spring.autoconfigure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import com.aporkolab.broker.client.BrokerClient;

/**
 * Connects the client when the context starts and closes it when the context stops.
 * An unreachable broker does not fail startup; the client keeps reconnecting.
 *
 * The lifecycle is one-shot: closing the client is terminal, so a context that is stopped
 * and started again stays disconnected and reports not running.
 */
public class BrokerClientLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(BrokerClientLifecycle.class);

    private final BrokerClient client;
    private volatile boolean running;

    public BrokerClientLifecycle(BrokerClient client) {
        this.client = client;
    }

    @Override
    public void start() {
        if (client.isClosed()) {
            log.warn("Broker client was closed by an earlier stop, it cannot be restarted");
            return;
        }
        if (!client.connect()) {
            log.warn("Broker not reachable at startup, reconnect scheduled");
        }
        running = true;
    }

    @Override
    public void stop() {
        client.close();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // start before and stop after the application's own consumers
    @Override
    public int getPhase() {
        return Integer.MIN_VALUE + 1000;
    }
}

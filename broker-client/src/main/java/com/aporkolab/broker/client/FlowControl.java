package com.aporkolab.broker.client;

import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.BlockedListener;

/**
 * Tracks broker flow control for one connection.
 * 
 * {@code connection.blocked} means the outbound path is full; {@code connection.unblocked}
 * is the drain signal. Publishers wait on {@link #awaitDrain()} while blocked.
 */
public class FlowControl implements BlockedListener {

    private static final Logger log = LoggerFactory.getLogger(FlowControl.class);

    private CompletableFuture<Void> drained = CompletableFuture.completedFuture(null);

    @Override
    public synchronized void handleBlocked(String reason) {
        if (drained.isDone()) {
            drained = new CompletableFuture<>();
        }
        log.warn("Broker blocked publishing on this connection: {}", reason);
    }

    @Override
    public void handleUnblocked() {
        CompletableFuture<Void> waiting;
        synchronized (this) {
            waiting = drained;
        }
        log.info("Broker unblocked publishing on this connection");
        waiting.complete(null);
    }

    public synchronized boolean isBlocked() {
        return !drained.isDone();
    }

    /**
     * Completes when the connection is (or becomes) unblocked.
     */
    public synchronized CompletableFuture<Void> awaitDrain() {
        return drained;
    }

    /**
     * Releases waiters when the connection goes away; their publish attempt then
     * fails fast against the missing channel instead of hanging.
     */
    public void reset() {
        CompletableFuture<Void> waiting;
        synchronized (this) {
            waiting = drained;
        }
        waiting.complete(null);
    }
}

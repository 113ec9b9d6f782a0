package com.aporkolab.broker.client;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.broker.exception.ChannelNotInitializedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Owns the broker connection and its single channel, and drives reconnection.
 *
 * Design decisions:
 * - Fixed reconnect delay, retried indefinitely; connection failures are never fatal
 * - At most one pending reconnect timer; a second schedule request is a no-op
 * - The client library's automatic recovery is disabled so this is the only recovery path
 * - An unexpected channel close invalidates the whole connection
 * - Application-initiated shutdowns never trigger a reconnect
 */
public class ConnectionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    private final BrokerSettings settings;
    private final ConnectionFactory connectionFactory;
    private final ScheduledExecutorService scheduler;
    private final FlowControl flowControl;
    private final BrokerClientListener events;
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private volatile Connection connection;
    private volatile Channel channel;
    private volatile boolean connected;
    private volatile boolean closed;
    private volatile Throwable lastError;
    private ScheduledFuture<?> reconnectTask;

    public ConnectionSupervisor(BrokerSettings settings,
                                ConnectionFactory connectionFactory,
                                ScheduledExecutorService scheduler,
                                FlowControl flowControl,
                                BrokerClientListener events) {
        this.settings = settings;
        this.connectionFactory = connectionFactory;
        this.scheduler = scheduler;
        this.flowControl = flowControl;
        this.events = events;
        configure(connectionFactory, settings);
    }

    private static void configure(ConnectionFactory factory, BrokerSettings settings) {
        factory.setHost(settings.getHost());
        factory.setPort(settings.getPort());
        factory.setUsername(settings.getUsername());
        factory.setPassword(settings.getPassword());
        factory.setVirtualHost(settings.getVirtualHost());
        factory.setRequestedHeartbeat((int) settings.getHeartbeat().toSeconds());
        factory.setConnectionTimeout((int) settings.getConnectionTimeout().toMillis());
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);
    }

    public void addListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    /**
     * Establishes the connection and channel, applying the prefetch limit.
     * Never throws: on failure the error is logged, a reconnect is scheduled and false is returned.
     */
    public boolean connect() {
        Channel newChannel;
        synchronized (lock) {
            if (closed) {
                log.warn("Connect requested after close, ignoring");
                return false;
            }
            if (connected && channel != null) {
                return true;
            }

            Connection newConnection = null;
            try {
                newConnection = connectionFactory.newConnection(settings.getServiceName());
                newConnection.addShutdownListener(this::onConnectionShutdown);
                newConnection.addBlockedListener(flowControl);

                newChannel = newConnection.createChannel();
                newChannel.addShutdownListener(this::onChannelShutdown);
                newChannel.basicQos(settings.getPrefetch());

                connection = newConnection;
                channel = newChannel;
                connected = true;
                lastError = null;
            } catch (IOException | TimeoutException | RuntimeException e) {
                lastError = e;
                connected = false;
                log.error("Failed to connect to broker {}: {}", settings.toRedactedUri(), e.getMessage());
                abort(newConnection);
                events.onConnectionFailed(e);
                scheduleReconnect();
                return false;
            }
        }

        log.info("Connected to broker {} (prefetch={})", settings.toRedactedUri(), settings.getPrefetch());
        events.onConnected();
        for (ConnectionListener listener : listeners) {
            try {
                listener.onConnected(newChannel);
            } catch (RuntimeException e) {
                log.error("Connection listener {} failed after connect: {}",
                        listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
        return true;
    }

    /**
     * Schedules a reconnect after the configured delay.
     *
     * @return false if a reconnect is already pending or the supervisor is closed
     */
    public boolean scheduleReconnect() {
        Duration delay = settings.getReconnectDelay();
        synchronized (lock) {
            if (closed) {
                return false;
            }
            if (reconnectTask != null && !reconnectTask.isDone()) {
                log.debug("Reconnect already scheduled, skipping");
                return false;
            }
            log.info("Scheduling reconnection in {} ms", delay.toMillis());
            reconnectTask = scheduler.schedule(this::runReconnect, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
        events.onReconnectScheduled(delay);
        return true;
    }

    private void runReconnect() {
        synchronized (lock) {
            reconnectTask = null;
        }
        connect();
    }

    private void onConnectionShutdown(ShutdownSignalException cause) {
        if (cause.isInitiatedByApplication()) {
            log.debug("Connection closed by application");
            return;
        }
        invalidate(cause, "connection");
    }

    private void onChannelShutdown(ShutdownSignalException cause) {
        if (cause.isInitiatedByApplication()) {
            log.debug("Channel closed by application");
            return;
        }
        invalidate(cause, "channel");
    }

    private void invalidate(ShutdownSignalException cause, String source) {
        Connection lost;
        synchronized (lock) {
            Object reference = cause.getReference();
            if (closed || (reference != connection && reference != channel)) {
                // shutdown of a connection or channel we no longer own
                return;
            }
            lost = connection;
            connection = null;
            channel = null;
            connected = false;
            lastError = cause;
        }

        log.warn("Broker {} closed unexpectedly: {}", source, cause.getMessage());
        flowControl.reset();
        abort(lost);
        events.onConnectionLost(cause);
        for (ConnectionListener listener : listeners) {
            try {
                listener.onDisconnected(cause);
            } catch (RuntimeException e) {
                log.error("Connection listener {} failed on disconnect: {}",
                        listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
        scheduleReconnect();
    }

    /**
     * Returns the live channel or fails fast.
     *
     * @throws ChannelNotInitializedException if there is no live channel
     */
    public Channel requireChannel(String operation) {
        Channel current = channel;
        if (current == null) {
            throw new ChannelNotInitializedException(operation);
        }
        return current;
    }

    /**
     * The live channel, or null while disconnected.
     */
    public Channel getChannel() {
        return channel;
    }

    public boolean isHealthy() {
        return connected && channel != null;
    }

    public boolean isReconnectPending() {
        synchronized (lock) {
            return reconnectTask != null && !reconnectTask.isDone();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public Throwable getLastError() {
        return lastError;
    }

    public BrokerSettings getSettings() {
        return settings;
    }

    /**
     * Cancels any pending reconnect, lets listeners cancel their consumers, then closes
     * channel and connection. Failures are logged, never propagated.
     */
    public void close() {
        Channel closingChannel;
        Connection closingConnection;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            if (reconnectTask != null) {
                reconnectTask.cancel(false);
                reconnectTask = null;
            }
            closingChannel = channel;
            closingConnection = connection;
        }

        for (ConnectionListener listener : listeners) {
            try {
                listener.onClosing(closingChannel);
            } catch (RuntimeException e) {
                log.error("Connection listener {} failed during close: {}",
                        listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }

        try {
            if (closingChannel != null && closingChannel.isOpen()) {
                closingChannel.close();
            }
        } catch (IOException | TimeoutException | RuntimeException e) {
            log.error("Error closing channel: {}", e.getMessage());
        }

        try {
            if (closingConnection != null && closingConnection.isOpen()) {
                closingConnection.close();
            }
        } catch (IOException | RuntimeException e) {
            log.error("Error closing connection: {}", e.getMessage());
        }

        synchronized (lock) {
            channel = null;
            connection = null;
            connected = false;
        }
        flowControl.reset();
        log.info("Disconnected from broker {}", settings.toRedactedUri());
    }

    private void abort(Connection target) {
        if (target == null) {
            return;
        }
        try {
            target.abort();
        } catch (RuntimeException e) {
            log.debug("Ignoring error while aborting connection: {}", e.getMessage());
        }
    }
}

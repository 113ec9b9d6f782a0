package com.aporkolab.broker.spring.autoconfigure;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the broker client and the retry protocol.
 *
 * Example application.yml:
 * <pre>
 * broker:
 *   host: rabbitmq
 *   username: admin
 *   password: admin123
 *   service-name: payment-service
 *   retry:
 *     max-attempts: 3
 *     delay: 5s
 *   queues:
 *     process: payments.process
 *     retry: payments.retry
 *     dead: payments.dead
 * </pre>
 */
@ConfigurationProperties(prefix = "broker")
public class BrokerProperties {

    private boolean enabled = true;
    private String host = "localhost";
    private int port = 5672;
    private String username = "admin";
    private String password = "admin123";
    private String virtualHost = "/";
    private Duration heartbeat = Duration.ofSeconds(60);
    private Duration connectionTimeout = Duration.ofSeconds(30);
    private Duration reconnectDelay = Duration.ofMillis(5000);
    private int prefetch = 1;
    /**
     * Stamped on outgoing messages; falls back to spring.application.name.
     */
    private String serviceName;
    private RetryProperties retry = new RetryProperties();
    private ExchangeProperties exchanges = new ExchangeProperties();
    private QueueProperties queues = new QueueProperties();
    private RoutingKeyProperties routingKeys = new RoutingKeyProperties();
    private MetricsProperties metrics = new MetricsProperties();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getVirtualHost() { return virtualHost; }
    public void setVirtualHost(String virtualHost) { this.virtualHost = virtualHost; }
    public Duration getHeartbeat() { return heartbeat; }
    public void setHeartbeat(Duration heartbeat) { this.heartbeat = heartbeat; }
    public Duration getConnectionTimeout() { return connectionTimeout; }
    public void setConnectionTimeout(Duration connectionTimeout) { this.connectionTimeout = connectionTimeout; }
    public Duration getReconnectDelay() { return reconnectDelay; }
    public void setReconnectDelay(Duration reconnectDelay) { this.reconnectDelay = reconnectDelay; }
    public int getPrefetch() { return prefetch; }
    public void setPrefetch(int prefetch) { this.prefetch = prefetch; }
    public String getServiceName() { return serviceName; }
    public void setServiceName(String serviceName) { this.serviceName = serviceName; }
    public RetryProperties getRetry() { return retry; }
    public void setRetry(RetryProperties retry) { this.retry = retry; }
    public ExchangeProperties getExchanges() { return exchanges; }
    public void setExchanges(ExchangeProperties exchanges) { this.exchanges = exchanges; }
    public QueueProperties getQueues() { return queues; }
    public void setQueues(QueueProperties queues) { this.queues = queues; }
    public RoutingKeyProperties getRoutingKeys() { return routingKeys; }
    public void setRoutingKeys(RoutingKeyProperties routingKeys) { this.routingKeys = routingKeys; }
    public MetricsProperties getMetrics() { return metrics; }
    public void setMetrics(MetricsProperties metrics) { this.metrics = metrics; }

    // ==================== NESTED PROPERTIES CLASSES ====================

    public static class RetryProperties {
        private int maxAttempts = 3;
        private Duration delay = Duration.ofMillis(5000);
        private String header = "x-retry-count";

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getDelay() { return delay; }
        public void setDelay(Duration delay) { this.delay = delay; }
        public String getHeader() { return header; }
        public void setHeader(String header) { this.header = header; }
    }

    public static class ExchangeProperties {
        private String deadLetter = "payments.dlx";
        private String events = "orders.fanout";

        public String getDeadLetter() { return deadLetter; }
        public void setDeadLetter(String deadLetter) { this.deadLetter = deadLetter; }
        public String getEvents() { return events; }
        public void setEvents(String events) { this.events = events; }
    }

    public static class QueueProperties {
        private String process = "payments.process";
        private String retry = "payments.retry";
        private String dead = "payments.dead";

        public String getProcess() { return process; }
        public void setProcess(String process) { this.process = process; }
        public String getRetry() { return retry; }
        public void setRetry(String retry) { this.retry = retry; }
        public String getDead() { return dead; }
        public void setDead(String dead) { this.dead = dead; }
    }

    public static class RoutingKeyProperties {
        private String process = "payment.process";
        private String retry = "payment.retry";
        private String dead = "payment.failed";

        public String getProcess() { return process; }
        public void setProcess(String process) { this.process = process; }
        public String getRetry() { return retry; }
        public void setRetry(String retry) { this.retry = retry; }
        public String getDead() { return dead; }
        public void setDead(String dead) { this.dead = dead; }
    }

    public static class MetricsProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}

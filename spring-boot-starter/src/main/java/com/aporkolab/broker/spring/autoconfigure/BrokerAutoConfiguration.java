package com.aporkolab.broker.spring.autoconfigure;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import com.aporkolab.broker.client.BrokerClient;
import com.aporkolab.broker.client.BrokerClientListener;
import com.aporkolab.broker.client.BrokerSettings;
import com.aporkolab.broker.deadletter.FailedWorkStore;
import com.aporkolab.broker.deadletter.InMemoryFailedWorkStore;
import com.aporkolab.broker.deadletter.RetryPolicy;
import com.aporkolab.broker.deadletter.RetryTopology;
import com.aporkolab.broker.metrics.BrokerClientMetrics;
import com.aporkolab.broker.metrics.RetryMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Spring Boot auto-configuration for the broker client.
 *
 * Automatically configures:
 * - BrokerSettings from {@code broker.*} properties
 * - BrokerClient, connected on context start and closed on stop
 * - RetryPolicy, RetryTopology and an in-memory FailedWorkStore for the retry engine
 * - BrokerClientMetrics and RetryMetrics when a MeterRegistry is present; RetryMetrics
 *   must be handed to the application's RetryDeadLetterEngine as its listener
 *
 * Disable with: broker.enabled=false
 */
@AutoConfiguration
@ConditionalOnClass(BrokerClient.class)
@EnableConfigurationProperties(BrokerProperties.class)
@ConditionalOnProperty(prefix = "broker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BrokerAutoConfiguration {

    // ==================== CLIENT ====================

    @Bean
    @ConditionalOnMissingBean
    public BrokerSettings brokerSettings(BrokerProperties properties, Environment environment) {
        String serviceName = properties.getServiceName() != null
                ? properties.getServiceName()
                : environment.getProperty("spring.application.name", "broker-client");
        return BrokerSettings.builder()
                .host(properties.getHost())
                .port(properties.getPort())
                .username(properties.getUsername())
                .password(properties.getPassword())
                .virtualHost(properties.getVirtualHost())
                .heartbeat(properties.getHeartbeat())
                .connectionTimeout(properties.getConnectionTimeout())
                .reconnectDelay(properties.getReconnectDelay())
                .prefetch(properties.getPrefetch())
                .serviceName(serviceName)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public BrokerClient brokerClient(BrokerSettings settings,
                                     ObjectProvider<ObjectMapper> objectMapper,
                                     ObjectProvider<BrokerClientListener> listeners) {
        BrokerClient.Builder builder = BrokerClient.builder()
                .settings(settings)
                .objectMapper(objectMapper.getIfAvailable());
        listeners.orderedStream().forEach(builder::listener);
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public BrokerClientLifecycle brokerClientLifecycle(BrokerClient brokerClient) {
        return new BrokerClientLifecycle(brokerClient);
    }

    // ==================== RETRY PROTOCOL ====================

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(BrokerProperties properties) {
        var retry = properties.getRetry();
        return RetryPolicy.builder()
                .maxAttempts(retry.getMaxAttempts())
                .retryDelay(retry.getDelay())
                .retryCountHeader(retry.getHeader())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryTopology retryTopology(BrokerProperties properties) {
        return RetryTopology.builder()
                .deadLetterExchange(properties.getExchanges().getDeadLetter())
                .eventExchange(properties.getExchanges().getEvents())
                .processQueue(properties.getQueues().getProcess())
                .retryQueue(properties.getQueues().getRetry())
                .deadQueue(properties.getQueues().getDead())
                .processRoutingKey(properties.getRoutingKeys().getProcess())
                .retryRoutingKey(properties.getRoutingKeys().getRetry())
                .deadRoutingKey(properties.getRoutingKeys().getDead())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public FailedWorkStore failedWorkStore() {
        return new InMemoryFailedWorkStore();
    }

    // ==================== METRICS ====================

    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "broker.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class MetricsAutoConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public BrokerClientMetrics brokerClientMetrics(MeterRegistry registry, BrokerSettings settings) {
            return new BrokerClientMetrics(registry, settings.getServiceName());
        }

        /**
         * No engine is created here, so this listener only counts once the application
         * passes it to {@code RetryDeadLetterEngine.builder(...).listener(retryMetrics)}.
         */
        @Bean
        @ConditionalOnMissingBean
        public RetryMetrics retryMetrics(MeterRegistry registry, RetryTopology topology, FailedWorkStore store) {
            return new RetryMetrics(registry, topology.getProcessQueue(), store);
        }
    }
}

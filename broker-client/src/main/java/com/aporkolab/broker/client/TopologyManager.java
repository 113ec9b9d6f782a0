package com.aporkolab.broker.client;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.broker.exception.BrokerOperationException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;

/**
 * Declares exchanges, queues and bindings, and replays them after every reconnect.
 *
 * All declarations are idempotent on the broker side; the local record is keyed by entity
 * so repeated calls never grow it.
 */
public class TopologyManager implements ConnectionListener {

    private static final Logger log = LoggerFactory.getLogger(TopologyManager.class);

    private final ConnectionSupervisor supervisor;

    private final Map<String, ExchangeDeclaration> exchanges = new LinkedHashMap<>();
    private final Map<String, QueueDeclaration> queues = new LinkedHashMap<>();
    private final Set<BindingDeclaration> bindings = new LinkedHashSet<>();

    public TopologyManager(ConnectionSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    public void assertExchange(String name, BuiltinExchangeType type, ExchangeOptions options) {
        Channel channel = supervisor.requireChannel("assertExchange");
        ExchangeDeclaration declaration = new ExchangeDeclaration(name, type, options);
        declare(channel, declaration);
        synchronized (this) {
            exchanges.put(name, declaration);
        }
        log.info("Exchange asserted: {} ({})", name, type.getType());
    }

    public QueueInfo assertQueue(String name, QueueOptions options) {
        Channel channel = supervisor.requireChannel("assertQueue");
        QueueDeclaration declaration = new QueueDeclaration(name, options);
        QueueInfo info = declare(channel, declaration);
        synchronized (this) {
            queues.put(name, declaration);
        }
        log.info("Queue asserted: {} (messages={}, consumers={})",
                info.queue(), info.messageCount(), info.consumerCount());
        return info;
    }

    public void bindQueue(String queue, String exchange, String routingKey, Map<String, Object> arguments) {
        Channel channel = supervisor.requireChannel("bindQueue");
        BindingDeclaration declaration = new BindingDeclaration(queue, exchange,
                routingKey == null ? "" : routingKey,
                arguments == null ? Map.of() : Map.copyOf(arguments));
        declare(channel, declaration);
        synchronized (this) {
            bindings.add(declaration);
        }
        log.info("Queue {} bound to {} with key '{}'", queue, exchange, declaration.routingKey());
    }

    /**
     * Replays every recorded declaration in order: exchanges, queues, bindings.
     */
    @Override
    public void onConnected(Channel channel) {
        List<ExchangeDeclaration> exchangeSnapshot;
        List<QueueDeclaration> queueSnapshot;
        List<BindingDeclaration> bindingSnapshot;
        synchronized (this) {
            exchangeSnapshot = List.copyOf(exchanges.values());
            queueSnapshot = List.copyOf(queues.values());
            bindingSnapshot = List.copyOf(bindings);
        }
        if (exchangeSnapshot.isEmpty() && queueSnapshot.isEmpty() && bindingSnapshot.isEmpty()) {
            return;
        }

        try {
            exchangeSnapshot.forEach(d -> declare(channel, d));
            queueSnapshot.forEach(d -> declare(channel, d));
            bindingSnapshot.forEach(d -> declare(channel, d));
            log.info("Topology restored: {} exchanges, {} queues, {} bindings",
                    exchangeSnapshot.size(), queueSnapshot.size(), bindingSnapshot.size());
        } catch (BrokerOperationException e) {
            log.error("Topology replay failed: {}", e.getMessage(), e);
        }
    }

    public synchronized int declaredExchangeCount() {
        return exchanges.size();
    }

    public synchronized int declaredQueueCount() {
        return queues.size();
    }

    public synchronized int declaredBindingCount() {
        return bindings.size();
    }

    private static void declare(Channel channel, ExchangeDeclaration d) {
        try {
            channel.exchangeDeclare(d.name(), d.type(), d.options().isDurable(), d.options().isAutoDelete(),
                    d.options().isInternal(), d.options().getArguments());
        } catch (IOException e) {
            throw BrokerOperationException.declare("exchange " + d.name(), e);
        }
    }

    private static QueueInfo declare(Channel channel, QueueDeclaration d) {
        try {
            AMQP.Queue.DeclareOk ok = channel.queueDeclare(d.name(), d.options().isDurable(),
                    d.options().isExclusive(), d.options().isAutoDelete(), d.options().getArguments());
            return new QueueInfo(ok.getQueue(), ok.getMessageCount(), ok.getConsumerCount());
        } catch (IOException e) {
            throw BrokerOperationException.declare("queue " + d.name(), e);
        }
    }

    private static void declare(Channel channel, BindingDeclaration d) {
        try {
            channel.queueBind(d.queue(), d.exchange(), d.routingKey(), d.arguments());
        } catch (IOException e) {
            throw BrokerOperationException.bind(d.queue(), d.exchange(), e);
        }
    }

    private record ExchangeDeclaration(String name, BuiltinExchangeType type, ExchangeOptions options) {
    }

    private record QueueDeclaration(String name, QueueOptions options) {
    }

    private record BindingDeclaration(String queue, String exchange, String routingKey, Map<String, Object> arguments) {
    }
}

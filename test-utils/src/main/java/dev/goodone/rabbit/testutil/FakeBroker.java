package dev.goodone.rabbit.testutil;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.client.impl.AMQImpl;
import org.mockito.invocation.InvocationOnMock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.mockito.Mockito.RETURNS_DEFAULTS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.withSettings;

/**
 * An in-memory stand-in for a RabbitMQ broker, reached through a mocked {@link ConnectionFactory}.
 *
 * Exchanges (direct, topic and fanout), queues, bindings, prefetch, acks and nacks, dead-lettering through
 * {@code x-dead-letter-exchange}, exclusive and auto-delete queues and the default exchange behave like the real
 * broker for the parts of the protocol the client uses. Tests can make connects, channel creation and publishes
 * fail, and can kill connections as if the broker went away.
 */
public class FakeBroker {

    static final Logger log = LoggerFactory.getLogger(FakeBroker.class);

    public static final String DEAD_LETTER_EXCHANGE_ARG = "x-dead-letter-exchange";
    public static final String DEAD_LETTER_ROUTING_KEY_ARG = "x-dead-letter-routing-key";

    private final Object lock = new Object();
    private final Map<String, ExchangeState> exchanges = new LinkedHashMap<>();
    private final Map<String, QueueState> queues = new LinkedHashMap<>();
    private final List<PublishedMessage> published = new CopyOnWriteArrayList<>();
    private final List<FakeConnection> connections = new CopyOnWriteArrayList<>();

    private final AtomicInteger failNextConnects = new AtomicInteger();
    private final AtomicInteger failNextChannels = new AtomicInteger();
    private final AtomicInteger failNextPublishes = new AtomicInteger();
    private final AtomicInteger connectAttempts = new AtomicInteger();
    private final AtomicInteger acks = new AtomicInteger();
    private final AtomicInteger nacks = new AtomicInteger();
    private final AtomicInteger requeues = new AtomicInteger();
    private final AtomicInteger deadLettered = new AtomicInteger();
    private final AtomicInteger unknownDeliveryTags = new AtomicInteger();
    private final AtomicInteger generatedNames = new AtomicInteger();

    private final ConnectionFactory connectionFactory;
    private volatile Map<String, Object> lastClientProperties = Collections.emptyMap();

    public FakeBroker() {
        this.connectionFactory = mock(ConnectionFactory.class, withSettings().stubOnly().defaultAnswer(this::answerFactory));
    }

    public ConnectionFactory connectionFactory() {
        return connectionFactory;
    }

    // ---------------------------------------------------------------- fault injection

    public void failNextConnects(int count) {
        failNextConnects.set(count);
    }

    public void failNextChannelCreations(int count) {
        failNextChannels.set(count);
    }

    public void failNextPublishes(int count) {
        failNextPublishes.set(count);
    }

    /**
     * Drops every open connection the way a broker restart or network failure would.
     */
    public void killConnections() {
        for (FakeConnection connection : connections) {
            if (connection.open) {
                closeConnection(connection, false);
            }
        }
    }

    /**
     * Publishes straight into the broker, bypassing any client.
     */
    public void publish(String exchange, String routingKey, AMQP.BasicProperties properties, byte[] body) {
        synchronized (lock) {
            route(new PublishedMessage(exchange, routingKey, properties, body, false));
        }
    }

    public void shutdown() {
        killConnections();
        for (FakeConnection connection : connections) {
            connection.dispatcher.shutdownNow();
        }
    }

    // ---------------------------------------------------------------- inspection

    public List<PublishedMessage> published() {
        return ImmutableList.copyOf(published);
    }

    public List<PublishedMessage> messagesIn(String queue) {
        synchronized (lock) {
            QueueState state = queues.get(queue);
            return state == null ? Collections.emptyList() : ImmutableList.copyOf(state.ready);
        }
    }

    public int queueDepth(String queue) {
        synchronized (lock) {
            QueueState state = queues.get(queue);
            return state == null ? 0 : state.ready.size();
        }
    }

    public boolean hasQueue(String queue) {
        synchronized (lock) {
            return queues.containsKey(queue);
        }
    }

    public List<String> queueNames() {
        synchronized (lock) {
            return ImmutableList.copyOf(queues.keySet());
        }
    }

    public Map<String, Object> queueArguments(String queue) {
        synchronized (lock) {
            QueueState state = queues.get(queue);
            return state == null ? Collections.emptyMap() : ImmutableMap.copyOf(state.arguments);
        }
    }

    public boolean isDurable(String queueOrExchange) {
        synchronized (lock) {
            if (queues.containsKey(queueOrExchange)) {
                return queues.get(queueOrExchange).durable;
            }
            return exchanges.containsKey(queueOrExchange) && exchanges.get(queueOrExchange).durable;
        }
    }

    public boolean hasExchange(String exchange) {
        synchronized (lock) {
            return exchanges.containsKey(exchange);
        }
    }

    public String exchangeType(String exchange) {
        synchronized (lock) {
            ExchangeState state = exchanges.get(exchange);
            return state == null ? null : state.type;
        }
    }

    public List<String> bindingKeys(String exchange, String queue) {
        synchronized (lock) {
            ExchangeState state = exchanges.get(exchange);
            if (state == null) {
                return Collections.emptyList();
            }
            List<String> keys = new ArrayList<>();
            for (Binding binding : state.bindings) {
                if (binding.queue.equals(queue)) {
                    keys.add(binding.key);
                }
            }
            return keys;
        }
    }

    public int consumerCount(String queue) {
        synchronized (lock) {
            QueueState state = queues.get(queue);
            return state == null ? 0 : state.consumers.size();
        }
    }

    /**
     * @return the prefetch of the channel the first consumer of the queue sits on, 0 when unlimited or unknown
     */
    public int prefetchOf(String queue) {
        synchronized (lock) {
            QueueState state = queues.get(queue);
            if (state == null || state.consumers.isEmpty()) {
                return 0;
            }
            return state.consumers.get(0).channel.prefetch;
        }
    }

    public int unackedCount() {
        synchronized (lock) {
            int count = 0;
            for (FakeConnection connection : connections) {
                for (FakeChannel channel : connection.channels) {
                    count += channel.unacked.size();
                }
            }
            return count;
        }
    }

    public int ackCount() {
        return acks.get();
    }

    public int nackCount() {
        return nacks.get();
    }

    public int requeueCount() {
        return requeues.get();
    }

    public int deadLetterCount() {
        return deadLettered.get();
    }

    /**
     * Acks and nacks for delivery tags the channel did not have outstanding, a double ack for instance.
     */
    public int unknownDeliveryTagCount() {
        return unknownDeliveryTags.get();
    }

    public int connectAttempts() {
        return connectAttempts.get();
    }

    public int connectionsOpened() {
        return connections.size();
    }

    public int openConnectionCount() {
        int count = 0;
        for (FakeConnection connection : connections) {
            if (connection.open) {
                count++;
            }
        }
        return count;
    }

    public int openChannelCount() {
        int count = 0;
        for (FakeConnection connection : connections) {
            for (FakeChannel channel : connection.channels) {
                if (channel.open) {
                    count++;
                }
            }
        }
        return count;
    }

    public Map<String, Object> lastClientProperties() {
        return lastClientProperties;
    }

    public List<String> connectionNames() {
        List<String> names = new ArrayList<>();
        for (FakeConnection connection : connections) {
            names.add(connection.name);
        }
        return names;
    }

    // ---------------------------------------------------------------- protocol, called from the fake channels

    @SuppressWarnings("unchecked")
    private Object answerFactory(InvocationOnMock invocation) throws Throwable {
        switch (invocation.getMethod().getName()) {
            case "newConnection":
                return newConnection(clientProvidedName(invocation.getArguments()));
            case "setClientProperties":
                lastClientProperties = new HashMap<>((Map<String, Object>) invocation.getArgument(0));
                return null;
            case "getClientProperties":
                return lastClientProperties;
            case "toString":
                return "FakeBroker.ConnectionFactory";
            default:
                return RETURNS_DEFAULTS.answer(invocation);
        }
    }

    private static String clientProvidedName(Object[] args) {
        for (int i = args.length - 1; i >= 0; i--) {
            if (args[i] instanceof String) {
                return (String) args[i];
            }
        }
        return "connection";
    }

    private Object newConnection(String name) throws IOException {
        connectAttempts.incrementAndGet();
        if (failNextConnects.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            log.info("Refusing connection {}", name);
            throw new ConnectException("Connection refused");
        }
        FakeConnection connection = new FakeConnection(this, name + "#" + (connections.size() + 1));
        connections.add(connection);
        log.info("Accepted connection {}", connection.name);
        return connection.mock;
    }

    FakeChannel createChannel(FakeConnection connection) throws IOException {
        if (failNextChannels.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new IOException("Channel creation refused");
        }
        FakeChannel channel = new FakeChannel(this, connection, connection.nextChannelNumber());
        connection.channels.add(channel);
        return channel;
    }

    void declareExchange(String name, String type, boolean durable) throws IOException {
        synchronized (lock) {
            ExchangeState existing = exchanges.get(name);
            if (existing != null) {
                if (!existing.type.equals(type)) {
                    throw new IOException("PRECONDITION_FAILED - inequivalent arg 'type' for exchange '" + name + "'");
                }
                return;
            }
            exchanges.put(name, new ExchangeState(name, type, durable));
        }
    }

    AMQP.Queue.DeclareOk declareQueue(FakeChannel channel, String name, boolean durable, boolean exclusive,
                                      boolean autoDelete, Map<String, Object> arguments) {
        synchronized (lock) {
            String queueName = name == null || name.isEmpty() ? "amq.gen-" + generatedNames.incrementAndGet() : name;
            QueueState state = queues.get(queueName);
            if (state == null) {
                state = new QueueState(queueName, durable, exclusive ? channel.connection : null, autoDelete,
                        arguments == null ? new HashMap<>() : new HashMap<>(arguments));
                queues.put(queueName, state);
            }
            return new AMQImpl.Queue.DeclareOk(queueName, state.ready.size(), state.consumers.size());
        }
    }

    void bindQueue(String queue, String exchange, String routingKey) throws IOException {
        synchronized (lock) {
            ExchangeState state = exchanges.get(exchange);
            if (state == null) {
                throw new IOException("NOT_FOUND - no exchange '" + exchange + "'");
            }
            if (!queues.containsKey(queue)) {
                throw new IOException("NOT_FOUND - no queue '" + queue + "'");
            }
            Binding binding = new Binding(queue, routingKey);
            if (!state.bindings.contains(binding)) {
                state.bindings.add(binding);
            }
        }
    }

    void deleteQueue(String queue) {
        synchronized (lock) {
            removeQueue(queue);
        }
    }

    void setPrefetch(FakeChannel channel, int prefetch) {
        synchronized (lock) {
            channel.prefetch = prefetch;
        }
    }

    void publishFromChannel(String exchange, String routingKey, AMQP.BasicProperties properties, byte[] body) throws IOException {
        if (failNextPublishes.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new IOException("Publish refused");
        }
        PublishedMessage message = new PublishedMessage(exchange, routingKey, properties, body, false);
        published.add(message);
        synchronized (lock) {
            route(message);
        }
    }

    String consume(FakeChannel channel, String queue, boolean autoAck, String consumerTag, boolean exclusive,
                   Consumer consumer) throws IOException {
        FakeChannel.ConsumerRegistration registration;
        synchronized (lock) {
            QueueState state = queues.get(queue);
            if (state == null) {
                throw new IOException("NOT_FOUND - no queue '" + queue + "'");
            }
            if (exclusive && !state.consumers.isEmpty()) {
                throw new IOException("ACCESS_REFUSED - queue '" + queue + "' in exclusive use");
            }
            String tag = consumerTag == null || consumerTag.isEmpty()
                    ? "amq.ctag-" + generatedNames.incrementAndGet()
                    : consumerTag;
            registration = new FakeChannel.ConsumerRegistration(channel, tag, queue, autoAck, consumer);
            channel.consumers.put(tag, registration);
            state.consumers.add(registration);
            state.hadConsumers = true;
            channel.connection.dispatch(() -> consumer.handleConsumeOk(registration.tag));
            deliverReady(state);
        }
        return registration.tag;
    }

    void cancel(FakeChannel channel, String consumerTag) throws IOException {
        synchronized (lock) {
            FakeChannel.ConsumerRegistration registration = channel.consumers.remove(consumerTag);
            if (registration == null) {
                throw new IOException("Unknown consumerTag " + consumerTag);
            }
            unregister(registration);
            channel.connection.dispatch(() -> registration.consumer.handleCancelOk(consumerTag));
        }
    }

    void ack(FakeChannel channel, long deliveryTag, boolean multiple) {
        synchronized (lock) {
            for (FakeChannel.Unacked settled : settle(channel, deliveryTag, multiple)) {
                acks.incrementAndGet();
                QueueState state = queues.get(settled.registration.queue);
                if (state != null) {
                    deliverReady(state);
                }
            }
        }
    }

    void nack(FakeChannel channel, long deliveryTag, boolean multiple, boolean requeue) {
        synchronized (lock) {
            for (FakeChannel.Unacked settled : settle(channel, deliveryTag, multiple)) {
                nacks.incrementAndGet();
                QueueState state = queues.get(settled.registration.queue);
                if (state == null) {
                    continue;
                }
                if (requeue) {
                    requeues.incrementAndGet();
                    state.ready.addFirst(settled.message.redelivered());
                } else {
                    deadLetter(state, settled.message);
                }
                deliverReady(state);
            }
        }
    }

    void closeChannel(FakeChannel channel, ShutdownSignalException cause) {
        synchronized (lock) {
            shutdownChannel(channel, cause);
        }
    }

    void closeConnection(FakeConnection connection, boolean initiatedByApplication) {
        ShutdownSignalException cause = new ShutdownSignalException(true, initiatedByApplication, null, connection.mock);
        synchronized (lock) {
            connection.open = false;
            connection.closeReason = cause;
            for (FakeChannel channel : connection.channels) {
                shutdownChannel(channel, cause);
            }
            List<String> owned = new ArrayList<>();
            for (QueueState state : queues.values()) {
                if (state.owner == connection) {
                    owned.add(state.name);
                }
            }
            for (String queue : owned) {
                removeQueue(queue);
            }
        }
        log.info("Connection {} closed, initiated by application: {}", connection.name, initiatedByApplication);
        for (ShutdownListener listener : connection.shutdownListeners) {
            connection.dispatch(() -> listener.shutdownCompleted(cause));
        }
        connection.dispatcher.shutdown();
    }

    // ---------------------------------------------------------------- internals, all called holding the lock

    private void shutdownChannel(FakeChannel channel, ShutdownSignalException cause) {
        if (!channel.open) {
            return;
        }
        channel.open = false;
        channel.closeReason = cause;

        Set<QueueState> touched = new LinkedHashSet<>();
        for (FakeChannel.Unacked pending : channel.unacked.descendingMap().values()) {
            QueueState state = queues.get(pending.registration.queue);
            if (state != null) {
                state.ready.addFirst(pending.message.redelivered());
                touched.add(state);
            }
        }
        channel.unacked.clear();

        for (FakeChannel.ConsumerRegistration registration : channel.consumers.values()) {
            unregister(registration);
            channel.connection.dispatch(() -> registration.consumer.handleShutdownSignal(registration.tag, cause));
        }
        channel.consumers.clear();

        for (QueueState state : touched) {
            if (queues.containsKey(state.name)) {
                deliverReady(state);
            }
        }
    }

    private List<FakeChannel.Unacked> settle(FakeChannel channel, long deliveryTag, boolean multiple) {
        List<FakeChannel.Unacked> settled = new ArrayList<>();
        if (multiple) {
            Map<Long, FakeChannel.Unacked> head = channel.unacked.headMap(deliveryTag, true);
            settled.addAll(head.values());
            head.clear();
        } else {
            FakeChannel.Unacked pending = channel.unacked.remove(deliveryTag);
            if (pending != null) {
                settled.add(pending);
            }
        }
        if (settled.isEmpty()) {
            unknownDeliveryTags.incrementAndGet();
            log.warn("Unknown delivery tag {} on channel {}", deliveryTag, channel.number);
        }
        for (FakeChannel.Unacked pending : settled) {
            pending.registration.unacked--;
        }
        return settled;
    }

    private void unregister(FakeChannel.ConsumerRegistration registration) {
        QueueState state = queues.get(registration.queue);
        if (state == null) {
            return;
        }
        state.consumers.remove(registration);
        if (state.autoDelete && state.hadConsumers && state.consumers.isEmpty()) {
            removeQueue(state.name);
        }
    }

    private void removeQueue(String queue) {
        if (queues.remove(queue) == null) {
            return;
        }
        for (ExchangeState exchange : exchanges.values()) {
            exchange.bindings.removeIf(binding -> binding.queue.equals(queue));
        }
        log.info("Queue {} deleted", queue);
    }

    private void route(PublishedMessage message) {
        List<QueueState> targets = new ArrayList<>();
        if (message.exchange.isEmpty()) {
            QueueState state = queues.get(message.routingKey);
            if (state != null) {
                targets.add(state);
            }
        } else {
            ExchangeState exchange = exchanges.get(message.exchange);
            if (exchange == null) {
                log.warn("Dropping message published to missing exchange {}", message.exchange);
                return;
            }
            Set<String> matched = new LinkedHashSet<>();
            for (Binding binding : exchange.bindings) {
                if (exchange.matches(binding.key, message.routingKey)) {
                    matched.add(binding.queue);
                }
            }
            for (String queue : matched) {
                targets.add(queues.get(queue));
            }
        }
        if (targets.isEmpty()) {
            log.debug("Message to {}/{} was unroutable", message.exchange, message.routingKey);
        }
        for (QueueState state : targets) {
            state.ready.addLast(message);
            deliverReady(state);
        }
    }

    private void deadLetter(QueueState state, PublishedMessage message) {
        Object exchange = state.arguments.get(DEAD_LETTER_EXCHANGE_ARG);
        if (exchange == null) {
            log.debug("Dropping rejected message from {}, no dead letter exchange", state.name);
            return;
        }
        Object routingKey = state.arguments.get(DEAD_LETTER_ROUTING_KEY_ARG);
        deadLettered.incrementAndGet();
        route(new PublishedMessage(
                exchange.toString(),
                routingKey == null ? message.routingKey : routingKey.toString(),
                message.properties,
                message.body,
                false));
    }

    private void deliverReady(QueueState state) {
        while (!state.ready.isEmpty() && !state.consumers.isEmpty()) {
            FakeChannel.ConsumerRegistration target = null;
            int size = state.consumers.size();
            for (int i = 0; i < size; i++) {
                int index = (state.nextConsumer + i) % size;
                FakeChannel.ConsumerRegistration candidate = state.consumers.get(index);
                if (candidate.canTake()) {
                    target = candidate;
                    state.nextConsumer = (index + 1) % size;
                    break;
                }
            }
            if (target == null) {
                return;
            }
            PublishedMessage message = state.ready.pollFirst();
            FakeChannel channel = target.channel;
            long deliveryTag = ++channel.deliveryTags;
            if (!target.autoAck) {
                channel.unacked.put(deliveryTag, new FakeChannel.Unacked(target, message));
                target.unacked++;
            }
            Consumer consumer = target.consumer;
            String consumerTag = target.tag;
            Envelope envelope = new Envelope(deliveryTag, message.redelivered, message.exchange, message.routingKey);
            channel.connection.dispatch(() -> {
                try {
                    consumer.handleDelivery(consumerTag, envelope, message.properties, message.body);
                } catch (IOException e) {
                    log.error("Consumer {} failed to handle delivery", consumerTag, e);
                }
            });
        }
    }

    private static class ExchangeState {
        final String name;
        final String type;
        final boolean durable;
        final List<Binding> bindings = new ArrayList<>();

        ExchangeState(String name, String type, boolean durable) {
            this.name = name;
            this.type = type;
            this.durable = durable;
        }

        boolean matches(String bindingKey, String routingKey) {
            switch (type) {
                case "fanout":
                    return true;
                case "topic":
                    return TopicMatcher.matches(bindingKey, routingKey);
                case "direct":
                    return bindingKey.equals(routingKey);
                default:
                    return false;
            }
        }
    }

    private static class QueueState {
        final String name;
        final boolean durable;
        final FakeConnection owner;
        final boolean autoDelete;
        final Map<String, Object> arguments;
        final Deque<PublishedMessage> ready = new ArrayDeque<>();
        final List<FakeChannel.ConsumerRegistration> consumers = new ArrayList<>();
        boolean hadConsumers = false;
        int nextConsumer = 0;

        QueueState(String name, boolean durable, FakeConnection owner, boolean autoDelete, Map<String, Object> arguments) {
            this.name = name;
            this.durable = durable;
            this.owner = owner;
            this.autoDelete = autoDelete;
            this.arguments = arguments;
        }
    }

    private static class Binding {
        final String queue;
        final String key;

        Binding(String queue, String key) {
            this.queue = queue;
            this.key = key;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Binding)) return false;
            Binding other = (Binding) o;
            return queue.equals(other.queue) && key.equals(other.key);
        }

        @Override
        public int hashCode() {
            return 31 * queue.hashCode() + key.hashCode();
        }
    }
}

package dev.goodone.rabbit.impl;

import dev.goodone.rabbit.BrokerAddress;
import dev.goodone.rabbit.ChannelPool;
import dev.goodone.rabbit.ClientClosedException;
import dev.goodone.rabbit.ClientSettings;
import dev.goodone.rabbit.ConnectionException;
import dev.goodone.rabbit.ConsumeOptions;
import dev.goodone.rabbit.DeliveryHandler;
import dev.goodone.rabbit.DeliveryMode;
import dev.goodone.rabbit.Destination;
import dev.goodone.rabbit.ExchangeSpec;
import dev.goodone.rabbit.Message;
import dev.goodone.rabbit.MessagingException;
import dev.goodone.rabbit.PublishException;
import dev.goodone.rabbit.QueueSpec;
import dev.goodone.rabbit.RabbitClient;
import dev.goodone.rabbit.RecoveryListener;
import dev.goodone.rabbit.TopologyException;
import dev.goodone.rabbit.tracing.HeaderCarrier;
import dev.goodone.rabbit.tracing.MessagingAttributes;
import dev.goodone.rabbit.util.FatalErrorHandler;
import dev.goodone.rabbit.util.Logger;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapPropagator;
import rx.Subscription;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The {@link RabbitClient} implementation. Every broker operation leases a channel from the {@link ChannelPool}
 * and gives it back when done, consumers keep theirs until they stop.
 */
public class DefaultRabbitClient implements RabbitClient {

    private static final Logger log = new Logger(DefaultRabbitClient.class);

    private final ChannelPool pool;
    private final ClientSettings settings;
    private final Tracer tracer;
    private final TextMapPropagator propagator;

    private final Set<ConsumerSubscription> subscriptions = ConcurrentHashMap.newKeySet();
    private final List<RecoveryListener> recoveryListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public DefaultRabbitClient(ChannelPool pool, ClientSettings settings, OpenTelemetry openTelemetry) {
        this.pool = pool;
        this.settings = settings;
        this.tracer = openTelemetry.getTracer(MessagingAttributes.INSTRUMENTATION_NAME);
        this.propagator = openTelemetry.getPropagators().getTextMapPropagator();
        pool.addRecoveryListener(this::onRecovered);
    }

    /**
     * Connects to the broker with the globally registered OpenTelemetry instance, exiting the process when the
     * broker can not be reached.
     */
    public static DefaultRabbitClient connect(BrokerAddress address, ClientSettings settings) throws ConnectionException {
        return connect(DefaultChannelPool.newConnectionFactory(address, settings), settings,
                GlobalOpenTelemetry.get(), FatalErrorHandler.EXIT_PROCESS);
    }

    public static DefaultRabbitClient connect(ConnectionFactory connectionFactory,
                                              ClientSettings settings,
                                              OpenTelemetry openTelemetry,
                                              FatalErrorHandler fatalErrorHandler) throws ConnectionException {
        DefaultChannelPool pool = new DefaultChannelPool(connectionFactory, settings, fatalErrorHandler);
        pool.connect();
        return new DefaultRabbitClient(pool, settings, openTelemetry);
    }

    @Override
    public void publish(Destination destination, Message message) throws MessagingException {
        Span span = tracer.spanBuilder(spanName(destination.exchange) + " publish")
                .setSpanKind(SpanKind.PRODUCER)
                .setAttribute(MessagingAttributes.SYSTEM, MessagingAttributes.RABBITMQ)
                .setAttribute(MessagingAttributes.DESTINATION, destination.exchange)
                .setAttribute(MessagingAttributes.ROUTING_KEY, destination.routingKey)
                .startSpan();
        if (message.getMessageId() != null) {
            span.setAttribute(MessagingAttributes.MESSAGE_ID, message.getMessageId());
        }
        try (Scope ignored = span.makeCurrent()) {
            Channel channel = pool.getChannel();
            try {
                Map<String, Object> headers = new HashMap<>(message.getHeaders());
                propagator.inject(Context.current(), headers, HeaderCarrier.SETTER);
                channel.basicPublish(
                        destination.exchange,
                        destination.routingKey,
                        destination.mandatory,
                        destination.immediate,
                        toProperties(message, headers),
                        message.getBody());
                log.traceWithParams("Published message.",
                        "destination", destination,
                        "messageId", message.getMessageId());
            } catch (IOException | ShutdownSignalException e) {
                throw new PublishException("Could not publish to " + destination, e);
            } finally {
                pool.returnChannel(channel);
            }
            span.setStatus(StatusCode.OK);
        } catch (MessagingException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public Subscription consume(String queue, DeliveryHandler handler) throws MessagingException {
        return consume(ConsumeOptions.forQueue(queue), handler);
    }

    @Override
    public Subscription consume(ConsumeOptions options, DeliveryHandler handler) throws MessagingException {
        if (closed.get()) {
            throw new ClientClosedException("The client has been shut down");
        }
        ConsumerSubscription subscription = new ConsumerSubscription(this, options, handler);
        subscriptions.add(subscription);
        try {
            subscription.start();
        } catch (MessagingException e) {
            subscriptions.remove(subscription);
            throw e;
        }
        return subscription;
    }

    @Override
    public void declareExchange(ExchangeSpec exchange) throws MessagingException {
        withChannel("declare exchange " + exchange, channel -> channel.exchangeDeclare(
                exchange.name,
                exchange.type.name(),
                exchange.durable,
                exchange.autoDelete,
                exchange.internal,
                exchange.arguments));
        log.debugWithParams("Declared exchange.", "exchange", exchange);
    }

    @Override
    public String declareQueue(QueueSpec queue) throws MessagingException {
        AMQP.Queue.DeclareOk ok = withChannel("declare queue " + queue, channel -> channel.queueDeclare(
                queue.name,
                queue.durable,
                queue.exclusive,
                queue.autoDelete,
                queue.arguments));
        log.debugWithParams("Declared queue.", "queue", queue, "name", ok.getQueue());
        return ok.getQueue();
    }

    @Override
    public void bindQueue(String queue, String routingKey, String exchange, Map<String, Object> arguments) throws MessagingException {
        withChannel("bind queue " + queue + " to " + exchange,
                channel -> channel.queueBind(queue, exchange, routingKey, arguments == null ? new HashMap<>() : arguments));
        log.debugWithParams("Bound queue.", "queue", queue, "exchange", exchange, "routingKey", routingKey);
    }

    @Override
    public Channel getChannel() throws MessagingException {
        return pool.getChannel();
    }

    @Override
    public void returnChannel(Channel channel) {
        pool.returnChannel(channel);
    }

    @Override
    public void addRecoveryListener(RecoveryListener listener) {
        recoveryListeners.add(listener);
    }

    @Override
    public ClientSettings getSettings() {
        return settings;
    }

    public ChannelPool getPool() {
        return pool;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.infoWithParams("Closing client.", "activeConsumers", subscriptions.size());
        for (ConsumerSubscription subscription : new ArrayList<>(subscriptions)) {
            subscription.unsubscribe();
        }
        pool.close();
    }

    Tracer tracer() {
        return tracer;
    }

    TextMapPropagator propagator() {
        return propagator;
    }

    boolean isClosed() {
        return closed.get();
    }

    void forget(ConsumerSubscription subscription) {
        subscriptions.remove(subscription);
    }

    private void onRecovered() {
        for (ConsumerSubscription subscription : new ArrayList<>(subscriptions)) {
            subscription.recover();
        }
        for (RecoveryListener listener : recoveryListeners) {
            try {
                listener.onRecovered(this);
            } catch (RuntimeException e) {
                log.errorWithParams("Recovery listener failed.", e);
            }
        }
    }

    private AMQP.BasicProperties toProperties(Message message, Map<String, Object> headers) {
        return new AMQP.BasicProperties.Builder()
                .contentType(message.getContentType())
                .headers(headers)
                .deliveryMode(DeliveryMode.persistent.code)
                .priority(message.getPriority())
                .expiration(message.getExpiration())
                .messageId(message.getMessageId())
                .timestamp(message.getTimestamp())
                .type(message.getType())
                .replyTo(message.getReplyTo())
                .correlationId(message.getCorrelationId())
                .build();
    }

    private <T> T withChannel(String operation, ChannelCallback<T> callback) throws MessagingException {
        Channel channel = pool.getChannel();
        try {
            return callback.call(channel);
        } catch (IOException | ShutdownSignalException e) {
            throw new TopologyException("Could not " + operation, e);
        } finally {
            pool.returnChannel(channel);
        }
    }

    private static String spanName(String exchange) {
        return exchange.isEmpty() ? "(default)" : exchange;
    }

    private interface ChannelCallback<T> {
        T call(Channel channel) throws IOException;
    }
}

package dev.goodone.rabbit.impl;

import dev.goodone.rabbit.Acknowledger;
import dev.goodone.rabbit.ChannelPool;
import dev.goodone.rabbit.ConsumeOptions;
import dev.goodone.rabbit.ConsumeRegistrationException;
import dev.goodone.rabbit.Delivery;
import dev.goodone.rabbit.DeliveryHandler;
import dev.goodone.rabbit.Destination;
import dev.goodone.rabbit.Message;
import dev.goodone.rabbit.MessagingException;
import dev.goodone.rabbit.tracing.HeaderCarrier;
import dev.goodone.rabbit.tracing.MessagingAttributes;
import dev.goodone.rabbit.util.BackoffAlgorithm;
import dev.goodone.rabbit.util.ConstantBackoffAlgorithm;
import dev.goodone.rabbit.util.Logger;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import rx.Scheduler;
import rx.Subscription;
import rx.schedulers.Schedulers;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One consumer registration: a leased channel with prefetch 1, a broker-side consumer and a single worker thread
 * that processes the deliveries in order.
 *
 * For every delivery exactly one ack or nack is sent:
 * <ul>
 *     <li>handler returned: ack</li>
 *     <li>handler failed below the max retry count: republish to the consumed queue through the default exchange
 *     with an incremented retry header, then ack (nack with requeue if the republish failed)</li>
 *     <li>handler failed at the max retry count: nack without requeue</li>
 *     <li>delivery dispatched after {@link #unsubscribe()}: nack with requeue</li>
 * </ul>
 */
class ConsumerSubscription implements Subscription {

    private static final Logger log = new Logger(ConsumerSubscription.class);
    private static final AtomicInteger consumerCount = new AtomicInteger();

    private final DefaultRabbitClient client;
    private final ConsumeOptions options;
    private final DeliveryHandler handler;
    private final BackoffAlgorithm retryDelay;
    private final int maxRetry;

    private final AtomicBoolean unsubscribed = new AtomicBoolean(false);
    private volatile boolean awaitingRecovery = false;
    private volatile boolean ended = false;
    private volatile InternalConsumer active;
    private volatile long generation;

    ConsumerSubscription(DefaultRabbitClient client, ConsumeOptions options, DeliveryHandler handler) {
        this.client = client;
        this.options = options;
        this.handler = handler;
        this.retryDelay = new ConstantBackoffAlgorithm(client.getSettings().retry_delay_millis);
        this.maxRetry = client.getSettings().max_retry;
    }

    synchronized void start() throws MessagingException {
        Channel channel = client.getChannel();
        generation = client.getPool().generation();
        int consumerNr = consumerCount.incrementAndGet();
        Scheduler.Worker worker = Schedulers.io().createWorker();
        worker.schedule(() -> Thread.currentThread().setName("consume-thread-" + consumerNr + "-delivery"));
        InternalConsumer consumer = new InternalConsumer(channel, worker);
        try {
            if (!options.autoAck) {
                channel.basicQos(1);
            }
            consumer.consumerTag = channel.basicConsume(
                    options.queue,
                    options.autoAck,
                    options.consumerTag,
                    false,
                    options.exclusive,
                    options.arguments,
                    consumer);
        } catch (IOException | ShutdownSignalException e) {
            worker.unsubscribe();
            client.returnChannel(channel);
            throw new ConsumeRegistrationException("Could not register consumer on queue " + options.queue, e);
        }
        awaitingRecovery = false;
        ended = false;
        active = consumer;
        log.infoWithParams("Started consumer.",
                "queue", options.queue,
                "consumerTag", consumer.consumerTag,
                "autoAck", options.autoAck,
                "channelNr", channel.getChannelNumber());
    }

    /**
     * Registers the consumer again if its previous registration died with a lost connection.
     */
    synchronized void recover() {
        if (!awaitingRecovery || unsubscribed.get()) {
            return;
        }
        try {
            start();
        } catch (MessagingException e) {
            log.errorWithParams("Could not re-register consumer after reconnect.", e,
                    "queue", options.queue);
        }
    }

    String getQueue() {
        return options.queue;
    }

    @Override
    public void unsubscribe() {
        if (!unsubscribed.compareAndSet(false, true)) {
            return;
        }
        client.forget(this);
        awaitingRecovery = false;
        InternalConsumer consumer = active;
        if (consumer != null) {
            log.infoWithParams("Un-subscribe invoked. Stopping the consumer.",
                    "queue", options.queue,
                    "consumerTag", consumer.consumerTag);
            consumer.cancel();
        }
    }

    @Override
    public boolean isUnsubscribed() {
        return unsubscribed.get() || (ended && !awaitingRecovery);
    }

    class InternalConsumer implements Consumer {

        private final Channel channel;
        private final Scheduler.Worker deliveryWorker;
        private final AtomicBoolean finished = new AtomicBoolean(false);
        private volatile String consumerTag;

        InternalConsumer(Channel channel, Scheduler.Worker deliveryWorker) {
            this.channel = channel;
            this.deliveryWorker = deliveryWorker;
        }

        @Override
        public void handleConsumeOk(String consumerTag) {
            this.consumerTag = consumerTag;
            log.infoWithParams("Consumer registered and ready to receive messages.",
                    "queue", options.queue,
                    "consumerTag", consumerTag);
        }

        @Override
        public void handleCancelOk(String consumerTag) {
            log.infoWithParams("Consumer successfully stopped. It will not receive any more messages.",
                    "queue", options.queue,
                    "consumerTag", consumerTag);
            deliveryWorker.schedule(() -> finish(false));
        }

        @Override
        public void handleCancel(String consumerTag) {
            log.warnWithParams("Consumer cancelled by the broker. It will not receive any more messages.",
                    "queue", options.queue,
                    "consumerTag", consumerTag);
            deliveryWorker.schedule(() -> finish(false));
        }

        @Override
        public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
            boolean recover = options.recover
                    && sig.isHardError()
                    && !sig.isInitiatedByApplication()
                    && !unsubscribed.get()
                    && !client.isClosed();
            if (sig.isInitiatedByApplication()) {
                log.infoWithParams("Consumer channel closed.",
                        "queue", options.queue,
                        "consumerTag", consumerTag);
            } else {
                log.errorWithParams("The consumer channel was unexpectedly closed.", sig,
                        "queue", options.queue,
                        "consumerTag", consumerTag,
                        "willRecover", recover);
            }
            deliveryWorker.schedule(() -> finish(recover));
        }

        @Override
        public void handleRecoverOk(String consumerTag) {
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
            deliveryWorker.schedule(() -> dispatch(new Delivery(consumerTag, envelope, properties, body)));
        }

        void cancel() {
            try {
                channel.basicCancel(consumerTag);
            } catch (IOException | ShutdownSignalException e) {
                log.warnWithParams("Unexpected error when cancelling consumer.", e,
                        "queue", options.queue,
                        "consumerTag", consumerTag);
                deliveryWorker.schedule(() -> finish(false));
            }
        }

        private void dispatch(Delivery delivery) {
            Acknowledger acknowledger = options.autoAck
                    ? ChannelAcknowledger.AUTO_ACKED
                    : new ChannelAcknowledger(channel, delivery.getDeliveryTag());
            if (unsubscribed.get()) {
                log.traceWithParams("Requeueing message received during shutdown.",
                        "queue", options.queue,
                        "deliveryTag", delivery.getDeliveryTag());
                if (!options.autoAck) {
                    nack(acknowledger, delivery, true);
                }
                return;
            }

            Context parent = client.propagator().extract(Context.current(), delivery.getHeaders(), HeaderCarrier.GETTER);
            int retryCount = delivery.retryCount();
            Span span = client.tracer().spanBuilder(options.queue + " process")
                    .setParent(parent)
                    .setSpanKind(SpanKind.CONSUMER)
                    .setAttribute(MessagingAttributes.SYSTEM, MessagingAttributes.RABBITMQ)
                    .setAttribute(MessagingAttributes.DESTINATION, delivery.getExchange())
                    .setAttribute(MessagingAttributes.ROUTING_KEY, delivery.getRoutingKey())
                    .setAttribute(MessagingAttributes.RETRY_COUNT, (long) retryCount)
                    .startSpan();
            if (delivery.getMessageId() != null) {
                span.setAttribute(MessagingAttributes.MESSAGE_ID, delivery.getMessageId());
            }
            try (Scope ignored = span.makeCurrent()) {
                log.traceWithParams("Consumer received message.",
                        "queue", options.queue,
                        "delivery", delivery);
                try {
                    handler.handle(delivery);
                } catch (Exception e) {
                    span.recordException(e);
                    span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
                    onHandlerFailure(delivery, acknowledger, retryCount, e);
                    return;
                }
                span.setStatus(StatusCode.OK);
                if (!options.autoAck) {
                    ack(acknowledger, delivery);
                }
            } finally {
                if (!acknowledger.isTerminated()) {
                    log.errorWithParams("Delivery left without ack or nack, requeueing it.",
                            "queue", options.queue,
                            "delivery", delivery);
                    nack(acknowledger, delivery, true);
                }
                span.end();
            }
        }

        private void onHandlerFailure(Delivery delivery, Acknowledger acknowledger, int retryCount, Exception error) {
            if (options.autoAck) {
                log.errorWithParams("Handler failed on an auto-acked delivery, the message is dropped.", error,
                        "queue", options.queue,
                        "delivery", delivery);
                return;
            }
            if (retryCount >= maxRetry) {
                log.warnWithParams("Handler failed and max retries reached, rejecting message.", error,
                        "queue", options.queue,
                        "delivery", delivery,
                        "maxRetry", maxRetry);
                nack(acknowledger, delivery, false);
                return;
            }

            log.warnWithParams("Handler failed, scheduling retry.", error,
                    "queue", options.queue,
                    "delivery", delivery,
                    "nextRetryCount", retryCount + 1);
            try {
                Thread.sleep(retryDelay.getDelayMs(retryCount + 1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                nack(acknowledger, delivery, true);
                return;
            }

            // only this queue sees the retry
            Message retry = delivery.toMessage().toBuilder()
                    .withHeader(Delivery.RETRY_COUNT_HEADER, retryCount + 1)
                    .withHeader(Delivery.ORIGINAL_EXCHANGE_HEADER, delivery.getExchange())
                    .withHeader(Delivery.ORIGINAL_ROUTING_KEY_HEADER, delivery.getRoutingKey())
                    .build();
            try {
                client.publish(Destination.queue(options.queue), retry);
            } catch (MessagingException e) {
                log.errorWithParams("Could not republish failed message, requeueing it instead.", e,
                        "queue", options.queue,
                        "delivery", delivery);
                nack(acknowledger, delivery, true);
                return;
            }
            ack(acknowledger, delivery);
        }

        private void ack(Acknowledger acknowledger, Delivery delivery) {
            try {
                acknowledger.ack();
            } catch (IOException | ShutdownSignalException e) {
                log.warnWithParams("Could not ack message, the broker redelivers it once the channel is gone.", e,
                        "queue", options.queue,
                        "delivery", delivery);
            }
        }

        private void nack(Acknowledger acknowledger, Delivery delivery, boolean requeue) {
            try {
                acknowledger.nack(requeue);
            } catch (IOException | ShutdownSignalException e) {
                log.warnWithParams("Could not nack message, the broker redelivers it once the channel is gone.", e,
                        "queue", options.queue,
                        "delivery", delivery,
                        "requeue", requeue);
            }
        }

        private void finish(boolean recover) {
            if (!finished.compareAndSet(false, true)) {
                return;
            }
            client.returnChannel(channel);
            ended = true;
            deliveryWorker.unsubscribe();
            if (!recover) {
                client.forget(ConsumerSubscription.this);
                return;
            }
            awaitingRecovery = true;
            log.infoWithParams("Consumer stopped, it is registered again once the connection is back.",
                    "queue", options.queue,
                    "consumerTag", consumerTag);
            ChannelPool pool = client.getPool();
            // the pool may have reconnected before this shutdown signal was processed
            if (pool.generation() != generation && pool.state() == ChannelPool.State.CONNECTED) {
                recover();
            }
        }
    }
}
